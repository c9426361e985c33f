package my.creativeaudit.app.collaborator;

public interface ObjectStorageClient {
	CollaboratorResult<byte[]> fetch(String locator);

	CollaboratorResult<String> store(String locator, byte[] content, String contentType);
}
