package my.creativeaudit.app.collaborator;

public class NoopObjectStorageClient implements ObjectStorageClient {
	@Override
	public CollaboratorResult<byte[]> fetch(String locator) {
		return CollaboratorResult.disabled("Object storage");
	}

	@Override
	public CollaboratorResult<String> store(String locator, byte[] content, String contentType) {
		return CollaboratorResult.disabled("Object storage");
	}
}
