package my.creativeaudit.app.collaborator;

import java.net.URI;
import java.time.Duration;

/**
 * Object storage reached through an HTTP gateway: {@code gs://bucket/path} maps to {@code <base>/bucket/path}.
 */
public class HttpObjectStorageClient implements ObjectStorageClient {
	private final JsonHttpTransport transport;
	private final ResilientCaller caller;
	private final CallPolicy policy;

	public HttpObjectStorageClient(String baseUrl,
								   String apiKey,
								   Duration connectTimeout,
								   Duration readTimeout,
								   ResilientCaller caller,
								   CallPolicy policy) {
		this.transport = new JsonHttpTransport(baseUrl, apiKey, connectTimeout, readTimeout);
		this.caller = caller;
		this.policy = policy;
	}

	@Override
	public CollaboratorResult<byte[]> fetch(String locator) {
		String path = objectPath(locator);
		return caller.call("storage.fetch", policy, () -> transport.getBytes(path));
	}

	@Override
	public CollaboratorResult<String> store(String locator, byte[] content, String contentType) {
		String path = objectPath(locator);
		return caller.call("storage.store", policy, () -> {
			transport.putBytes(path, content, contentType);
			return locator;
		});
	}

	static String objectPath(String locator) {
		URI uri = URI.create(locator.trim());
		String bucket = uri.getHost();
		if (bucket == null || bucket.isBlank()) {
			throw new IllegalArgumentException("Storage locator lacks bucket: " + locator);
		}
		String path = uri.getPath() == null ? "" : uri.getPath();
		return "/" + bucket + path;
	}
}
