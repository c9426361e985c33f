package my.creativeaudit.app.collaborator;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Thin {@link RestClient} wrapper shared by the HTTP adapters. Maps transport failures to
 * {@link CollaboratorException} with a retryable hint.
 */
class JsonHttpTransport {
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMinutes(2);

	private final RestClient restClient;

	JsonHttpTransport(String baseUrl, String apiKey, Duration connectTimeout, Duration readTimeout) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
		requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		RestClient.Builder builder = RestClient.builder()
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
		if (baseUrl != null && !baseUrl.isBlank()) {
			builder.baseUrl(baseUrl);
		}
		if (apiKey != null && !apiKey.isBlank()) {
			builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
		}
		this.restClient = builder.build();
	}

	String post(String uri, Object body) {
		return exchange(() -> restClient.post().uri(uri).body(body).retrieve().body(String.class));
	}

	byte[] getBytes(String uri) {
		return exchange(() -> restClient.get().uri(uri).retrieve().body(byte[].class));
	}

	void putBytes(String uri, byte[] content, String contentType) {
		exchange(() -> restClient.put()
				.uri(uri)
				.contentType(MediaType.parseMediaType(contentType))
				.body(content)
				.retrieve()
				.toBodilessEntity());
	}

	private <T> T exchange(Supplier<T> call) {
		try {
			return call.get();
		} catch (RestClientResponseException ex) {
			int status = ex.getStatusCode().value();
			throw new CollaboratorException(safeMessage(ex), status, isRetryable(status), ex);
		} catch (ResourceAccessException ex) {
			throw new CollaboratorException(safeMessage(ex), null, true, ex);
		}
	}

	static boolean isRetryable(int status) {
		return status == 408 || status == 429 || status >= 500;
	}

	private static String safeMessage(Exception ex) {
		String message = ex.getMessage();
		if (message == null || message.isBlank()) {
			message = ex.getClass().getSimpleName();
		}
		return message;
	}
}
