package my.creativeaudit.app.collaborator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class HttpPaymentProcessorClient implements PaymentProcessorClient {
	private final JsonHttpTransport transport;
	private final ObjectMapper objectMapper;

	public HttpPaymentProcessorClient(String baseUrl, String apiKey, ObjectMapper objectMapper) {
		this.transport = new JsonHttpTransport(baseUrl, apiKey, Duration.ofSeconds(10), Duration.ofSeconds(30));
		this.objectMapper = objectMapper;
	}

	@Override
	public CheckoutSession createCheckout(String priceId, String successUrl, String cancelUrl, Map<String, String> metadata) {
		Map<String, Object> request = new HashMap<>();
		request.put("mode", "payment");
		request.put("line_items", List.of(Map.of("price", priceId, "quantity", 1)));
		request.put("success_url", successUrl);
		request.put("cancel_url", cancelUrl);
		request.put("metadata", metadata);
		String body = transport.post("/v1/checkout/sessions", request);
		try {
			JsonNode root = objectMapper.readTree(body);
			String sessionId = root.path("id").asText(null);
			String url = root.path("url").asText(null);
			if (sessionId == null || url == null) {
				throw CollaboratorException.malformed("Checkout session response lacks id or url");
			}
			return new CheckoutSession(sessionId, url);
		} catch (CollaboratorException ex) {
			throw ex;
		} catch (Exception ex) {
			throw new CollaboratorException("Checkout session response is not JSON", null, false,
					CollaboratorErrorKind.MALFORMED_RESPONSE, ex);
		}
	}
}
