package my.creativeaudit.app.collaborator;

import java.util.Map;

public interface PaymentProcessorClient {
	CheckoutSession createCheckout(String priceId, String successUrl, String cancelUrl, Map<String, String> metadata);

	record CheckoutSession(String sessionId, String redirectUrl) {
	}
}
