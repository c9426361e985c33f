package my.creativeaudit.app.collaborator;

import java.util.Map;

public class NoopPaymentProcessorClient implements PaymentProcessorClient {
	@Override
	public CheckoutSession createCheckout(String priceId, String successUrl, String cancelUrl, Map<String, String> metadata) {
		throw CollaboratorException.disabled("Payment processor");
	}
}
