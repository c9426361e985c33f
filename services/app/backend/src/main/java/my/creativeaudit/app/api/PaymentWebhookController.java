package my.creativeaudit.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.creativeaudit.app.dto.PaymentWebhookResponseDto;
import my.creativeaudit.app.service.BillingSettlementService;
import my.creativeaudit.app.service.WebhookSignatureVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@Tag(name = "Payment Webhooks")
public class PaymentWebhookController {
	private static final Logger logger = LoggerFactory.getLogger(PaymentWebhookController.class);

	private final WebhookSignatureVerifier signatureVerifier;
	private final BillingSettlementService settlementService;

	public PaymentWebhookController(WebhookSignatureVerifier signatureVerifier,
									BillingSettlementService settlementService) {
		this.signatureVerifier = signatureVerifier;
		this.settlementService = settlementService;
	}

	@PostMapping("/webhooks/payments")
	@Operation(summary = "Payment processor event callback")
	public PaymentWebhookResponseDto receive(@RequestBody String payload,
											 @RequestHeader(value = WebhookSignatureVerifier.HEADER, required = false) String signature) {
		if (!signatureVerifier.verify(payload, signature)) {
			logger.warn("Rejected payment webhook with invalid signature");
			throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid signature");
		}
		return settlementService.handleEvent(payload);
	}
}
