package my.creativeaudit.app.service;

import my.creativeaudit.app.collaborator.PaymentProcessorClient;
import my.creativeaudit.app.config.AppProperties;
import my.creativeaudit.app.dto.BillingPacksDto;
import my.creativeaudit.app.dto.CheckoutResponseDto;
import my.creativeaudit.app.dto.TokenPackDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Token packs on sale and hosted checkout sessions for them. Credits arrive later through the payment webhook.
 */
@Service
public class BillingService {
	private static final Logger logger = LoggerFactory.getLogger(BillingService.class);

	private final PaymentProcessorClient paymentProcessor;
	private final CreditLedgerService ledger;
	private final CostEstimator costEstimator;
	private final AppProperties properties;

	public BillingService(PaymentProcessorClient paymentProcessor,
						  CreditLedgerService ledger,
						  CostEstimator costEstimator,
						  AppProperties properties) {
		this.paymentProcessor = paymentProcessor;
		this.ledger = ledger;
		this.costEstimator = costEstimator;
		this.properties = properties;
	}

	public BillingPacksDto packs(String accountId) {
		List<TokenPackDto> packs = configuredPacks().entrySet().stream()
				.map(entry -> new TokenPackDto(entry.getKey(), entry.getValue().tokens(), entry.getValue().usd()))
				.sorted(Comparator.comparingInt(TokenPackDto::tokens))
				.toList();
		return new BillingPacksDto(ledger.balance(accountId), costEstimator.tokensPerSecond(), packs);
	}

	public CheckoutResponseDto checkout(String accountId, String packName) {
		String key = packName == null ? "" : packName.trim().toUpperCase(Locale.ROOT);
		AppProperties.Billing.Pack pack = configuredPacks().get(key);
		if (pack == null) {
			throw new IllegalArgumentException("Unknown token pack: " + packName);
		}
		String baseUrl = properties.billing().publicBaseUrl() == null ? "" : properties.billing().publicBaseUrl();
		PaymentProcessorClient.CheckoutSession session = paymentProcessor.createCheckout(
				pack.priceId(),
				baseUrl + "/billing/success?session_id={CHECKOUT_SESSION_ID}",
				baseUrl + "/billing/cancel",
				Map.of(
						"account_id", accountId,
						"token_amount", String.valueOf(pack.tokens()),
						"pack", key
				)
		);
		logger.info("Checkout session {} created for account {} (pack={})", session.sessionId(), accountId, key);
		return new CheckoutResponseDto(session.sessionId(), session.redirectUrl());
	}

	private Map<String, AppProperties.Billing.Pack> configuredPacks() {
		Map<String, AppProperties.Billing.Pack> packs = properties.billing().packs();
		return packs == null ? Map.of() : packs;
	}
}
