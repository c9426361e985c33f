package my.creativeaudit.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import my.creativeaudit.app.dto.PaymentWebhookResponseDto;
import my.creativeaudit.app.repository.ProcessedPaymentEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Credits the ledger for confirmed external payments, once per external event id. The processed-event row and the
 * grant commit together; a redelivered event hits the event id's primary key and changes nothing.
 */
@Service
public class BillingSettlementService {
	private static final Logger logger = LoggerFactory.getLogger(BillingSettlementService.class);
	static final String CHECKOUT_COMPLETED = "checkout.session.completed";

	private final ProcessedPaymentEventRepository eventRepository;
	private final CreditLedgerService ledger;
	private final TransactionTemplate transactionTemplate;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	public BillingSettlementService(ProcessedPaymentEventRepository eventRepository,
									CreditLedgerService ledger,
									PlatformTransactionManager transactionManager,
									ObjectMapper objectMapper,
									Clock clock) {
		this.eventRepository = eventRepository;
		this.ledger = ledger;
		this.transactionTemplate = new TransactionTemplate(transactionManager);
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	public SettlementResult onExternalPaymentConfirmed(String eventId, String sessionId, String accountId, long amount) {
		if (eventId == null || eventId.isBlank()) {
			throw new IllegalArgumentException("Event id is required");
		}
		if (amount <= 0) {
			throw new IllegalArgumentException("Payment amount must be positive");
		}
		if (eventRepository.existsById(eventId)) {
			logger.info("Payment event {} already processed", eventId);
			return SettlementResult.ALREADY_PROCESSED;
		}
		SettlementResult result = transactionTemplate.execute(status -> {
			try {
				eventRepository.insert(eventId, sessionId, accountId, amount, LocalDateTime.now(clock));
			} catch (DataIntegrityViolationException ex) {
				status.setRollbackOnly();
				return SettlementResult.ALREADY_PROCESSED;
			}
			ledger.grant(accountId, amount, "payment", paymentKey(eventId));
			return SettlementResult.CREDITED;
		});
		if (result == SettlementResult.CREDITED) {
			logger.info("Payment event {} credited {} tokens to account {}", eventId, amount, accountId);
		} else {
			logger.info("Payment event {} already processed", eventId);
		}
		return result;
	}

	/**
	 * Handles a verified webhook payload. Events other than completed checkouts are acknowledged and ignored.
	 */
	public PaymentWebhookResponseDto handleEvent(String payload) {
		JsonNode root;
		try {
			root = objectMapper.readTree(payload);
		} catch (IOException ex) {
			throw new IllegalArgumentException("Payment event is not JSON", ex);
		}
		String eventId = root.path("id").asText(null);
		String type = root.path("type").asText(null);
		if (eventId == null || eventId.isBlank()) {
			throw new IllegalArgumentException("Payment event lacks an id");
		}
		if (!CHECKOUT_COMPLETED.equals(type)) {
			logger.debug("Ignoring payment event {} of type {}", eventId, type);
			return new PaymentWebhookResponseDto(eventId, "IGNORED");
		}
		JsonNode session = root.path("data").path("object");
		JsonNode metadata = session.path("metadata");
		String accountId = metadata.path("account_id").asText(null);
		String tokens = metadata.path("token_amount").asText(null);
		if (accountId == null || accountId.isBlank() || tokens == null || tokens.isBlank()) {
			logger.warn("Payment event {} lacks account or token metadata", eventId);
			throw new IllegalArgumentException("Payment event metadata is incomplete");
		}
		long amount;
		try {
			amount = Long.parseLong(tokens.trim());
		} catch (NumberFormatException ex) {
			throw new IllegalArgumentException("Payment event token amount is not a number", ex);
		}
		SettlementResult result = onExternalPaymentConfirmed(eventId, session.path("id").asText(null), accountId, amount);
		return new PaymentWebhookResponseDto(eventId, result.name());
	}

	static String paymentKey(String eventId) {
		return "payment:" + eventId;
	}
}
