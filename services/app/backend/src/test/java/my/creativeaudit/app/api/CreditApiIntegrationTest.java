package my.creativeaudit.app.api;

import my.creativeaudit.app.AppApplication;
import my.creativeaudit.app.service.CreditLedgerService;
import my.creativeaudit.app.service.WebhookSignatureVerifier;
import my.creativeaudit.app.support.TestDatabaseCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = AppApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CreditApiIntegrationTest {
	private static final String JWT_SECRET = UUID.randomUUID().toString();
	private static final String WEBHOOK_SECRET = "test-webhook-secret";

	@Autowired
	private MockMvc mockMvc;

	@Autowired
	private CreditLedgerService ledger;

	@Autowired
	private TestDatabaseCleaner databaseCleaner;

	@DynamicPropertySource
	static void registerProperties(DynamicPropertyRegistry registry) {
		registry.add("app.jwt.secret", () -> JWT_SECRET);
		registry.add("app.jwt.issuer", () -> "test-issuer");
	}

	@AfterEach
	void tearDown() {
		databaseCleaner.clean();
	}

	@Test
	void creditsShowBalanceAndHistory() throws Exception {
		ledger.grant("wallet-1", 1000, "signup", "wallet-1-grant");
		ledger.debit("wallet-1", 600, "evaluation_hold", "job-1", "wallet-1-hold");

		mockMvc.perform(get("/api/credits").with(caller("wallet-1")))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.accountId").value("wallet-1"))
				.andExpect(jsonPath("$.balance").value(400))
				.andExpect(jsonPath("$.transactions.length()").value(2))
				.andExpect(jsonPath("$.transactions[0].kind").value("DEBIT"))
				.andExpect(jsonPath("$.transactions[0].amount").value(-600));
	}

	@Test
	void billingPacksAreListedSmallestFirst() throws Exception {
		mockMvc.perform(get("/api/billing/packs").with(caller("wallet-2")))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.balance").value(0))
				.andExpect(jsonPath("$.tokensPerSecond").value(10))
				.andExpect(jsonPath("$.packs[0].pack").value("TOKENS_1000"))
				.andExpect(jsonPath("$.packs[0].tokens").value(1000))
				.andExpect(jsonPath("$.packs[1].pack").value("TOKENS_3000"));
	}

	@Test
	void checkoutIsUnavailableWithoutAPaymentProcessor() throws Exception {
		mockMvc.perform(post("/api/billing/checkout")
						.with(caller("wallet-3"))
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"pack": "TOKENS_1000"}
								"""))
				.andExpect(status().isServiceUnavailable());
		mockMvc.perform(post("/api/billing/checkout")
						.with(caller("wallet-3"))
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"pack": "TOKENS_9"}
								"""))
				.andExpect(status().isBadRequest());
	}

	@Test
	void adminGrantIsIdempotentPerKey() throws Exception {
		String body = """
				{"accountId": "wallet-4", "amount": 250, "reason": "goodwill", "idempotencyKey": "grant-wallet-4"}
				""";
		mockMvc.perform(post("/api/admin/credits/grant")
						.with(admin())
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.amount").value(250))
				.andExpect(jsonPath("$.replayed").value(false));
		mockMvc.perform(post("/api/admin/credits/grant")
						.with(admin())
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.replayed").value(true));

		assertThat(ledger.balance("wallet-4")).isEqualTo(250);
	}

	@Test
	void adminGrantIsForbiddenForCallers() throws Exception {
		mockMvc.perform(post("/api/admin/credits/grant")
						.with(caller("wallet-5"))
						.contentType(MediaType.APPLICATION_JSON)
						.content("""
								{"accountId": "wallet-5", "amount": 1000000}
								"""))
				.andExpect(status().isForbidden());

		assertThat(ledger.balance("wallet-5")).isZero();
	}

	@Test
	void signedPaymentEventCreditsOnce() throws Exception {
		String payload = """
				{"id": "evt_api_1", "type": "checkout.session.completed",
				 "data": {"object": {"id": "cs_api_1", "metadata": {"account_id": "wallet-6", "token_amount": "3000"}}}}
				""";

		mockMvc.perform(post("/webhooks/payments")
						.header(WebhookSignatureVerifier.HEADER, signature(payload))
						.contentType(MediaType.APPLICATION_JSON)
						.content(payload))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.eventId").value("evt_api_1"))
				.andExpect(jsonPath("$.result").value("CREDITED"));
		mockMvc.perform(post("/webhooks/payments")
						.header(WebhookSignatureVerifier.HEADER, signature(payload))
						.contentType(MediaType.APPLICATION_JSON)
						.content(payload))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.result").value("ALREADY_PROCESSED"));

		assertThat(ledger.balance("wallet-6")).isEqualTo(3000);
	}

	@Test
	void unsignedPaymentEventIsRejected() throws Exception {
		String payload = """
				{"id": "evt_api_2", "type": "checkout.session.completed",
				 "data": {"object": {"metadata": {"account_id": "wallet-7", "token_amount": "3000"}}}}
				""";

		mockMvc.perform(post("/webhooks/payments")
						.contentType(MediaType.APPLICATION_JSON)
						.content(payload))
				.andExpect(status().isUnauthorized());
		mockMvc.perform(post("/webhooks/payments")
						.header(WebhookSignatureVerifier.HEADER, "t=" + Instant.now().getEpochSecond() + ",v1=deadbeef")
						.contentType(MediaType.APPLICATION_JSON)
						.content(payload))
				.andExpect(status().isUnauthorized());

		assertThat(ledger.balance("wallet-7")).isZero();
	}

	private static String signature(String payload) {
		long timestamp = Instant.now().getEpochSecond();
		return "t=" + timestamp + ",v1=" + WebhookSignatureVerifier.sign(WEBHOOK_SECRET, timestamp + "." + payload);
	}

	private static RequestPostProcessor caller(String accountId) {
		return jwt().jwt(token -> token.subject(accountId));
	}

	private static RequestPostProcessor admin() {
		return jwt().jwt(token -> token.subject("operator")).authorities(new SimpleGrantedAuthority("ROLE_ADMIN"));
	}
}
