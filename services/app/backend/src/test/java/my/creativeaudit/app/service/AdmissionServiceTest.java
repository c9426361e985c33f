package my.creativeaudit.app.service;

import my.creativeaudit.app.AppApplication;
import my.creativeaudit.app.support.TestDatabaseCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(classes = AppApplication.class)
@ActiveProfiles("test")
class AdmissionServiceTest {
	private static final String JWT_SECRET = UUID.randomUUID().toString();

	@Autowired
	private AdmissionService admissionService;

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
	void admitsAndHoldsTheEstimate() {
		ledger.grant("adm-1", 1000, "signup", "adm-1-grant");

		try (JobSlot slot = admissionService.tryAdmit("adm-1", 600)) {
			assertThat(slot.heldAmount()).isEqualTo(600);
			assertThat(ledger.balance("adm-1")).isEqualTo(400);
			assertThat(admissionService.activeJob("adm-1")).contains(slot.jobId());
			assertThat(ledger.findByIdempotencyKey(AdmissionService.holdKey(slot.jobId()))).isPresent();
		}
		assertThat(admissionService.activeJob("adm-1")).isEmpty();
	}

	@Test
	void secondJobOfAnAccountIsRejectedWhileTheFirstRuns() {
		ledger.grant("adm-2", 2000, "signup", "adm-2-grant");

		try (JobSlot slot = admissionService.tryAdmit("adm-2", 600)) {
			assertThatThrownBy(() -> admissionService.tryAdmit("adm-2", 600))
					.isInstanceOf(ConcurrencyLimitExceededException.class)
					.satisfies(ex -> assertThat(((ConcurrencyLimitExceededException) ex).getActiveJobId())
							.isEqualTo(slot.jobId()));
			assertThat(ledger.balance("adm-2")).isEqualTo(1400);
		}

		try (JobSlot next = admissionService.tryAdmit("adm-2", 600)) {
			assertThat(next.jobId()).isNotBlank();
		}
	}

	@Test
	void insufficientCreditsReleasesTheSlot() {
		ledger.grant("adm-3", 100, "signup", "adm-3-grant");

		assertThatThrownBy(() -> admissionService.tryAdmit("adm-3", 600))
				.isInstanceOf(InsufficientCreditsException.class)
				.satisfies(ex -> {
					InsufficientCreditsException insufficient = (InsufficientCreditsException) ex;
					assertThat(insufficient.getRequired()).isEqualTo(600);
					assertThat(insufficient.getAvailable()).isEqualTo(100);
				});
		assertThat(admissionService.activeJob("adm-3")).isEmpty();
		assertThat(ledger.balance("adm-3")).isEqualTo(100);
	}

	@Test
	void otherAccountsAreAdmittedIndependently() {
		ledger.grant("adm-4", 1000, "signup", "adm-4-grant");
		ledger.grant("adm-5", 1000, "signup", "adm-5-grant");

		try (JobSlot first = admissionService.tryAdmit("adm-4", 600);
			 JobSlot second = admissionService.tryAdmit("adm-5", 600)) {
			assertThat(first.jobId()).isNotEqualTo(second.jobId());
		}
	}
}
