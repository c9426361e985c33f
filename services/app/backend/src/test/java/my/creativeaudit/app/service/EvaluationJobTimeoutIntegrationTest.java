package my.creativeaudit.app.service;

import my.creativeaudit.app.AppApplication;
import my.creativeaudit.app.collaborator.AnnotationClient;
import my.creativeaudit.app.collaborator.CollaboratorResult;
import my.creativeaudit.app.collaborator.ContentUnderstandingClient;
import my.creativeaudit.app.domain.JobErrorCode;
import my.creativeaudit.app.domain.JobStatus;
import my.creativeaudit.app.dto.EvaluationJobDto;
import my.creativeaudit.app.dto.EvaluationRequestDto;
import my.creativeaudit.app.dto.EvaluationSubmissionDto;
import my.creativeaudit.app.model.MediaDescription;
import my.creativeaudit.app.model.ProgressEvent;
import my.creativeaudit.app.rubric.CheckSet;
import my.creativeaudit.app.support.TestDatabaseCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@SpringBootTest(classes = AppApplication.class)
@ActiveProfiles("test")
class EvaluationJobTimeoutIntegrationTest {
	private static final String JWT_SECRET = UUID.randomUUID().toString();
	private static final long WAIT_MILLIS = 15_000;

	@Autowired
	private EvaluationJobService jobService;

	@Autowired
	private AdmissionService admissionService;

	@Autowired
	private CreditLedgerService ledger;

	@Autowired
	private ProgressBroadcaster progress;

	@Autowired
	private TestDatabaseCleaner databaseCleaner;

	@MockBean
	private ContentUnderstandingClient contentUnderstanding;

	@MockBean
	private AnnotationClient annotationClient;

	private final CountDownLatch release = new CountDownLatch(1);

	private String accountId;

	@DynamicPropertySource
	static void registerProperties(DynamicPropertyRegistry registry) {
		registry.add("app.jwt.secret", () -> JWT_SECRET);
		registry.add("app.jwt.issuer", () -> "test-issuer");
		registry.add("app.evaluation.job-timeout-seconds", () -> 1);
	}

	@BeforeEach
	void setUp() {
		accountId = "acct-" + UUID.randomUUID();
		ledger.grant(accountId, 1000, "signup", accountId + "-grant");
		when(contentUnderstanding.describe(any())).thenAnswer(invocation -> {
			release.await(WAIT_MILLIS, TimeUnit.MILLISECONDS);
			return CollaboratorResult.success(new MediaDescription(30.0, null, null, List.of()));
		});
	}

	@AfterEach
	void tearDown() {
		release.countDown();
		databaseCleaner.clean();
	}

	@Test
	void jobOverItsTimeLimitFailsAndIsRefunded() throws Exception {
		EvaluationSubmissionDto submission = jobService.submit(accountId, new EvaluationRequestDto(
				"https://cdn.example.com/ads/" + UUID.randomUUID() + ".mp4", 60.0, null, List.of(CheckSet.SHORTS.name())));
		assertThat(ledger.balance(accountId)).isEqualTo(400);

		EvaluationJobDto job = awaitFinished(submission.jobId());

		assertThat(job.status()).isEqualTo(JobStatus.FAILED);
		assertThat(job.errorCode()).isEqualTo(JobErrorCode.JOB_TIMEOUT.name());
		assertThat(job.refundedAmount()).isEqualTo(600);
		assertThat(ledger.balance(accountId)).isEqualTo(1000);
		assertThat(progress.terminalEvent(submission.jobId()))
				.hasValueSatisfying(event -> assertThat(event.milestone()).isEqualTo(ProgressEvent.ERROR));
	}

	private EvaluationJobDto awaitFinished(String jobId) throws InterruptedException {
		long deadline = System.currentTimeMillis() + WAIT_MILLIS;
		while (System.currentTimeMillis() < deadline) {
			EvaluationJobDto job = jobService.get(jobId, accountId, false);
			if (job.status().terminal() && admissionService.activeJob(accountId).isEmpty()) {
				return job;
			}
			Thread.sleep(50);
		}
		throw new AssertionError("Job " + jobId + " did not finish in time");
	}
}
