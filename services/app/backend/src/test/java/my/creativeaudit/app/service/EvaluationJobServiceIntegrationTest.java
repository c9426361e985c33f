package my.creativeaudit.app.service;

import my.creativeaudit.app.AppApplication;
import my.creativeaudit.app.collaborator.AnnotationClient;
import my.creativeaudit.app.collaborator.CollaboratorErrorKind;
import my.creativeaudit.app.collaborator.CollaboratorResult;
import my.creativeaudit.app.collaborator.ContentUnderstandingClient;
import my.creativeaudit.app.config.AppProperties;
import my.creativeaudit.app.domain.FeedbackVerdict;
import my.creativeaudit.app.domain.JobErrorCode;
import my.creativeaudit.app.domain.JobStatus;
import my.creativeaudit.app.dto.EvaluationJobDto;
import my.creativeaudit.app.dto.EvaluationRequestDto;
import my.creativeaudit.app.dto.EvaluationSubmissionDto;
import my.creativeaudit.app.dto.FeedbackRequestDto;
import my.creativeaudit.app.model.AnnotationFeatures;
import my.creativeaudit.app.model.BrandProfile;
import my.creativeaudit.app.model.CheckSetResult;
import my.creativeaudit.app.model.CheckVerdict;
import my.creativeaudit.app.model.EvaluationReport;
import my.creativeaudit.app.model.MediaDescription;
import my.creativeaudit.app.model.ProgressEvent;
import my.creativeaudit.app.model.Scene;
import my.creativeaudit.app.repository.EvaluationJobRepository;
import my.creativeaudit.app.rubric.CheckDefinition;
import my.creativeaudit.app.rubric.CheckSet;
import my.creativeaudit.app.scoring.PlatformScore;
import my.creativeaudit.app.scoring.SpeechRate;
import my.creativeaudit.app.support.TestDatabaseCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@SpringBootTest(classes = AppApplication.class)
@ActiveProfiles("test")
class EvaluationJobServiceIntegrationTest {
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

	@Autowired
	private EvaluationOrchestrator orchestrator;

	@Autowired
	private EvaluationJobRepository jobRepository;

	@Autowired
	private JobCharges jobCharges;

	@Autowired
	private AppProperties properties;

	@Autowired
	private CalibrationService calibrationService;

	@MockBean
	private ContentUnderstandingClient contentUnderstanding;

	@MockBean
	private AnnotationClient annotationClient;

	private String accountId;

	@DynamicPropertySource
	static void registerProperties(DynamicPropertyRegistry registry) {
		registry.add("app.jwt.secret", () -> JWT_SECRET);
		registry.add("app.jwt.issuer", () -> "test-issuer");
	}

	@BeforeEach
	void setUp() {
		accountId = "acct-" + UUID.randomUUID();
		ledger.grant(accountId, 1000, "signup", accountId + "-grant");

		when(contentUnderstanding.describe(any())).thenReturn(CollaboratorResult.success(new MediaDescription(
				30.0, "Acme", "A product demo", List.of(new Scene(0, 0.0, 12.0, "Opening"), new Scene(1, 12.0, 30.0, "Demo")))));
		when(contentUnderstanding.profile(any(), any())).thenReturn(CollaboratorResult.success(
				new BrandProfile("Acme", "Consumer tech", "Confident", List.of("Fast setup"))));
		when(contentUnderstanding.evaluate(any(), anyList())).thenAnswer(invocation ->
				CollaboratorResult.success(detectedVerdicts(invocation.getArgument(1))));
		when(annotationClient.annotate(any(), anySet())).thenReturn(CollaboratorResult.success(
				new AnnotationFeatures(Map.of("LOGO", List.of(new AnnotationFeatures.Detection("Acme", 0.9, 1.0, 3.0))))));
	}

	@AfterEach
	void tearDown() {
		databaseCleaner.clean();
	}

	@Test
	void succeededJobIsChargedForTheMeasuredDuration() throws Exception {
		EvaluationSubmissionDto submission = submit(uniqueUri(), 60.0, CheckSet.LONG_FORM_ABCD);

		assertThat(submission.status()).isEqualTo(JobStatus.QUEUED);
		assertThat(submission.estimatedCost()).isEqualTo(600);

		EvaluationJobDto job = awaitFinished(submission.jobId());

		assertThat(job.status()).isEqualTo(JobStatus.SUCCEEDED);
		assertThat(job.progress()).isEqualTo(100);
		assertThat(job.estimatedCost()).isEqualTo(600);
		assertThat(job.actualCost()).isEqualTo(300);
		assertThat(job.refundedAmount()).isEqualTo(300);
		assertThat(job.cacheHit()).isFalse();
		assertThat(ledger.balance(accountId)).isEqualTo(700);

		EvaluationReport report = jobService.report(submission.jobId(), accountId, false);
		assertThat(report.tokensUsed()).isEqualTo(300);
		assertThat(report.gaps()).isEmpty();
		assertThat(report.brandName()).isEqualTo("Acme");
		assertThat(report.checkSetResults()).singleElement()
				.satisfies(result -> assertThat(result.status()).isEqualTo(CheckSetResult.Status.COMPLETED));
		assertThat(report.scoring().overallScore()).isBetween(0.0, 100.0);
		assertThat(report.artifacts().brandProfile()).isNotNull();
		assertThat(report.platformFit()).hasSize(5);
		assertThat(report.benchmarks()).isNotNull();

		assertThat(progress.terminalEvent(submission.jobId()))
				.hasValueSatisfying(event -> {
					assertThat(event.milestone()).isEqualTo(ProgressEvent.COMPLETE);
					assertThat(event.percentage()).isEqualTo(100);
				});
	}

	@Test
	void failedBranchBecomesAGapAndTheJobStillSucceeds() throws Exception {
		when(contentUnderstanding.evaluate(any(), anyList())).thenAnswer(invocation -> {
			List<CheckDefinition> checks = invocation.getArgument(1);
			if (checks.get(0).checkSet() == CheckSet.SHORTS) {
				return CollaboratorResult.failure(CollaboratorErrorKind.TIMEOUT, "model timed out");
			}
			return CollaboratorResult.success(detectedVerdicts(checks));
		});

		EvaluationSubmissionDto submission = submit(uniqueUri(), 60.0, CheckSet.LONG_FORM_ABCD, CheckSet.SHORTS);
		EvaluationJobDto job = awaitFinished(submission.jobId());

		assertThat(job.status()).isEqualTo(JobStatus.SUCCEEDED);
		EvaluationReport report = jobService.report(submission.jobId(), accountId, false);
		assertThat(report.gaps()).singleElement().satisfies(gap -> {
			assertThat(gap.checkSet()).isEqualTo(CheckSet.SHORTS);
			assertThat(gap.errorCode()).isEqualTo("COLLABORATOR_TIMEOUT");
		});
		assertThat(report.checkSetResults()).hasSize(2);
		assertThat(report.checkSetResults())
				.filteredOn(result -> result.checkSet() == CheckSet.LONG_FORM_ABCD)
				.singleElement()
				.satisfies(result -> assertThat(result.passed()).isPositive());
	}

	@Test
	void repeatedSubmissionIsServedFromCache() throws Exception {
		String uri = uniqueUri();
		EvaluationJobDto first = awaitFinished(submit(uri, 60.0, CheckSet.LONG_FORM_ABCD).jobId());
		assertThat(first.status()).isEqualTo(JobStatus.SUCCEEDED);
		clearInvocations(contentUnderstanding, annotationClient);

		EvaluationSubmissionDto second = submit(uri + "/", 60.0, CheckSet.LONG_FORM_ABCD);
		EvaluationJobDto repeated = awaitFinished(second.jobId());

		assertThat(repeated.status()).isEqualTo(JobStatus.SUCCEEDED);
		assertThat(repeated.cacheHit()).isTrue();
		assertThat(repeated.actualCost()).isEqualTo(300);
		verifyNoInteractions(contentUnderstanding, annotationClient);
		assertThat(ledger.balance(accountId)).isEqualTo(400);

		EvaluationReport report = jobService.report(second.jobId(), accountId, false);
		assertThat(report.reportId()).isEqualTo(second.jobId());
	}

	@Test
	void allBranchesFailingRefundsTheHold() throws Exception {
		when(contentUnderstanding.evaluate(any(), anyList()))
				.thenReturn(CollaboratorResult.failure(CollaboratorErrorKind.UNAVAILABLE, "model down"));
		when(annotationClient.annotate(any(), anySet()))
				.thenReturn(CollaboratorResult.failure(CollaboratorErrorKind.UNAVAILABLE, "annotations down"));

		EvaluationSubmissionDto submission = submit(uniqueUri(), 60.0, CheckSet.LONG_FORM_ABCD, CheckSet.SHORTS);
		EvaluationJobDto job = awaitFinished(submission.jobId());

		assertThat(job.status()).isEqualTo(JobStatus.FAILED);
		assertThat(job.errorCode()).isEqualTo(JobErrorCode.ALL_BRANCHES_FAILED.name());
		assertThat(job.refundedAmount()).isEqualTo(600);
		assertThat(job.actualCost()).isZero();
		assertThat(ledger.balance(accountId)).isEqualTo(1000);
		assertThatThrownBy(() -> jobService.report(submission.jobId(), accountId, false))
				.isInstanceOf(ResponseStatusException.class)
				.satisfies(ex -> assertThat(((ResponseStatusException) ex).getStatusCode()).isEqualTo(HttpStatus.CONFLICT));
		assertThat(progress.terminalEvent(submission.jobId()))
				.hasValueSatisfying(event -> assertThat(event.milestone()).isEqualTo(ProgressEvent.ERROR));
	}

	@Test
	void unknownDurationIsChargedTheFullEstimate() throws Exception {
		when(contentUnderstanding.describe(any()))
				.thenReturn(CollaboratorResult.failure(CollaboratorErrorKind.TIMEOUT, "describe timed out"));

		EvaluationJobDto job = awaitFinished(submit(uniqueUri(), null, CheckSet.SHORTS).jobId());

		assertThat(job.status()).isEqualTo(JobStatus.SUCCEEDED);
		assertThat(job.estimatedCost()).isEqualTo(600);
		assertThat(job.actualCost()).isEqualTo(600);
		assertThat(ledger.balance(accountId)).isEqualTo(400);
	}

	@Test
	void cancelStopsARunningJobAndRefunds() throws Exception {
		CountDownLatch started = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		when(contentUnderstanding.describe(any())).thenAnswer(invocation -> {
			started.countDown();
			release.await(WAIT_MILLIS, TimeUnit.MILLISECONDS);
			return CollaboratorResult.success(new MediaDescription(30.0, null, null, List.of()));
		});

		try {
			EvaluationSubmissionDto submission = submit(uniqueUri(), 60.0, CheckSet.LONG_FORM_ABCD);
			assertThat(started.await(WAIT_MILLIS, TimeUnit.MILLISECONDS)).isTrue();

			jobService.cancel(submission.jobId());
			EvaluationJobDto job = awaitFinished(submission.jobId());

			assertThat(job.status()).isEqualTo(JobStatus.CANCELED);
			assertThat(job.errorCode()).isEqualTo(JobErrorCode.CANCELED.name());
			assertThat(ledger.balance(accountId)).isEqualTo(1000);
			assertThatThrownBy(() -> jobService.cancel(submission.jobId()))
					.isInstanceOf(ResponseStatusException.class);
		} finally {
			release.countDown();
		}
	}

	@Test
	void jobsAreOnlyVisibleToTheirAccount() throws Exception {
		EvaluationSubmissionDto submission = submit(uniqueUri(), 60.0, CheckSet.SHORTS);
		awaitFinished(submission.jobId());

		assertThatThrownBy(() -> jobService.get(submission.jobId(), "someone-else", false))
				.isInstanceOf(ResponseStatusException.class)
				.satisfies(ex -> assertThat(((ResponseStatusException) ex).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
		assertThat(jobService.get(submission.jobId(), "operator", true).accountId()).isEqualTo(accountId);
		assertThat(jobService.recent(accountId)).extracting(EvaluationJobDto::jobId).contains(submission.jobId());
	}

	@Test
	void adminRefundReturnsTheCharge() throws Exception {
		EvaluationSubmissionDto submission = submit(uniqueUri(), 60.0, CheckSet.LONG_FORM_ABCD);
		awaitFinished(submission.jobId());

		LedgerEntry refund = jobService.adminRefund(submission.jobId());
		LedgerEntry repeated = jobService.adminRefund(submission.jobId());

		assertThat(refund.amount()).isEqualTo(300);
		assertThat(repeated.replayed()).isTrue();
		assertThat(ledger.balance(accountId)).isEqualTo(1000);
		assertThat(jobService.get(submission.jobId(), accountId, false).refundedAmount()).isEqualTo(600);
	}

	@Test
	void videoLongerThanDeclaredFailsWithCostMismatchAndRefunds() throws Exception {
		EvaluationSubmissionDto submission = submit(uniqueUri(), 1.0, CheckSet.LONG_FORM_ABCD);
		assertThat(submission.estimatedCost()).isEqualTo(10);

		EvaluationJobDto job = awaitFinished(submission.jobId());

		assertThat(job.status()).isEqualTo(JobStatus.FAILED);
		assertThat(job.errorCode()).isEqualTo(JobErrorCode.COST_MISMATCH.name());
		assertThat(job.errorMessage()).contains("30.0 s").contains("300");
		assertThat(job.refundedAmount()).isEqualTo(10);
		assertThat(job.actualCost()).isZero();
		assertThat(ledger.balance(accountId)).isEqualTo(1000);
		assertThat(ledger.findByIdempotencyKey(JobCharges.settleKey(submission.jobId()))).isEmpty();
	}

	@Test
	void unexpectedBranchErrorBecomesAGap() throws Exception {
		when(contentUnderstanding.evaluate(any(), anyList())).thenAnswer(invocation -> {
			List<CheckDefinition> checks = invocation.getArgument(1);
			if (checks.get(0).checkSet() == CheckSet.SHORTS) {
				throw new IllegalStateException("verdict parser bug");
			}
			return CollaboratorResult.success(detectedVerdicts(checks));
		});

		EvaluationSubmissionDto submission = submit(uniqueUri(), 60.0, CheckSet.LONG_FORM_ABCD, CheckSet.SHORTS);
		EvaluationJobDto job = awaitFinished(submission.jobId());

		assertThat(job.status()).isEqualTo(JobStatus.SUCCEEDED);
		assertThat(job.actualCost()).isEqualTo(300);
		EvaluationReport report = jobService.report(submission.jobId(), accountId, false);
		assertThat(report.gaps()).singleElement().satisfies(gap -> {
			assertThat(gap.checkSet()).isEqualTo(CheckSet.SHORTS);
			assertThat(gap.errorCode()).isEqualTo(EvaluationOrchestrator.BRANCH_ERROR);
			assertThat(gap.message()).doesNotContain("verdict parser bug");
		});
	}

	@Test
	void failedPostProcessingStepLeavesItsArtifactOut() throws Exception {
		when(contentUnderstanding.profile(any(), any())).thenThrow(new IllegalStateException("profile exploded"));

		EvaluationSubmissionDto submission = submit(uniqueUri(), 60.0, CheckSet.LONG_FORM_ABCD);
		EvaluationJobDto job = awaitFinished(submission.jobId());

		assertThat(job.status()).isEqualTo(JobStatus.SUCCEEDED);
		EvaluationReport report = jobService.report(submission.jobId(), accountId, false);
		assertThat(report.artifacts().brandProfile()).isNull();
		assertThat(report.gaps()).isEmpty();
		assertThat(report.benchmarks()).isNotNull();
		assertThat(report.benchmarks().vertical()).isEqualTo("all");
		assertThat(ledger.balance(accountId)).isEqualTo(700);
	}

	@Test
	void reportCarriesAccessibilityPlatformFitAndBenchmarks() throws Exception {
		String fortyWords = String.join(" ", Collections.nCopies(40, "word"));
		when(contentUnderstanding.describe(any())).thenReturn(CollaboratorResult.success(new MediaDescription(
				30.0, "Acme", "A product demo", List.of(
						new Scene(0, 0.0, 12.0, "Opening", fortyWords, 1.0),
						new Scene(1, 12.0, 30.0, "Demo", null, null)))));

		EvaluationSubmissionDto submission = submit(uniqueUri(), 60.0, CheckSet.CREATIVE_INTELLIGENCE);
		awaitFinished(submission.jobId());

		EvaluationReport report = jobService.report(submission.jobId(), accountId, false);
		assertThat(report.accessibility()).isNotNull();
		assertThat(report.accessibility().speechRate().wordsPerMinute()).isEqualTo(200.0);
		assertThat(report.accessibility().speechRate().flag()).isEqualTo(SpeechRate.Flag.TOO_FAST);
		assertThat(report.accessibility().total()).isEqualTo(4);
		assertThat(report.accessibility().passed()).isEqualTo(3);
		assertThat(report.accessibility().score()).isEqualTo(75.0);
		assertThat(report.accessibilityRemediation()).singleElement().satisfies(item -> {
			assertThat(item.checkId()).isEqualTo("acc_speech_rate");
			assertThat(item.remediation()).startsWith("Speech rate is 200 WPM.");
		});
		assertThat(report.platformFit()).extracting(PlatformScore::platform)
				.containsExactly("youtube", "meta_feed", "meta_reels", "tiktok", "ctv");
		assertThat(report.platformFit()).allSatisfy(fit -> {
			assertThat(fit.score()).isBetween(0, 100);
			assertThat(fit.tips()).hasSizeLessThanOrEqualTo(3);
		});
		assertThat(report.benchmarks()).isNotNull();
		assertThat(report.benchmarks().vertical()).isEqualTo("all");
		assertThat(report.benchmarks().sampleSize()).isZero();
	}

	@Test
	void reaperAndRunnerFinishAJobOnlyOnce() throws Exception {
		CountDownLatch started = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		when(contentUnderstanding.describe(any())).thenAnswer(invocation -> {
			started.countDown();
			release.await(WAIT_MILLIS, TimeUnit.MILLISECONDS);
			return CollaboratorResult.success(new MediaDescription(30.0, null, null, List.of()));
		});
		// the reaper of another instance: it cannot see this runner and its clock is past the stale cutoff
		StaleJobReaper reaper = new StaleJobReaper(jobRepository, mock(EvaluationOrchestrator.class), admissionService,
				jobCharges, progress, properties, Clock.offset(Clock.systemUTC(), Duration.ofHours(1)));

		String jobId;
		try {
			jobId = submit(uniqueUri(), 60.0, CheckSet.LONG_FORM_ABCD).jobId();
			assertThat(started.await(WAIT_MILLIS, TimeUnit.MILLISECONDS)).isTrue();

			assertThat(reaper.reapOnce()).isEqualTo(1);
		} finally {
			release.countDown();
		}
		awaitRunnerGone(jobId);

		EvaluationJobDto job = jobService.get(jobId, accountId, false);
		assertThat(job.status()).isEqualTo(JobStatus.FAILED);
		assertThat(job.errorCode()).isEqualTo(JobErrorCode.STALE_TIMEOUT.name());
		assertThat(job.refundedAmount()).isEqualTo(600);
		assertThat(ledger.balance(accountId)).isEqualTo(1000);
		assertThat(ledger.findByIdempotencyKey(JobCharges.settleKey(jobId))).isEmpty();
		assertThat(reaper.reapOnce()).isZero();
	}

	@Test
	void cancelOfAFinishedJobLeavesNoPendingRequest() throws Exception {
		EvaluationSubmissionDto submission = submit(uniqueUri(), 60.0, CheckSet.SHORTS);
		awaitFinished(submission.jobId());

		orchestrator.cancel(submission.jobId());
		orchestrator.cancel("no-such-job");

		assertThat(orchestrator.hasPendingCancel(submission.jobId())).isFalse();
		assertThat(orchestrator.hasPendingCancel("no-such-job")).isFalse();
	}

	@Test
	void reviewerFeedbackFeedsCheckReliability() throws Exception {
		EvaluationSubmissionDto submission = submit(uniqueUri(), 60.0, CheckSet.SHORTS);
		awaitFinished(submission.jobId());
		String checkId = jobService.report(submission.jobId(), accountId, false)
				.checkSetResults().get(0).checks().get(0).checkId();

		assertThat(calibrationService.submit(submission.jobId(), accountId, false,
				new FeedbackRequestDto(checkId, "correct")).verdict()).isEqualTo(FeedbackVerdict.CORRECT);
		calibrationService.submit(submission.jobId(), accountId, false, new FeedbackRequestDto(checkId, "INCORRECT"));

		assertThatThrownBy(() -> calibrationService.submit(submission.jobId(), accountId, false,
				new FeedbackRequestDto("no_such_check", "correct")))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> calibrationService.submit(submission.jobId(), accountId, false,
				new FeedbackRequestDto(checkId, "maybe")))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> calibrationService.submit(submission.jobId(), "someone-else", false,
				new FeedbackRequestDto(checkId, "correct")))
				.isInstanceOf(ResponseStatusException.class);

		assertThat(calibrationService.reliability()).singleElement().satisfies(reliability -> {
			assertThat(reliability.checkId()).isEqualTo(checkId);
			assertThat(reliability.sampleSize()).isEqualTo(2);
			assertThat(reliability.accuracy()).isEqualTo(0.5);
			assertThat(reliability.reliabilityLevel()).isEqualTo(ReliabilityLevel.LOW);
		});
	}

	@Test
	void invalidRequestsAreRejectedBeforeAdmission() {
		assertThatThrownBy(() -> jobService.submit(accountId,
				new EvaluationRequestDto(uniqueUri(), 60.0, null, List.of("NOT_A_SET"))))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> jobService.submit(accountId,
				new EvaluationRequestDto(" ", 60.0, null, List.of("SHORTS"))))
				.isInstanceOf(IllegalArgumentException.class);
		assertThat(ledger.balance(accountId)).isEqualTo(1000);
		assertThat(admissionService.activeJob(accountId)).isEmpty();
	}

	private EvaluationSubmissionDto submit(String uri, Double durationSeconds, CheckSet... checkSets) {
		List<String> names = Arrays.stream(checkSets).map(CheckSet::name).toList();
		return jobService.submit(accountId, new EvaluationRequestDto(uri, durationSeconds, null, names));
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

	private void awaitRunnerGone(String jobId) throws InterruptedException {
		long deadline = System.currentTimeMillis() + WAIT_MILLIS;
		while (orchestrator.isActive(jobId)) {
			if (System.currentTimeMillis() > deadline) {
				throw new AssertionError("Runner of job " + jobId + " did not stop in time");
			}
			Thread.sleep(50);
		}
	}

	private static List<CheckVerdict> detectedVerdicts(List<CheckDefinition> checks) {
		return checks.stream()
				.map(check -> new CheckVerdict(check.id(), true, 0.9, "Present", "00:01", null))
				.toList();
	}

	private static String uniqueUri() {
		return "https://cdn.example.com/ads/" + UUID.randomUUID() + ".mp4";
	}
}
