package my.creativeaudit.app.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import my.creativeaudit.app.collaborator.AnalyticsWarehouseClient;
import my.creativeaudit.app.collaborator.ChatNotifier;
import my.creativeaudit.app.collaborator.CollaboratorResult;
import my.creativeaudit.app.collaborator.ContentUnderstandingClient;
import my.creativeaudit.app.collaborator.MediaToolkit;
import my.creativeaudit.app.collaborator.ObjectStorageClient;
import my.creativeaudit.app.config.AppProperties;
import my.creativeaudit.app.domain.EvaluationJob;
import my.creativeaudit.app.domain.JobErrorCode;
import my.creativeaudit.app.domain.JobPhase;
import my.creativeaudit.app.domain.JobStatus;
import my.creativeaudit.app.model.AudioLevels;
import my.creativeaudit.app.model.BrandProfile;
import my.creativeaudit.app.model.CheckResult;
import my.creativeaudit.app.model.CheckSetResult;
import my.creativeaudit.app.model.EvaluatedCheck;
import my.creativeaudit.app.model.EvaluationReport;
import my.creativeaudit.app.model.Keyframe;
import my.creativeaudit.app.model.MediaDescription;
import my.creativeaudit.app.model.MediaRef;
import my.creativeaudit.app.model.PostProcessingArtifacts;
import my.creativeaudit.app.model.ProgressEvent;
import my.creativeaudit.app.model.Scene;
import my.creativeaudit.app.model.TechnicalMetadata;
import my.creativeaudit.app.repository.EvaluationJobRepository;
import my.creativeaudit.app.rubric.CheckSet;
import my.creativeaudit.app.rubric.RubricCatalog;
import my.creativeaudit.app.scoring.BenchmarkScores;
import my.creativeaudit.app.scoring.Benchmarks;
import my.creativeaudit.app.scoring.ScoringEngine;
import my.creativeaudit.app.scoring.ScoringSnapshot;
import my.creativeaudit.app.service.util.MdcAwareThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Drives one admitted evaluation from cache check to settled report.
 * <p>
 * Stages run on per-job pools sized to their fan-out (metadata and fetch in parallel, one branch per check-set,
 * post-processing tasks). The job thread only waits at stage joins, in slices, so a cancel request or the
 * wall-clock ceiling ends the job at the next join. Whatever way the job ends, the hold placed at admission is
 * either settled against the measured cost or refunded in full.
 * <p>
 * The terminal status is claimed with a conditional update before any money moves, so when the stale-job reaper
 * and the runner race, only the side that claimed the job settles or compensates it.
 */
@Service
public class EvaluationOrchestrator {
	private static final Logger logger = LoggerFactory.getLogger(EvaluationOrchestrator.class);
	static final double LEADING_WINDOW_SECONDS = 5.0;
	private static final int[] BRANCH_MILESTONES = {50, 55, 60};
	private static final int METADATA_THREADS = 2;
	static final String BRANCH_ERROR = "BRANCH_ERROR";

	private final RubricCatalog catalog;
	private final CheckSetEvaluator checkSetEvaluator;
	private final ContentUnderstandingClient contentUnderstanding;
	private final ObjectStorageClient storage;
	private final MediaToolkit mediaToolkit;
	private final AnalyticsWarehouseClient warehouse;
	private final ChatNotifier chatNotifier;
	private final ScoringEngine scoringEngine;
	private final ReportAssembler reportAssembler;
	private final BenchmarkService benchmarkService;
	private final CostEstimator costEstimator;
	private final JobCharges jobCharges;
	private final FingerprintCache cache;
	private final ProgressBroadcaster progress;
	private final DetachedTaskRunner detached;
	private final EvaluationJobRepository jobRepository;
	private final ObjectMapper objectMapper;
	private final AppProperties properties;
	private final Clock clock;
	private final Map<String, JobContext> running = new ConcurrentHashMap<>();
	private final Set<String> pendingCancels = ConcurrentHashMap.newKeySet();

	public EvaluationOrchestrator(RubricCatalog catalog,
								  CheckSetEvaluator checkSetEvaluator,
								  ContentUnderstandingClient contentUnderstanding,
								  ObjectStorageClient storage,
								  MediaToolkit mediaToolkit,
								  AnalyticsWarehouseClient warehouse,
								  ChatNotifier chatNotifier,
								  ScoringEngine scoringEngine,
								  ReportAssembler reportAssembler,
								  BenchmarkService benchmarkService,
								  CostEstimator costEstimator,
								  JobCharges jobCharges,
								  FingerprintCache cache,
								  ProgressBroadcaster progress,
								  DetachedTaskRunner detached,
								  EvaluationJobRepository jobRepository,
								  ObjectMapper objectMapper,
								  AppProperties properties,
								  Clock clock) {
		this.catalog = catalog;
		this.checkSetEvaluator = checkSetEvaluator;
		this.contentUnderstanding = contentUnderstanding;
		this.storage = storage;
		this.mediaToolkit = mediaToolkit;
		this.warehouse = warehouse;
		this.chatNotifier = chatNotifier;
		this.scoringEngine = scoringEngine;
		this.reportAssembler = reportAssembler;
		this.benchmarkService = benchmarkService;
		this.costEstimator = costEstimator;
		this.jobCharges = jobCharges;
		this.cache = cache;
		this.progress = progress;
		this.detached = detached;
		this.jobRepository = jobRepository;
		this.objectMapper = objectMapper;
		this.properties = properties;
		this.clock = clock;
	}

	/**
	 * Runs the job to a terminal state on the calling thread. Never throws: every outcome is recorded on the job
	 * and published as a terminal progress event.
	 */
	public void run(JobRequest request) {
		String jobId = request.jobId();
		JobContext context = new JobContext(jobId, properties.evaluation().jobTimeout(), clock);
		running.put(jobId, context);
		if (pendingCancels.remove(jobId)) {
			context.cancel();
		}
		MDC.put("jobId", jobId);
		MDC.put("accountId", request.accountId());
		try {
			execute(request, context);
		} catch (AlreadyFinishedException ex) {
			logger.info("Evaluation {} is already {}; stopping", jobId, ex.status);
		} catch (JobAbortedException ex) {
			JobStatus status = ex.getErrorCode() == JobErrorCode.CANCELED ? JobStatus.CANCELED : JobStatus.FAILED;
			logger.info("Evaluation {} ended {} ({}): {}", jobId, status, ex.getErrorCode(), ex.getMessage());
			fail(request, status, ex.getErrorCode(), ex.getMessage());
		} catch (OptimisticLockingFailureException ex) {
			logger.info("Evaluation {} was finished concurrently; stopping", jobId);
		} catch (RuntimeException ex) {
			fail(request, JobStatus.FAILED, JobErrorCode.INTERNAL_ERROR, failWithReference(jobId, ex));
		} finally {
			running.remove(jobId);
			pendingCancels.remove(jobId);
			MDC.remove("jobId");
			MDC.remove("accountId");
		}
	}

	/**
	 * Requests cancellation. A running job stops at its next suspension point; a queued job stops before its
	 * first stage.
	 */
	public void cancel(String jobId) {
		JobContext context = running.get(jobId);
		if (context != null) {
			context.cancel();
			return;
		}
		pendingCancels.add(jobId);
		context = running.get(jobId);
		if (context != null) {
			context.cancel();
			pendingCancels.remove(jobId);
			return;
		}
		// no runner will pick up a job that is gone or already finished
		boolean finished = jobRepository.findById(jobId).map(job -> job.getStatus().terminal()).orElse(true);
		if (finished) {
			pendingCancels.remove(jobId);
		}
	}

	public boolean isActive(String jobId) {
		return running.containsKey(jobId);
	}

	void clearPendingCancel(String jobId) {
		pendingCancels.remove(jobId);
	}

	boolean hasPendingCancel(String jobId) {
		return pendingCancels.contains(jobId);
	}

	private void execute(JobRequest request, JobContext context) {
		String jobId = request.jobId();
		EvaluationJob record = jobRepository.findById(jobId)
				.orElseThrow(() -> new IllegalStateException("Job record " + jobId + " is missing"));
		if (record.getStatus().terminal()) {
			throw new AlreadyFinishedException(record.getStatus());
		}
		context.checkpoint();
		record.setStatus(JobStatus.RUNNING);
		record.setPhase(JobPhase.PREPROCESSING);
		record.setStartedAt(LocalDateTime.now(clock));
		jobRepository.save(record);

		EvaluationReport cached = cache.lookup(request.fingerprint()).orElse(null);
		if (cached != null) {
			finishFromCache(request, cached);
			return;
		}

		MediaRef media = request.media();
		Leading leading = preprocess(request, context);

		// analysis
		milestone(jobId, JobPhase.ANALYZING, "metadata", 8, "Reading video metadata", null);
		MediaDescription description;
		byte[] video;
		ExecutorService metadataPool = pool(jobId, "meta", METADATA_THREADS);
		try {
			Future<CollaboratorResult<MediaDescription>> describeFuture =
					metadataPool.submit(() -> contentUnderstanding.describe(media));
			Future<CollaboratorResult<byte[]>> fetchFuture = leading.video() == null && media.isStorageLocator()
					? metadataPool.submit(() -> storage.fetch(media.uri()))
					: null;
			description = valueOrWarn(context.await(describeFuture), "describe");
			video = fetchFuture == null ? leading.video() : valueOrWarn(context.await(fetchFuture), "fetch");
		} finally {
			metadataPool.shutdownNow();
		}
		List<Scene> scenes = description == null ? List.of() : description.scenes();
		Double describedDuration = description == null ? null : description.durationSeconds();
		String brandName = media.brandName() != null ? media.brandName()
				: description == null ? null : description.brandName();
		Map<String, Object> metadataPartial = new LinkedHashMap<>();
		metadataPartial.put("scenes", scenes.size());
		metadataPartial.put("durationSeconds", describedDuration);
		metadataPartial.put("brandName", brandName);
		milestone(jobId, JobPhase.ANALYZING, "metadata_done", 18, "Metadata ready", metadataPartial);
		verifyCost(request, describedDuration);

		Map<CheckSet, BranchOutcome> outcomes = analyze(request, context, media, leading.media(),
				describedDuration != null ? describedDuration : media.declaredDurationSeconds());

		// post-processing
		milestone(jobId, JobPhase.POSTPROCESSING, "post", 65, "Extracting keyframes and audio", null);
		PostProcessingArtifacts artifacts = postProcess(request, context, video, scenes, brandName);

		// finalizing
		context.checkpoint();
		milestone(jobId, JobPhase.FINALIZING, "formatting", 95, "Assembling report", null);

		Double measured = artifacts.technicalMetadata() != null && artifacts.technicalMetadata().durationSeconds() != null
				? artifacts.technicalMetadata().durationSeconds()
				: describedDuration;
		verifyCost(request, measured);
		long actual = costEstimator.actual(measured, request.estimatedCost());
		List<EvaluatedCheck> evaluated = new ArrayList<>();
		outcomes.values().stream().filter(outcome -> !outcome.failed()).forEach(outcome -> evaluated.addAll(outcome.checks()));
		ScoringSnapshot scoring = scoringEngine.score(evaluated);
		String vertical = artifacts.brandProfile() == null ? null : artifacts.brandProfile().category();
		BenchmarkScores headline = benchmarkService.scores(evaluated, scoring, vertical);
		EvaluationReport report = reportAssembler.assemble(jobId, media, brandName, outcomes, scoring, scenes, artifacts,
				benchmarks(jobId, headline), measured, actual, Instant.now(clock));
		context.checkpoint();
		if (complete(request, report, false)) {
			spawnSideEffects(request, report, headline);
		}
	}

	private void finishFromCache(JobRequest request, EvaluationReport cached) {
		String jobId = request.jobId();
		verifyCost(request, cached.measuredDurationSeconds());
		long actual = costEstimator.actual(cached.measuredDurationSeconds(), request.estimatedCost());
		EvaluationReport report = cached.reissue(jobId, Instant.now(clock), actual);
		milestone(jobId, JobPhase.FINALIZING, "cache", 100, "Served from cache", null);
		logger.info("Evaluation {} served from cache (fingerprint={})", jobId, request.fingerprint());
		complete(request, report, true);
	}

	private Leading preprocess(JobRequest request, JobContext context) {
		MediaRef media = request.media();
		if (!catalog.requiresLeadingWindow(request.checkSets()) || !media.isStorageLocator()) {
			return new Leading(null, null);
		}
		milestone(request.jobId(), JobPhase.PREPROCESSING, "trim", 5, "Trimming the opening seconds", null);
		byte[] video = valueOrWarn(storage.fetch(media.uri()), "fetch");
		context.checkpoint();
		if (video == null) {
			return new Leading(null, null);
		}
		byte[] trimmed = valueOrWarn(mediaToolkit.trimLeading(video, LEADING_WINDOW_SECONDS), "trim");
		context.checkpoint();
		if (trimmed == null) {
			return new Leading(video, null);
		}
		String locator = media.uri() + ".first5s.mp4";
		String stored = valueOrWarn(storage.store(locator, trimmed, "video/mp4"), "store leading window");
		context.checkpoint();
		return new Leading(video, stored == null ? null : media.withUri(stored));
	}

	private Map<CheckSet, BranchOutcome> analyze(JobRequest request,
												 JobContext context,
												 MediaRef media,
												 MediaRef leadingWindow,
												 Double durationSeconds) {
		String jobId = request.jobId();
		milestone(jobId, JobPhase.ANALYZING, "evaluating", 20, "Evaluating check-sets", null);
		List<CheckSet> checkSets = request.checkSets().stream().sorted().toList();
		int threads = Math.min(checkSets.size(), properties.evaluation().analysisParallelismOrDefault());
		ExecutorService analysisPool = pool(jobId, "analysis", Math.max(1, threads));
		Map<CheckSet, BranchOutcome> outcomes = new EnumMap<>(CheckSet.class);
		try {
			CompletionService<BranchOutcome> completion = new ExecutorCompletionService<>(analysisPool);
			for (CheckSet checkSet : checkSets) {
				MediaRef leading = checkSet == CheckSet.LONG_FORM_ABCD ? leadingWindow : null;
				completion.submit(() -> evaluateBranch(checkSet, media, leading, durationSeconds));
			}
			for (int i = 0; i < checkSets.size(); i++) {
				BranchOutcome outcome = context.next(completion);
				outcomes.put(outcome.checkSet(), outcome);
				int percentage = BRANCH_MILESTONES[Math.min(i, BRANCH_MILESTONES.length - 1)];
				CheckSetResult partial = outcome.failed()
						? CheckSetResult.failed(outcome.checkSet(), outcome.errorCode(), outcome.message())
						: CheckSetResult.completed(outcome.checkSet(), outcome.checks().stream().map(CheckResult::of).toList());
				milestone(jobId, JobPhase.ANALYZING, outcome.checkSet().milestone(), percentage,
						outcome.failed() ? outcome.checkSet() + " failed" : outcome.checkSet() + " evaluated", partial);
			}
		} finally {
			analysisPool.shutdownNow();
		}
		if (outcomes.values().stream().allMatch(BranchOutcome::failed)) {
			throw new JobAbortedException(JobErrorCode.ALL_BRANCHES_FAILED, "Every check-set evaluation failed");
		}
		return outcomes;
	}

	/**
	 * Runs one check-set. An unexpected error becomes a failed branch, so the other check-sets still report.
	 */
	private BranchOutcome evaluateBranch(CheckSet checkSet, MediaRef media, MediaRef leading, Double durationSeconds) {
		try {
			return checkSetEvaluator.evaluate(checkSet, media, leading, durationSeconds);
		} catch (RuntimeException ex) {
			String reference = reference();
			logger.warn("Check-set {} failed (ref={}): {}", checkSet, reference, ex.getMessage(), ex);
			return BranchOutcome.failure(checkSet, BRANCH_ERROR, "Check-set evaluation failed (ref " + reference + ")");
		}
	}

	private PostProcessingArtifacts postProcess(JobRequest request,
												JobContext context,
												byte[] video,
												List<Scene> scenes,
												String brandName) {
		String jobId = request.jobId();
		MediaRef media = request.media();
		ExecutorService postPool = pool(jobId, "post", properties.evaluation().postprocessingParallelismOrDefault());
		List<Keyframe> keyframes = null;
		AudioLevels audioLevels = null;
		BrandProfile brandProfile = null;
		TechnicalMetadata technicalMetadata = null;
		try {
			CompletionService<PostResult> completion = new ExecutorCompletionService<>(postPool);
			List<Callable<PostResult>> tasks = List.of(
					step("keyframes_done", 75,
							() -> video == null || scenes.isEmpty() ? null : extractKeyframes(media, video, scenes)),
					step("audio_done", 82,
							() -> video == null || scenes.isEmpty() ? null : valueOrWarn(mediaToolkit.audioLevels(video, scenes), "audio levels")),
					step("profile_done", 90,
							() -> valueOrWarn(contentUnderstanding.profile(media, brandName), "brand profile")),
					step("probe_done", 92,
							() -> video == null ? null : valueOrWarn(mediaToolkit.probe(video), "probe"))
			);
			tasks.forEach(completion::submit);
			for (int i = 0; i < tasks.size(); i++) {
				PostResult result = context.next(completion);
				switch (result.milestone()) {
					case "keyframes_done" -> keyframes = castList(result.value());
					case "audio_done" -> audioLevels = (AudioLevels) result.value();
					case "profile_done" -> brandProfile = (BrandProfile) result.value();
					case "probe_done" -> technicalMetadata = (TechnicalMetadata) result.value();
					default -> throw new IllegalStateException("Unknown post-processing step " + result.milestone());
				}
				milestone(jobId, JobPhase.POSTPROCESSING, result.milestone(), result.percentage(),
						result.failed() ? "Failed" : result.value() == null ? "Skipped" : "Done", null);
			}
		} finally {
			postPool.shutdownNow();
		}
		return new PostProcessingArtifacts(keyframes, audioLevels, brandProfile, technicalMetadata);
	}

	/**
	 * A post-processing task whose failure leaves its artifact out of the report instead of failing the job.
	 */
	private static Callable<PostResult> step(String milestone, int percentage, Supplier<Object> work) {
		return () -> {
			try {
				return new PostResult(milestone, percentage, work.get(), false);
			} catch (RuntimeException ex) {
				logger.warn("Post-processing step {} failed; continuing without it: {}", milestone, ex.getMessage(), ex);
				return new PostResult(milestone, percentage, null, true);
			}
		};
	}

	private List<Keyframe> extractKeyframes(MediaRef media, byte[] video, List<Scene> scenes) {
		List<Double> timestamps = scenes.stream().map(Scene::midpointSeconds).toList();
		List<byte[]> frames = valueOrWarn(mediaToolkit.extractFrames(video, timestamps), "keyframes");
		if (frames == null) {
			return null;
		}
		List<Keyframe> keyframes = new ArrayList<>();
		for (int i = 0; i < frames.size() && i < scenes.size(); i++) {
			byte[] frame = frames.get(i);
			if (frame == null || frame.length == 0) {
				continue;
			}
			Scene scene = scenes.get(i);
			String locator = String.format(Locale.ROOT, "%s.keyframes/scene_%03d.jpg", media.uri(), scene.index());
			String stored = valueOrWarn(storage.store(locator, frame, "image/jpeg"), "store keyframe");
			if (stored != null) {
				keyframes.add(new Keyframe(scene.index(), timestamps.get(i), stored));
			}
		}
		return keyframes;
	}

	/**
	 * Records the report and settles the hold.
	 *
	 * @return {@code false} when the job had already been finished elsewhere
	 */
	private boolean complete(JobRequest request, EvaluationReport report, boolean cacheHit) {
		String jobId = request.jobId();
		String reportJson = toJson(report);
		long charged = report.tokensUsed();
		updateActiveJob(jobId, job -> {
			job.setCacheHit(cacheHit);
			job.setActualCost(charged);
			job.setRefundedAmount(Math.max(0L, request.estimatedCost() - charged));
			job.setMeasuredDurationSeconds(report.measuredDurationSeconds());
			job.setReportJson(reportJson);
		});
		if (!jobRepository.finish(jobId, JobStatus.SUCCEEDED, null, null, LocalDateTime.now(clock))) {
			logger.info("Evaluation {} was finished elsewhere before it could complete", jobId);
			return false;
		}
		long refunded = jobCharges.settle(request.accountId(), jobId, request.estimatedCost(), charged);
		updateJob(jobId, job -> {
			job.setPhase(JobPhase.DONE);
			job.setProgress(100);
			job.setRefundedAmount(refunded);
		});
		if (!cacheHit) {
			cache.store(request.fingerprint(), report);
		}
		progress.publish(jobId, ProgressEvent.COMPLETE, 100, "Evaluation complete", report);
		logger.info("Evaluation {} succeeded (tokens={}, refunded={}, cacheHit={})", jobId, charged, refunded, cacheHit);
		return true;
	}

	private void fail(JobRequest request, JobStatus status, JobErrorCode errorCode, String message) {
		String jobId = request.jobId();
		long refunded = 0L;
		try {
			refunded = jobCharges.compensate(request.accountId(), jobId, request.estimatedCost());
		} catch (RuntimeException ex) {
			logger.error("Compensation of job {} failed; its hold is still outstanding: {}", jobId, ex.getMessage(), ex);
		}
		try {
			if (!jobRepository.finish(jobId, status, errorCode.name(), message, LocalDateTime.now(clock))) {
				logger.info("Evaluation {} was already finished; not recording {}", jobId, errorCode);
				return;
			}
			jobRepository.recordCharges(jobId, Math.max(0L, request.estimatedCost() - refunded), refunded);
		} catch (RuntimeException ex) {
			logger.error("Recording the failure of job {} failed: {}", jobId, ex.getMessage(), ex);
		}
		Map<String, Object> partial = new LinkedHashMap<>();
		partial.put("errorCode", errorCode.name());
		partial.put("message", message);
		progress.publish(jobId, ProgressEvent.ERROR, progress.lastPercentage(jobId), message, partial);
	}

	/**
	 * Fails the job when the video turns out longer than the duration its hold was sized for.
	 */
	private void verifyCost(JobRequest request, Double measuredSeconds) {
		if (measuredSeconds == null || measuredSeconds.isNaN() || measuredSeconds <= 0) {
			return;
		}
		long required = costEstimator.estimate(measuredSeconds);
		if (required > request.estimatedCost()) {
			throw new JobAbortedException(JobErrorCode.COST_MISMATCH, String.format(Locale.ROOT,
					"Video runs %.1f s and costs %d tokens, but only %d were held for the declared duration",
					measuredSeconds, required, request.estimatedCost()));
		}
	}

	private Benchmarks benchmarks(String jobId, BenchmarkScores headline) {
		try {
			return benchmarkService.benchmark(headline);
		} catch (RuntimeException ex) {
			logger.warn("Benchmarks unavailable for job {}: {}", jobId, ex.getMessage());
			return null;
		}
	}

	private void spawnSideEffects(JobRequest request, EvaluationReport report, BenchmarkScores headline) {
		String table = properties.collaborators().warehouse() == null
				|| properties.collaborators().warehouse().table() == null
				|| properties.collaborators().warehouse().table().isBlank()
				? "evaluations"
				: properties.collaborators().warehouse().table();
		detached.spawn("analytics", () -> warehouse.appendRows(table, analyticsRows(request, report)));
		detached.spawn("chat", () -> chatNotifier.notify(chatSummary(report)));
		detached.spawn("benchmark", () -> benchmarkService.record(request.jobId(), headline));
		if (request.media().isStorageLocator()) {
			String locator = request.media().uri() + "." + report.reportId() + ".report.json";
			detached.spawn("archive", () -> {
				CollaboratorResult<String> stored = storage.store(locator,
						toJson(report).getBytes(StandardCharsets.UTF_8), "application/json");
				if (stored instanceof CollaboratorResult.Failure<String> failure) {
					logger.warn("Report archival for {} failed ({}): {}", report.reportId(), failure.kind(), failure.message());
				}
			});
		}
	}

	static List<Map<String, Object>> analyticsRows(JobRequest request, EvaluationReport report) {
		List<Map<String, Object>> rows = new ArrayList<>();
		for (CheckSetResult result : report.checkSetResults()) {
			for (CheckResult check : result.checks()) {
				Map<String, Object> row = new LinkedHashMap<>();
				row.put("job_id", report.reportId());
				row.put("account_id", request.accountId());
				row.put("media_uri", report.mediaUri());
				row.put("brand_name", report.brandName());
				row.put("check_set", result.checkSet().name());
				row.put("check_id", check.checkId());
				row.put("detected", check.detected());
				row.put("confidence", check.confidence());
				row.put("overall_score", report.scoring() == null ? null : report.scoring().overallScore());
				row.put("generated_at", report.generatedAt().toString());
				rows.add(row);
			}
		}
		return rows;
	}

	static String chatSummary(EvaluationReport report) {
		ScoringSnapshot scoring = report.scoring();
		String score = scoring == null ? "n/a" : String.format(Locale.ROOT, "%.1f/100", scoring.overallScore());
		String risk = scoring == null ? "n/a" : scoring.labels().predictedCpaRisk();
		String gaps = report.gaps().isEmpty() ? "" : " (" + report.gaps().size() + " check-set(s) incomplete)";
		return "Evaluation " + report.reportId() + " of " + report.mediaUri() + ": score " + score
				+ ", CPA risk " + risk + gaps;
	}

	private void milestone(String jobId, JobPhase phase, String milestone, int percentage, String message, Object partial) {
		updateActiveJob(jobId, job -> {
			job.setPhase(phase);
			job.setProgress(Math.max(job.getProgress() == null ? 0 : job.getProgress(), percentage));
		});
		progress.publish(jobId, milestone, percentage, message, partial);
	}

	/**
	 * Applies a change while the job is still QUEUED or RUNNING. A concurrent finish surfaces as an
	 * {@link OptimisticLockingFailureException} on save.
	 */
	private void updateActiveJob(String jobId, Consumer<EvaluationJob> change) {
		EvaluationJob job = findJob(jobId);
		if (job.getStatus().terminal()) {
			throw new AlreadyFinishedException(job.getStatus());
		}
		change.accept(job);
		jobRepository.save(job);
	}

	private void updateJob(String jobId, Consumer<EvaluationJob> change) {
		EvaluationJob job = findJob(jobId);
		change.accept(job);
		jobRepository.save(job);
	}

	private EvaluationJob findJob(String jobId) {
		return jobRepository.findById(jobId)
				.orElseThrow(() -> new IllegalStateException("Job record " + jobId + " is missing"));
	}

	private String toJson(EvaluationReport report) {
		try {
			return objectMapper.writeValueAsString(report);
		} catch (JsonProcessingException ex) {
			throw new IllegalStateException("Report serialization failed", ex);
		}
	}

	private ExecutorService pool(String jobId, String stage, int threads) {
		return new MdcAwareThreadPoolExecutor("job-" + jobId.substring(0, Math.min(8, jobId.length())) + "-" + stage, threads);
	}

	private static <T> T valueOrWarn(CollaboratorResult<T> result, String operation) {
		if (result instanceof CollaboratorResult.Failure<T> failure) {
			logger.warn("{} unavailable ({}): {}", operation, failure.kind(), failure.message());
			return null;
		}
		return result.valueOrNull();
	}

	@SuppressWarnings("unchecked")
	private static List<Keyframe> castList(Object value) {
		return (List<Keyframe>) value;
	}

	private String failWithReference(String jobId, Exception ex) {
		String message = ex == null ? null : ex.getMessage();
		String reference = reference();
		logger.error("Evaluation job failed (ref={}, jobId={}, error={})", reference, jobId, message, ex);
		return "Error ref " + reference;
	}

	private static String reference() {
		return "EV-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
	}

	private record Leading(byte[] video, MediaRef media) {
	}

	private static final class AlreadyFinishedException extends RuntimeException {
		private final JobStatus status;

		private AlreadyFinishedException(JobStatus status) {
			super("Job already " + status);
			this.status = status;
		}
	}

	private record PostResult(String milestone, int percentage, Object value, boolean failed) {
	}
}
