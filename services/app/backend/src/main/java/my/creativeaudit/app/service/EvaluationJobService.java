package my.creativeaudit.app.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import my.creativeaudit.app.config.AppProperties;
import my.creativeaudit.app.domain.EvaluationJob;
import my.creativeaudit.app.domain.JobErrorCode;
import my.creativeaudit.app.domain.JobPhase;
import my.creativeaudit.app.domain.JobStatus;
import my.creativeaudit.app.dto.EvaluationJobDto;
import my.creativeaudit.app.dto.EvaluationRequestDto;
import my.creativeaudit.app.dto.EvaluationSubmissionDto;
import my.creativeaudit.app.model.EvaluationReport;
import my.creativeaudit.app.model.MediaRef;
import my.creativeaudit.app.model.ProgressEvent;
import my.creativeaudit.app.repository.EvaluationJobRepository;
import my.creativeaudit.app.rubric.CheckSet;
import my.creativeaudit.app.service.util.MdcAwareThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Caller-facing evaluation jobs: submission through admission, status and report lookup, progress subscription
 * and the operator actions (cancel, refund).
 */
@Service
public class EvaluationJobService {
	private static final Logger logger = LoggerFactory.getLogger(EvaluationJobService.class);

	private final AdmissionService admissionService;
	private final CostEstimator costEstimator;
	private final EvaluationOrchestrator orchestrator;
	private final ProgressBroadcaster progress;
	private final JobCharges jobCharges;
	private final EvaluationJobRepository jobRepository;
	private final ObjectMapper objectMapper;
	private final Clock clock;
	private final ExecutorService jobPool;

	public EvaluationJobService(AdmissionService admissionService,
								CostEstimator costEstimator,
								EvaluationOrchestrator orchestrator,
								ProgressBroadcaster progress,
								JobCharges jobCharges,
								EvaluationJobRepository jobRepository,
								ObjectMapper objectMapper,
								AppProperties properties,
								Clock clock) {
		this.admissionService = admissionService;
		this.costEstimator = costEstimator;
		this.orchestrator = orchestrator;
		this.progress = progress;
		this.jobCharges = jobCharges;
		this.jobRepository = jobRepository;
		this.objectMapper = objectMapper;
		this.clock = clock;
		this.jobPool = new MdcAwareThreadPoolExecutor("evaluation", properties.evaluation().maxConcurrentJobsOrDefault());
	}

	public EvaluationSubmissionDto submit(String accountId, EvaluationRequestDto request) {
		if (request == null || request.mediaUri() == null || request.mediaUri().isBlank()) {
			throw new IllegalArgumentException("mediaUri is required");
		}
		Set<CheckSet> checkSets = parseCheckSets(request.checkSets());
		MediaRef media = new MediaRef(request.mediaUri().trim(), request.durationSeconds(), blankToNull(request.brandName()));
		long estimate = costEstimator.estimate(request.durationSeconds());
		String fingerprint = FingerprintCache.fingerprint(media.uri(), checkSets);

		JobSlot slot = admissionService.tryAdmit(accountId, estimate);
		JobRequest jobRequest = new JobRequest(accountId, slot.jobId(), media, checkSets, estimate, fingerprint);
		try {
			jobRepository.save(newJob(jobRequest));
		} catch (RuntimeException ex) {
			jobCharges.compensate(accountId, slot.jobId(), estimate);
			slot.close();
			throw ex;
		}
		progress.publish(slot.jobId(), "queued", 0, "Queued", null);
		try {
			jobPool.execute(() -> {
				try (JobSlot held = slot) {
					orchestrator.run(jobRequest);
				}
			});
		} catch (RejectedExecutionException ex) {
			logger.warn("Evaluation {} rejected by the job pool: {}", slot.jobId(), ex.getMessage());
			if (markFailed(slot.jobId(), JobErrorCode.INTERNAL_ERROR, "Service is shutting down")) {
				jobCharges.compensate(accountId, slot.jobId(), estimate);
			}
			slot.close();
			throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Service is shutting down");
		}
		logger.info("Evaluation {} submitted by {} ({} check-set(s), estimate {})", slot.jobId(), accountId,
				checkSets.size(), estimate);
		return new EvaluationSubmissionDto(slot.jobId(), JobStatus.QUEUED, estimate);
	}

	public EvaluationJobDto get(String jobId, String accountId, boolean admin) {
		return toDto(load(jobId, accountId, admin));
	}

	public List<EvaluationJobDto> recent(String accountId) {
		return jobRepository.findTop50ByAccountIdOrderByCreatedAtDesc(accountId).stream().map(this::toDto).toList();
	}

	public EvaluationReport report(String jobId, String accountId, boolean admin) {
		EvaluationJob job = load(jobId, accountId, admin);
		if (job.getStatus() != JobStatus.SUCCEEDED || job.getReportJson() == null) {
			throw new ResponseStatusException(HttpStatus.CONFLICT, "Report not available while job is " + job.getStatus());
		}
		try {
			return objectMapper.readValue(job.getReportJson(), EvaluationReport.class);
		} catch (JsonProcessingException ex) {
			throw new IllegalStateException("Stored report of job " + jobId + " is unreadable", ex);
		}
	}

	/**
	 * Subscribes to a job's progress. A job that finished before this process started replays a terminal event
	 * rebuilt from its record.
	 */
	public ProgressBroadcaster.Subscription subscribe(String jobId,
													  String accountId,
													  boolean admin,
													  Consumer<ProgressEvent> listener) {
		EvaluationJob job = load(jobId, accountId, admin);
		if (job.getStatus().terminal() && progress.terminalEvent(jobId).isEmpty()) {
			progress.publish(terminalEvent(job));
		}
		return progress.subscribe(jobId, listener);
	}

	public EvaluationJobDto cancel(String jobId) {
		EvaluationJob job = jobRepository.findById(jobId)
				.orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Evaluation job not found"));
		if (job.getStatus().terminal()) {
			throw new ResponseStatusException(HttpStatus.CONFLICT, "Job already " + job.getStatus());
		}
		orchestrator.cancel(jobId);
		logger.info("Cancel requested for evaluation {}", jobId);
		return toDto(job);
	}

	/**
	 * Refunds what a succeeded job was charged. Repeating the call returns the original refund.
	 */
	public LedgerEntry adminRefund(String jobId) {
		EvaluationJob job = jobRepository.findById(jobId)
				.orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Evaluation job not found"));
		long charged = job.getActualCost() == null ? 0L : job.getActualCost();
		if (job.getStatus() != JobStatus.SUCCEEDED || charged <= 0) {
			throw new IllegalArgumentException("Job " + jobId + " has nothing billed to refund");
		}
		LedgerEntry entry = jobCharges.adminRefund(job.getAccountId(), jobId, charged);
		if (!entry.replayed()) {
			job.setRefundedAmount((job.getRefundedAmount() == null ? 0L : job.getRefundedAmount()) + entry.amount());
			jobRepository.save(job);
		}
		logger.info("Admin refund of {} for job {} (replayed={})", entry.amount(), jobId, entry.replayed());
		return entry;
	}

	@PreDestroy
	public void shutdown() {
		jobPool.shutdownNow();
	}

	private EvaluationJob load(String jobId, String accountId, boolean admin) {
		EvaluationJob job = jobRepository.findById(jobId).orElse(null);
		if (job == null || (!admin && !job.getAccountId().equals(accountId))) {
			throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Evaluation job not found");
		}
		return job;
	}

	private EvaluationJob newJob(JobRequest request) {
		EvaluationJob job = new EvaluationJob();
		job.setJobId(request.jobId());
		job.setAccountId(request.accountId());
		job.setMediaUri(request.media().uri());
		job.setDeclaredDurationSeconds(request.media().declaredDurationSeconds());
		job.setBrandName(request.media().brandName());
		job.setCheckSets(CheckSet.joinSorted(request.checkSets()));
		job.setStatus(JobStatus.QUEUED);
		job.setPhase(JobPhase.QUEUED);
		job.setProgress(0);
		job.setCreatedAt(LocalDateTime.now(clock));
		job.setEstimatedCost(request.estimatedCost());
		job.setRefundedAmount(0L);
		job.setFingerprint(request.fingerprint());
		return job;
	}

	private boolean markFailed(String jobId, JobErrorCode errorCode, String message) {
		return jobRepository.finish(jobId, JobStatus.FAILED, errorCode.name(), message, LocalDateTime.now(clock));
	}

	private ProgressEvent terminalEvent(EvaluationJob job) {
		if (job.getStatus() == JobStatus.SUCCEEDED) {
			EvaluationReport report = job.getReportJson() == null ? null : report(job.getJobId(), job.getAccountId(), true);
			return new ProgressEvent(job.getJobId(), ProgressEvent.COMPLETE, 100, "Evaluation complete", report);
		}
		String code = job.getErrorCode() == null ? job.getStatus().name() : job.getErrorCode();
		String message = job.getErrorMessage() == null ? "Evaluation " + job.getStatus().name().toLowerCase(Locale.ROOT)
				: job.getErrorMessage();
		return new ProgressEvent(job.getJobId(), ProgressEvent.ERROR, job.getProgress() == null ? 0 : job.getProgress(),
				message, Map.of("errorCode", code, "message", message));
	}

	private EvaluationJobDto toDto(EvaluationJob job) {
		return new EvaluationJobDto(
				job.getJobId(),
				job.getAccountId(),
				job.getMediaUri(),
				CheckSet.parseList(job.getCheckSets()).stream().map(CheckSet::name).sorted().toList(),
				job.getStatus(),
				job.getPhase(),
				job.getProgress() == null ? 0 : job.getProgress(),
				job.getCreatedAt(),
				job.getStartedAt(),
				job.getFinishedAt(),
				job.getEstimatedCost(),
				job.getActualCost(),
				job.getRefundedAmount(),
				job.isCacheHit(),
				job.getErrorCode(),
				job.getErrorMessage()
		);
	}

	static Set<CheckSet> parseCheckSets(List<String> names) {
		if (names == null || names.isEmpty()) {
			throw new IllegalArgumentException("At least one check-set is required");
		}
		Set<CheckSet> checkSets = EnumSet.noneOf(CheckSet.class);
		for (String name : names) {
			if (name == null || name.isBlank()) {
				throw new IllegalArgumentException("Check-set names must not be blank");
			}
			try {
				checkSets.add(CheckSet.valueOf(name.trim().toUpperCase(Locale.ROOT)));
			} catch (IllegalArgumentException ex) {
				throw new IllegalArgumentException("Unknown check-set: " + name, ex);
			}
		}
		return checkSets;
	}

	private static String blankToNull(String value) {
		return value == null || value.isBlank() ? null : value.trim();
	}
}
