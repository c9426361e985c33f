package my.creativeaudit.app.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import my.creativeaudit.app.config.AppProperties;
import my.creativeaudit.app.domain.EvaluationJob;
import my.creativeaudit.app.domain.JobErrorCode;
import my.creativeaudit.app.domain.JobStatus;
import my.creativeaudit.app.model.ProgressEvent;
import my.creativeaudit.app.repository.EvaluationJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fails jobs left QUEUED or RUNNING with no live runner, typically after a restart, and returns their holds.
 */
@Service
@ConditionalOnProperty(name = "app.evaluation.reaper-enabled", havingValue = "true", matchIfMissing = true)
public class StaleJobReaper {
	private static final Logger logger = LoggerFactory.getLogger(StaleJobReaper.class);
	private static final long INITIAL_DELAY_SECONDS = 30;
	private static final long INTERVAL_SECONDS = 120;
	static final String STALE_MESSAGE = "Evaluation did not finish in time and was abandoned";

	private final EvaluationJobRepository jobRepository;
	private final EvaluationOrchestrator orchestrator;
	private final AdmissionService admissionService;
	private final JobCharges jobCharges;
	private final ProgressBroadcaster progress;
	private final AppProperties properties;
	private final Clock clock;
	private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();

	public StaleJobReaper(EvaluationJobRepository jobRepository,
						  EvaluationOrchestrator orchestrator,
						  AdmissionService admissionService,
						  JobCharges jobCharges,
						  ProgressBroadcaster progress,
						  AppProperties properties,
						  Clock clock) {
		this.jobRepository = jobRepository;
		this.orchestrator = orchestrator;
		this.admissionService = admissionService;
		this.jobCharges = jobCharges;
		this.progress = progress;
		this.properties = properties;
		this.clock = clock;
	}

	@PostConstruct
	public void schedule() {
		executor.scheduleWithFixedDelay(this::runOnce, INITIAL_DELAY_SECONDS, INTERVAL_SECONDS, TimeUnit.SECONDS);
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	/**
	 * @return the number of jobs failed by this pass
	 */
	public int reapOnce() {
		LocalDateTime cutoff = LocalDateTime.now(clock)
				.minus(properties.evaluation().jobTimeout())
				.minus(properties.evaluation().staleGrace());
		List<EvaluationJob> stale = jobRepository.findStale(JobStatus.active(), cutoff);
		int reaped = 0;
		for (EvaluationJob job : stale) {
			if (orchestrator.isActive(job.getJobId())) {
				continue;
			}
			try {
				if (reap(job)) {
					reaped++;
				}
			} catch (RuntimeException ex) {
				logger.warn("Failed to reap job {}: {}", job.getJobId(), ex.getMessage());
			}
		}
		if (reaped > 0) {
			logger.info("Reaped {} stale evaluation job(s)", reaped);
		}
		return reaped;
	}

	private void runOnce() {
		try {
			reapOnce();
		} catch (Exception ex) {
			logger.warn("Stale job sweep failed: {}", ex.getMessage());
		}
	}

	private boolean reap(EvaluationJob job) {
		String jobId = job.getJobId();
		if (!jobRepository.finish(jobId, JobStatus.FAILED, JobErrorCode.STALE_TIMEOUT.name(), STALE_MESSAGE,
				LocalDateTime.now(clock))) {
			logger.debug("Job {} finished before it could be reaped", jobId);
			return false;
		}
		orchestrator.clearPendingCancel(jobId);
		long estimate = job.getEstimatedCost() == null ? 0L : job.getEstimatedCost();
		long refunded = jobCharges.compensate(job.getAccountId(), jobId, estimate);
		jobRepository.recordCharges(jobId, Math.max(0L, estimate - refunded), refunded);
		admissionService.forceRelease(job.getAccountId(), jobId);
		progress.publish(jobId, ProgressEvent.ERROR, job.getProgress() == null ? 0 : job.getProgress(),
				STALE_MESSAGE, Map.of("errorCode", JobErrorCode.STALE_TIMEOUT.name(), "message", STALE_MESSAGE));
		logger.warn("Job {} of account {} marked {} (refunded {})", jobId, job.getAccountId(),
				JobErrorCode.STALE_TIMEOUT, refunded);
		return true;
	}
}
