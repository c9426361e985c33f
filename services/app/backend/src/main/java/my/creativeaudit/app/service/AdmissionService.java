package my.creativeaudit.app.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Admits at most one running evaluation per account and holds its estimated cost on the ledger.
 */
@Service
public class AdmissionService {
	private static final Logger logger = LoggerFactory.getLogger(AdmissionService.class);

	private final CreditLedgerService ledger;
	private final Map<String, String> activeJobs = new ConcurrentHashMap<>();

	public AdmissionService(CreditLedgerService ledger) {
		this.ledger = ledger;
	}

	public JobSlot tryAdmit(String accountId, long estimatedCost) {
		if (estimatedCost <= 0) {
			throw new IllegalArgumentException("Estimated cost must be positive");
		}
		String jobId = UUID.randomUUID().toString();
		String holder = activeJobs.putIfAbsent(accountId, jobId);
		if (holder != null) {
			logger.info("Admission rejected for account {}: job {} still running", accountId, holder);
			throw new ConcurrencyLimitExceededException(holder);
		}
		JobSlot slot = new JobSlot(this, accountId, jobId, estimatedCost);
		try {
			ledger.debit(accountId, estimatedCost, "evaluation_hold", jobId, holdKey(jobId));
		} catch (InsufficientBalanceException ex) {
			slot.close();
			logger.info("Admission rejected for account {}: {}", accountId, ex.getMessage());
			throw new InsufficientCreditsException(estimatedCost, ex.getBalance());
		} catch (RuntimeException ex) {
			slot.close();
			throw ex;
		}
		logger.info("Admitted job {} for account {} (hold={})", jobId, accountId, estimatedCost);
		return slot;
	}

	public Optional<String> activeJob(String accountId) {
		return Optional.ofNullable(activeJobs.get(accountId));
	}

	/**
	 * Frees a slot whose runner is gone, for example after the reaper failed the job.
	 */
	public void forceRelease(String accountId, String jobId) {
		release(accountId, jobId);
	}

	void release(String accountId, String jobId) {
		if (activeJobs.remove(accountId, jobId)) {
			logger.debug("Released slot of account {} (job {})", accountId, jobId);
		}
	}

	public static String holdKey(String jobId) {
		return "job:" + jobId + ":hold";
	}
}
