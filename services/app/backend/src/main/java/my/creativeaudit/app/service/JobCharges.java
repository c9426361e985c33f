package my.creativeaudit.app.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Ledger movements that close out a job's hold: the delta refund after success, the full compensation after
 * failure, and the operator refund of a billed job. Each uses a fixed per-job idempotency key, so repeating any
 * of them is harmless.
 */
@Component
public class JobCharges {
	private static final Logger logger = LoggerFactory.getLogger(JobCharges.class);

	private final CreditLedgerService ledger;

	public JobCharges(CreditLedgerService ledger) {
		this.ledger = ledger;
	}

	/**
	 * Refunds what the hold over-charged. Does nothing once the job has been compensated.
	 *
	 * @return the refunded amount
	 */
	public long settle(String accountId, String jobId, long estimate, long actual) {
		if (ledger.findByIdempotencyKey(compensateKey(jobId)).isPresent()) {
			logger.warn("Job {} was already compensated; skipping settlement", jobId);
			return 0L;
		}
		long refund = estimate - Math.max(0L, Math.min(estimate, actual));
		if (refund > 0) {
			ledger.refund(accountId, refund, "evaluation_settle", jobId, settleKey(jobId));
		}
		logger.info("Settled job {}: charged {}, refunded {}", jobId, estimate - refund, refund);
		return refund;
	}

	/**
	 * Returns whatever part of the hold has not been refunded yet.
	 *
	 * @return the total refunded for the job, settlement included
	 */
	public long compensate(String accountId, String jobId, long estimate) {
		if (ledger.findByIdempotencyKey(AdmissionService.holdKey(jobId)).isEmpty()) {
			logger.debug("No hold recorded for job {}; nothing to compensate", jobId);
			return 0L;
		}
		long alreadyRefunded = ledger.findByIdempotencyKey(settleKey(jobId))
				.map(LedgerEntry::amount)
				.orElse(0L);
		long remaining = estimate - alreadyRefunded;
		if (remaining > 0) {
			ledger.refund(accountId, remaining, "evaluation_compensate", jobId, compensateKey(jobId));
		}
		logger.info("Compensated job {}: refunded {}", jobId, Math.max(0L, remaining));
		return alreadyRefunded + Math.max(0L, remaining);
	}

	public LedgerEntry adminRefund(String accountId, String jobId, long amount) {
		return ledger.refund(accountId, amount, "admin_refund", jobId, adminRefundKey(jobId));
	}

	static String settleKey(String jobId) {
		return "job:" + jobId + ":settle";
	}

	static String compensateKey(String jobId) {
		return "job:" + jobId + ":compensate";
	}

	static String adminRefundKey(String jobId) {
		return "job:" + jobId + ":admin-refund";
	}
}
