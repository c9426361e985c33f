package my.creativeaudit.app.domain;

/**
 * Stable error codes stored on failed or canceled jobs.
 */
public enum JobErrorCode {
	ALL_BRANCHES_FAILED,
	JOB_TIMEOUT,
	COST_MISMATCH,
	CANCELED,
	STALE_TIMEOUT,
	INTERNAL_ERROR
}
