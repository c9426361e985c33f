package my.creativeaudit.app.service;

import my.creativeaudit.app.domain.JobErrorCode;

/**
 * Ends a running job early with a stable error code: cancellation, the wall-clock ceiling, or no usable result.
 */
public class JobAbortedException extends RuntimeException {
	private final JobErrorCode errorCode;

	public JobAbortedException(JobErrorCode errorCode, String message) {
		super(message);
		this.errorCode = errorCode;
	}

	public JobErrorCode getErrorCode() {
		return errorCode;
	}
}
