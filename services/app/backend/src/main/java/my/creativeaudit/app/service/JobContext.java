package my.creativeaudit.app.service;

import my.creativeaudit.app.domain.JobErrorCode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag and wall-clock deadline of one running job. Joins wait in short slices so both are observed
 * while workers are still busy.
 */
final class JobContext {
	static final long JOIN_SLICE_MILLIS = 200;

	private final String jobId;
	private final Clock clock;
	private final Instant deadline;
	private final AtomicBoolean canceled = new AtomicBoolean(false);

	JobContext(String jobId, Duration timeout, Clock clock) {
		this.jobId = jobId;
		this.clock = clock;
		this.deadline = clock.instant().plus(timeout);
	}

	String jobId() {
		return jobId;
	}

	void cancel() {
		canceled.set(true);
	}

	boolean isCanceled() {
		return canceled.get();
	}

	void checkpoint() {
		if (canceled.get()) {
			throw new JobAbortedException(JobErrorCode.CANCELED, "Evaluation canceled");
		}
		if (!clock.instant().isBefore(deadline)) {
			throw new JobAbortedException(JobErrorCode.JOB_TIMEOUT, "Evaluation exceeded its time limit");
		}
	}

	<T> T await(Future<T> future) {
		while (true) {
			checkpoint();
			try {
				return future.get(JOIN_SLICE_MILLIS, TimeUnit.MILLISECONDS);
			} catch (TimeoutException ex) {
				continue;
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				throw new JobAbortedException(JobErrorCode.CANCELED, "Evaluation interrupted");
			} catch (ExecutionException ex) {
				throw unwrap(ex);
			}
		}
	}

	/**
	 * Next finished task of a completion service, in completion order.
	 */
	<T> T next(CompletionService<T> completionService) {
		while (true) {
			checkpoint();
			try {
				Future<T> done = completionService.poll(JOIN_SLICE_MILLIS, TimeUnit.MILLISECONDS);
				if (done != null) {
					return done.get();
				}
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				throw new JobAbortedException(JobErrorCode.CANCELED, "Evaluation interrupted");
			} catch (ExecutionException ex) {
				throw unwrap(ex);
			}
		}
	}

	private static RuntimeException unwrap(ExecutionException ex) {
		Throwable cause = ex.getCause();
		if (cause instanceof RuntimeException runtime) {
			return runtime;
		}
		return new IllegalStateException("Pipeline task failed", cause);
	}
}
