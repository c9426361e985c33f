package my.creativeaudit.app.collaborator;

import jakarta.annotation.PreDestroy;
import my.creativeaudit.app.service.util.MdcAwareThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs a collaborator call under a per-attempt timeout with bounded retries, and folds every outcome
 * into a {@link CollaboratorResult}. The timeout starts when a worker picks the attempt up; waiting for a free
 * worker is bounded separately by the same duration.
 */
@Component
public class ResilientCaller {
	private static final Logger logger = LoggerFactory.getLogger(ResilientCaller.class);
	private static final int POOL_SIZE = 32;
	private static final long MAX_BACKOFF_MILLIS = 8_000L;

	private final ExecutorService executor;
	private final Random jitter = new Random();

	public ResilientCaller() {
		this(new MdcAwareThreadPoolExecutor("collaborator", POOL_SIZE));
	}

	ResilientCaller(ExecutorService executor) {
		this.executor = executor;
	}

	public <T> CollaboratorResult<T> call(String operation, CallPolicy policy, Supplier<T> action) {
		int attempts = Math.max(1, policy.maxRetries() + 1);
		CollaboratorResult.Failure<T> last = null;
		for (int attempt = 1; attempt <= attempts; attempt++) {
			Attempt<T> outcome = attempt(operation, policy, action);
			if (outcome.result() instanceof CollaboratorResult.Success<T>) {
				return outcome.result();
			}
			last = (CollaboratorResult.Failure<T>) outcome.result();
			if (!outcome.retryable() || attempt == attempts || Thread.currentThread().isInterrupted()) {
				break;
			}
			long sleepMillis = backoffMillis(policy.baseBackoffMillis(), attempt);
			logger.info("Retrying {} after {} (attempt {}/{}, sleep={}ms)", operation, last.kind(), attempt, attempts, sleepMillis);
			try {
				Thread.sleep(sleepMillis);
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				break;
			}
		}
		logger.warn("Collaborator call {} failed (kind={}, message={})", operation, last.kind(), last.message());
		return last;
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private <T> Attempt<T> attempt(String operation, CallPolicy policy, Supplier<T> action) {
		CountDownLatch started = new CountDownLatch(1);
		Callable<T> task = () -> {
			started.countDown();
			return action.get();
		};
		long timeoutMillis = policy.timeout().toMillis();
		Future<T> future = executor.submit(task);
		try {
			if (!started.await(timeoutMillis, TimeUnit.MILLISECONDS)) {
				future.cancel(false);
				return new Attempt<>(CollaboratorResult.failure(CollaboratorErrorKind.UNAVAILABLE,
						operation + " waited " + policy.timeout().toSeconds() + "s for a free worker"), true);
			}
			T value = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
			if (value == null) {
				return new Attempt<>(CollaboratorResult.failure(CollaboratorErrorKind.MALFORMED_RESPONSE,
						operation + " returned no content"), false);
			}
			return new Attempt<>(CollaboratorResult.success(value), false);
		} catch (TimeoutException ex) {
			future.cancel(true);
			return new Attempt<>(CollaboratorResult.failure(CollaboratorErrorKind.TIMEOUT,
					operation + " timed out after " + policy.timeout().toSeconds() + "s"), true);
		} catch (InterruptedException ex) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			return new Attempt<>(CollaboratorResult.failure(CollaboratorErrorKind.UNAVAILABLE, operation + " interrupted"), false);
		} catch (ExecutionException ex) {
			Throwable cause = ex.getCause() == null ? ex : ex.getCause();
			if (cause instanceof CollaboratorException collaboratorException) {
				return new Attempt<>(CollaboratorResult.failure(collaboratorException.getKind(), safeMessage(cause)),
						collaboratorException.isRetryable());
			}
			logger.debug("Unexpected collaborator error in {}", operation, cause);
			return new Attempt<>(CollaboratorResult.failure(CollaboratorErrorKind.UNAVAILABLE, safeMessage(cause)), false);
		}
	}

	private long backoffMillis(long baseBackoffMillis, int attempt) {
		long base = Math.max(1L, baseBackoffMillis);
		long exponential = Math.min(MAX_BACKOFF_MILLIS, base * (1L << Math.min(attempt - 1, 10)));
		double jitterFactor = 0.5 + jitter.nextDouble();
		return Math.max(1L, Math.round(exponential * jitterFactor));
	}

	private String safeMessage(Throwable ex) {
		String message = ex.getMessage();
		if (message == null || message.isBlank()) {
			message = ex.getClass().getSimpleName();
		}
		return message;
	}

	private record Attempt<T>(CollaboratorResult<T> result, boolean retryable) {
	}
}
