package my.creativeaudit.app.collaborator;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ResilientCallerTest {
	private final ExecutorService executor = Executors.newCachedThreadPool();
	private final ResilientCaller caller = new ResilientCaller(executor);

	@AfterEach
	void tearDown() {
		executor.shutdownNow();
	}

	@Test
	void successIsReturnedAsIs() {
		CollaboratorResult<String> result = caller.call("op", policy(1000, 0), () -> "ok");

		assertThat(result).isEqualTo(CollaboratorResult.success("ok"));
	}

	@Test
	void slowCallTimesOut() {
		CollaboratorResult<String> result = caller.call("slow", policy(50, 0), () -> {
			try {
				Thread.sleep(5_000);
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
			}
			return "late";
		});

		assertThat(result).isInstanceOfSatisfying(CollaboratorResult.Failure.class,
				failure -> assertThat(failure.kind()).isEqualTo(CollaboratorErrorKind.TIMEOUT));
	}

	@Test
	void retryableFailureIsRetried() {
		AtomicInteger attempts = new AtomicInteger();

		CollaboratorResult<String> result = caller.call("flaky", policy(1000, 2), () -> {
			if (attempts.incrementAndGet() == 1) {
				throw new CollaboratorException("busy", 503, true, null);
			}
			return "recovered";
		});

		assertThat(result.valueOrNull()).isEqualTo("recovered");
		assertThat(attempts).hasValue(2);
	}

	@Test
	void nonRetryableFailureIsNotRetried() {
		AtomicInteger attempts = new AtomicInteger();

		CollaboratorResult<String> result = caller.call("bad", policy(1000, 3), () -> {
			attempts.incrementAndGet();
			throw new CollaboratorException("bad request", 400, false, null);
		});

		assertThat(result.isSuccess()).isFalse();
		assertThat(((CollaboratorResult.Failure<String>) result).kind()).isEqualTo(CollaboratorErrorKind.UNAVAILABLE);
		assertThat(attempts).hasValue(1);
	}

	@Test
	void exhaustedQuotaKeepsItsKind() {
		AtomicInteger attempts = new AtomicInteger();

		CollaboratorResult<String> result = caller.call("quota", policy(1000, 1), () -> {
			attempts.incrementAndGet();
			throw new CollaboratorException("slow down", 429, true, null);
		});

		assertThat(((CollaboratorResult.Failure<String>) result).kind()).isEqualTo(CollaboratorErrorKind.QUOTA);
		assertThat(attempts).hasValue(2);
	}

	@Test
	void emptyResponseIsMalformed() {
		CollaboratorResult<String> result = caller.call("empty", policy(1000, 0), () -> null);

		assertThat(((CollaboratorResult.Failure<String>) result).kind())
				.isEqualTo(CollaboratorErrorKind.MALFORMED_RESPONSE);
	}

	@Test
	void waitingForAWorkerDoesNotCountAgainstTheAttempt() throws Exception {
		ExecutorService single = Executors.newSingleThreadExecutor();
		try {
			ResilientCaller queued = new ResilientCaller(single);
			occupy(single, 400);

			CollaboratorResult<String> result = queued.call("queued", policy(700, 0), () -> {
				sleep(400);
				return "done";
			});

			assertThat(result.valueOrNull()).isEqualTo("done");
		} finally {
			single.shutdownNow();
		}
	}

	@Test
	void attemptThatNeverGetsAWorkerIsUnavailable() throws Exception {
		ExecutorService single = Executors.newSingleThreadExecutor();
		try {
			ResilientCaller queued = new ResilientCaller(single);
			occupy(single, 3_000);
			AtomicInteger runs = new AtomicInteger();

			CollaboratorResult<String> result = queued.call("starved", policy(100, 0), () -> {
				runs.incrementAndGet();
				return "never";
			});

			assertThat(result).isInstanceOfSatisfying(CollaboratorResult.Failure.class, failure -> {
				assertThat(failure.kind()).isEqualTo(CollaboratorErrorKind.UNAVAILABLE);
				assertThat(failure.message()).contains("free worker");
			});
			assertThat(runs).hasValue(0);
		} finally {
			single.shutdownNow();
		}
	}

	private static void occupy(ExecutorService executor, long millis) throws InterruptedException {
		CountDownLatch busy = new CountDownLatch(1);
		executor.submit(() -> {
			busy.countDown();
			sleep(millis);
		});
		assertThat(busy.await(1, TimeUnit.SECONDS)).isTrue();
	}

	private static void sleep(long millis) {
		try {
			Thread.sleep(millis);
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
		}
	}

	private static CallPolicy policy(long timeoutMillis, int retries) {
		return new CallPolicy(Duration.ofMillis(timeoutMillis), retries, 1L);
	}
}
