package my.creativeaudit.app.service;

import my.creativeaudit.app.domain.JobErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobContextTest {
	private final ExecutorService executor = Executors.newFixedThreadPool(2);

	@AfterEach
	void tearDown() {
		executor.shutdownNow();
	}

	@Test
	void canceledContextAbortsAtCheckpoint() {
		JobContext context = new JobContext("job", Duration.ofMinutes(1), Clock.systemUTC());
		context.cancel();

		assertThatThrownBy(context::checkpoint)
				.isInstanceOfSatisfying(JobAbortedException.class,
						ex -> assertThat(ex.getErrorCode()).isEqualTo(JobErrorCode.CANCELED));
	}

	@Test
	void expiredDeadlineAbortsWithTimeout() {
		JobContext context = new JobContext("job", Duration.ZERO, Clock.systemUTC());

		assertThatThrownBy(context::checkpoint)
				.isInstanceOfSatisfying(JobAbortedException.class,
						ex -> assertThat(ex.getErrorCode()).isEqualTo(JobErrorCode.JOB_TIMEOUT));
	}

	@Test
	void awaitReturnsValueAndUnwrapsFailures() {
		JobContext context = new JobContext("job", Duration.ofMinutes(1), Clock.systemUTC());

		assertThat(context.await(CompletableFuture.completedFuture("value"))).isEqualTo("value");
		assertThatThrownBy(() -> context.await(CompletableFuture.failedFuture(new IllegalArgumentException("boom"))))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("boom");
	}

	@Test
	void cancelEndsAWaitOnASlowTask() {
		JobContext context = new JobContext("job", Duration.ofMinutes(1), Clock.systemUTC());
		CompletionService<String> completion = new ExecutorCompletionService<>(executor);
		completion.submit(() -> {
			Thread.sleep(10_000);
			return "late";
		});
		executor.submit(() -> {
			Thread.sleep(100);
			context.cancel();
			return null;
		});

		assertThatThrownBy(() -> context.next(completion))
				.isInstanceOfSatisfying(JobAbortedException.class,
						ex -> assertThat(ex.getErrorCode()).isEqualTo(JobErrorCode.CANCELED));
	}
}
