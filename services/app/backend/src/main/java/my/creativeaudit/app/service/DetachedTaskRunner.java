package my.creativeaudit.app.service;

import jakarta.annotation.PreDestroy;
import my.creativeaudit.app.service.util.MdcAwareThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs side effects nobody waits for (analytics rows, notifications, report archival). Failures are logged and
 * never reach the job that spawned them.
 */
@Component
public class DetachedTaskRunner {
	private static final Logger logger = LoggerFactory.getLogger(DetachedTaskRunner.class);
	private static final int THREADS = 2;

	private final ExecutorService executor;

	public DetachedTaskRunner() {
		this(new MdcAwareThreadPoolExecutor("detached", THREADS));
	}

	DetachedTaskRunner(ExecutorService executor) {
		this.executor = executor;
	}

	public void spawn(String name, Runnable task) {
		try {
			executor.execute(() -> {
				try {
					task.run();
				} catch (RuntimeException ex) {
					logger.warn("Detached task {} failed: {}", name, ex.getMessage(), ex);
				}
			});
		} catch (RejectedExecutionException ex) {
			logger.warn("Detached task {} rejected: {}", name, ex.getMessage());
		}
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdown();
	}
}
