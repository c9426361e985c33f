package my.creativeaudit.app.service.util;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size pool that carries the submitting thread's MDC (jobId, accountId) into each task.
 */
public class MdcAwareThreadPoolExecutor extends ThreadPoolExecutor {

	public MdcAwareThreadPoolExecutor(String namePrefix, int threads) {
		super(threads, threads, 60L, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), namedDaemonFactory(namePrefix));
		allowCoreThreadTimeOut(true);
	}

	@Override
	public void execute(Runnable command) {
		Map<String, String> parentMdc = MDC.getCopyOfContextMap();
		super.execute(() -> {
			Map<String, String> previous = MDC.getCopyOfContextMap();
			if (parentMdc != null) {
				MDC.setContextMap(parentMdc);
			} else {
				MDC.clear();
			}
			try {
				command.run();
			} finally {
				if (previous != null) {
					MDC.setContextMap(previous);
				} else {
					MDC.clear();
				}
			}
		});
	}

	private static ThreadFactory namedDaemonFactory(String namePrefix) {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}
}
