package my.creativeaudit.app.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PreDestroy;
import my.creativeaudit.app.model.ProgressEvent;
import my.creativeaudit.app.service.util.MdcAwareThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Per-job progress channels. Publishing never blocks the job: events are appended to each subscriber's bounded queue
 * and delivered on a shared dispatcher pool. A full queue loses its oldest non-terminal event; the terminal event
 * ({@code complete} or {@code error}) is always kept and is the last event a subscriber sees.
 */
@Component
public class ProgressBroadcaster {
	private static final Logger logger = LoggerFactory.getLogger(ProgressBroadcaster.class);
	static final int DEFAULT_QUEUE_CAPACITY = 64;
	private static final Duration CHANNEL_IDLE_EXPIRY = Duration.ofHours(1);

	private final Cache<String, Channel> channels = Caffeine.newBuilder()
			.expireAfterAccess(CHANNEL_IDLE_EXPIRY)
			.build();
	private final Executor dispatcher;
	private final ExecutorService ownedDispatcher;
	private final int queueCapacity;

	public ProgressBroadcaster() {
		this(new MdcAwareThreadPoolExecutor("progress", 2), DEFAULT_QUEUE_CAPACITY);
	}

	ProgressBroadcaster(Executor dispatcher, int queueCapacity) {
		this.dispatcher = dispatcher;
		this.ownedDispatcher = dispatcher instanceof ExecutorService service ? service : null;
		this.queueCapacity = Math.max(1, queueCapacity);
	}

	public ProgressEvent publish(String jobId, String milestone, int percentage, String message, Object partial) {
		return publish(new ProgressEvent(jobId, milestone, percentage, message, partial));
	}

	/**
	 * Publishes an event, raising its percentage to the highest one already published for the job. Events after
	 * the terminal event are ignored.
	 *
	 * @return the event as delivered, or {@code null} when it was ignored
	 */
	public ProgressEvent publish(ProgressEvent event) {
		Channel channel = channels.get(event.jobId(), key -> new Channel());
		ProgressEvent delivered;
		List<Subscription> targets;
		synchronized (channel) {
			if (channel.terminal != null) {
				logger.debug("Ignoring {} for job {}: already terminated", event.milestone(), event.jobId());
				return null;
			}
			int percentage = Math.max(channel.lastPercentage, Math.min(100, Math.max(0, event.percentage())));
			if (ProgressEvent.COMPLETE.equals(event.milestone())) {
				percentage = 100;
			}
			channel.lastPercentage = percentage;
			delivered = percentage == event.percentage() ? event : event.withPercentage(percentage);
			if (delivered.terminal()) {
				channel.terminal = delivered;
			}
			targets = new ArrayList<>(channel.subscriptions);
		}
		for (Subscription subscription : targets) {
			subscription.offer(delivered);
		}
		return delivered;
	}

	/**
	 * Subscribes to a job's events from now on. A job that already terminated replays only its terminal event.
	 */
	public Subscription subscribe(String jobId, Consumer<ProgressEvent> listener) {
		Channel channel = channels.get(jobId, key -> new Channel());
		Subscription subscription = new Subscription(channel, listener);
		ProgressEvent terminal;
		synchronized (channel) {
			terminal = channel.terminal;
			if (terminal == null) {
				channel.subscriptions.add(subscription);
			}
		}
		if (terminal != null) {
			subscription.offer(terminal);
		}
		return subscription;
	}

	public Optional<ProgressEvent> terminalEvent(String jobId) {
		Channel channel = channels.getIfPresent(jobId);
		if (channel == null) {
			return Optional.empty();
		}
		synchronized (channel) {
			return Optional.ofNullable(channel.terminal);
		}
	}

	public int lastPercentage(String jobId) {
		Channel channel = channels.getIfPresent(jobId);
		if (channel == null) {
			return 0;
		}
		synchronized (channel) {
			return channel.lastPercentage;
		}
	}

	@PreDestroy
	public void shutdown() {
		if (ownedDispatcher != null) {
			ownedDispatcher.shutdownNow();
		}
	}

	private static final class Channel {
		private final List<Subscription> subscriptions = new ArrayList<>();
		private int lastPercentage;
		private ProgressEvent terminal;
	}

	public final class Subscription {
		private final Channel channel;
		private final Consumer<ProgressEvent> listener;
		private final Deque<ProgressEvent> queue = new ArrayDeque<>();
		private final AtomicBoolean draining = new AtomicBoolean(false);
		private volatile boolean canceled;

		private Subscription(Channel channel, Consumer<ProgressEvent> listener) {
			this.channel = channel;
			this.listener = listener;
		}

		public void cancel() {
			canceled = true;
			synchronized (channel) {
				channel.subscriptions.remove(this);
			}
			synchronized (queue) {
				queue.clear();
			}
		}

		public boolean isCanceled() {
			return canceled;
		}

		private void offer(ProgressEvent event) {
			if (canceled) {
				return;
			}
			synchronized (queue) {
				if (queue.size() >= queueCapacity) {
					dropOldestNonTerminal(event);
				}
				if (queue.size() < queueCapacity || event.terminal()) {
					queue.addLast(event);
				}
			}
			scheduleDrain();
		}

		private void dropOldestNonTerminal(ProgressEvent incoming) {
			Iterator<ProgressEvent> iterator = queue.iterator();
			while (iterator.hasNext()) {
				ProgressEvent queued = iterator.next();
				if (!queued.terminal()) {
					iterator.remove();
					logger.debug("Progress queue full for job {}: dropped {}", queued.jobId(), queued.milestone());
					return;
				}
			}
			logger.debug("Progress queue full for job {}: dropped {}", incoming.jobId(), incoming.milestone());
		}

		private void scheduleDrain() {
			if (draining.compareAndSet(false, true)) {
				dispatcher.execute(this::drain);
			}
		}

		private void drain() {
			try {
				while (!canceled) {
					ProgressEvent next;
					synchronized (queue) {
						next = queue.pollFirst();
					}
					if (next == null) {
						break;
					}
					try {
						listener.accept(next);
					} catch (RuntimeException ex) {
						logger.debug("Progress subscriber for job {} failed, unsubscribing: {}", next.jobId(), ex.getMessage());
						cancel();
						return;
					}
					if (next.terminal()) {
						cancel();
						return;
					}
				}
			} finally {
				draining.set(false);
			}
			boolean pending;
			synchronized (queue) {
				pending = !queue.isEmpty();
			}
			if (pending && !canceled) {
				scheduleDrain();
			}
		}
	}
}
