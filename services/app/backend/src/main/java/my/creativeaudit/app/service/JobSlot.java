package my.creativeaudit.app.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The single in-flight job permit of an account. Closing releases it; only the first close has an effect.
 */
public final class JobSlot implements AutoCloseable {
	private final AdmissionService owner;
	private final String accountId;
	private final String jobId;
	private final long heldAmount;
	private final AtomicBoolean released = new AtomicBoolean(false);

	JobSlot(AdmissionService owner, String accountId, String jobId, long heldAmount) {
		this.owner = owner;
		this.accountId = accountId;
		this.jobId = jobId;
		this.heldAmount = heldAmount;
	}

	public String accountId() {
		return accountId;
	}

	public String jobId() {
		return jobId;
	}

	public long heldAmount() {
		return heldAmount;
	}

	public boolean isReleased() {
		return released.get();
	}

	@Override
	public void close() {
		if (released.compareAndSet(false, true)) {
			owner.release(accountId, jobId);
		}
	}
}
