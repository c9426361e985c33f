package my.creativeaudit.app.service;

public class InsufficientCreditsException extends RuntimeException {
	private final long required;
	private final long available;

	public InsufficientCreditsException(long required, long available) {
		super("Insufficient credits: " + required + " required, " + available + " available");
		this.required = required;
		this.available = available;
	}

	public long getRequired() {
		return required;
	}

	public long getAvailable() {
		return available;
	}
}
