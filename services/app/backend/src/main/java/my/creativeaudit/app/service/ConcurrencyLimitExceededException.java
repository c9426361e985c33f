package my.creativeaudit.app.service;

public class ConcurrencyLimitExceededException extends RuntimeException {
	private final String activeJobId;

	public ConcurrencyLimitExceededException(String activeJobId) {
		super("Another evaluation is already running for this account");
		this.activeJobId = activeJobId;
	}

	public String getActiveJobId() {
		return activeJobId;
	}
}
