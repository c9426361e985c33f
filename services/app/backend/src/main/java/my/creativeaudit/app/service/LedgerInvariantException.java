package my.creativeaudit.app.service;

public class LedgerInvariantException extends RuntimeException {
	public LedgerInvariantException(String message) {
		super(message);
	}
}
