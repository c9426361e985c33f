package my.creativeaudit.app.service;

public class InsufficientBalanceException extends RuntimeException {
	private final String accountId;
	private final long balance;
	private final long requested;

	public InsufficientBalanceException(String accountId, long balance, long requested) {
		super("Insufficient balance (balance=" + balance + ", requested=" + requested + ")");
		this.accountId = accountId;
		this.balance = balance;
		this.requested = requested;
	}

	public String getAccountId() {
		return accountId;
	}

	public long getBalance() {
		return balance;
	}

	public long getRequested() {
		return requested;
	}
}
