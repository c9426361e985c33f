package my.creativeaudit.app.domain;

public enum CreditTransactionKind {
	GRANT,
	DEBIT,
	REFUND
}
