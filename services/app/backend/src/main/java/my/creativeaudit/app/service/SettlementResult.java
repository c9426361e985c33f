package my.creativeaudit.app.service;

public enum SettlementResult {
	CREDITED,
	ALREADY_PROCESSED
}
