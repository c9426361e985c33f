package my.creativeaudit.app.service;

import my.creativeaudit.app.domain.CreditTransaction;
import my.creativeaudit.app.domain.CreditTransactionKind;

import java.time.LocalDateTime;

/**
 * Committed ledger entry as returned to callers. {@code replayed} marks an idempotent repeat of an earlier call.
 */
public record LedgerEntry(
		Long transactionId,
		String accountId,
		CreditTransactionKind kind,
		long amount,
		String reason,
		String jobId,
		String idempotencyKey,
		long balanceAfter,
		LocalDateTime createdAt,
		boolean replayed
) {
	static LedgerEntry of(CreditTransaction transaction, boolean replayed) {
		return new LedgerEntry(
				transaction.getTransactionId(),
				transaction.getAccountId(),
				transaction.getKind(),
				transaction.getAmount(),
				transaction.getReason(),
				transaction.getJobId(),
				transaction.getIdempotencyKey(),
				transaction.getBalanceAfter(),
				transaction.getCreatedAt(),
				replayed
		);
	}
}
