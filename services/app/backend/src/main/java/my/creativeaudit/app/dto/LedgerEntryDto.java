package my.creativeaudit.app.dto;

import my.creativeaudit.app.domain.CreditTransactionKind;

import java.time.LocalDateTime;

public record LedgerEntryDto(Long transactionId,
							 CreditTransactionKind kind,
							 long amount,
							 String reason,
							 String jobId,
							 long balanceAfter,
							 LocalDateTime createdAt,
							 boolean replayed) {
}
