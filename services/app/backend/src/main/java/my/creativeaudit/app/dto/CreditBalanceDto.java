package my.creativeaudit.app.dto;

import java.util.List;

public record CreditBalanceDto(String accountId,
							   long balance,
							   List<LedgerEntryDto> transactions) {
}
