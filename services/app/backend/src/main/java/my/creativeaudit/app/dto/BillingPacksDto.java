package my.creativeaudit.app.dto;

import java.util.List;

public record BillingPacksDto(long balance,
							  int tokensPerSecond,
							  List<TokenPackDto> packs) {
}
