package my.creativeaudit.app.dto;

public record TokenPackDto(String pack,
						   int tokens,
						   int usd) {
}
