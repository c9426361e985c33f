package my.creativeaudit.app.dto;

public record CheckoutResponseDto(String sessionId,
								  String redirectUrl) {
}
