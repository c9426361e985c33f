package my.creativeaudit.app.dto;

public record PaymentWebhookResponseDto(String eventId,
										String result) {
}
