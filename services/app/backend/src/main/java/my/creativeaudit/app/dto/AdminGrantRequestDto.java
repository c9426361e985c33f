package my.creativeaudit.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record AdminGrantRequestDto(@NotBlank String accountId,
								   @Positive long amount,
								   String reason,
								   String idempotencyKey) {
}
