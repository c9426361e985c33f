package my.creativeaudit.app.dto;

import jakarta.validation.constraints.NotBlank;

public record FeedbackRequestDto(@NotBlank String checkId,
								 @NotBlank String verdict) {
}
