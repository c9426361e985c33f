package my.creativeaudit.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

public record EvaluationRequestDto(@NotBlank @Size(max = 2048) String mediaUri,
								   @Positive Double durationSeconds,
								   @Size(max = 200) String brandName,
								   @NotEmpty List<String> checkSets) {
}
