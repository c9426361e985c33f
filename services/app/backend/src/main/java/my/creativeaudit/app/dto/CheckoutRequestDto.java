package my.creativeaudit.app.dto;

import jakarta.validation.constraints.NotBlank;

public record CheckoutRequestDto(@NotBlank String pack) {
}
