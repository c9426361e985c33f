package my.creativeaudit.app.dto;

import my.creativeaudit.app.domain.FeedbackVerdict;

import java.time.LocalDateTime;

public record CheckFeedbackDto(Long feedbackId,
							   String jobId,
							   String checkId,
							   FeedbackVerdict verdict,
							   LocalDateTime createdAt) {
}
