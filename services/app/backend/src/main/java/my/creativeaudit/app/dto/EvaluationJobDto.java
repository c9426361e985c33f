package my.creativeaudit.app.dto;

import my.creativeaudit.app.domain.JobPhase;
import my.creativeaudit.app.domain.JobStatus;

import java.time.LocalDateTime;
import java.util.List;

public record EvaluationJobDto(String jobId,
							   String accountId,
							   String mediaUri,
							   List<String> checkSets,
							   JobStatus status,
							   JobPhase phase,
							   int progress,
							   LocalDateTime createdAt,
							   LocalDateTime startedAt,
							   LocalDateTime finishedAt,
							   Long estimatedCost,
							   Long actualCost,
							   Long refundedAmount,
							   boolean cacheHit,
							   String errorCode,
							   String errorMessage) {
}
