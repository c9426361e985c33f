package my.creativeaudit.app.dto;

import my.creativeaudit.app.domain.JobStatus;

public record EvaluationSubmissionDto(String jobId,
									  JobStatus status,
									  long estimatedCost) {
}
