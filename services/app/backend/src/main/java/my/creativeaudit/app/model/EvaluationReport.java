package my.creativeaudit.app.model;

import my.creativeaudit.app.scoring.AccessibilitySummary;
import my.creativeaudit.app.scoring.Benchmarks;
import my.creativeaudit.app.scoring.PlatformScore;
import my.creativeaudit.app.scoring.ScoringSnapshot;

import java.time.Instant;
import java.util.List;

public record EvaluationReport(
		String reportId,
		String mediaUri,
		String brandName,
		Instant generatedAt,
		List<CheckSetResult> checkSetResults,
		List<Gap> gaps,
		ScoringSnapshot scoring,
		List<Scene> scenes,
		PostProcessingArtifacts artifacts,
		List<RemediationItem> accessibilityRemediation,
		List<ActionItem> actionPlan,
		AccessibilitySummary accessibility,
		List<PlatformScore> platformFit,
		Benchmarks benchmarks,
		Double measuredDurationSeconds,
		long tokensUsed
) {
	public EvaluationReport {
		checkSetResults = checkSetResults == null ? List.of() : List.copyOf(checkSetResults);
		gaps = gaps == null ? List.of() : List.copyOf(gaps);
		scenes = scenes == null ? List.of() : List.copyOf(scenes);
		accessibilityRemediation = accessibilityRemediation == null ? List.of() : List.copyOf(accessibilityRemediation);
		actionPlan = actionPlan == null ? List.of() : List.copyOf(actionPlan);
		platformFit = platformFit == null ? List.of() : List.copyOf(platformFit);
	}

	/**
	 * Copy served from the fingerprint cache under a new job id and cost.
	 */
	public EvaluationReport reissue(String newReportId, Instant at, long tokens) {
		return new EvaluationReport(newReportId, mediaUri, brandName, at, checkSetResults, gaps, scoring, scenes,
				artifacts, accessibilityRemediation, actionPlan, accessibility, platformFit, benchmarks,
				measuredDurationSeconds, tokens);
	}
}
