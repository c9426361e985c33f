package my.creativeaudit.app.service;

import my.creativeaudit.app.model.ActionItem;
import my.creativeaudit.app.model.CheckResult;
import my.creativeaudit.app.model.CheckSetResult;
import my.creativeaudit.app.model.EvaluatedCheck;
import my.creativeaudit.app.model.EvaluationReport;
import my.creativeaudit.app.model.Gap;
import my.creativeaudit.app.model.MediaRef;
import my.creativeaudit.app.model.PostProcessingArtifacts;
import my.creativeaudit.app.model.RemediationItem;
import my.creativeaudit.app.model.Scene;
import my.creativeaudit.app.rubric.CheckDefinition;
import my.creativeaudit.app.rubric.CheckSet;
import my.creativeaudit.app.scoring.AccessibilityScorer;
import my.creativeaudit.app.scoring.AccessibilitySummary;
import my.creativeaudit.app.scoring.Benchmarks;
import my.creativeaudit.app.scoring.PlatformFitEngine;
import my.creativeaudit.app.scoring.ScoringEngine;
import my.creativeaudit.app.scoring.ScoringSection;
import my.creativeaudit.app.scoring.ScoringSnapshot;
import my.creativeaudit.app.scoring.SpeechRate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Component
public class ReportAssembler {
	private static final String FALLBACK_RECOMMENDATION = "Revisit this element of the creative: ";

	private final AccessibilityScorer accessibilityScorer;
	private final PlatformFitEngine platformFitEngine;

	public ReportAssembler(AccessibilityScorer accessibilityScorer, PlatformFitEngine platformFitEngine) {
		this.accessibilityScorer = accessibilityScorer;
		this.platformFitEngine = platformFitEngine;
	}

	public EvaluationReport assemble(String jobId,
									 MediaRef media,
									 String brandName,
									 Map<CheckSet, BranchOutcome> branches,
									 ScoringSnapshot scoring,
									 List<Scene> scenes,
									 PostProcessingArtifacts artifacts,
									 Benchmarks benchmarks,
									 Double measuredDurationSeconds,
									 long tokensUsed,
									 Instant generatedAt) {
		List<CheckSetResult> results = new ArrayList<>();
		List<Gap> gaps = new ArrayList<>();
		List<EvaluatedCheck> evaluated = new ArrayList<>();
		for (BranchOutcome outcome : branches.values()) {
			if (outcome.failed()) {
				results.add(CheckSetResult.failed(outcome.checkSet(), outcome.errorCode(), outcome.message()));
				gaps.add(new Gap(outcome.checkSet(), outcome.errorCode(), outcome.message()));
			} else {
				results.add(CheckSetResult.completed(outcome.checkSet(),
						outcome.checks().stream().map(CheckResult::of).toList()));
				evaluated.addAll(outcome.checks());
			}
		}
		PostProcessingArtifacts resolved = artifacts == null ? PostProcessingArtifacts.empty() : artifacts;
		AccessibilitySummary accessibility = accessibilityScorer.summarize(evaluated, scenes);
		SpeechRate speechRate = accessibility == null ? SpeechRate.none() : accessibility.speechRate();
		return new EvaluationReport(
				jobId,
				media.uri(),
				brandName,
				generatedAt,
				results,
				gaps,
				scoring,
				scenes,
				resolved,
				accessibilityRemediation(evaluated, speechRate),
				actionPlan(evaluated),
				accessibility,
				platformFitEngine.fit(evaluated, resolved.technicalMetadata(), measuredDurationSeconds,
						scenes == null ? 0 : scenes.size()),
				benchmarks,
				measuredDurationSeconds,
				tokensUsed
		);
	}

	/**
	 * Failed accessibility checks, with the remediation note the model supplied. A measured speech rate decides
	 * the speech-rate check and replaces its note.
	 */
	static List<RemediationItem> accessibilityRemediation(List<EvaluatedCheck> checks, SpeechRate speechRate) {
		List<RemediationItem> items = new ArrayList<>();
		for (EvaluatedCheck check : checks) {
			if (!check.definition().accessibility() || AccessibilityScorer.passed(check, speechRate)) {
				continue;
			}
			boolean measuredPace = AccessibilityScorer.SPEECH_RATE_CHECK.equals(check.definition().id())
					&& speechRate.measured();
			String note = measuredPace ? AccessibilityScorer.speechRateRemediation(speechRate)
					: check.verdict() == null ? null : check.verdict().remediation();
			items.add(new RemediationItem(check.definition().id(), check.definition().name(),
					note == null || note.isBlank() ? check.definition().criteria() : note));
		}
		return items;
	}

	/**
	 * Undetected scored checks, heaviest section first; checks of the same section keep catalog order.
	 */
	static List<ActionItem> actionPlan(List<EvaluatedCheck> checks) {
		List<PlannedCheck> planned = new ArrayList<>();
		int order = 0;
		for (EvaluatedCheck check : checks) {
			CheckDefinition definition = check.definition();
			if (definition.accessibility() || check.detected()) {
				continue;
			}
			planned.add(new PlannedCheck(check, ScoringEngine.primarySection(definition), order++));
		}
		planned.sort(Comparator
				.comparingDouble((PlannedCheck item) -> item.section() == null ? 0.0 : item.section().maxScore())
				.reversed()
				.thenComparingInt(item -> item.section() == null ? Integer.MAX_VALUE : item.section().ordinal())
				.thenComparingInt(PlannedCheck::order));

		List<ActionItem> items = new ArrayList<>();
		int priority = 1;
		for (PlannedCheck item : planned) {
			CheckDefinition definition = item.check().definition();
			String remediation = item.check().verdict() == null ? null : item.check().verdict().remediation();
			String recommendation = remediation != null && !remediation.isBlank()
					? remediation
					: FALLBACK_RECOMMENDATION + definition.criteria();
			items.add(new ActionItem(priority++, definition.id(), definition.name(), definition.subCategory(),
					item.section() == null ? null : item.section().key(), recommendation));
		}
		return items;
	}

	private record PlannedCheck(EvaluatedCheck check, ScoringSection section, int order) {
	}
}
