package my.creativeaudit.app.service;

import my.creativeaudit.app.collaborator.AnnotationClient;
import my.creativeaudit.app.collaborator.CollaboratorResult;
import my.creativeaudit.app.collaborator.ContentUnderstandingClient;
import my.creativeaudit.app.model.AnnotationFeatures;
import my.creativeaudit.app.model.CheckVerdict;
import my.creativeaudit.app.model.EvaluatedCheck;
import my.creativeaudit.app.model.MediaRef;
import my.creativeaudit.app.rubric.CheckDefinition;
import my.creativeaudit.app.rubric.CheckSet;
import my.creativeaudit.app.rubric.EvaluationMethod;
import my.creativeaudit.app.rubric.RubricCatalog;
import my.creativeaudit.app.rubric.VideoSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates the checks of one check-set. Each check is answered by the collaborator its evaluation method names;
 * hybrid checks use both. The branch fails only when every collaborator call it made failed.
 */
@Component
public class CheckSetEvaluator {
	private static final Logger logger = LoggerFactory.getLogger(CheckSetEvaluator.class);

	private final RubricCatalog catalog;
	private final ContentUnderstandingClient contentUnderstanding;
	private final AnnotationClient annotationClient;

	public CheckSetEvaluator(RubricCatalog catalog,
							 ContentUnderstandingClient contentUnderstanding,
							 AnnotationClient annotationClient) {
		this.catalog = catalog;
		this.contentUnderstanding = contentUnderstanding;
		this.annotationClient = annotationClient;
	}

	/**
	 * @param media          the full asset
	 * @param leadingWindow  the trimmed first seconds of the asset, or {@code null} when not available
	 * @param durationSeconds best known duration, used to place the last-seconds window
	 */
	public BranchOutcome evaluate(CheckSet checkSet, MediaRef media, MediaRef leadingWindow, Double durationSeconds) {
		List<CheckDefinition> checks = catalog.checks(checkSet);
		if (checks.isEmpty()) {
			return BranchOutcome.completed(checkSet, List.of());
		}
		List<CollaboratorResult.Failure<?>> failures = new ArrayList<>();
		int calls = 0;

		List<CheckDefinition> fullWindowChecks = new ArrayList<>();
		List<CheckDefinition> leadingWindowChecks = new ArrayList<>();
		Set<String> annotationTypes = new LinkedHashSet<>();
		for (CheckDefinition check : checks) {
			EvaluationMethod method = check.evaluationMethod();
			if (method.usesContentUnderstanding()) {
				if (leadingWindow != null && check.segment() == VideoSegment.FIRST_5_SECS_VIDEO) {
					leadingWindowChecks.add(check);
				} else {
					fullWindowChecks.add(check);
				}
			}
			if (method.usesAnnotations()) {
				annotationTypes.addAll(check.annotationTypes());
			}
		}

		Map<String, CheckVerdict> modelVerdicts = new HashMap<>();
		Set<String> modelAnswered = new LinkedHashSet<>();
		if (!fullWindowChecks.isEmpty()) {
			calls++;
			collectVerdicts(contentUnderstanding.evaluate(media, fullWindowChecks), fullWindowChecks, modelVerdicts,
					modelAnswered, failures, checkSet);
		}
		if (!leadingWindowChecks.isEmpty()) {
			calls++;
			collectVerdicts(contentUnderstanding.evaluate(leadingWindow, leadingWindowChecks), leadingWindowChecks,
					modelVerdicts, modelAnswered, failures, checkSet);
		}

		AnnotationFeatures features = null;
		if (!annotationTypes.isEmpty()) {
			calls++;
			CollaboratorResult<AnnotationFeatures> result = annotationClient.annotate(media, annotationTypes);
			if (result instanceof CollaboratorResult.Success<AnnotationFeatures> success) {
				features = success.value();
			} else {
				CollaboratorResult.Failure<AnnotationFeatures> failure = (CollaboratorResult.Failure<AnnotationFeatures>) result;
				logger.warn("Annotation call for {} failed ({}): {}", checkSet, failure.kind(), failure.message());
				failures.add(failure);
			}
		}

		if (calls > 0 && failures.size() == calls) {
			CollaboratorResult.Failure<?> first = failures.get(0);
			return BranchOutcome.failure(checkSet, first.kind().errorCode(), first.message());
		}

		List<EvaluatedCheck> evaluated = new ArrayList<>();
		for (CheckDefinition check : checks) {
			CheckVerdict model = modelAnswered.contains(check.id())
					? modelVerdicts.getOrDefault(check.id(), CheckVerdict.undetected(check.id(), "No verdict returned"))
					: null;
			CheckVerdict annotations = check.evaluationMethod().usesAnnotations() && features != null
					? VerdictMerger.fromAnnotations(check, features, durationSeconds)
					: null;
			CheckVerdict verdict = VerdictMerger.combine(model, annotations);
			if (verdict == null) {
				verdict = CheckVerdict.undetected(check.id(), "Not evaluated: collaborator unavailable");
			}
			evaluated.add(new EvaluatedCheck(check, verdict));
		}
		return BranchOutcome.completed(checkSet, evaluated);
	}

	private void collectVerdicts(CollaboratorResult<List<CheckVerdict>> result,
								 List<CheckDefinition> requested,
								 Map<String, CheckVerdict> verdicts,
								 Set<String> answered,
								 List<CollaboratorResult.Failure<?>> failures,
								 CheckSet checkSet) {
		if (result instanceof CollaboratorResult.Success<List<CheckVerdict>> success) {
			for (CheckVerdict verdict : success.value()) {
				verdicts.putIfAbsent(verdict.checkId(), verdict);
			}
			requested.forEach(check -> answered.add(check.id()));
			return;
		}
		CollaboratorResult.Failure<List<CheckVerdict>> failure = (CollaboratorResult.Failure<List<CheckVerdict>>) result;
		logger.warn("Content understanding call for {} failed ({}): {}", checkSet, failure.kind(), failure.message());
		failures.add(failure);
	}
}
