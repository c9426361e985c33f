package my.creativeaudit.app.service;

import my.creativeaudit.app.collaborator.AnnotationClient;
import my.creativeaudit.app.collaborator.CollaboratorErrorKind;
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
import my.creativeaudit.app.rubric.SubCategory;
import my.creativeaudit.app.rubric.VideoSegment;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CheckSetEvaluatorTest {
	private static final MediaRef MEDIA = new MediaRef("gs://bucket/spot.mp4", 30.0, "Acme");
	private static final CheckDefinition MODEL_ONLY = check("s_model", CheckSet.SHORTS, VideoSegment.FULL_VIDEO,
			EvaluationMethod.LLMS);
	private static final CheckDefinition LOGO_ONLY = check("s_logo", CheckSet.SHORTS, VideoSegment.FULL_VIDEO,
			EvaluationMethod.ANNOTATIONS, "LOGO_RECOGNITION");
	private static final CheckDefinition HYBRID = check("s_text", CheckSet.SHORTS, VideoSegment.FULL_VIDEO,
			EvaluationMethod.LLMS_AND_ANNOTATIONS, "TEXT_DETECTION");
	private static final CheckDefinition OPENING = check("l_open", CheckSet.LONG_FORM_ABCD,
			VideoSegment.FIRST_5_SECS_VIDEO, EvaluationMethod.LLMS);
	private static final CheckDefinition WHOLE = check("l_whole", CheckSet.LONG_FORM_ABCD, VideoSegment.FULL_VIDEO,
			EvaluationMethod.LLMS);

	@Mock
	private ContentUnderstandingClient contentUnderstanding;

	@Mock
	private AnnotationClient annotationClient;

	@Test
	void combinesModelAndAnnotationVerdicts() {
		when(contentUnderstanding.evaluate(eq(MEDIA), anyList())).thenReturn(CollaboratorResult.success(List.of(
				new CheckVerdict("s_model", true, 0.9, "clear", null, null),
				new CheckVerdict("s_text", false, 0.4, "no supers", null, null)
		)));
		when(annotationClient.annotate(eq(MEDIA), anySet())).thenReturn(CollaboratorResult.success(
				new AnnotationFeatures(Map.of(
						"LOGO_RECOGNITION", List.of(new AnnotationFeatures.Detection("Acme", 0.8, 1.0, 2.0)),
						"TEXT_DETECTION", List.of(new AnnotationFeatures.Detection("Sale", 0.7, 4.0, 6.0))
				))));

		BranchOutcome outcome = evaluator().evaluate(CheckSet.SHORTS, MEDIA, null, 30.0);

		assertThat(outcome.failed()).isFalse();
		assertThat(outcome.checks()).extracting(check -> check.definition().id())
				.containsExactly("s_model", "s_logo", "s_text");
		assertThat(outcome.checks()).allSatisfy(check -> assertThat(check.detected()).isTrue());
		EvaluatedCheck hybrid = outcome.checks().get(2);
		assertThat(hybrid.verdict().confidence()).isEqualTo(0.7);
		verify(annotationClient).annotate(MEDIA, Set.of("LOGO_RECOGNITION", "TEXT_DETECTION"));
	}

	@Test
	void branchFailsWhenEveryCallFails() {
		when(contentUnderstanding.evaluate(any(), anyList()))
				.thenReturn(CollaboratorResult.failure(CollaboratorErrorKind.TIMEOUT, "timed out"));
		when(annotationClient.annotate(any(), anySet()))
				.thenReturn(CollaboratorResult.failure(CollaboratorErrorKind.QUOTA, "quota"));

		BranchOutcome outcome = evaluator().evaluate(CheckSet.SHORTS, MEDIA, null, 30.0);

		assertThat(outcome.failed()).isTrue();
		assertThat(outcome.errorCode()).isEqualTo("COLLABORATOR_TIMEOUT");
		assertThat(outcome.checks()).isEmpty();
	}

	@Test
	void partialFailureKeepsTheBranch() {
		when(contentUnderstanding.evaluate(any(), anyList()))
				.thenReturn(CollaboratorResult.failure(CollaboratorErrorKind.UNAVAILABLE, "down"));
		when(annotationClient.annotate(any(), anySet())).thenReturn(CollaboratorResult.success(
				new AnnotationFeatures(Map.of(
						"LOGO_RECOGNITION", List.of(new AnnotationFeatures.Detection("Acme", 0.8, 1.0, 2.0))
				))));

		BranchOutcome outcome = evaluator().evaluate(CheckSet.SHORTS, MEDIA, null, 30.0);

		assertThat(outcome.failed()).isFalse();
		EvaluatedCheck modelOnly = outcome.checks().get(0);
		assertThat(modelOnly.detected()).isFalse();
		assertThat(modelOnly.verdict().rationale()).isEqualTo("Not evaluated: collaborator unavailable");
		assertThat(outcome.checks().get(1).detected()).isTrue();
		assertThat(outcome.checks().get(2).detected()).isFalse();
	}

	@Test
	void omittedVerdictBecomesUndetected() {
		when(contentUnderstanding.evaluate(any(), anyList())).thenReturn(CollaboratorResult.success(List.of()));

		BranchOutcome outcome = new CheckSetEvaluator(new RubricCatalog(List.of(MODEL_ONLY)), contentUnderstanding,
				annotationClient).evaluate(CheckSet.SHORTS, MEDIA, null, 30.0);

		assertThat(outcome.checks()).singleElement()
				.satisfies(check -> assertThat(check.verdict().rationale()).isEqualTo("No verdict returned"));
		verify(annotationClient, never()).annotate(any(), anySet());
	}

	@Test
	void openingChecksUseTheLeadingWindow() {
		MediaRef leading = MEDIA.withUri("gs://bucket/spot.mp4.first5s.mp4");
		when(contentUnderstanding.evaluate(eq(MEDIA), anyList())).thenReturn(CollaboratorResult.success(List.of(
				new CheckVerdict("l_whole", true, 0.6, null, null, null))));
		when(contentUnderstanding.evaluate(eq(leading), anyList())).thenReturn(CollaboratorResult.success(List.of(
				new CheckVerdict("l_open", true, 0.8, null, null, null))));

		BranchOutcome outcome = evaluator().evaluate(CheckSet.LONG_FORM_ABCD, MEDIA, leading, 30.0);

		assertThat(outcome.checks()).allSatisfy(check -> assertThat(check.detected()).isTrue());
		verify(contentUnderstanding).evaluate(MEDIA, List.of(WHOLE));
		verify(contentUnderstanding).evaluate(leading, List.of(OPENING));
	}

	private CheckSetEvaluator evaluator() {
		RubricCatalog catalog = new RubricCatalog(List.of(MODEL_ONLY, LOGO_ONLY, HYBRID, OPENING, WHOLE));
		return new CheckSetEvaluator(catalog, contentUnderstanding, annotationClient);
	}

	private static CheckDefinition check(String id, CheckSet checkSet, VideoSegment segment, EvaluationMethod method,
										 String... annotationTypes) {
		return new CheckDefinition(id, id, checkSet, SubCategory.ATTRACT, segment, method, "criteria " + id,
				List.of(annotationTypes));
	}
}
