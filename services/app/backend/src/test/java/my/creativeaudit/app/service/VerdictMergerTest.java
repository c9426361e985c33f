package my.creativeaudit.app.service;

import my.creativeaudit.app.model.AnnotationFeatures;
import my.creativeaudit.app.model.CheckVerdict;
import my.creativeaudit.app.rubric.CheckDefinition;
import my.creativeaudit.app.rubric.CheckSet;
import my.creativeaudit.app.rubric.EvaluationMethod;
import my.creativeaudit.app.rubric.SubCategory;
import my.creativeaudit.app.rubric.VideoSegment;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class VerdictMergerTest {
	@Test
	void detectionInsideLeadingWindowCounts() {
		CheckDefinition check = check(VideoSegment.FIRST_5_SECS_VIDEO, "LOGO_RECOGNITION");
		AnnotationFeatures features = new AnnotationFeatures(Map.of("LOGO_RECOGNITION", List.of(
				new AnnotationFeatures.Detection("Acme", 0.62, 1.5, 3.0),
				new AnnotationFeatures.Detection("Acme", 0.91, 12.0, 14.0)
		)));

		CheckVerdict verdict = VerdictMerger.fromAnnotations(check, features, 30.0);

		assertThat(verdict.detected()).isTrue();
		assertThat(verdict.confidence()).isEqualTo(0.62);
		assertThat(verdict.evidence()).isEqualTo("Acme at 1.5s");
	}

	@Test
	void detectionOutsideSegmentIsIgnored() {
		CheckDefinition check = check(VideoSegment.LAST_5_SECS_VIDEO, "TEXT_DETECTION");
		AnnotationFeatures features = new AnnotationFeatures(Map.of("TEXT_DETECTION", List.of(
				new AnnotationFeatures.Detection("Shop now", 0.8, 2.0, 6.0)
		)));

		CheckVerdict verdict = VerdictMerger.fromAnnotations(check, features, 30.0);

		assertThat(verdict.detected()).isFalse();
		assertThat(verdict.rationale()).contains("text_detection").contains("last 5 seconds");
	}

	@Test
	void lastWindowWithoutDurationAcceptsAnyDetection() {
		AnnotationFeatures.Detection detection = new AnnotationFeatures.Detection("x", 0.5, 1.0, 2.0);

		assertThat(VerdictMerger.inSegment(VideoSegment.LAST_5_SECS_VIDEO, detection, null)).isTrue();
		assertThat(VerdictMerger.inSegment(VideoSegment.LAST_5_SECS_VIDEO, detection, 20.0)).isFalse();
		assertThat(VerdictMerger.inSegment(VideoSegment.FULL_VIDEO, detection, 20.0)).isTrue();
	}

	@Test
	void hybridVerdictIsDetectedWhenEitherSideDetects() {
		CheckVerdict model = new CheckVerdict("c", false, 0.3, "not seen", null, "Add a logo");
		CheckVerdict annotations = new CheckVerdict("c", true, 0.85, "1 detection(s)", "Acme at 2.0s", null);

		CheckVerdict combined = VerdictMerger.combine(model, annotations);

		assertThat(combined.detected()).isTrue();
		assertThat(combined.confidence()).isEqualTo(0.85);
		assertThat(combined.rationale()).isEqualTo("not seen | 1 detection(s)");
		assertThat(combined.evidence()).isEqualTo("Acme at 2.0s");
		assertThat(combined.remediation()).isEqualTo("Add a logo");
	}

	@Test
	void missingSideLeavesTheOtherUnchanged() {
		CheckVerdict model = new CheckVerdict("c", true, 0.7, "seen", "frame 3", null);

		assertThat(VerdictMerger.combine(model, null)).isSameAs(model);
		assertThat(VerdictMerger.combine(null, model)).isSameAs(model);
		assertThat(VerdictMerger.combine(null, null)).isNull();
	}

	private static CheckDefinition check(VideoSegment segment, String annotationType) {
		return new CheckDefinition("c", "Check", CheckSet.LONG_FORM_ABCD, SubCategory.BRAND, segment,
				EvaluationMethod.ANNOTATIONS, "criteria", List.of(annotationType));
	}
}
