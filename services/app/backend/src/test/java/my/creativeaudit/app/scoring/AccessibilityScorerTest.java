package my.creativeaudit.app.scoring;

import my.creativeaudit.app.model.CheckVerdict;
import my.creativeaudit.app.model.EvaluatedCheck;
import my.creativeaudit.app.model.Scene;
import my.creativeaudit.app.rubric.CheckDefinition;
import my.creativeaudit.app.rubric.CheckSet;
import my.creativeaudit.app.rubric.EvaluationMethod;
import my.creativeaudit.app.rubric.SubCategory;
import my.creativeaudit.app.rubric.VideoSegment;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AccessibilityScorerTest {
	private final AccessibilityScorer scorer = new AccessibilityScorer();

	@Test
	void speechRateCountsOnlyTheSpokenShareOfEachScene() {
		List<Scene> scenes = List.of(
				new Scene(0, 0.0, 20.0, "Talking head", words(50), 0.5),
				new Scene(1, 20.0, 30.0, "Pack shot", null, null));

		SpeechRate rate = AccessibilityScorer.speechRate(scenes);

		assertThat(rate.wordsPerMinute()).isEqualTo(300.0);
		assertThat(rate.flag()).isEqualTo(SpeechRate.Flag.TOO_FAST);
	}

	@Test
	void scenesWithoutTranscriptsHaveNoSpeech() {
		assertThat(AccessibilityScorer.speechRate(List.of(new Scene(0, 0.0, 10.0, "Silent")))).isEqualTo(SpeechRate.none());
		assertThat(AccessibilityScorer.speechRate(null).measured()).isFalse();
	}

	@Test
	void slowNarrationIsFlagged() {
		SpeechRate rate = AccessibilityScorer.speechRate(List.of(new Scene(0, 0.0, 60.0, "Voice over", words(80), 1.0)));

		assertThat(rate.wordsPerMinute()).isEqualTo(80.0);
		assertThat(rate.flag()).isEqualTo(SpeechRate.Flag.TOO_SLOW);
		assertThat(AccessibilityScorer.speechRateRemediation(rate)).startsWith("Speech rate is 80 WPM.");
	}

	@Test
	void measuredPaceOverridesTheSpeechRateVerdict() {
		List<EvaluatedCheck> checks = List.of(
				check("acc_captions_present", true),
				check(AccessibilityScorer.SPEECH_RATE_CHECK, false),
				check("acc_text_contrast", false));
		List<Scene> scenes = List.of(new Scene(0, 0.0, 30.0, "Voice over", words(70), 1.0));

		AccessibilitySummary summary = scorer.summarize(checks, scenes);

		assertThat(summary.speechRate().flag()).isEqualTo(SpeechRate.Flag.OK);
		assertThat(summary.passed()).isEqualTo(2);
		assertThat(summary.total()).isEqualTo(3);
		assertThat(summary.score()).isEqualTo(66.7);
	}

	@Test
	void verdictStandsWhenNoSpeechWasMeasured() {
		EvaluatedCheck speech = check(AccessibilityScorer.SPEECH_RATE_CHECK, true);

		assertThat(AccessibilityScorer.passed(speech, SpeechRate.none())).isTrue();
	}

	@Test
	void noAccessibilityChecksMeansNoSummary() {
		assertThat(scorer.summarize(List.of(), List.of())).isNull();
	}

	private static String words(int count) {
		return String.join(" ", Collections.nCopies(count, "word"));
	}

	private static EvaluatedCheck check(String id, boolean detected) {
		CheckDefinition definition = new CheckDefinition(id, id, CheckSet.CREATIVE_INTELLIGENCE, SubCategory.ACCESSIBILITY,
				VideoSegment.FULL_VIDEO, EvaluationMethod.LLMS, "criteria of " + id, List.of());
		return new EvaluatedCheck(definition, new CheckVerdict(id, detected, 0.9, null, null, null));
	}
}
