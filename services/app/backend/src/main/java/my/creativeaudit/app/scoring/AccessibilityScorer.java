package my.creativeaudit.app.scoring;

import my.creativeaudit.app.model.EvaluatedCheck;
import my.creativeaudit.app.model.Scene;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Accessibility pass rate of the evaluated accessibility checks. The speech-rate check is judged on the pace
 * measured from scene transcripts whenever the scenes carry speech.
 */
@Service
public class AccessibilityScorer {
	public static final String SPEECH_RATE_CHECK = "acc_speech_rate";
	private static final double MIN_SCENE_SECONDS = 0.1;

	/**
	 * @return {@code null} when no accessibility check was evaluated
	 */
	public AccessibilitySummary summarize(List<EvaluatedCheck> checks, List<Scene> scenes) {
		List<EvaluatedCheck> accessibility = checks == null ? List.of() : checks.stream()
				.filter(check -> check.definition().accessibility())
				.toList();
		if (accessibility.isEmpty()) {
			return null;
		}
		SpeechRate rate = speechRate(scenes);
		int passed = (int) accessibility.stream().filter(check -> passed(check, rate)).count();
		double score = ScoringEngine.round(passed * 100.0 / accessibility.size(), 1);
		return new AccessibilitySummary(score, passed, accessibility.size(), rate);
	}

	public static boolean passed(EvaluatedCheck check, SpeechRate rate) {
		if (SPEECH_RATE_CHECK.equals(check.definition().id()) && rate != null && rate.measured()) {
			return rate.flag() == SpeechRate.Flag.OK;
		}
		return check.detected();
	}

	public static SpeechRate speechRate(List<Scene> scenes) {
		if (scenes == null) {
			return SpeechRate.none();
		}
		int words = 0;
		double speechSeconds = 0.0;
		for (Scene scene : scenes) {
			String transcript = scene.transcript();
			Double ratio = scene.speechRatio();
			if (transcript == null || transcript.isBlank() || ratio == null || ratio <= 0) {
				continue;
			}
			words += transcript.trim().split("\\s+").length;
			speechSeconds += Math.max(scene.endSeconds() - scene.startSeconds(), MIN_SCENE_SECONDS) * ratio;
		}
		if (speechSeconds <= 0) {
			return SpeechRate.none();
		}
		double wpm = ScoringEngine.round(words / (speechSeconds / 60.0), 1);
		SpeechRate.Flag flag = wpm > SpeechRate.TOO_FAST_ABOVE ? SpeechRate.Flag.TOO_FAST
				: wpm < SpeechRate.TOO_SLOW_BELOW ? SpeechRate.Flag.TOO_SLOW
				: SpeechRate.Flag.OK;
		return new SpeechRate(wpm, flag);
	}

	public static String speechRateRemediation(SpeechRate rate) {
		String pace = String.format(Locale.ROOT, "Speech rate is %.0f WPM. ", rate.wordsPerMinute());
		return switch (rate.flag()) {
			case TOO_FAST -> pace + "Slow down narration to 180 WPM or less, or add pauses between key points.";
			case TOO_SLOW -> pace + "Consider a more natural pacing (120-170 WPM) to maintain engagement.";
			case OK -> pace + "Speech rate is within the comfortable range (100-180 WPM).";
			case NO_SPEECH -> "No narration was detected.";
		};
	}
}
