package my.creativeaudit.app.scoring;

/**
 * Narration pace in words per minute of speech.
 */
public record SpeechRate(
		double wordsPerMinute,
		Flag flag
) {
	public static final double TOO_FAST_ABOVE = 180.0;
	public static final double TOO_SLOW_BELOW = 100.0;

	public static SpeechRate none() {
		return new SpeechRate(0.0, Flag.NO_SPEECH);
	}

	public boolean measured() {
		return flag != Flag.NO_SPEECH;
	}

	public enum Flag {
		TOO_FAST,
		TOO_SLOW,
		OK,
		NO_SPEECH
	}
}
