package my.creativeaudit.app.domain;

import java.util.Locale;

public enum FeedbackVerdict {
	CORRECT,
	INCORRECT;

	public static FeedbackVerdict parse(String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("verdict is required");
		}
		try {
			return valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			throw new IllegalArgumentException("verdict must be 'correct' or 'incorrect'", ex);
		}
	}
}
