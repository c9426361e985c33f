package my.creativeaudit.app.service;

/**
 * How far a check's verdicts can be trusted, judged from reviewer feedback.
 */
public enum ReliabilityLevel {
	HIGH,
	MEDIUM,
	LOW;

	static final int HIGH_MIN_SAMPLES = 20;
	static final double HIGH_MIN_ACCURACY = 0.85;
	static final int MEDIUM_MIN_SAMPLES = 10;
	static final double MEDIUM_MIN_ACCURACY = 0.70;

	public static ReliabilityLevel of(long samples, double accuracy) {
		if (samples >= HIGH_MIN_SAMPLES && accuracy >= HIGH_MIN_ACCURACY) {
			return HIGH;
		}
		if (samples >= MEDIUM_MIN_SAMPLES && accuracy >= MEDIUM_MIN_ACCURACY) {
			return MEDIUM;
		}
		return LOW;
	}
}
