package my.creativeaudit.app.model;

/**
 * A scene of the analysed video. {@code transcript} and {@code speechRatio} (share of the scene with speech,
 * 0 to 1) are optional.
 */
public record Scene(
		int index,
		double startSeconds,
		double endSeconds,
		String description,
		String transcript,
		Double speechRatio
) {
	public Scene(int index, double startSeconds, double endSeconds, String description) {
		this(index, startSeconds, endSeconds, description, null, null);
	}

	public double midpointSeconds() {
		return startSeconds + Math.max(0.0, endSeconds - startSeconds) / 2.0;
	}
}
