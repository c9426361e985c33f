package my.creativeaudit.app.model;

public record Keyframe(
		int sceneIndex,
		double timestampSeconds,
		String locator
) {
}
