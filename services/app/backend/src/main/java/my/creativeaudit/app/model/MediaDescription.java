package my.creativeaudit.app.model;

import java.util.List;

public record MediaDescription(
		Double durationSeconds,
		String brandName,
		String summary,
		List<Scene> scenes
) {
	public MediaDescription {
		scenes = scenes == null ? List.of() : List.copyOf(scenes);
	}
}
