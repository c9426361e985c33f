package my.creativeaudit.app.model;

import java.util.List;

/**
 * Loudness per scene on a 0-100 scale (-60 dB maps to 0, 0 dB to 100). Jumps over 10 points are flagged.
 */
public record AudioLevels(
		Double meanVolumeDb,
		List<SceneVolume> scenes
) {
	public AudioLevels {
		scenes = scenes == null ? List.of() : List.copyOf(scenes);
	}

	public record SceneVolume(
			int sceneIndex,
			double volumeDb,
			double volumePercent,
			double changePercent,
			boolean flagged
	) {
	}
}
