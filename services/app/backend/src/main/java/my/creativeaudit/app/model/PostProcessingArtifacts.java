package my.creativeaudit.app.model;

import java.util.List;

public record PostProcessingArtifacts(
		List<Keyframe> keyframes,
		AudioLevels audioLevels,
		BrandProfile brandProfile,
		TechnicalMetadata technicalMetadata
) {
	public static PostProcessingArtifacts empty() {
		return new PostProcessingArtifacts(null, null, null, null);
	}
}
