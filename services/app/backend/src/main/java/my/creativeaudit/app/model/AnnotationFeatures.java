package my.creativeaudit.app.model;

import java.util.List;
import java.util.Map;

/**
 * Structured detections keyed by annotation type (for example {@code LOGO}, {@code TEXT}, {@code SPEECH}).
 */
public record AnnotationFeatures(
		Map<String, List<Detection>> detections
) {
	public AnnotationFeatures {
		detections = detections == null ? Map.of() : Map.copyOf(detections);
	}

	public List<Detection> ofType(String annotationType) {
		return detections.getOrDefault(annotationType, List.of());
	}

	public record Detection(
			String label,
			double confidence,
			double startSeconds,
			double endSeconds
	) {
	}
}
