package my.creativeaudit.app.service;

import my.creativeaudit.app.model.AnnotationFeatures;
import my.creativeaudit.app.model.CheckVerdict;
import my.creativeaudit.app.rubric.CheckDefinition;
import my.creativeaudit.app.rubric.VideoSegment;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns annotation detections into verdicts and combines the two sources of a hybrid check.
 */
final class VerdictMerger {
	static final double SEGMENT_WINDOW_SECONDS = 5.0;
	private static final int MAX_EVIDENCE_LABELS = 5;

	private VerdictMerger() {
	}

	/**
	 * A check is detected when any detection of its annotation types falls inside the check's segment window.
	 * Confidence is the strongest matching detection.
	 */
	static CheckVerdict fromAnnotations(CheckDefinition check, AnnotationFeatures features, Double durationSeconds) {
		List<AnnotationFeatures.Detection> matches = new ArrayList<>();
		for (String type : check.annotationTypes()) {
			for (AnnotationFeatures.Detection detection : features.ofType(type)) {
				if (inSegment(check.segment(), detection, durationSeconds)) {
					matches.add(detection);
				}
			}
		}
		if (matches.isEmpty()) {
			return CheckVerdict.undetected(check.id(),
					"No " + String.join("/", check.annotationTypes()).toLowerCase(Locale.ROOT) + " detections in "
							+ segmentLabel(check.segment()));
		}
		double confidence = 0.0;
		List<String> labels = new ArrayList<>();
		for (AnnotationFeatures.Detection detection : matches) {
			confidence = Math.max(confidence, detection.confidence());
			if (detection.label() != null && !detection.label().isBlank() && labels.size() < MAX_EVIDENCE_LABELS
					&& !labels.contains(detection.label())) {
				labels.add(detection.label());
			}
		}
		String evidence = labels.isEmpty()
				? null
				: String.format(Locale.ROOT, "%s at %.1fs", String.join(", ", labels), matches.get(0).startSeconds());
		return new CheckVerdict(check.id(), true, confidence,
				matches.size() + " detection(s) in " + segmentLabel(check.segment()), evidence, null);
	}

	/**
	 * Hybrid combination: detected when either side detected, the higher confidence, both texts kept.
	 * A missing side leaves the other one unchanged.
	 */
	static CheckVerdict combine(CheckVerdict model, CheckVerdict annotations) {
		if (model == null) {
			return annotations;
		}
		if (annotations == null) {
			return model;
		}
		Double confidence;
		if (model.confidence() == null) {
			confidence = annotations.confidence();
		} else if (annotations.confidence() == null) {
			confidence = model.confidence();
		} else {
			confidence = Math.max(model.confidence(), annotations.confidence());
		}
		return new CheckVerdict(
				model.checkId(),
				model.detected() || annotations.detected(),
				confidence,
				join(model.rationale(), annotations.rationale()),
				join(model.evidence(), annotations.evidence()),
				model.remediation() != null ? model.remediation() : annotations.remediation()
		);
	}

	static boolean inSegment(VideoSegment segment, AnnotationFeatures.Detection detection, Double durationSeconds) {
		return switch (segment) {
			case FULL_VIDEO -> true;
			case FIRST_5_SECS_VIDEO -> detection.startSeconds() < SEGMENT_WINDOW_SECONDS;
			case LAST_5_SECS_VIDEO -> durationSeconds == null
					|| detection.endSeconds() >= durationSeconds - SEGMENT_WINDOW_SECONDS;
		};
	}

	private static String segmentLabel(VideoSegment segment) {
		return switch (segment) {
			case FULL_VIDEO -> "the full video";
			case FIRST_5_SECS_VIDEO -> "the first 5 seconds";
			case LAST_5_SECS_VIDEO -> "the last 5 seconds";
		};
	}

	private static String join(String first, String second) {
		boolean hasFirst = first != null && !first.isBlank();
		boolean hasSecond = second != null && !second.isBlank();
		if (hasFirst && hasSecond) {
			return first + " | " + second;
		}
		return hasFirst ? first : hasSecond ? second : null;
	}
}
