package my.creativeaudit.app.model;

public record TechnicalMetadata(
		Double durationSeconds,
		Integer width,
		Integer height,
		Double frameRate,
		String videoCodec,
		Long bitRate
) {
}
