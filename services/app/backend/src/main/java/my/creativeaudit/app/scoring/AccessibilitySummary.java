package my.creativeaudit.app.scoring;

public record AccessibilitySummary(
		double score,
		int passed,
		int total,
		SpeechRate speechRate
) {
}
