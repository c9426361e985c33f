package my.creativeaudit.app.scoring;

/**
 * The three headline numbers a report is ranked on, each 0 to 100.
 */
public record BenchmarkScores(
		double abcdScore,
		double persuasionDensity,
		double performanceScore,
		String vertical
) {
}
