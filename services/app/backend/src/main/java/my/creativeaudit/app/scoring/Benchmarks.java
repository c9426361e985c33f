package my.creativeaudit.app.scoring;

public record Benchmarks(
		double abcdPercentile,
		double persuasionPercentile,
		double performancePercentile,
		int sampleSize,
		String vertical,
		Distribution abcd,
		Distribution persuasion,
		Distribution performance
) {
	/**
	 * Nearest-rank percentiles of the history, {@code null} when the history is empty.
	 */
	public record Distribution(
			double p10,
			double p25,
			double p50,
			double p75,
			double p90,
			double mean
	) {
	}
}
