package my.creativeaudit.app.scoring;

import my.creativeaudit.app.model.EvaluatedCheck;
import my.creativeaudit.app.rubric.CheckSet;
import my.creativeaudit.app.rubric.SubCategory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Ranks a report's scores against earlier evaluations. History is narrowed to the report's vertical only when
 * that vertical has at least {@link #MIN_VERTICAL_SAMPLE} entries.
 */
@Service
public class BenchmarkCalculator {
	public static final int MIN_VERTICAL_SAMPLE = 10;
	static final double NO_HISTORY_PERCENTILE = 50.0;
	static final String ALL_VERTICALS = "all";

	public BenchmarkScores scores(List<EvaluatedCheck> checks, ScoringSnapshot scoring, String vertical) {
		List<EvaluatedCheck> all = checks == null ? List.of() : checks;
		List<EvaluatedCheck> abcd = all.stream()
				.filter(check -> check.definition().checkSet() == CheckSet.LONG_FORM_ABCD)
				.toList();
		List<EvaluatedCheck> persuasion = all.stream()
				.filter(check -> check.definition().subCategory() == SubCategory.PERSUASION)
				.toList();
		return new BenchmarkScores(detectedShare(abcd), detectedShare(persuasion),
				scoring == null ? 0.0 : scoring.overallScore(), vertical);
	}

	public Benchmarks compute(BenchmarkScores current, List<BenchmarkScores> history) {
		List<BenchmarkScores> population = history == null ? List.of() : history;
		String vertical = current.vertical() == null || current.vertical().isBlank() ? null : current.vertical();
		String compared = ALL_VERTICALS;
		if (vertical != null) {
			String wanted = vertical.toLowerCase(Locale.ROOT);
			List<BenchmarkScores> sameVertical = population.stream()
					.filter(entry -> entry.vertical() != null && entry.vertical().toLowerCase(Locale.ROOT).equals(wanted))
					.toList();
			if (sameVertical.size() >= MIN_VERTICAL_SAMPLE) {
				population = sameVertical;
				compared = vertical;
			}
		}
		double[] abcd = sorted(population, BenchmarkScores::abcdScore);
		double[] persuasion = sorted(population, BenchmarkScores::persuasionDensity);
		double[] performance = sorted(population, BenchmarkScores::performanceScore);
		return new Benchmarks(
				percentileRank(abcd, current.abcdScore()),
				percentileRank(persuasion, current.persuasionDensity()),
				percentileRank(performance, current.performanceScore()),
				population.size(),
				compared,
				distribution(abcd),
				distribution(persuasion),
				distribution(performance)
		);
	}

	/**
	 * Share of values strictly below {@code value}, as a percentage.
	 */
	static double percentileRank(double[] sortedValues, double value) {
		if (sortedValues.length == 0) {
			return NO_HISTORY_PERCENTILE;
		}
		int below = 0;
		while (below < sortedValues.length && sortedValues[below] < value) {
			below++;
		}
		return ScoringEngine.round(below * 100.0 / sortedValues.length, 1);
	}

	static Benchmarks.Distribution distribution(double[] sortedValues) {
		if (sortedValues.length == 0) {
			return null;
		}
		double sum = 0.0;
		for (double value : sortedValues) {
			sum += value;
		}
		return new Benchmarks.Distribution(
				nearestRank(sortedValues, 10),
				nearestRank(sortedValues, 25),
				nearestRank(sortedValues, 50),
				nearestRank(sortedValues, 75),
				nearestRank(sortedValues, 90),
				ScoringEngine.round(sum / sortedValues.length, 1)
		);
	}

	private static double nearestRank(double[] sortedValues, int percentile) {
		int index = (int) (percentile / 100.0 * (sortedValues.length - 1));
		return ScoringEngine.round(sortedValues[index], 1);
	}

	private static double detectedShare(List<EvaluatedCheck> checks) {
		if (checks.isEmpty()) {
			return 0.0;
		}
		long detected = checks.stream().filter(EvaluatedCheck::detected).count();
		return ScoringEngine.round(detected * 100.0 / checks.size(), 1);
	}

	private static double[] sorted(List<BenchmarkScores> entries, ToDoubleFunction<BenchmarkScores> field) {
		double[] values = entries.stream().mapToDouble(field).toArray();
		Arrays.sort(values);
		return values;
	}
}
