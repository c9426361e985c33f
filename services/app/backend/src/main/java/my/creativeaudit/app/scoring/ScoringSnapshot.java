package my.creativeaudit.app.scoring;

import java.util.List;

public record ScoringSnapshot(
		double overallScore,
		List<SectionScore> sections,
		Indices indices,
		Flags flags,
		Labels labels,
		Drivers drivers,
		String modelVersion
) {
	public record SectionScore(
			String key,
			String label,
			double score,
			double maxScore,
			double normalized
	) {
	}

	public record Indices(
			double conversionReadiness,
			double revenueEfficiency,
			double refreshability,
			FunnelStrength funnelStrength
	) {
	}

	public record FunnelStrength(
			double tof,
			double mof,
			double bof,
			String winner,
			String hybrid
	) {
		public String label() {
			return hybrid == null ? winner : hybrid;
		}
	}

	public record Flags(
			boolean hookWithin3s,
			boolean brandMentions3x,
			boolean hasTrackableAnchor,
			boolean hasTestimonialOrUgc,
			boolean productDemoPresent,
			boolean endCardPresent
	) {
	}

	public record Labels(
			String predictedCpaRisk,
			String predictedRoasTier,
			String creativeFatigueRisk,
			String expectedFunnelStrength
	) {
	}

	public record Drivers(
			List<Driver> topPositive,
			List<Driver> topNegative,
			List<Adjustment> appliedAdjustments
	) {
	}

	public record Driver(
			String section,
			String label,
			double score
	) {
	}

	public record Adjustment(
			String type,
			String index,
			String key,
			double delta
	) {
	}
}
