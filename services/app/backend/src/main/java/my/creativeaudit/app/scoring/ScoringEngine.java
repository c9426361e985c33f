package my.creativeaudit.app.scoring;

import my.creativeaudit.app.model.CheckVerdict;
import my.creativeaudit.app.model.EvaluatedCheck;
import my.creativeaudit.app.rubric.CheckDefinition;
import my.creativeaudit.app.rubric.SubCategory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

import static my.creativeaudit.app.scoring.ScoringRules.*;
import static my.creativeaudit.app.scoring.ScoringSection.*;

/**
 * Deterministic performance prediction from evaluated rubric checks. No I/O, no clock, no randomness:
 * identical inputs produce identical snapshots.
 */
@Service
public class ScoringEngine {

	public ScoringSnapshot score(List<EvaluatedCheck> checks) {
		Groups groups = Groups.of(checks == null ? List.of() : checks);

		Map<ScoringSection, Double> scores = new EnumMap<>(ScoringSection.class);
		scores.put(HOOK_ATTENTION, sectionScore(groups.attract(), HOOK_ATTENTION.maxScore()));
		scores.put(BRAND_VISIBILITY, sectionScore(groups.brand(), BRAND_VISIBILITY.maxScore()));
		scores.put(SOCIAL_PROOF_TRUST, sectionScore(concat(groups.people(), groups.persuasion()), SOCIAL_PROOF_TRUST.maxScore()));
		scores.put(PRODUCT_CLARITY_BENEFITS, sectionScore(groups.product(), PRODUCT_CLARITY_BENEFITS.maxScore()));
		scores.put(FUNNEL_ALIGNMENT, sectionScore(groups.structure(), FUNNEL_ALIGNMENT.maxScore()));
		scores.put(CTA, sectionScore(groups.direct(), CTA.maxScore()));

		double coverage = coverage(groups.abcd());
		double diversity = sectionScore(concat(groups.structure(), groups.persuasion()), CREATIVE_DIVERSITY_READINESS.maxScore())
				* DIVERSITY_SECTION_WEIGHT + coverage * DIVERSITY_COVERAGE_POINTS;
		scores.put(CREATIVE_DIVERSITY_READINESS, round(Math.min(diversity, CREATIVE_DIVERSITY_READINESS.maxScore()), 2));

		boolean measurementKeyword = anyDetectedContains(concat(groups.direct(), groups.abcd()), MEASUREMENT_KEYWORDS, Field.EVIDENCE);
		double measurement = sectionScore(groups.direct(), MEASUREMENT_CTA_MAX)
				+ (measurementKeyword ? MEASUREMENT_KEYWORD_POINTS : 0.0);
		scores.put(MEASUREMENT_COMPATIBILITY, round(Math.min(measurement, MEASUREMENT_COMPATIBILITY.maxScore()), 2));
		scores.put(DATA_AUDIENCE_LEVERAGE, round(Math.min(sectionScore(groups.brand(), DATA_AUDIENCE_LEVERAGE.maxScore()),
				DATA_AUDIENCE_LEVERAGE.maxScore()), 2));

		Map<ScoringSection, Double> norm = new EnumMap<>(ScoringSection.class);
		for (ScoringSection section : ScoringSection.values()) {
			norm.put(section, round(scores.get(section) / section.maxScore(), 4));
		}

		ScoringSnapshot.Flags flags = flags(groups);

		double cri = CRI_HOOK * norm.get(HOOK_ATTENTION)
				+ CRI_PRODUCT * norm.get(PRODUCT_CLARITY_BENEFITS)
				+ CRI_CTA * norm.get(CTA)
				+ CRI_SOCIAL * norm.get(SOCIAL_PROOF_TRUST)
				+ CRI_BRAND * norm.get(BRAND_VISIBILITY)
				+ CRI_FUNNEL * norm.get(FUNNEL_ALIGNMENT)
				+ CRI_MEASUREMENT * norm.get(MEASUREMENT_COMPATIBILITY);
		List<ScoringSnapshot.Adjustment> criAdjustments = conversionAdjustments(flags);
		double criAdjusted = clamp(cri + sumDeltas(criAdjustments));

		double rei = REI_PRODUCT * norm.get(PRODUCT_CLARITY_BENEFITS)
				+ REI_SOCIAL * norm.get(SOCIAL_PROOF_TRUST)
				+ REI_BRAND * norm.get(BRAND_VISIBILITY)
				+ REI_FUNNEL * norm.get(FUNNEL_ALIGNMENT)
				+ REI_HOOK * norm.get(HOOK_ATTENTION)
				+ REI_CTA * norm.get(CTA)
				+ REI_DIVERSITY * norm.get(CREATIVE_DIVERSITY_READINESS);
		List<ScoringSnapshot.Adjustment> reiAdjustments = revenueAdjustments(flags, norm);
		double reiAdjusted = clamp(rei + sumDeltas(reiAdjustments));

		double rfi = RFI_DIVERSITY * norm.get(CREATIVE_DIVERSITY_READINESS)
				+ RFI_HOOK * norm.get(HOOK_ATTENTION)
				+ RFI_MEASUREMENT * norm.get(MEASUREMENT_COMPATIBILITY);

		double story = (norm.get(FUNNEL_ALIGNMENT) + norm.get(PRODUCT_CLARITY_BENEFITS)) / 2;
		double tof = TOF_HOOK * norm.get(HOOK_ATTENTION)
				+ TOF_BRAND * norm.get(BRAND_VISIBILITY)
				+ TOF_SOCIAL * norm.get(SOCIAL_PROOF_TRUST)
				+ TOF_STORY * story;
		double mof = MOF_SOCIAL * norm.get(SOCIAL_PROOF_TRUST)
				+ MOF_PRODUCT * norm.get(PRODUCT_CLARITY_BENEFITS)
				+ MOF_BRAND * norm.get(BRAND_VISIBILITY)
				+ MOF_HOOK * norm.get(HOOK_ATTENTION)
				+ MOF_CTA * norm.get(CTA);
		double bof = BOF_CTA * norm.get(CTA)
				+ BOF_PRODUCT * norm.get(PRODUCT_CLARITY_BENEFITS)
				+ BOF_SOCIAL * norm.get(SOCIAL_PROOF_TRUST)
				+ BOF_MEASUREMENT * norm.get(MEASUREMENT_COMPATIBILITY)
				+ BOF_FUNNEL * norm.get(FUNNEL_ALIGNMENT);
		ScoringSnapshot.FunnelStrength funnel = resolveFunnelStage(tof, mof, bof);

		ScoringSnapshot.Labels labels = new ScoringSnapshot.Labels(
				criAdjusted >= CPA_RISK_LOW ? "Low" : criAdjusted >= CPA_RISK_MEDIUM ? "Medium" : "High",
				reiAdjusted >= ROAS_HIGH ? "High" : reiAdjusted >= ROAS_MODERATE ? "Moderate" : "Low",
				rfi >= FATIGUE_LOW ? "Low" : rfi >= FATIGUE_MEDIUM ? "Medium" : "High",
				funnel.label()
		);

		List<ScoringSnapshot.Adjustment> adjustments = new ArrayList<>();
		reiAdjustments.stream().filter(adjustment -> adjustment.delta() > 0).forEach(adjustments::add);
		adjustments.addAll(criAdjustments);
		reiAdjustments.stream().filter(adjustment -> adjustment.delta() < 0).forEach(adjustments::add);

		List<ScoringSnapshot.SectionScore> sections = new ArrayList<>();
		double overall = 0.0;
		for (ScoringSection section : ScoringSection.values()) {
			double value = scores.get(section);
			overall += value;
			sections.add(new ScoringSnapshot.SectionScore(section.key(), section.label(), value, section.maxScore(), norm.get(section)));
		}

		return new ScoringSnapshot(
				round(overall, 1),
				List.copyOf(sections),
				new ScoringSnapshot.Indices(round(criAdjusted, 3), round(reiAdjusted, 3), round(rfi, 3), funnel),
				flags,
				labels,
				drivers(norm, adjustments),
				MODEL_VERSION
		);
	}

	/**
	 * Section a check contributes to first, or {@code null} for checks that are not scored (accessibility,
	 * connect checks that are neither about the product nor about people).
	 */
	public static ScoringSection primarySection(CheckDefinition definition) {
		if (definition == null || definition.subCategory() == null) {
			return null;
		}
		String name = definition.name() == null ? "" : definition.name().toLowerCase(Locale.ROOT);
		return switch (definition.subCategory()) {
			case ATTRACT -> HOOK_ATTENTION;
			case BRAND -> BRAND_VISIBILITY;
			case DIRECT -> CTA;
			case PERSUASION -> SOCIAL_PROOF_TRUST;
			case STRUCTURE -> FUNNEL_ALIGNMENT;
			case CONNECT -> PRODUCT_KEYWORDS.stream().anyMatch(name::contains)
					? PRODUCT_CLARITY_BENEFITS
					: PEOPLE_KEYWORDS.stream().anyMatch(name::contains) ? SOCIAL_PROOF_TRUST : null;
			case ACCESSIBILITY -> null;
		};
	}

	/**
	 * Picks the strongest funnel stage; when the runner-up is within {@link ScoringRules#HYBRID_STAGE_THRESHOLD}
	 * the two-stage label (for example {@code TOF/MOF}) is reported as well.
	 */
	static ScoringSnapshot.FunnelStrength resolveFunnelStage(double tof, double mof, double bof) {
		List<Map.Entry<String, Double>> stages = new ArrayList<>(List.of(
				Map.entry("TOF", tof),
				Map.entry("MOF", mof),
				Map.entry("BOF", bof)
		));
		stages.sort(Map.Entry.<String, Double>comparingByValue().reversed());
		String winner = stages.get(0).getKey();
		String hybrid = null;
		if (Math.abs(stages.get(0).getValue() - stages.get(1).getValue()) < HYBRID_STAGE_THRESHOLD) {
			hybrid = stages.get(0).getKey() + "/" + stages.get(1).getKey();
		}
		return new ScoringSnapshot.FunnelStrength(round(tof, 3), round(mof, 3), round(bof, 3), winner, hybrid);
	}

	static double sectionScore(List<EvaluatedCheck> checks, double maxScore) {
		if (checks.isEmpty()) {
			return 0.0;
		}
		double perCheck = maxScore / checks.size();
		double total = 0.0;
		for (EvaluatedCheck check : checks) {
			if (check.detected()) {
				total += confidence(check.verdict()) * perCheck;
			}
		}
		return round(Math.min(total, maxScore), 2);
	}

	static double round(double value, int scale) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			return 0.0;
		}
		return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
	}

	private static ScoringSnapshot.Flags flags(Groups groups) {
		List<EvaluatedCheck> anchorScope = concat(groups.direct(), groups.abcd());
		boolean trackable = anyDetectedContains(anchorScope, TRACKABLE_KEYWORDS, Field.EVIDENCE)
				|| anyDetectedContains(groups.direct(), TRACKABLE_KEYWORDS, Field.RATIONALE);
		long brandDetected = groups.brand().stream().filter(EvaluatedCheck::detected).count();
		return new ScoringSnapshot.Flags(
				anyDetectedContains(groups.attract(), HOOK_KEYWORDS, Field.NAME),
				brandDetected >= BRAND_MENTION_THRESHOLD,
				trackable,
				anyDetectedContains(concat(groups.persuasion(), groups.people()), TESTIMONIAL_KEYWORDS, Field.NAME),
				anyDetectedContains(groups.product(), PRODUCT_DEMO_KEYWORDS, Field.NAME),
				anyDetectedContains(groups.direct(), END_CARD_KEYWORDS, Field.NAME)
		);
	}

	private static List<ScoringSnapshot.Adjustment> conversionAdjustments(ScoringSnapshot.Flags flags) {
		List<ScoringSnapshot.Adjustment> adjustments = new ArrayList<>();
		if (!flags.hookWithin3s()) {
			adjustments.add(penalty("conversion_readiness_index", "hook_within_3s", CRI_PENALTY_NO_HOOK));
		}
		if (!flags.hasTrackableAnchor()) {
			adjustments.add(penalty("conversion_readiness_index", "has_trackable_anchor", CRI_PENALTY_NO_ANCHOR));
		}
		if (!flags.productDemoPresent()) {
			adjustments.add(penalty("conversion_readiness_index", "product_demo_present", CRI_PENALTY_NO_DEMO));
		}
		if (!flags.hasTestimonialOrUgc()) {
			adjustments.add(penalty("conversion_readiness_index", "has_testimonial_or_ugc", CRI_PENALTY_NO_TESTIMONIAL));
		}
		return adjustments;
	}

	private static List<ScoringSnapshot.Adjustment> revenueAdjustments(ScoringSnapshot.Flags flags,
																	   Map<ScoringSection, Double> norm) {
		List<ScoringSnapshot.Adjustment> adjustments = new ArrayList<>();
		if (flags.hasTrackableAnchor()) {
			adjustments.add(boost("revenue_efficiency_index", "has_trackable_anchor", REI_BOOST_ANCHOR));
		}
		if (flags.brandMentions3x()) {
			adjustments.add(boost("revenue_efficiency_index", "brand_mentions_3x", REI_BOOST_BRAND_3X));
		}
		if (flags.endCardPresent()) {
			adjustments.add(boost("revenue_efficiency_index", "end_card_present", REI_BOOST_END_CARD));
		}
		if (norm.get(PRODUCT_CLARITY_BENEFITS) < REI_WEAK_PRODUCT_BELOW) {
			adjustments.add(penalty("revenue_efficiency_index", PRODUCT_CLARITY_BENEFITS.key(), REI_PENALTY_WEAK_PRODUCT));
		}
		if (norm.get(SOCIAL_PROOF_TRUST) < REI_WEAK_SOCIAL_BELOW) {
			adjustments.add(penalty("revenue_efficiency_index", SOCIAL_PROOF_TRUST.key(), REI_PENALTY_WEAK_SOCIAL));
		}
		return adjustments;
	}

	private static ScoringSnapshot.Drivers drivers(Map<ScoringSection, Double> norm,
												   List<ScoringSnapshot.Adjustment> adjustments) {
		List<ScoringSection> ranked = new ArrayList<>(List.of(ScoringSection.values()));
		// stable sort keeps declaration order for ties
		ranked.sort(Comparator.comparing((Function<ScoringSection, Double>) norm::get).reversed());
		List<ScoringSnapshot.Driver> positive = ranked.stream()
				.limit(DRIVER_COUNT)
				.filter(section -> norm.get(section) > DRIVER_MIDPOINT)
				.map(section -> driver(section, norm))
				.toList();
		List<ScoringSnapshot.Driver> negative = ranked.stream()
				.filter(section -> norm.get(section) < DRIVER_MIDPOINT)
				.limit(DRIVER_COUNT)
				.map(section -> driver(section, norm))
				.toList();
		return new ScoringSnapshot.Drivers(positive, negative, List.copyOf(adjustments));
	}

	private static ScoringSnapshot.Driver driver(ScoringSection section, Map<ScoringSection, Double> norm) {
		return new ScoringSnapshot.Driver(section.key(), section.label(), round(norm.get(section), 2));
	}

	private static ScoringSnapshot.Adjustment boost(String index, String key, double delta) {
		return new ScoringSnapshot.Adjustment("boost", index, key, delta);
	}

	private static ScoringSnapshot.Adjustment penalty(String index, String key, double delta) {
		return new ScoringSnapshot.Adjustment("penalty", index, key, -delta);
	}

	private static double sumDeltas(List<ScoringSnapshot.Adjustment> adjustments) {
		double total = 0.0;
		for (ScoringSnapshot.Adjustment adjustment : adjustments) {
			total += adjustment.delta();
		}
		return total;
	}

	private static double coverage(List<EvaluatedCheck> checks) {
		long detected = checks.stream().filter(EvaluatedCheck::detected).count();
		return (double) detected / Math.max(checks.size(), 1);
	}

	private static double confidence(CheckVerdict verdict) {
		Double value = verdict.confidence();
		// zero confidence on a detected check counts as unknown
		return value == null || value == 0.0 ? DEFAULT_CONFIDENCE : value;
	}

	private static double clamp(double value) {
		return Math.max(0.0, Math.min(1.0, value));
	}

	private static boolean anyDetectedContains(List<EvaluatedCheck> checks, List<String> keywords, Field field) {
		for (EvaluatedCheck check : checks) {
			if (!check.detected()) {
				continue;
			}
			String text = field.read(check);
			if (text == null) {
				continue;
			}
			String lower = text.toLowerCase(Locale.ROOT);
			for (String keyword : keywords) {
				if (lower.contains(keyword)) {
					return true;
				}
			}
		}
		return false;
	}

	private static List<EvaluatedCheck> concat(List<EvaluatedCheck> first, List<EvaluatedCheck> second) {
		List<EvaluatedCheck> combined = new ArrayList<>(first.size() + second.size());
		combined.addAll(first);
		combined.addAll(second);
		return combined;
	}

	private enum Field {
		NAME,
		EVIDENCE,
		RATIONALE;

		String read(EvaluatedCheck check) {
			return switch (this) {
				case NAME -> check.definition().name();
				case EVIDENCE -> check.verdict().evidence();
				case RATIONALE -> check.verdict().rationale();
			};
		}
	}

	private record Groups(
			List<EvaluatedCheck> attract,
			List<EvaluatedCheck> brand,
			List<EvaluatedCheck> connect,
			List<EvaluatedCheck> direct,
			List<EvaluatedCheck> persuasion,
			List<EvaluatedCheck> structure,
			List<EvaluatedCheck> product,
			List<EvaluatedCheck> people
	) {
		static Groups of(List<EvaluatedCheck> checks) {
			List<EvaluatedCheck> connect = bySubCategory(checks, SubCategory.CONNECT);
			return new Groups(
					bySubCategory(checks, SubCategory.ATTRACT),
					bySubCategory(checks, SubCategory.BRAND),
					connect,
					bySubCategory(checks, SubCategory.DIRECT),
					bySubCategory(checks, SubCategory.PERSUASION),
					bySubCategory(checks, SubCategory.STRUCTURE),
					nameContains(connect, PRODUCT_KEYWORDS),
					nameContains(connect, PEOPLE_KEYWORDS)
			);
		}

		List<EvaluatedCheck> abcd() {
			List<EvaluatedCheck> all = new ArrayList<>();
			all.addAll(attract);
			all.addAll(brand);
			all.addAll(connect);
			all.addAll(direct);
			return all;
		}

		private static List<EvaluatedCheck> bySubCategory(List<EvaluatedCheck> checks, SubCategory subCategory) {
			return checks.stream()
					.filter(check -> check.definition() != null && check.verdict() != null)
					.filter(check -> check.definition().subCategory() == subCategory)
					.toList();
		}

		private static List<EvaluatedCheck> nameContains(List<EvaluatedCheck> checks, List<String> keywords) {
			return checks.stream()
					.filter(check -> {
						String name = check.definition().name() == null ? "" : check.definition().name().toLowerCase(Locale.ROOT);
						return keywords.stream().anyMatch(name::contains);
					})
					.toList();
		}
	}
}
