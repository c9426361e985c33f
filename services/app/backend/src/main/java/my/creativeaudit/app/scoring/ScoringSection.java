package my.creativeaudit.app.scoring;

/**
 * The nine scored sections in declaration order, which is also the tie-break order for driver ranking.
 */
public enum ScoringSection {
	HOOK_ATTENTION("hook_attention", "Hook & Attention", 15),
	BRAND_VISIBILITY("brand_visibility", "Brand Visibility", 10),
	SOCIAL_PROOF_TRUST("social_proof_trust", "Social Proof & Trust", 15),
	PRODUCT_CLARITY_BENEFITS("product_clarity_benefits", "Product Clarity", 15),
	FUNNEL_ALIGNMENT("funnel_alignment", "Funnel Alignment", 10),
	CTA("cta", "Call to Action", 10),
	CREATIVE_DIVERSITY_READINESS("creative_diversity_readiness", "Creative Diversity", 10),
	MEASUREMENT_COMPATIBILITY("measurement_compatibility", "Measurement Readiness", 10),
	DATA_AUDIENCE_LEVERAGE("data_audience_leverage", "Audience Leverage", 5);

	private final String key;
	private final String label;
	private final double maxScore;

	ScoringSection(String key, String label, double maxScore) {
		this.key = key;
		this.label = label;
		this.maxScore = maxScore;
	}

	public String key() {
		return key;
	}

	public String label() {
		return label;
	}

	public double maxScore() {
		return maxScore;
	}
}
