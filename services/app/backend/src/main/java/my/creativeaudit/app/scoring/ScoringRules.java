package my.creativeaudit.app.scoring;

import java.util.List;

/**
 * Calibrated constants of the deterministic scoring model. Changing any value changes the model version.
 */
public final class ScoringRules {
	public static final String MODEL_VERSION = "deterministic-rules.v1";

	public static final double DEFAULT_CONFIDENCE = 0.5;

	public static final List<String> PRODUCT_KEYWORDS = List.of("product");
	public static final List<String> PEOPLE_KEYWORDS = List.of("people", "face", "person", "presence");
	public static final List<String> HOOK_KEYWORDS = List.of("dynamic start");
	public static final List<String> MEASUREMENT_KEYWORDS = List.of("url", "qr", "link", "code", "shop", "visit");
	public static final List<String> TRACKABLE_KEYWORDS = List.of("url", "qr", "link", "code", "shop", "offer");
	public static final List<String> TESTIMONIAL_KEYWORDS = List.of("testimonial", "ugc", "user-generated", "review", "creator");
	public static final List<String> PRODUCT_DEMO_KEYWORDS = List.of("product visuals");
	public static final List<String> END_CARD_KEYWORDS = List.of("text", "call to action");
	public static final int BRAND_MENTION_THRESHOLD = 3;

	// creative diversity / measurement blends
	public static final double DIVERSITY_SECTION_WEIGHT = 0.6;
	public static final double DIVERSITY_COVERAGE_POINTS = 4.0;
	public static final double MEASUREMENT_CTA_MAX = 7.0;
	public static final double MEASUREMENT_KEYWORD_POINTS = 3.0;

	// conversion readiness index
	public static final double CRI_HOOK = 0.22;
	public static final double CRI_PRODUCT = 0.18;
	public static final double CRI_CTA = 0.18;
	public static final double CRI_SOCIAL = 0.14;
	public static final double CRI_BRAND = 0.12;
	public static final double CRI_FUNNEL = 0.10;
	public static final double CRI_MEASUREMENT = 0.06;
	public static final double CRI_PENALTY_NO_HOOK = 0.10;
	public static final double CRI_PENALTY_NO_ANCHOR = 0.10;
	public static final double CRI_PENALTY_NO_DEMO = 0.07;
	public static final double CRI_PENALTY_NO_TESTIMONIAL = 0.05;
	public static final double CPA_RISK_LOW = 0.72;
	public static final double CPA_RISK_MEDIUM = 0.52;

	// revenue efficiency index
	public static final double REI_PRODUCT = 0.24;
	public static final double REI_SOCIAL = 0.18;
	public static final double REI_BRAND = 0.14;
	public static final double REI_FUNNEL = 0.12;
	public static final double REI_HOOK = 0.12;
	public static final double REI_CTA = 0.10;
	public static final double REI_DIVERSITY = 0.10;
	public static final double REI_BOOST_ANCHOR = 0.05;
	public static final double REI_BOOST_BRAND_3X = 0.03;
	public static final double REI_BOOST_END_CARD = 0.02;
	public static final double REI_PENALTY_WEAK_PRODUCT = 0.07;
	public static final double REI_PENALTY_WEAK_SOCIAL = 0.05;
	public static final double REI_WEAK_PRODUCT_BELOW = 0.45;
	public static final double REI_WEAK_SOCIAL_BELOW = 0.40;
	public static final double ROAS_HIGH = 0.70;
	public static final double ROAS_MODERATE = 0.50;

	// refreshability index
	public static final double RFI_DIVERSITY = 0.55;
	public static final double RFI_HOOK = 0.25;
	public static final double RFI_MEASUREMENT = 0.20;
	public static final double FATIGUE_LOW = 0.70;
	public static final double FATIGUE_MEDIUM = 0.50;

	// funnel strength
	public static final double TOF_HOOK = 0.35;
	public static final double TOF_BRAND = 0.25;
	public static final double TOF_SOCIAL = 0.20;
	public static final double TOF_STORY = 0.20;
	public static final double MOF_SOCIAL = 0.25;
	public static final double MOF_PRODUCT = 0.25;
	public static final double MOF_BRAND = 0.20;
	public static final double MOF_HOOK = 0.15;
	public static final double MOF_CTA = 0.15;
	public static final double BOF_CTA = 0.30;
	public static final double BOF_PRODUCT = 0.25;
	public static final double BOF_SOCIAL = 0.20;
	public static final double BOF_MEASUREMENT = 0.15;
	public static final double BOF_FUNNEL = 0.10;
	public static final double HYBRID_STAGE_THRESHOLD = 0.05;

	public static final int DRIVER_COUNT = 3;
	public static final double DRIVER_MIDPOINT = 0.5;

	private ScoringRules() {
	}
}
