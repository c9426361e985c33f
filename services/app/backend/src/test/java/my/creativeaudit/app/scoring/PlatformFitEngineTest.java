package my.creativeaudit.app.scoring;

import my.creativeaudit.app.model.CheckVerdict;
import my.creativeaudit.app.model.EvaluatedCheck;
import my.creativeaudit.app.model.TechnicalMetadata;
import my.creativeaudit.app.rubric.CheckDefinition;
import my.creativeaudit.app.rubric.CheckSet;
import my.creativeaudit.app.rubric.EvaluationMethod;
import my.creativeaudit.app.rubric.SubCategory;
import my.creativeaudit.app.rubric.VideoSegment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PlatformFitEngineTest {
	private final PlatformFitEngine engine = new PlatformFitEngine();

	@Test
	void everyPlatformIsScoredInAFixedOrder() {
		List<PlatformScore> scores = engine.fit(List.of(), null, null, 0);

		assertThat(scores).extracting(PlatformScore::platform)
				.containsExactly("youtube", "meta_feed", "meta_reels", "tiktok", "ctv");
		assertThat(scores).allSatisfy(score -> {
			assertThat(score.score()).isBetween(0, 100);
			assertThat(score.tips()).hasSizeLessThanOrEqualTo(PlatformFitEngine.MAX_TIPS);
		});
	}

	@Test
	void signalsComeFromDetectedCheckNamesAndMetadata() {
		List<EvaluatedCheck> checks = List.of(
				check("a1", "Dynamic Start", SubCategory.ATTRACT, true, null),
				check("d1", "Call to Action (Text)", SubCategory.DIRECT, false, null),
				check("acc1", "Captions / Subtitles Present", SubCategory.ACCESSIBILITY, true, null),
				check("acc2", "Audio Independence", SubCategory.ACCESSIBILITY, false, null),
				check("s1", "Creative Structure", SubCategory.STRUCTURE, true, "UGC testimonial"));

		PlatformFitEngine.Signals signals = PlatformFitEngine.Signals.of(checks,
				new TechnicalMetadata(15.0, 1080, 1920, 30.0, "h264", 4_000_000L), 15.0, 4);

		assertThat(signals.hookFast()).isTrue();
		assertThat(signals.hasCta()).isFalse();
		assertThat(signals.brandEarly()).isFalse();
		assertThat(signals.captions()).isTrue();
		assertThat(signals.audioIndependent()).isFalse();
		assertThat(signals.aspectRatio()).isEqualTo(0.5625);
		assertThat(signals.pacingFast()).isTrue();
		assertThat(signals.archetypeContains("ugc")).isTrue();
	}

	@Test
	void verticalUgcShortIsCappedAtOneHundredOnTikTok() {
		PlatformScore score = PlatformFitEngine.score(Platform.TIKTOK,
				signals(15.0, 0.5625, true, false, false, true, true, "ugc testimonial"));

		assertThat(score.score()).isEqualTo(100);
		assertThat(score.tips()).isEmpty();
	}

	@Test
	void verticalCreativeIsPenalizedOnCtv() {
		PlatformScore score = PlatformFitEngine.score(Platform.CTV,
				signals(20.0, 0.5625, false, false, false, false, false, ""));

		assertThat(score.score()).isEqualTo(65);
		assertThat(score.tips()).containsExactly(
				"CTV requires 16:9 landscape. Re-crop from vertical or square.",
				"Brand recall on CTV still requires early logo placement.",
				"Ensure text is large and high-contrast for viewing from 10+ feet on TV screens.");
	}

	@Test
	void tipsAreCappedButEveryPenaltyCounts() {
		PlatformScore score = PlatformFitEngine.score(Platform.YOUTUBE,
				signals(4.0, null, false, false, false, false, false, ""));

		assertThat(score.score()).isEqualTo(55);
		assertThat(score.tips()).hasSize(PlatformFitEngine.MAX_TIPS);
		assertThat(score.tips().get(0)).startsWith("Video is very short");
	}

	private static PlatformFitEngine.Signals signals(double duration, Double aspectRatio, boolean hook, boolean cta,
													 boolean brand, boolean captions, boolean pacingFast, String archetype) {
		return new PlatformFitEngine.Signals(duration, aspectRatio, 0, hook, cta, brand, captions, false, false,
				pacingFast, archetype);
	}

	private static EvaluatedCheck check(String id, String name, SubCategory subCategory, boolean detected, String evidence) {
		CheckDefinition definition = new CheckDefinition(id, name, CheckSet.CREATIVE_INTELLIGENCE, subCategory,
				VideoSegment.FULL_VIDEO, EvaluationMethod.LLMS, "criteria of " + name, List.of());
		return new EvaluatedCheck(definition, new CheckVerdict(id, detected, 0.9, null, evidence, null));
	}
}
