package my.creativeaudit.app.scoring;

import my.creativeaudit.app.model.EvaluatedCheck;
import my.creativeaudit.app.model.TechnicalMetadata;
import my.creativeaudit.app.rubric.SubCategory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Rule-based fit of a creative for each ad placement. Like {@link ScoringEngine} it is a pure function of the
 * evaluated checks and the technical metadata.
 */
@Service
public class PlatformFitEngine {
	public static final int MAX_TIPS = 3;

	static final List<String> HOOK_KEYWORDS = List.of("dynamic start", "hook", "supers");
	static final List<String> CTA_KEYWORDS = List.of("call to action", "offer", "text", "url");
	static final List<String> BRAND_KEYWORDS = List.of("brand", "logo");
	static final List<String> CAPTION_KEYWORDS = List.of("captions", "subtitles");
	static final List<String> AUDIO_KEYWORDS = List.of("audio independence");
	static final List<String> READABILITY_KEYWORDS = List.of("text contrast", "readability");

	private static final Set<SubCategory> ABCD = EnumSet.of(SubCategory.ATTRACT, SubCategory.BRAND,
			SubCategory.CONNECT, SubCategory.DIRECT);

	public List<PlatformScore> fit(List<EvaluatedCheck> checks,
								   TechnicalMetadata metadata,
								   Double durationSeconds,
								   int sceneCount) {
		Signals signals = Signals.of(checks == null ? List.of() : checks, metadata, durationSeconds, sceneCount);
		List<PlatformScore> scores = new ArrayList<>();
		for (Platform platform : Platform.values()) {
			scores.add(score(platform, signals));
		}
		return List.copyOf(scores);
	}

	static PlatformScore score(Platform platform, Signals signals) {
		Tally tally = new Tally(platform.baseline());
		switch (platform) {
			case YOUTUBE -> youtube(signals, tally);
			case META_FEED -> metaFeed(signals, tally);
			case META_REELS -> metaReels(signals, tally);
			case TIKTOK -> tiktok(signals, tally);
			case CTV -> ctv(signals, tally);
		}
		return new PlatformScore(platform.key(), Math.max(0, Math.min(100, tally.score)),
				tally.tips.subList(0, Math.min(MAX_TIPS, tally.tips.size())));
	}

	private static void youtube(Signals s, Tally t) {
		if (s.durationSeconds() < 6) {
			t.add(-15, "Video is very short for YouTube pre-roll. Aim for 15-60 seconds.");
		} else if (s.durationSeconds() < 15) {
			t.add(-5, "Consider extending to at least 15 seconds for full pre-roll impact.");
		} else if (s.durationSeconds() > 180) {
			t.add(-10, "Long-form (over 3 min) may lose viewers. Consider a :30-:60 cutdown.");
		}
		if (s.aspectRatio() != null) {
			double ar = s.aspectRatio();
			if (ar >= 1.6 && ar <= 1.9) {
				t.add(10);
			} else if (ar >= 0.9 && ar <= 1.1) {
				t.tip("Square (1:1) works but 16:9 is optimal for YouTube.");
			} else if (ar < 0.7) {
				t.add(-5, "Vertical video loses impact on YouTube. Use 16:9 landscape.");
			}
		}
		t.either(s.hookFast(), 5, "Add a strong hook in the first 5 seconds; viewers can skip after 5s.");
		t.either(s.hasCta(), 5, "Include a clear CTA (end card, overlay, or verbal) to drive action.");
		t.either(s.brandEarly(), 5, "Show your brand or logo in the first 5 seconds for skippable ads.");
		if (s.captions()) {
			t.add(5);
		}
	}

	private static void metaFeed(Signals s, Tally t) {
		if (s.durationSeconds() > 60) {
			t.add(-10, "Trim to 15-30 seconds for Feed. Shorter videos get higher completion rates.");
		} else if (s.durationSeconds() > 30) {
			t.add(-5, "Consider a :15-:30 edit for better Feed performance.");
		}
		if (s.aspectRatio() != null) {
			double ar = s.aspectRatio();
			if (ar >= 0.75 && ar <= 1.1) {
				t.add(10);
			} else if (ar < 0.65) {
				t.add(5);
			} else if (ar > 1.5) {
				t.add(-10, "Use square (1:1) or 4:5 vertical for Feed. Landscape loses real estate.");
			}
		}
		if (s.audioIndependent()) {
			t.add(10);
		} else {
			t.add(-10, "Most Feed viewers watch with sound off. Add text overlays so the message works visually.");
		}
		if (s.captions()) {
			t.add(10);
		} else {
			t.add(-5, "Add captions; Feed autoplay is muted.");
		}
		t.either(s.hookFast(), 5, "Hook viewers in the first 3 seconds; Feed scrolling is fast.");
		if (s.hasCta()) {
			t.add(5);
		}
	}

	private static void metaReels(Signals s, Tally t) {
		if (s.durationSeconds() > 60) {
			t.add(-15, "Reels perform best at 15-30 seconds. Trim aggressively.");
		} else if (s.durationSeconds() > 30) {
			t.add(-5);
		}
		if (s.aspectRatio() != null) {
			double ar = s.aspectRatio();
			if (ar < 0.65) {
				t.add(15);
			} else if (ar >= 0.75 && ar <= 1.1) {
				t.tip("Reels are 9:16 vertical. Crop to vertical for maximum screen coverage.");
			} else if (ar > 1.3) {
				t.add(-15, "Landscape video is heavily penalized on Reels. Re-crop to 9:16.");
			}
		}
		t.either(s.pacingFast(), 5, "Increase pacing; Reels reward quick cuts and dynamic movement.");
		if (s.archetypeContains("ugc")) {
			t.add(10);
		} else if (s.archetypeContains("demo")) {
			t.add(5);
		}
		if (s.captions()) {
			t.add(5);
		}
		t.either(s.hookFast(), 5, "Open with motion, text, or a face in the first 1-2 seconds.");
		if (s.audioIndependent()) {
			t.add(5);
		}
	}

	private static void tiktok(Signals s, Tally t) {
		if (s.durationSeconds() <= 15) {
			t.add(10);
		} else if (s.durationSeconds() <= 30) {
			t.add(5);
		} else if (s.durationSeconds() > 60) {
			t.add(-15, "TikTok ads perform best at 9-15 seconds. Cut to a :15 version.");
		} else {
			t.add(-5, "Trim to under 30 seconds for better TikTok completion rates.");
		}
		if (s.aspectRatio() != null) {
			double ar = s.aspectRatio();
			if (ar < 0.65) {
				t.add(15);
			} else if (ar >= 0.75 && ar <= 1.1) {
				t.tip("Re-crop to 9:16 vertical. TikTok is a vertical-first platform.");
			} else if (ar > 1.3) {
				t.add(-15, "Landscape format does not work on TikTok. Convert to 9:16.");
			}
		}
		if (s.hookFast()) {
			t.add(10);
		} else {
			t.add(-5, "Open with a hook in the first second: text, a question, or an unexpected visual.");
		}
		if (s.pacingFast()) {
			t.add(5);
		}
		if (s.archetypeContains("ugc")) {
			t.add(10);
		} else if (s.archetypeContains("demo") || s.archetypeContains("problem-solution")
				|| s.archetypeContains("before-after")) {
			t.add(5);
		}
		if (s.captions()) {
			t.add(5);
		}
	}

	private static void ctv(Signals s, Tally t) {
		if (s.durationSeconds() >= 13 && s.durationSeconds() <= 32) {
			t.add(10);
		} else if (s.durationSeconds() < 10) {
			t.add(-10, "CTV slots are typically :15 or :30. Extend your creative.");
		} else if (s.durationSeconds() > 60) {
			t.add(-10, "CTV ads should be :15 or :30. Create a broadcast-length cutdown.");
		}
		if (s.aspectRatio() != null) {
			double ar = s.aspectRatio();
			if (ar >= 1.6 && ar <= 1.9) {
				t.add(10);
			} else {
				t.add(-15, "CTV requires 16:9 landscape. Re-crop from vertical or square.");
			}
		}
		t.either(s.brandEarly(), 5, "Brand recall on CTV still requires early logo placement.");
		if (s.hasCta()) {
			t.add(5);
		}
		if (s.pacingFast()) {
			t.add(-5, "Slow pacing slightly for CTV; viewers are in lean-back mode.");
		}
		t.either(s.textReadable(), 5, "Ensure text is large and high-contrast for viewing from 10+ feet on TV screens.");
	}

	record Signals(
			double durationSeconds,
			Double aspectRatio,
			int sceneCount,
			boolean hookFast,
			boolean hasCta,
			boolean brandEarly,
			boolean captions,
			boolean audioIndependent,
			boolean textReadable,
			boolean pacingFast,
			String archetype
	) {
		static Signals of(List<EvaluatedCheck> checks, TechnicalMetadata metadata, Double durationSeconds, int sceneCount) {
			double duration = durationSeconds == null || durationSeconds.isNaN() ? 0.0 : durationSeconds;
			List<EvaluatedCheck> abcd = checks.stream()
					.filter(check -> ABCD.contains(check.definition().subCategory()))
					.toList();
			List<EvaluatedCheck> accessibility = checks.stream()
					.filter(check -> check.definition().accessibility())
					.toList();
			String archetype = checks.stream()
					.filter(check -> check.definition().subCategory() == SubCategory.STRUCTURE)
					.map(check -> check.verdict() == null ? null : check.verdict().evidence())
					.findFirst()
					.orElse(null);
			// more than one scene per five seconds
			boolean pacingFast = duration > 0 && sceneCount / Math.max(duration, 1.0) * 5 > 1.0;
			return new Signals(
					duration,
					aspectRatio(metadata),
					sceneCount,
					anyDetected(abcd, HOOK_KEYWORDS),
					anyDetected(abcd, CTA_KEYWORDS),
					anyDetected(abcd, BRAND_KEYWORDS),
					anyDetected(accessibility, CAPTION_KEYWORDS),
					anyDetected(accessibility, AUDIO_KEYWORDS),
					anyDetected(accessibility, READABILITY_KEYWORDS),
					pacingFast,
					archetype == null ? "" : archetype
			);
		}

		boolean archetypeContains(String keyword) {
			return archetype.toLowerCase(Locale.ROOT).contains(keyword);
		}

		private static Double aspectRatio(TechnicalMetadata metadata) {
			if (metadata == null || metadata.width() == null || metadata.height() == null || metadata.height() <= 0) {
				return null;
			}
			return metadata.width() / (double) metadata.height();
		}

		private static boolean anyDetected(List<EvaluatedCheck> checks, List<String> keywords) {
			for (EvaluatedCheck check : checks) {
				if (!check.detected() || check.definition().name() == null) {
					continue;
				}
				String name = check.definition().name().toLowerCase(Locale.ROOT);
				if (keywords.stream().anyMatch(name::contains)) {
					return true;
				}
			}
			return false;
		}
	}

	private static final class Tally {
		private int score;
		private final List<String> tips = new ArrayList<>();

		private Tally(int baseline) {
			this.score = baseline;
		}

		void add(int delta) {
			score += delta;
		}

		void add(int delta, String tip) {
			score += delta;
			tips.add(tip);
		}

		void tip(String tip) {
			tips.add(tip);
		}

		void either(boolean present, int bonus, String tipWhenMissing) {
			if (present) {
				score += bonus;
			} else {
				tips.add(tipWhenMissing);
			}
		}
	}
}
