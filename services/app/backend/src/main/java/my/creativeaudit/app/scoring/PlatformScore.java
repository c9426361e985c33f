package my.creativeaudit.app.scoring;

import java.util.List;

/**
 * Fit of the creative for one placement, 0 to 100, with at most {@link PlatformFitEngine#MAX_TIPS} tips.
 */
public record PlatformScore(
		String platform,
		int score,
		List<String> tips
) {
	public PlatformScore {
		tips = tips == null ? List.of() : List.copyOf(tips);
	}
}
