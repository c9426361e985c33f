package my.creativeaudit.app.scoring;

import java.util.Locale;

public enum Platform {
	YOUTUBE(70),
	META_FEED(65),
	META_REELS(60),
	TIKTOK(55),
	CTV(70);

	private final int baseline;

	Platform(int baseline) {
		this.baseline = baseline;
	}

	public int baseline() {
		return baseline;
	}

	public String key() {
		return name().toLowerCase(Locale.ROOT);
	}
}
