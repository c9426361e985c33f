package my.creativeaudit.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Locale;

/**
 * Submitted video asset. {@code uri} is either a storage locator ({@code gs://}, {@code s3://}) or a public URL.
 */
public record MediaRef(
		String uri,
		Double declaredDurationSeconds,
		String brandName
) {
	@JsonIgnore
	public boolean isStorageLocator() {
		if (uri == null) {
			return false;
		}
		String lower = uri.trim().toLowerCase(Locale.ROOT);
		return lower.startsWith("gs://") || lower.startsWith("s3://");
	}

	public MediaRef withUri(String replacement) {
		return new MediaRef(replacement, declaredDurationSeconds, brandName);
	}
}
