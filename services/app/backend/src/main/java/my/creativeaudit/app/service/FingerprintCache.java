package my.creativeaudit.app.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import my.creativeaudit.app.config.AppProperties;
import my.creativeaudit.app.model.EvaluationReport;
import my.creativeaudit.app.rubric.CheckSet;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * In-process report cache keyed by (canonical media reference, requested check-sets). Concurrent misses for the same
 * key both run; the last store wins.
 */
@Component
public class FingerprintCache {
	private static final int DEFAULT_MAX_ENTRIES = 500;
	private static final int DEFAULT_TTL_MINUTES = 360;

	private final Cache<String, EvaluationReport> cache;

	@Autowired
	public FingerprintCache(AppProperties properties) {
		this(maxEntries(properties), ttl(properties));
	}

	FingerprintCache(long maxEntries, Duration ttl) {
		this.cache = Caffeine.newBuilder()
				.maximumSize(maxEntries)
				.expireAfterWrite(ttl)
				.build();
	}

	public Optional<EvaluationReport> lookup(String fingerprint) {
		return Optional.ofNullable(cache.getIfPresent(fingerprint));
	}

	public void store(String fingerprint, EvaluationReport report) {
		cache.put(fingerprint, report);
	}

	public void invalidateAll() {
		cache.invalidateAll();
	}

	public static String fingerprint(String mediaUri, Set<CheckSet> checkSets) {
		String material = canonical(mediaUri) + "|" + CheckSet.joinSorted(checkSets);
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
		} catch (NoSuchAlgorithmException ex) {
			throw new IllegalStateException("SHA-256 not available", ex);
		}
	}

	static String canonical(String mediaUri) {
		if (mediaUri == null) {
			return "";
		}
		String trimmed = mediaUri.trim();
		while (trimmed.endsWith("/") && trimmed.length() > 1) {
			trimmed = trimmed.substring(0, trimmed.length() - 1);
		}
		int schemeEnd = trimmed.indexOf("://");
		if (schemeEnd <= 0) {
			return trimmed;
		}
		try {
			URI uri = URI.create(trimmed);
			if (uri.getScheme() == null || uri.getRawAuthority() == null) {
				return trimmed;
			}
			String rest = trimmed.substring(schemeEnd + 3 + uri.getRawAuthority().length());
			return uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getRawAuthority().toLowerCase(Locale.ROOT) + rest;
		} catch (IllegalArgumentException ex) {
			return trimmed;
		}
	}

	private static long maxEntries(AppProperties properties) {
		AppProperties.Evaluation.Cache config = properties.evaluation().cache();
		return config == null || config.maxEntries() == null || config.maxEntries() <= 0
				? DEFAULT_MAX_ENTRIES
				: config.maxEntries();
	}

	private static Duration ttl(AppProperties properties) {
		AppProperties.Evaluation.Cache config = properties.evaluation().cache();
		return Duration.ofMinutes(config == null || config.ttlMinutes() == null || config.ttlMinutes() <= 0
				? DEFAULT_TTL_MINUTES
				: config.ttlMinutes());
	}
}
