package my.creativeaudit.app.service;

import my.creativeaudit.app.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Checks the {@code Payment-Signature: t=<unix seconds>,v1=<hex>} header of inbound payment events. The signature
 * is HMAC-SHA256 over {@code <t>.<raw body>} with the shared webhook secret.
 */
@Component
public class WebhookSignatureVerifier {
	private static final Logger logger = LoggerFactory.getLogger(WebhookSignatureVerifier.class);
	public static final String HEADER = "Payment-Signature";
	static final Duration TOLERANCE = Duration.ofMinutes(5);

	private final String secret;
	private final Clock clock;

	@Autowired
	public WebhookSignatureVerifier(AppProperties properties) {
		this(properties.billing().webhookSecret(), Clock.systemUTC());
	}

	WebhookSignatureVerifier(String secret, Clock clock) {
		this.secret = secret;
		this.clock = clock;
	}

	public boolean verify(String payload, String header) {
		if (secret == null || secret.isBlank()) {
			logger.warn("Payment webhook secret not configured; rejecting event.");
			return false;
		}
		if (header == null || header.isBlank() || payload == null) {
			return false;
		}
		String timestamp = null;
		String signature = null;
		for (String part : header.split(",")) {
			String[] pair = part.trim().split("=", 2);
			if (pair.length != 2) {
				continue;
			}
			if ("t".equals(pair[0])) {
				timestamp = pair[1];
			} else if ("v1".equals(pair[0]) && signature == null) {
				signature = pair[1];
			}
		}
		if (timestamp == null || signature == null) {
			return false;
		}
		long seconds;
		try {
			seconds = Long.parseLong(timestamp);
		} catch (NumberFormatException ex) {
			return false;
		}
		long age = Math.abs(clock.instant().getEpochSecond() - seconds);
		if (age > TOLERANCE.getSeconds()) {
			logger.warn("Payment webhook signature outside tolerance ({}s old)", age);
			return false;
		}
		byte[] expected = sign(secret, timestamp + "." + payload).getBytes(StandardCharsets.UTF_8);
		return MessageDigest.isEqual(expected, signature.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
	}

	public static String sign(String secret, String content) {
		try {
			Mac mac = Mac.getInstance("HmacSHA256");
			mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
			return HexFormat.of().formatHex(mac.doFinal(content.getBytes(StandardCharsets.UTF_8)));
		} catch (GeneralSecurityException ex) {
			throw new IllegalStateException("HmacSHA256 not available", ex);
		}
	}
}
