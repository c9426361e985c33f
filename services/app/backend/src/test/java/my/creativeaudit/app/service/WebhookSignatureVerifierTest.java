package my.creativeaudit.app.service;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookSignatureVerifierTest {
	private static final String SECRET = "whsec_test";
	private static final long NOW = 1_760_000_000L;
	private static final String PAYLOAD = "{\"id\":\"evt_1\",\"type\":\"checkout.session.completed\"}";

	private final WebhookSignatureVerifier verifier =
			new WebhookSignatureVerifier(SECRET, Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC));

	@Test
	void acceptsFreshValidSignature() {
		assertThat(verifier.verify(PAYLOAD, header(NOW, PAYLOAD))).isTrue();
	}

	@Test
	void acceptsUpperCaseHex() {
		String signature = WebhookSignatureVerifier.sign(SECRET, NOW + "." + PAYLOAD).toUpperCase(Locale.ROOT);

		assertThat(verifier.verify(PAYLOAD, "t=" + NOW + ",v1=" + signature)).isTrue();
	}

	@Test
	void rejectsTamperedPayload() {
		assertThat(verifier.verify(PAYLOAD.replace("evt_1", "evt_2"), header(NOW, PAYLOAD))).isFalse();
	}

	@Test
	void rejectsStaleTimestamp() {
		long old = NOW - 600;

		assertThat(verifier.verify(PAYLOAD, header(old, PAYLOAD))).isFalse();
	}

	@Test
	void rejectsMalformedHeaders() {
		assertThat(verifier.verify(PAYLOAD, null)).isFalse();
		assertThat(verifier.verify(PAYLOAD, "")).isFalse();
		assertThat(verifier.verify(PAYLOAD, "v1=abc")).isFalse();
		assertThat(verifier.verify(PAYLOAD, "t=soon,v1=abc")).isFalse();
	}

	@Test
	void rejectsEverythingWithoutSecret() {
		WebhookSignatureVerifier unconfigured =
				new WebhookSignatureVerifier("", Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC));

		assertThat(unconfigured.verify(PAYLOAD, header(NOW, PAYLOAD))).isFalse();
	}

	private static String header(long timestamp, String payload) {
		return "t=" + timestamp + ",v1=" + WebhookSignatureVerifier.sign(SECRET, timestamp + "." + payload);
	}
}
