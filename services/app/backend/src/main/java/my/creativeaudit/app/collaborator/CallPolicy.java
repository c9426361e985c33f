package my.creativeaudit.app.collaborator;

import my.creativeaudit.app.config.AppProperties;

import java.time.Duration;

public record CallPolicy(
		Duration timeout,
		int maxRetries,
		long baseBackoffMillis
) {
	public static CallPolicy of(AppProperties.Endpoint endpoint) {
		if (endpoint == null) {
			return new CallPolicy(Duration.ofSeconds(120), 1, 500L);
		}
		return new CallPolicy(endpoint.callTimeout(), endpoint.maxRetriesOrDefault(), endpoint.baseBackoffMillisOrDefault());
	}
}
