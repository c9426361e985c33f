package my.creativeaudit.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@NotNull @Valid Jwt jwt,
		@NotNull @Valid Evaluation evaluation,
		@NotNull Collaborators collaborators,
		@NotNull Billing billing,
		Database database
) {
	public Database databaseOrDefault() {
		return database == null ? new Database(null, null, null, null) : database;
	}

	public record Jwt(
			String secret,
			@NotBlank String issuer
	) {
	}

	public record Evaluation(
			Integer tokensPerSecond,
			Integer maxVideoSeconds,
			Integer jobTimeoutSeconds,
			Integer staleGraceSeconds,
			Integer maxConcurrentJobs,
			Integer analysisParallelism,
			Integer postprocessingParallelism,
			Cache cache
	) {
		public int tokensPerSecondOrDefault() {
			return tokensPerSecond == null || tokensPerSecond <= 0 ? 10 : tokensPerSecond;
		}

		public int maxVideoSecondsOrDefault() {
			return maxVideoSeconds == null || maxVideoSeconds <= 0 ? 60 : maxVideoSeconds;
		}

		public Duration jobTimeout() {
			return Duration.ofSeconds(jobTimeoutSeconds == null || jobTimeoutSeconds <= 0 ? 300 : jobTimeoutSeconds);
		}

		public Duration staleGrace() {
			return Duration.ofSeconds(staleGraceSeconds == null || staleGraceSeconds < 0 ? 120 : staleGraceSeconds);
		}

		public int maxConcurrentJobsOrDefault() {
			return maxConcurrentJobs == null || maxConcurrentJobs <= 0 ? 8 : maxConcurrentJobs;
		}

		public int analysisParallelismOrDefault() {
			return analysisParallelism == null || analysisParallelism <= 0 ? 3 : Math.min(3, analysisParallelism);
		}

		public int postprocessingParallelismOrDefault() {
			return postprocessingParallelism == null || postprocessingParallelism <= 0 ? 4 : postprocessingParallelism;
		}

		public record Cache(
				Integer maxEntries,
				Integer ttlMinutes
		) {
		}
	}

	public record Collaborators(
			Endpoint contentUnderstanding,
			Endpoint annotation,
			Endpoint storage,
			Endpoint warehouse,
			Chat chat,
			Media media
	) {
	}

	public record Endpoint(
			String provider,
			String baseUrl,
			String apiKey,
			String model,
			String table,
			Integer connectTimeoutSeconds,
			Integer readTimeoutSeconds,
			Integer callTimeoutSeconds,
			Integer maxRetries,
			Integer baseBackoffMillis
	) {
		public Duration callTimeout() {
			return Duration.ofSeconds(callTimeoutSeconds == null || callTimeoutSeconds <= 0 ? 120 : callTimeoutSeconds);
		}

		public int maxRetriesOrDefault() {
			return maxRetries == null || maxRetries <= 0 ? 1 : maxRetries;
		}

		public long baseBackoffMillisOrDefault() {
			return baseBackoffMillis == null || baseBackoffMillis <= 0 ? 500L : baseBackoffMillis;
		}
	}

	public record Chat(
			String provider,
			String webhookUrl
	) {
	}

	public record Media(
			String provider,
			String ffmpegPath,
			String ffprobePath,
			Integer callTimeoutSeconds
	) {
	}

	public record Database(
			String changeLog,
			Integer startupTimeoutSeconds,
			Integer startupIntervalSeconds,
			Boolean migrate
	) {
		public String changeLogOrDefault() {
			return changeLog == null || changeLog.isBlank() ? "classpath:db/changelog/db.changelog-master.yaml" : changeLog;
		}

		public int startupTimeoutSecondsOrDefault() {
			return startupTimeoutSeconds == null || startupTimeoutSeconds <= 0 ? 60 : startupTimeoutSeconds;
		}

		public int startupIntervalSecondsOrDefault() {
			return startupIntervalSeconds == null || startupIntervalSeconds <= 0 ? 5 : startupIntervalSeconds;
		}

		public boolean migrateOrDefault() {
			return migrate == null || migrate;
		}
	}

	public record Billing(
			String provider,
			String baseUrl,
			String apiKey,
			String webhookSecret,
			String publicBaseUrl,
			Map<String, Pack> packs
	) {
		public record Pack(
				int usd,
				int tokens,
				String priceId
		) {
		}
	}
}
