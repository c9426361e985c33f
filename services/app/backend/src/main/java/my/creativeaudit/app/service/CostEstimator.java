package my.creativeaudit.app.service;

import my.creativeaudit.app.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Token pricing: one charge unit per started second, capped at the maximum billable length.
 */
@Component
public class CostEstimator {
	private final int tokensPerSecond;
	private final int maxVideoSeconds;

	@Autowired
	public CostEstimator(AppProperties properties) {
		this(properties.evaluation().tokensPerSecondOrDefault(), properties.evaluation().maxVideoSecondsOrDefault());
	}

	CostEstimator(int tokensPerSecond, int maxVideoSeconds) {
		this.tokensPerSecond = tokensPerSecond;
		this.maxVideoSeconds = maxVideoSeconds;
	}

	public long estimate(Double durationSeconds) {
		if (durationSeconds == null || durationSeconds.isNaN() || durationSeconds <= 0) {
			return maximum();
		}
		double billable = Math.min(durationSeconds, maxVideoSeconds);
		return (long) Math.ceil(billable) * tokensPerSecond;
	}

	/**
	 * Cost from the measured duration, never above the amount held at admission.
	 */
	public long actual(Double measuredDurationSeconds, long estimate) {
		if (measuredDurationSeconds == null || measuredDurationSeconds.isNaN() || measuredDurationSeconds <= 0) {
			return estimate;
		}
		return Math.max(0L, Math.min(estimate, estimate(measuredDurationSeconds)));
	}

	public long maximum() {
		return (long) maxVideoSeconds * tokensPerSecond;
	}

	public int tokensPerSecond() {
		return tokensPerSecond;
	}

	public int maxVideoSeconds() {
		return maxVideoSeconds;
	}
}
