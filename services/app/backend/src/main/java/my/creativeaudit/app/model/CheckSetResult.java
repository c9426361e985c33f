package my.creativeaudit.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import my.creativeaudit.app.rubric.CheckSet;

import java.util.List;

public record CheckSetResult(
		CheckSet checkSet,
		Status status,
		List<CheckResult> checks,
		int passed,
		int total,
		double scorePercent,
		String errorCode,
		String message
) {
	public CheckSetResult {
		checks = checks == null ? List.of() : List.copyOf(checks);
	}

	public static CheckSetResult completed(CheckSet checkSet, List<CheckResult> checks) {
		int passed = (int) checks.stream().filter(CheckResult::detected).count();
		int total = checks.size();
		double percent = total == 0 ? 0.0 : Math.round(passed * 1000.0 / total) / 10.0;
		return new CheckSetResult(checkSet, Status.COMPLETED, checks, passed, total, percent, null, null);
	}

	public static CheckSetResult failed(CheckSet checkSet, String errorCode, String message) {
		return new CheckSetResult(checkSet, Status.FAILED, List.of(), 0, 0, 0.0, errorCode, message);
	}

	@JsonIgnore
	public boolean isFailed() {
		return status == Status.FAILED;
	}

	public enum Status {
		COMPLETED,
		FAILED
	}
}
