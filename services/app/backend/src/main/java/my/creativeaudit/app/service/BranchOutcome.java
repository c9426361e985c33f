package my.creativeaudit.app.service;

import my.creativeaudit.app.model.EvaluatedCheck;
import my.creativeaudit.app.rubric.CheckSet;

import java.util.List;

/**
 * Result of one check-set branch: its evaluated checks, or the error that failed the whole branch.
 */
public record BranchOutcome(
		CheckSet checkSet,
		List<EvaluatedCheck> checks,
		String errorCode,
		String message
) {
	public BranchOutcome {
		checks = checks == null ? List.of() : List.copyOf(checks);
	}

	static BranchOutcome completed(CheckSet checkSet, List<EvaluatedCheck> checks) {
		return new BranchOutcome(checkSet, checks, null, null);
	}

	static BranchOutcome failure(CheckSet checkSet, String errorCode, String message) {
		return new BranchOutcome(checkSet, List.of(), errorCode, message);
	}

	public boolean failed() {
		return errorCode != null;
	}
}
