package my.creativeaudit.app.model;

import my.creativeaudit.app.rubric.SubCategory;
import my.creativeaudit.app.rubric.VideoSegment;

/**
 * Report view of one evaluated check.
 */
public record CheckResult(
		String checkId,
		String name,
		SubCategory subCategory,
		VideoSegment segment,
		boolean detected,
		Double confidence,
		String rationale,
		String evidence,
		String remediation
) {
	public static CheckResult of(EvaluatedCheck check) {
		CheckVerdict verdict = check.verdict();
		return new CheckResult(
				check.definition().id(),
				check.definition().name(),
				check.definition().subCategory(),
				check.definition().segment(),
				verdict.detected(),
				verdict.confidence(),
				verdict.rationale(),
				verdict.evidence(),
				verdict.remediation()
		);
	}
}
