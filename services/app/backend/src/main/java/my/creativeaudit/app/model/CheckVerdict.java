package my.creativeaudit.app.model;

public record CheckVerdict(
		String checkId,
		boolean detected,
		Double confidence,
		String rationale,
		String evidence,
		String remediation
) {
	public CheckVerdict {
		if (confidence != null) {
			confidence = Math.max(0.0, Math.min(1.0, confidence));
		}
	}

	public static CheckVerdict undetected(String checkId, String rationale) {
		return new CheckVerdict(checkId, false, 0.0, rationale, null, null);
	}
}
