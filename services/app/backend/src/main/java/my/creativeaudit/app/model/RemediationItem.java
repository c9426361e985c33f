package my.creativeaudit.app.model;

public record RemediationItem(
		String checkId,
		String name,
		String remediation
) {
}
