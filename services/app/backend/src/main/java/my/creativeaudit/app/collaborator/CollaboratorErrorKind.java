package my.creativeaudit.app.collaborator;

public enum CollaboratorErrorKind {
	TIMEOUT,
	QUOTA,
	MALFORMED_RESPONSE,
	UNAVAILABLE,
	DISABLED;

	public String errorCode() {
		return "COLLABORATOR_" + name();
	}
}
