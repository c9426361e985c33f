package my.creativeaudit.app.collaborator;

public class CollaboratorException extends RuntimeException {
	private final Integer statusCode;
	private final boolean retryable;
	private final CollaboratorErrorKind kind;

	public CollaboratorException(String message, Integer statusCode, boolean retryable, Throwable cause) {
		this(message, statusCode, retryable, kindFor(statusCode), cause);
	}

	public CollaboratorException(String message, Integer statusCode, boolean retryable, CollaboratorErrorKind kind, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
		this.retryable = retryable;
		this.kind = kind == null ? CollaboratorErrorKind.UNAVAILABLE : kind;
	}

	public static CollaboratorException malformed(String message) {
		return new CollaboratorException(message, null, false, CollaboratorErrorKind.MALFORMED_RESPONSE, null);
	}

	public static CollaboratorException disabled(String collaborator) {
		return new CollaboratorException(collaborator + " disabled", null, false, CollaboratorErrorKind.DISABLED, null);
	}

	public Integer getStatusCode() {
		return statusCode;
	}

	public boolean isRetryable() {
		return retryable;
	}

	public CollaboratorErrorKind getKind() {
		return kind;
	}

	private static CollaboratorErrorKind kindFor(Integer statusCode) {
		if (statusCode == null) {
			return CollaboratorErrorKind.UNAVAILABLE;
		}
		if (statusCode == 429) {
			return CollaboratorErrorKind.QUOTA;
		}
		if (statusCode == 408 || statusCode == 504) {
			return CollaboratorErrorKind.TIMEOUT;
		}
		return CollaboratorErrorKind.UNAVAILABLE;
	}
}
