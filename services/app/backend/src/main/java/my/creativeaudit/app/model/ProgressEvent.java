package my.creativeaudit.app.model;

public record ProgressEvent(
		String jobId,
		String milestone,
		int percentage,
		String message,
		Object partial
) {
	public static final String COMPLETE = "complete";
	public static final String ERROR = "error";

	public boolean terminal() {
		return COMPLETE.equals(milestone) || ERROR.equals(milestone);
	}

	public ProgressEvent withPercentage(int value) {
		return new ProgressEvent(jobId, milestone, value, message, partial);
	}
}
