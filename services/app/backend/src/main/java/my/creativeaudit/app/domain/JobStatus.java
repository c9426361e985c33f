package my.creativeaudit.app.domain;

import java.util.List;

public enum JobStatus {
	QUEUED,
	RUNNING,
	SUCCEEDED,
	FAILED,
	CANCELED;

	public boolean terminal() {
		return this == SUCCEEDED || this == FAILED || this == CANCELED;
	}

	public static List<JobStatus> active() {
		return List.of(QUEUED, RUNNING);
	}
}
