package my.creativeaudit.app.domain;

public enum JobPhase {
	QUEUED,
	PREPROCESSING,
	ANALYZING,
	POSTPROCESSING,
	FINALIZING,
	DONE
}
