package my.creativeaudit.app.rubric;

public enum VideoSegment {
	FULL_VIDEO,
	FIRST_5_SECS_VIDEO,
	LAST_5_SECS_VIDEO
}
