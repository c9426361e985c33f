package my.creativeaudit.app.rubric;

public enum EvaluationMethod {
	LLMS,
	ANNOTATIONS,
	LLMS_AND_ANNOTATIONS;

	public boolean usesContentUnderstanding() {
		return this != ANNOTATIONS;
	}

	public boolean usesAnnotations() {
		return this != LLMS;
	}
}
