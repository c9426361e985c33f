package my.creativeaudit.app.model;

import my.creativeaudit.app.rubric.CheckDefinition;

public record EvaluatedCheck(
		CheckDefinition definition,
		CheckVerdict verdict
) {
	public boolean detected() {
		return verdict != null && verdict.detected();
	}
}
