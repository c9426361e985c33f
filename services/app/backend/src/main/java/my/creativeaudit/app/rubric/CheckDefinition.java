package my.creativeaudit.app.rubric;

import java.util.List;

public record CheckDefinition(
		String id,
		String name,
		CheckSet checkSet,
		SubCategory subCategory,
		VideoSegment segment,
		EvaluationMethod evaluationMethod,
		String criteria,
		List<String> annotationTypes
) {
	public CheckDefinition {
		annotationTypes = annotationTypes == null ? List.of() : List.copyOf(annotationTypes);
	}

	public boolean accessibility() {
		return subCategory == SubCategory.ACCESSIBILITY;
	}
}
