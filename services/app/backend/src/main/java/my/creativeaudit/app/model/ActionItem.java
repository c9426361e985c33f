package my.creativeaudit.app.model;

import my.creativeaudit.app.rubric.SubCategory;

public record ActionItem(
		int priority,
		String checkId,
		String name,
		SubCategory subCategory,
		String section,
		String recommendation
) {
}
