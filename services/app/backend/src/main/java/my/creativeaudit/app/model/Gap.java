package my.creativeaudit.app.model;

import my.creativeaudit.app.rubric.CheckSet;

public record Gap(
		CheckSet checkSet,
		String errorCode,
		String message
) {
}
