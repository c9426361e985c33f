package my.creativeaudit.app.rubric;

public enum SubCategory {
	ATTRACT,
	BRAND,
	CONNECT,
	DIRECT,
	PERSUASION,
	STRUCTURE,
	ACCESSIBILITY
}
