package my.creativeaudit.app.rubric;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public enum CheckSet {
	LONG_FORM_ABCD,
	SHORTS,
	CREATIVE_INTELLIGENCE;

	public String milestone() {
		return name().toLowerCase(Locale.ROOT) + "_done";
	}

	/**
	 * Parses a comma separated list such as {@code "SHORTS,LONG_FORM_ABCD"}.
	 */
	public static Set<CheckSet> parseList(String value) {
		EnumSet<CheckSet> result = EnumSet.noneOf(CheckSet.class);
		if (value == null || value.isBlank()) {
			return result;
		}
		for (String part : value.split(",")) {
			String trimmed = part.trim();
			if (!trimmed.isEmpty()) {
				result.add(CheckSet.valueOf(trimmed.toUpperCase(Locale.ROOT)));
			}
		}
		return result;
	}

	/**
	 * Sorted by name, which is also the order used for fingerprints.
	 */
	public static String joinSorted(Set<CheckSet> checkSets) {
		return checkSets.stream()
				.map(CheckSet::name)
				.sorted()
				.collect(Collectors.joining(","));
	}

	public static Set<CheckSet> all() {
		return EnumSet.copyOf(Arrays.asList(values()));
	}
}
