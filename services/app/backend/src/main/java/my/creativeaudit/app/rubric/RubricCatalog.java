package my.creativeaudit.app.rubric;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable registry of rubric checks, grouped by check-set in catalog order.
 */
@Component
public class RubricCatalog {
	private static final Logger logger = LoggerFactory.getLogger(RubricCatalog.class);
	static final String DEFAULT_LOCATION = "rubric/checks.yaml";

	private final Map<String, CheckDefinition> byId;
	private final Map<CheckSet, List<CheckDefinition>> byCheckSet;

	public RubricCatalog() {
		this(loadDefault());
	}

	public RubricCatalog(List<CheckDefinition> definitions) {
		validate(definitions);
		Map<String, CheckDefinition> ids = new LinkedHashMap<>();
		Map<CheckSet, List<CheckDefinition>> groups = new EnumMap<>(CheckSet.class);
		for (CheckDefinition definition : definitions) {
			ids.put(definition.id(), definition);
			groups.computeIfAbsent(definition.checkSet(), key -> new ArrayList<>()).add(definition);
		}
		groups.replaceAll((key, value) -> List.copyOf(value));
		this.byId = Map.copyOf(ids);
		this.byCheckSet = groups;
		logger.info("Rubric catalog loaded ({} checks, {} check-sets).", ids.size(), groups.size());
	}

	public List<CheckDefinition> checks(CheckSet checkSet) {
		return byCheckSet.getOrDefault(checkSet, List.of());
	}

	public Optional<CheckDefinition> find(String checkId) {
		return Optional.ofNullable(byId.get(checkId));
	}

	public Collection<CheckDefinition> all() {
		return byId.values();
	}

	public boolean requiresLeadingWindow(Set<CheckSet> checkSets) {
		return checkSets.contains(CheckSet.LONG_FORM_ABCD)
				&& checks(CheckSet.LONG_FORM_ABCD).stream()
				.anyMatch(check -> check.segment() == VideoSegment.FIRST_5_SECS_VIDEO);
	}

	private static List<CheckDefinition> loadDefault() {
		try (InputStream input = new ClassPathResource(DEFAULT_LOCATION).getInputStream()) {
			return new RubricParser().parse(input);
		} catch (IOException ex) {
			throw new IllegalStateException("Failed to load rubric catalog from " + DEFAULT_LOCATION, ex);
		}
	}

	private static void validate(List<CheckDefinition> definitions) {
		if (definitions == null || definitions.isEmpty()) {
			throw new IllegalStateException("Rubric catalog is empty");
		}
		Set<String> seen = new HashSet<>();
		for (CheckDefinition definition : definitions) {
			if (definition.id() == null || definition.id().isBlank()) {
				throw new IllegalStateException("Rubric check without id");
			}
			if (!seen.add(definition.id())) {
				throw new IllegalStateException("Duplicate rubric check id: " + definition.id());
			}
			if (definition.checkSet() == null || definition.subCategory() == null) {
				throw new IllegalStateException("Rubric check " + definition.id() + " lacks check-set or sub-category");
			}
			if (definition.evaluationMethod().usesAnnotations() && definition.annotationTypes().isEmpty()) {
				throw new IllegalStateException("Rubric check " + definition.id() + " needs annotation types");
			}
		}
	}
}
