package my.creativeaudit.app.rubric;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

public class RubricParser {
	private final ObjectMapper yamlMapper;

	public RubricParser() {
		this.yamlMapper = YAMLMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
	}

	public List<CheckDefinition> parse(InputStream content) throws IOException {
		RubricDocument document = yamlMapper.readValue(content, RubricDocument.class);
		List<CheckDefinition> definitions = new ArrayList<>();
		if (document == null || document.getChecks() == null) {
			return definitions;
		}
		for (CheckEntry entry : document.getChecks()) {
			definitions.add(new CheckDefinition(
					entry.getId(),
					entry.getName(),
					entry.getCheckSet(),
					entry.getSubCategory(),
					entry.getSegment() == null ? VideoSegment.FULL_VIDEO : entry.getSegment(),
					entry.getEvaluationMethod() == null ? EvaluationMethod.LLMS : entry.getEvaluationMethod(),
					entry.getCriteria(),
					entry.getAnnotationTypes()
			));
		}
		return definitions;
	}

	public static class RubricDocument {
		private List<CheckEntry> checks;

		public List<CheckEntry> getChecks() {
			return checks;
		}

		public void setChecks(List<CheckEntry> checks) {
			this.checks = checks;
		}
	}

	public static class CheckEntry {
		private String id;
		private String name;
		private CheckSet checkSet;
		private SubCategory subCategory;
		private VideoSegment segment;
		private EvaluationMethod evaluationMethod;
		private String criteria;
		private List<String> annotationTypes;

		public String getId() {
			return id;
		}

		public void setId(String id) {
			this.id = id;
		}

		public String getName() {
			return name;
		}

		public void setName(String name) {
			this.name = name;
		}

		public CheckSet getCheckSet() {
			return checkSet;
		}

		public void setCheckSet(CheckSet checkSet) {
			this.checkSet = checkSet;
		}

		public SubCategory getSubCategory() {
			return subCategory;
		}

		public void setSubCategory(SubCategory subCategory) {
			this.subCategory = subCategory;
		}

		public VideoSegment getSegment() {
			return segment;
		}

		public void setSegment(VideoSegment segment) {
			this.segment = segment;
		}

		public EvaluationMethod getEvaluationMethod() {
			return evaluationMethod;
		}

		public void setEvaluationMethod(EvaluationMethod evaluationMethod) {
			this.evaluationMethod = evaluationMethod;
		}

		public String getCriteria() {
			return criteria;
		}

		public void setCriteria(String criteria) {
			this.criteria = criteria;
		}

		public List<String> getAnnotationTypes() {
			return annotationTypes;
		}

		public void setAnnotationTypes(List<String> annotationTypes) {
			this.annotationTypes = annotationTypes;
		}
	}
}
