package my.creativeaudit.app.collaborator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import my.creativeaudit.app.model.BrandProfile;
import my.creativeaudit.app.model.CheckVerdict;
import my.creativeaudit.app.model.MediaDescription;
import my.creativeaudit.app.model.MediaRef;
import my.creativeaudit.app.model.Scene;
import my.creativeaudit.app.rubric.CheckDefinition;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Content-understanding adapter over a JSON HTTP API. Every response is validated against a JSON schema
 * before mapping; a mismatch is reported as {@link CollaboratorErrorKind#MALFORMED_RESPONSE}.
 */
public class HttpContentUnderstandingClient implements ContentUnderstandingClient {
	static final String VERDICTS_SCHEMA_JSON = """
			{
			  "type": "object",
			  "required": ["verdicts"],
			  "properties": {
			    "verdicts": {
			      "type": "array",
			      "items": {
			        "type": "object",
			        "required": ["check_id", "detected"],
			        "properties": {
			          "check_id": {"type": "string", "minLength": 1},
			          "detected": {"type": "boolean"},
			          "confidence": {"type": ["number", "null"], "minimum": 0, "maximum": 1},
			          "rationale": {"type": ["string", "null"]},
			          "evidence": {"type": ["string", "null"]},
			          "remediation": {"type": ["string", "null"]}
			        }
			      }
			    }
			  }
			}
			""";
	static final String DESCRIPTION_SCHEMA_JSON = """
			{
			  "type": "object",
			  "required": ["scenes"],
			  "properties": {
			    "duration_seconds": {"type": ["number", "null"], "minimum": 0},
			    "brand_name": {"type": ["string", "null"]},
			    "summary": {"type": ["string", "null"]},
			    "scenes": {
			      "type": "array",
			      "items": {
			        "type": "object",
			        "required": ["start_seconds", "end_seconds"],
			        "properties": {
			          "index": {"type": "integer"},
			          "start_seconds": {"type": "number", "minimum": 0},
			          "end_seconds": {"type": "number", "minimum": 0},
			          "description": {"type": ["string", "null"]},
			          "transcript": {"type": ["string", "null"]},
			          "speech_ratio": {"type": ["number", "null"], "minimum": 0, "maximum": 1}
			        }
			      }
			    }
			  }
			}
			""";
	static final String PROFILE_SCHEMA_JSON = """
			{
			  "type": "object",
			  "required": ["brand_name"],
			  "properties": {
			    "brand_name": {"type": "string"},
			    "category": {"type": ["string", "null"]},
			    "tone": {"type": ["string", "null"]},
			    "key_messages": {"type": "array", "items": {"type": "string"}}
			  }
			}
			""";

	private final JsonHttpTransport transport;
	private final ResilientCaller caller;
	private final CallPolicy policy;
	private final ObjectMapper objectMapper;
	private final String model;
	private final JsonSchema verdictsSchema;
	private final JsonSchema descriptionSchema;
	private final JsonSchema profileSchema;

	public HttpContentUnderstandingClient(String baseUrl,
										  String apiKey,
										  String model,
										  Duration connectTimeout,
										  Duration readTimeout,
										  ResilientCaller caller,
										  CallPolicy policy,
										  ObjectMapper objectMapper) {
		this.transport = new JsonHttpTransport(baseUrl, apiKey, connectTimeout, readTimeout);
		this.caller = caller;
		this.policy = policy;
		this.objectMapper = objectMapper;
		this.model = model == null || model.isBlank() ? "default" : model;
		this.verdictsSchema = schema(objectMapper, VERDICTS_SCHEMA_JSON);
		this.descriptionSchema = schema(objectMapper, DESCRIPTION_SCHEMA_JSON);
		this.profileSchema = schema(objectMapper, PROFILE_SCHEMA_JSON);
	}

	@Override
	public CollaboratorResult<List<CheckVerdict>> evaluate(MediaRef media, List<CheckDefinition> checks) {
		Map<String, Object> request = new HashMap<>();
		request.put("model", model);
		request.put("media_uri", media.uri());
		List<Map<String, Object>> questions = new ArrayList<>();
		for (CheckDefinition check : checks) {
			Map<String, Object> question = new LinkedHashMap<>();
			question.put("id", check.id());
			question.put("name", check.name());
			question.put("criteria", check.criteria());
			question.put("segment", check.segment().name());
			question.put("remediation_requested", check.accessibility());
			questions.add(question);
		}
		request.put("checks", questions);
		Set<String> requested = new HashSet<>();
		checks.forEach(check -> requested.add(check.id()));
		return caller.call("content-understanding.evaluate", policy, () -> {
			JsonNode root = post("/v1/evaluate", request, verdictsSchema);
			List<CheckVerdict> verdicts = new ArrayList<>();
			for (JsonNode node : root.get("verdicts")) {
				String checkId = node.get("check_id").asText();
				if (!requested.contains(checkId)) {
					continue;
				}
				verdicts.add(new CheckVerdict(
						checkId,
						node.get("detected").asBoolean(),
						doubleOrNull(node, "confidence"),
						textOrNull(node, "rationale"),
						textOrNull(node, "evidence"),
						textOrNull(node, "remediation")
				));
			}
			return verdicts;
		});
	}

	@Override
	public CollaboratorResult<MediaDescription> describe(MediaRef media) {
		Map<String, Object> request = Map.of("model", model, "media_uri", media.uri());
		return caller.call("content-understanding.describe", policy, () -> {
			JsonNode root = post("/v1/describe", request, descriptionSchema);
			List<Scene> scenes = new ArrayList<>();
			int position = 0;
			for (JsonNode node : root.get("scenes")) {
				int index = node.hasNonNull("index") ? node.get("index").asInt() : position;
				scenes.add(new Scene(index, node.get("start_seconds").asDouble(), node.get("end_seconds").asDouble(),
						textOrNull(node, "description"), textOrNull(node, "transcript"), doubleOrNull(node, "speech_ratio")));
				position++;
			}
			return new MediaDescription(doubleOrNull(root, "duration_seconds"), textOrNull(root, "brand_name"),
					textOrNull(root, "summary"), scenes);
		});
	}

	@Override
	public CollaboratorResult<BrandProfile> profile(MediaRef media, String brandName) {
		Map<String, Object> request = new HashMap<>();
		request.put("model", model);
		request.put("media_uri", media.uri());
		if (brandName != null) {
			request.put("brand_name", brandName);
		}
		return caller.call("content-understanding.profile", policy, () -> {
			JsonNode root = post("/v1/profile", request, profileSchema);
			List<String> messages = new ArrayList<>();
			JsonNode keyMessages = root.get("key_messages");
			if (keyMessages != null && keyMessages.isArray()) {
				keyMessages.forEach(message -> messages.add(message.asText()));
			}
			return new BrandProfile(root.get("brand_name").asText(), textOrNull(root, "category"),
					textOrNull(root, "tone"), messages);
		});
	}

	private JsonNode post(String path, Map<String, Object> request, JsonSchema schema) {
		String body = transport.post(path, request);
		JsonNode root;
		try {
			root = objectMapper.readTree(body);
		} catch (Exception ex) {
			throw CollaboratorException.malformed("Response is not JSON");
		}
		Set<ValidationMessage> errors = schema.validate(root);
		if (!errors.isEmpty()) {
			throw CollaboratorException.malformed("Response did not match schema: " + errors.iterator().next().getMessage());
		}
		return root;
	}

	private static JsonSchema schema(ObjectMapper mapper, String json) {
		try {
			JsonNode schemaNode = mapper.readTree(json);
			return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(schemaNode);
		} catch (Exception ex) {
			throw new IllegalStateException("Failed to load content-understanding response schema", ex);
		}
	}

	private static String textOrNull(JsonNode node, String field) {
		JsonNode value = node.get(field);
		if (value == null || value.isNull()) {
			return null;
		}
		String text = value.asText();
		return text.isBlank() ? null : text;
	}

	private static Double doubleOrNull(JsonNode node, String field) {
		JsonNode value = node.get(field);
		return value == null || value.isNull() || !value.isNumber() ? null : value.asDouble();
	}
}
