package my.creativeaudit.app.collaborator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import my.creativeaudit.app.model.AnnotationFeatures;
import my.creativeaudit.app.model.MediaRef;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

public class HttpAnnotationClient implements AnnotationClient {
	private final JsonHttpTransport transport;
	private final ResilientCaller caller;
	private final CallPolicy policy;
	private final ObjectMapper objectMapper;

	public HttpAnnotationClient(String baseUrl,
								String apiKey,
								Duration connectTimeout,
								Duration readTimeout,
								ResilientCaller caller,
								CallPolicy policy,
								ObjectMapper objectMapper) {
		this.transport = new JsonHttpTransport(baseUrl, apiKey, connectTimeout, readTimeout);
		this.caller = caller;
		this.policy = policy;
		this.objectMapper = objectMapper;
	}

	@Override
	public CollaboratorResult<AnnotationFeatures> annotate(MediaRef media, Set<String> annotationTypes) {
		Map<String, Object> request = Map.of(
				"media_uri", media.uri(),
				"features", List.copyOf(new TreeSet<>(annotationTypes))
		);
		return caller.call("annotation.annotate", policy, () -> parse(transport.post("/v1/annotate", request)));
	}

	private AnnotationFeatures parse(String body) {
		JsonNode root;
		try {
			root = objectMapper.readTree(body);
		} catch (Exception ex) {
			throw CollaboratorException.malformed("Annotation response is not JSON");
		}
		JsonNode annotations = root == null ? null : root.get("annotations");
		if (annotations == null || !annotations.isObject()) {
			throw CollaboratorException.malformed("Annotation response lacks annotations");
		}
		Map<String, List<AnnotationFeatures.Detection>> detections = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> fields = annotations.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> entry = fields.next();
			if (!entry.getValue().isArray()) {
				throw CollaboratorException.malformed("Annotation type " + entry.getKey() + " is not a list");
			}
			List<AnnotationFeatures.Detection> items = new ArrayList<>();
			for (JsonNode item : entry.getValue()) {
				items.add(new AnnotationFeatures.Detection(
						item.path("label").asText(""),
						item.path("confidence").asDouble(0.0),
						item.path("start_seconds").asDouble(0.0),
						item.path("end_seconds").asDouble(0.0)
				));
			}
			detections.put(entry.getKey(), List.copyOf(items));
		}
		return new AnnotationFeatures(detections);
	}
}
