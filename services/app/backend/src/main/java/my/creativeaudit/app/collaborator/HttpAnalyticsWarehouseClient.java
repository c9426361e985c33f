package my.creativeaudit.app.collaborator;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public class HttpAnalyticsWarehouseClient implements AnalyticsWarehouseClient {
	private final JsonHttpTransport transport;

	public HttpAnalyticsWarehouseClient(String baseUrl, String apiKey, Duration connectTimeout, Duration readTimeout) {
		this.transport = new JsonHttpTransport(baseUrl, apiKey, connectTimeout, readTimeout);
	}

	@Override
	public void appendRows(String table, List<Map<String, Object>> rows) {
		if (rows == null || rows.isEmpty()) {
			return;
		}
		transport.post("/v1/tables/" + table + "/rows", Map.of("rows", rows));
	}
}
