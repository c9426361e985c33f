package my.creativeaudit.app.collaborator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

public class NoopAnalyticsWarehouseClient implements AnalyticsWarehouseClient {
	private static final Logger logger = LoggerFactory.getLogger(NoopAnalyticsWarehouseClient.class);

	@Override
	public void appendRows(String table, List<Map<String, Object>> rows) {
		logger.debug("Analytics disabled, dropping {} rows for {}", rows == null ? 0 : rows.size(), table);
	}
}
