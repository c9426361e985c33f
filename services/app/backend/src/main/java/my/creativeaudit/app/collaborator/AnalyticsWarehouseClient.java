package my.creativeaudit.app.collaborator;

import java.util.List;
import java.util.Map;

public interface AnalyticsWarehouseClient {
	/**
	 * Appends rows to the given table. Throws {@link CollaboratorException} on failure; callers run this detached.
	 */
	void appendRows(String table, List<Map<String, Object>> rows);
}
