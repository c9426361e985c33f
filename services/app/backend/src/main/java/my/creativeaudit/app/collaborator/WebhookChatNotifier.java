package my.creativeaudit.app.collaborator;

import java.time.Duration;
import java.util.Map;

/**
 * Posts plain-text messages to an incoming-webhook URL.
 */
public class WebhookChatNotifier implements ChatNotifier {
	private final JsonHttpTransport transport;
	private final String webhookUrl;

	public WebhookChatNotifier(String webhookUrl) {
		this.transport = new JsonHttpTransport(null, null, Duration.ofSeconds(5), Duration.ofSeconds(10));
		this.webhookUrl = webhookUrl;
	}

	@Override
	public void notify(String text) {
		transport.post(webhookUrl, Map.of("text", text));
	}
}
