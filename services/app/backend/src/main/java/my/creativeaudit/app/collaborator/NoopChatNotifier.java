package my.creativeaudit.app.collaborator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class NoopChatNotifier implements ChatNotifier {
	private static final Logger logger = LoggerFactory.getLogger(NoopChatNotifier.class);

	@Override
	public void notify(String text) {
		logger.debug("Chat notifications disabled: {}", text);
	}
}
