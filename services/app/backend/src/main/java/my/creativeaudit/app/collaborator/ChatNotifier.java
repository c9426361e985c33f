package my.creativeaudit.app.collaborator;

public interface ChatNotifier {
	void notify(String text);
}
