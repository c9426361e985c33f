package my.creativeaudit.app.model;

import java.util.List;

public record BrandProfile(
		String brandName,
		String category,
		String tone,
		List<String> keyMessages
) {
	public BrandProfile {
		keyMessages = keyMessages == null ? List.of() : List.copyOf(keyMessages);
	}
}
