package my.creativeaudit.app.collaborator;

import my.creativeaudit.app.model.BrandProfile;
import my.creativeaudit.app.model.CheckVerdict;
import my.creativeaudit.app.model.MediaDescription;
import my.creativeaudit.app.model.MediaRef;
import my.creativeaudit.app.rubric.CheckDefinition;

import java.util.List;

public class NoopContentUnderstandingClient implements ContentUnderstandingClient {
	@Override
	public CollaboratorResult<List<CheckVerdict>> evaluate(MediaRef media, List<CheckDefinition> checks) {
		return CollaboratorResult.disabled("Content understanding");
	}

	@Override
	public CollaboratorResult<MediaDescription> describe(MediaRef media) {
		return CollaboratorResult.disabled("Content understanding");
	}

	@Override
	public CollaboratorResult<BrandProfile> profile(MediaRef media, String brandName) {
		return CollaboratorResult.disabled("Content understanding");
	}
}
