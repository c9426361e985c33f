package my.creativeaudit.app.collaborator;

import my.creativeaudit.app.model.BrandProfile;
import my.creativeaudit.app.model.CheckVerdict;
import my.creativeaudit.app.model.MediaDescription;
import my.creativeaudit.app.model.MediaRef;
import my.creativeaudit.app.rubric.CheckDefinition;

import java.util.List;

/**
 * Multimodal model that watches the video and answers rubric questions about it.
 */
public interface ContentUnderstandingClient {
	CollaboratorResult<List<CheckVerdict>> evaluate(MediaRef media, List<CheckDefinition> checks);

	CollaboratorResult<MediaDescription> describe(MediaRef media);

	CollaboratorResult<BrandProfile> profile(MediaRef media, String brandName);
}
