package my.creativeaudit.app.collaborator;

import my.creativeaudit.app.model.AudioLevels;
import my.creativeaudit.app.model.Scene;
import my.creativeaudit.app.model.TechnicalMetadata;

import java.util.List;

/**
 * Local media processing on raw video bytes.
 */
public interface MediaToolkit {
	CollaboratorResult<byte[]> trimLeading(byte[] video, double seconds);

	CollaboratorResult<List<byte[]>> extractFrames(byte[] video, List<Double> timestampsSeconds);

	CollaboratorResult<AudioLevels> audioLevels(byte[] video, List<Scene> scenes);

	CollaboratorResult<TechnicalMetadata> probe(byte[] video);
}
