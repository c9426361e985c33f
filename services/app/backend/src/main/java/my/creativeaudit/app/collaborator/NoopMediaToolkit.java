package my.creativeaudit.app.collaborator;

import my.creativeaudit.app.model.AudioLevels;
import my.creativeaudit.app.model.Scene;
import my.creativeaudit.app.model.TechnicalMetadata;

import java.util.List;

public class NoopMediaToolkit implements MediaToolkit {
	@Override
	public CollaboratorResult<byte[]> trimLeading(byte[] video, double seconds) {
		return CollaboratorResult.disabled("Media toolkit");
	}

	@Override
	public CollaboratorResult<List<byte[]>> extractFrames(byte[] video, List<Double> timestampsSeconds) {
		return CollaboratorResult.disabled("Media toolkit");
	}

	@Override
	public CollaboratorResult<AudioLevels> audioLevels(byte[] video, List<Scene> scenes) {
		return CollaboratorResult.disabled("Media toolkit");
	}

	@Override
	public CollaboratorResult<TechnicalMetadata> probe(byte[] video) {
		return CollaboratorResult.disabled("Media toolkit");
	}
}
