package my.creativeaudit.app.collaborator;

import my.creativeaudit.app.model.AnnotationFeatures;
import my.creativeaudit.app.model.MediaRef;

import java.util.Set;

public class NoopAnnotationClient implements AnnotationClient {
	@Override
	public CollaboratorResult<AnnotationFeatures> annotate(MediaRef media, Set<String> annotationTypes) {
		return CollaboratorResult.disabled("Annotation");
	}
}
