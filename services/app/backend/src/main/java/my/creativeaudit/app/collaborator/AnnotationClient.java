package my.creativeaudit.app.collaborator;

import my.creativeaudit.app.model.AnnotationFeatures;
import my.creativeaudit.app.model.MediaRef;

import java.util.Set;

public interface AnnotationClient {
	CollaboratorResult<AnnotationFeatures> annotate(MediaRef media, Set<String> annotationTypes);
}
