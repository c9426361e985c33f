package my.creativeaudit.app.service;

import my.creativeaudit.app.model.MediaRef;
import my.creativeaudit.app.rubric.CheckSet;

import java.util.Set;

/**
 * An admitted evaluation as handed to the orchestrator.
 */
public record JobRequest(
		String accountId,
		String jobId,
		MediaRef media,
		Set<CheckSet> checkSets,
		long estimatedCost,
		String fingerprint
) {
	public JobRequest {
		checkSets = Set.copyOf(checkSets);
	}
}
