package org.threatmodel.github.integration;

import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for the records the webhook flow creates. Implementations back this with
 * the platform database; {@link InMemoryThreatModelStore} is the reference
 * implementation.
 */
public interface ThreatModelStore {

	Optional<ThreatModelRef> findThreatModelByName(String name);

	/**
	 * Insert a threat model.
	 * @param name unique repository full name
	 * @param description free text
	 * @param createdBy creating actor
	 * @return the new model
	 * @throws DuplicateRecordException if a model with this name already exists
	 */
	ThreatModelRef createThreatModel(String name, String description, UUID createdBy);

	/**
	 * Look up the automation actor by email, creating it on first use.
	 * @return the actor id, stable across calls
	 */
	UUID findOrCreateSystemActor(String email);

	AnalysisRecord createAnalysisRecord(UUID threatModelId, String repositoryUrl, String branch,
			RepositoryAnalysis analysis);

}
