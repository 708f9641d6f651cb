package org.threatmodel.github.integration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ThreatModelStore} held in memory, with the same unique-name semantics as the
 * database schema.
 */
public class InMemoryThreatModelStore implements ThreatModelStore {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryThreatModelStore.class);

	private final ConcurrentMap<String, ThreatModelRef> threatModels = new ConcurrentHashMap<>();

	private final ConcurrentMap<String, UUID> actors = new ConcurrentHashMap<>();

	private final List<AnalysisRecord> analyses = new CopyOnWriteArrayList<>();

	private final Clock clock;

	public InMemoryThreatModelStore() {
		this(Clock.systemUTC());
	}

	public InMemoryThreatModelStore(Clock clock) {
		this.clock = clock;
	}

	@Override
	public Optional<ThreatModelRef> findThreatModelByName(String name) {
		return Optional.ofNullable(threatModels.get(name));
	}

	@Override
	public ThreatModelRef createThreatModel(String name, String description, UUID createdBy) {
		ThreatModelRef model = new ThreatModelRef(UUID.randomUUID(), name, createdBy);
		if (threatModels.putIfAbsent(name, model) != null) {
			throw new DuplicateRecordException("threat_models.name=" + name);
		}
		logger.info("Threat model created for {}: {}", name, model.id());
		return model;
	}

	@Override
	public UUID findOrCreateSystemActor(String email) {
		return actors.computeIfAbsent(email, key -> UUID.randomUUID());
	}

	@Override
	public AnalysisRecord createAnalysisRecord(UUID threatModelId, String repositoryUrl, String branch,
			RepositoryAnalysis analysis) {
		AnalysisRecord record = new AnalysisRecord(UUID.randomUUID(), threatModelId, AnalysisRecord.STATUS_COMPLETED,
				AnalysisRecord.TYPE_AUTOMATED, repositoryUrl, branch, AnalysisSummary.from(analysis), clock.instant());
		analyses.add(record);
		return record;
	}

	public List<ThreatModelRef> getThreatModels() {
		return new ArrayList<>(threatModels.values());
	}

	public List<AnalysisRecord> getAnalysisRecords() {
		return List.copyOf(analyses);
	}

}
