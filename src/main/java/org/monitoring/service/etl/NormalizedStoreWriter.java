package org.monitoring.service.etl;

import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.monitoring.models.entity.Project;
import org.monitoring.models.entity.UnifiedObject;
import org.monitoring.models.entity.UnifiedTimeSeries;
import org.monitoring.repository.MetricCatalogRepository;
import org.monitoring.repository.ProjectRepository;
import org.monitoring.repository.UnifiedObjectRepository;
import org.monitoring.repository.UnifiedTimeSeriesRepository;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Upserts one batch of drafts into the normalized store. Must run inside the caller's transaction;
 * the persistence context is flushed and cleared after every batch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NormalizedStoreWriter {

    private final EntityManager entityManager;
    private final ProjectRepository projectRepository;
    private final UnifiedObjectRepository unifiedObjectRepository;
    private final UnifiedTimeSeriesRepository unifiedTimeSeriesRepository;
    private final MetricCatalogRepository metricCatalogRepository;
    private final MetricCatalogService metricCatalogService;

    /**
     * State that spans batches of one ingestion run.
     */
    public static class RunState {
        private final Long projectId;
        private final Long datasetId;
        private final String metricUnit;
        private final Set<String> entitiesSeen = new HashSet<>();
        private final Set<ReadingKey> readingsSeen = new HashSet<>();
        private final Map<String, Long> metricIds = new HashMap<>();

        public RunState(Long projectId, Long datasetId, String metricUnit) {
            this.projectId = projectId;
            this.datasetId = datasetId;
            this.metricUnit = metricUnit;
        }

        public long entitiesWritten() {
            return entitiesSeen.size();
        }

        public long readingsWritten() {
            return readingsSeen.size();
        }
    }

    private record ReadingKey(Long objectId, Long metricId, Instant observedAt) {
    }

    public void writeBatch(RunState state, List<RowOutcome> outcomes) {
        Project project = projectRepository.getReferenceById(state.projectId);
        Instant now = Instant.now();

        Map<String, UnifiedObject> objects = upsertEntities(state, project, outcomes, now);
        upsertReadings(state, project, objects, outcomes, now);

        entityManager.flush();
        entityManager.clear();
    }

    private Map<String, UnifiedObject> upsertEntities(RunState state, Project project, List<RowOutcome> outcomes, Instant now) {
        Set<String> externalIds = new HashSet<>();
        for (RowOutcome outcome : outcomes) {
            if (outcome.entity() != null) {
                externalIds.add(outcome.entity().externalId());
            }
        }
        Map<String, UnifiedObject> objects = new HashMap<>();
        if (externalIds.isEmpty()) {
            return objects;
        }
        for (UnifiedObject existing : unifiedObjectRepository.findAllByProject_IdAndExternalIdIn(state.projectId, externalIds)) {
            objects.put(existing.getExternalId(), existing);
        }

        for (RowOutcome outcome : outcomes) {
            RowOutcome.EntityDraft draft = outcome.entity();
            if (draft == null) {
                continue;
            }
            UnifiedObject object = objects.get(draft.externalId());
            if (object == null) {
                object = new UnifiedObject();
                object.setProject(project);
                object.setExternalId(draft.externalId());
                object.setName(draft.externalId());
                object.setExtra(new LinkedHashMap<>());
                object.setCreatedAt(now);
                objects.put(draft.externalId(), object);
            }
            if (draft.latitude() != null) {
                object.setLatitude(draft.latitude());
            }
            if (draft.longitude() != null) {
                object.setLongitude(draft.longitude());
            }
            if (state.entitiesSeen.add(draft.externalId())) {
                Map<String, Object> extra = object.getExtra() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(object.getExtra());
                extra.putAll(draft.extra());
                object.setExtra(extra);
            }
            object.setLastDatasetId(state.datasetId);
            object.setUpdatedAt(now);
        }
        unifiedObjectRepository.saveAll(objects.values());
        return objects;
    }

    private void upsertReadings(RunState state, Project project, Map<String, UnifiedObject> objects,
                                List<RowOutcome> outcomes, Instant now) {
        Map<ReadingKey, RowOutcome.ReadingDraft> latest = new LinkedHashMap<>();
        for (RowOutcome outcome : outcomes) {
            RowOutcome.ReadingDraft reading = outcome.reading();
            if (reading == null) {
                continue;
            }
            UnifiedObject object = objects.get(reading.externalId());
            Long metricId = state.metricIds.computeIfAbsent(MetricCatalogService.metricKey(reading.metricName()),
                    key -> metricCatalogService.resolve(state.projectId, reading.metricName(), state.metricUnit));
            // last row wins inside the file
            ReadingKey key = new ReadingKey(object.getId(), metricId, reading.observedAt());
            latest.remove(key);
            latest.put(key, reading);
        }
        if (latest.isEmpty()) {
            return;
        }

        Set<Long> objectIds = new HashSet<>();
        Set<Instant> instants = new HashSet<>();
        latest.keySet().forEach(key -> {
            objectIds.add(key.objectId());
            instants.add(key.observedAt());
        });
        Map<ReadingKey, UnifiedTimeSeries> existing = new HashMap<>();
        for (UnifiedTimeSeries row : unifiedTimeSeriesRepository.findAllByUnifiedObject_IdInAndObservedAtIn(objectIds, instants)) {
            existing.put(new ReadingKey(row.getUnifiedObject().getId(), row.getMetric().getId(), row.getObservedAt()), row);
        }

        for (Map.Entry<ReadingKey, RowOutcome.ReadingDraft> entry : latest.entrySet()) {
            ReadingKey key = entry.getKey();
            RowOutcome.ReadingDraft draft = entry.getValue();
            UnifiedTimeSeries reading = existing.get(key);
            if (reading == null) {
                reading = new UnifiedTimeSeries();
                reading.setProject(project);
                reading.setUnifiedObject(objects.get(draft.externalId()));
                reading.setMetric(metricCatalogRepository.getReferenceById(key.metricId()));
                reading.setObservedAt(key.observedAt());
            }
            reading.setValue(draft.value());
            reading.setExtra(new LinkedHashMap<>(draft.extra()));
            reading.setLastDatasetId(state.datasetId);
            reading.setIngestedAt(now);
            unifiedTimeSeriesRepository.save(reading);
            state.readingsSeen.add(key);
        }
        log.debug("[ingest] Upserted {} readings ({} updated)", latest.size(),
                latest.keySet().stream().filter(existing::containsKey).count());
    }
}
