package org.monitoring.service.lifecycle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.monitoring.configuration.MonitoringProperties;
import org.monitoring.exceptions.InferenceUnavailableException;
import org.monitoring.exceptions.IngestException;
import org.monitoring.exceptions.ResourceNotFoundException;
import org.monitoring.exceptions.StaleTransitionException;
import org.monitoring.models.dto.ConfirmMappingRequest;
import org.monitoring.models.entity.Dataset;
import org.monitoring.models.entity.DatasetTransition;
import org.monitoring.models.entity.IngestionRun;
import org.monitoring.models.entity.Project;
import org.monitoring.models.enums.DatasetStatus;
import org.monitoring.models.enums.IngestErrorCode;
import org.monitoring.models.enums.MappingOrigin;
import org.monitoring.models.mapping.ColumnMapping;
import org.monitoring.repository.DatasetRepository;
import org.monitoring.repository.DatasetTransitionRepository;
import org.monitoring.repository.ProjectRepository;
import org.monitoring.service.etl.EtlEngine;
import org.monitoring.service.etl.IngestResult;
import org.monitoring.service.ingestion.RawRecordStore;
import org.monitoring.service.ingestion.RawTable;
import org.monitoring.service.mapping.MappingInferenceService;
import org.monitoring.service.mapping.MappingValidator;
import org.monitoring.utils.AppUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives a dataset from upload to ingestion.
 *
 * <p>Every status change goes through {@link DatasetTransitionService}. No transaction is open
 * while inference or the load itself runs; each step commits its own transition first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetLifecycleService {

    private final ProjectRepository projectRepository;
    private final DatasetRepository datasetRepository;
    private final DatasetTransitionRepository datasetTransitionRepository;
    private final DatasetTransitionService transitionService;
    private final IngestionRunService ingestionRunService;
    private final IngestionCancellationRegistry cancellationRegistry;
    private final RawRecordStore rawRecordStore;
    private final MappingInferenceService mappingInferenceService;
    private final MappingValidator mappingValidator;
    private final EtlEngine etlEngine;
    private final MonitoringProperties properties;

    @Transactional
    public Dataset upload(Long projectId, MultipartFile file) {
        Project project = projectRepository.findById(projectId)
                .orElseThrow(() -> new ResourceNotFoundException("Project not found: " + projectId));

        RawRecordStore.StoredDataset stored = rawRecordStore.store(file);

        Dataset dataset = new Dataset();
        dataset.setDatasetUid(AppUtils.generateUUID());
        dataset.setProject(project);
        dataset.setOriginalFilename(stored.file().originalFilename() != null
                ? stored.file().originalFilename() : stored.file().handle());
        dataset.setStorageHandle(stored.file().handle());
        dataset.setFormat(stored.file().format());
        dataset.setHeaders(stored.headers());
        dataset.setRowCount(stored.rowCount());
        dataset.setStatus(DatasetStatus.UPLOADED);
        dataset.setRetryable(false);
        Instant now = Instant.now();
        dataset.setCreatedAt(now);
        dataset.setUpdatedAt(now);
        Dataset saved = datasetRepository.saveAndFlush(dataset);
        transitionService.recordCreated(saved);

        log.info("[upload] Dataset {} created in project {} with {} columns and {} rows",
                saved.getId(), projectId, stored.headers().size(), stored.rowCount());
        return saved;
    }

    /**
     * Proposes a mapping. Allowed from UPLOADED, ANALYZED and retryable FAILED; a repeat call
     * replaces the stored proposal.
     */
    public Dataset analyze(Long datasetId) {
        Dataset dataset = transitionService.transition(datasetId,
                EnumSet.of(DatasetStatus.UPLOADED, DatasetStatus.ANALYZED, DatasetStatus.FAILED),
                null, DatasetStatus.ANALYZING, "analysis started", d -> { });

        ColumnMapping proposal;
        List<String> headers;
        try {
            headers = rawRecordStore.readHeaders(dataset);
            int sampleRows = properties.getInference().getSampleRows();
            List<Map<String, String>> sample = rawRecordStore.sample(dataset, Math.min(sampleRows, MappingInferenceService.MAX_SAMPLE_ROWS));
            proposal = mappingInferenceService.propose(headers, sample);
        } catch (IngestException e) {
            throw fail(datasetId, DatasetStatus.ANALYZING, e.getMessage(), e.isRetryable(), e);
        } catch (InferenceUnavailableException e) {
            throw fail(datasetId, DatasetStatus.ANALYZING, e.getMessage(), true, e);
        } catch (RuntimeException e) {
            log.error("[analyze] Unexpected failure for dataset {}", datasetId, e);
            throw fail(datasetId, DatasetStatus.ANALYZING, "Analysis failed: " + e.getMessage(), true, e);
        }

        log.info("[analyze] Dataset {} mapping proposed ({}): {}", datasetId, proposal.getOrigin(), proposal.getRoles());
        return transitionService.transition(datasetId, Set.of(DatasetStatus.ANALYZING), null, DatasetStatus.ANALYZED,
                "mapping proposed (" + proposal.getOrigin() + ")", d -> {
                    d.setHeaders(headers);
                    d.setMapping(proposal);
                });
    }

    /**
     * Runs the gate, records the confirmed mapping and ingests straight away.
     *
     * @throws org.monitoring.exceptions.MappingValidationException without changing the dataset
     */
    public Dataset confirm(Long datasetId, ConfirmMappingRequest request) {
        Dataset dataset = get(datasetId);
        if (dataset.getStatus() != DatasetStatus.ANALYZED) {
            throw new StaleTransitionException(datasetId, dataset.getStatus(), dataset.getRevision(),
                    "Dataset " + datasetId + " is " + dataset.getStatus() + ", only ANALYZED datasets can be confirmed");
        }

        ColumnMapping candidate;
        if (request != null && request.mapping() != null) {
            candidate = request.mapping().copy();
            candidate.setOrigin(MappingOrigin.USER);
        } else {
            candidate = dataset.getMapping().copy();
        }
        ColumnMapping confirmed = mappingValidator.validate(candidate, dataset.getHeaders());

        List<String> currentHeaders;
        try {
            currentHeaders = rawRecordStore.readHeaders(dataset);
        } catch (IngestException e) {
            throw fail(datasetId, DatasetStatus.ANALYZED, e.getMessage(), e.isRetryable(), e);
        }
        if (!currentHeaders.equals(dataset.getHeaders())) {
            IngestException drift = new IngestException(IngestErrorCode.MAPPING_DRIFT,
                    "Stored file headers changed since analysis: " + currentHeaders);
            throw fail(datasetId, DatasetStatus.ANALYZED, drift.getMessage(), true, drift);
        }

        Long expectedRevision = request != null ? request.expectedRevision() : null;
        Dataset confirmedDataset = transitionService.transition(datasetId, Set.of(DatasetStatus.ANALYZED),
                expectedRevision, DatasetStatus.CONFIRMED, "mapping confirmed (" + confirmed.getOrigin() + ")",
                d -> d.setMapping(confirmed));
        log.info("[confirm] Dataset {} confirmed with roles {}", datasetId, confirmed.getRoles());

        return runIngestion(confirmedDataset, confirmed, DatasetStatus.CONFIRMED);
    }

    /**
     * Ingests a CONFIRMED dataset with its confirmed mapping.
     */
    public Dataset ingest(Long datasetId) {
        Dataset dataset = get(datasetId);
        if (dataset.getStatus() != DatasetStatus.CONFIRMED || dataset.getMapping() == null) {
            throw new StaleTransitionException(datasetId, dataset.getStatus(), dataset.getRevision(),
                    "Dataset " + datasetId + " is " + dataset.getStatus() + ", only CONFIRMED datasets can be ingested");
        }
        return runIngestion(dataset, dataset.getMapping().copy(), DatasetStatus.CONFIRMED);
    }

    /**
     * Re-drives a retryable failure. A failure after confirmation re-ingests with the confirmed
     * mapping, a failed ingestion re-runs with its mapping snapshot, anything else goes back to
     * analysis.
     */
    public Dataset retry(Long datasetId) {
        Dataset dataset = get(datasetId);
        if (dataset.getStatus() != DatasetStatus.FAILED || !Boolean.TRUE.equals(dataset.getRetryable())) {
            throw new StaleTransitionException(datasetId, dataset.getStatus(), dataset.getRevision(),
                    "Dataset " + datasetId + " is not in a retryable failed state");
        }
        if (dataset.getFailedStage() == DatasetStatus.CONFIRMED && dataset.getMapping() != null) {
            log.info("[lifecycle] Retrying ingestion of dataset {} with its confirmed mapping", datasetId);
            return runIngestion(dataset, dataset.getMapping().copy(), DatasetStatus.FAILED);
        }
        if (dataset.getFailedStage() == DatasetStatus.INGESTING) {
            Optional<ColumnMapping> snapshot = ingestionRunService.latestSnapshot(datasetId);
            if (snapshot.isPresent()) {
                log.info("[lifecycle] Retrying ingestion of dataset {} with its last mapping snapshot", datasetId);
                return runIngestion(dataset, snapshot.get(), DatasetStatus.FAILED);
            }
            log.warn("[lifecycle] Dataset {} has no mapping snapshot, retrying from analysis", datasetId);
        }
        return analyze(datasetId);
    }

    /**
     * Requests cancellation of a running ingestion. The run stops at the next batch boundary.
     */
    public Dataset cancel(Long datasetId) {
        Dataset dataset = get(datasetId);
        if (dataset.getStatus() != DatasetStatus.INGESTING) {
            throw new StaleTransitionException(datasetId, dataset.getStatus(), dataset.getRevision(),
                    "Dataset " + datasetId + " is " + dataset.getStatus() + ", only INGESTING datasets can be cancelled");
        }
        if (!cancellationRegistry.requestCancel(datasetId)) {
            log.warn("[lifecycle] Dataset {} is INGESTING but no run is active in this process", datasetId);
        }
        return dataset;
    }

    @Transactional(readOnly = true)
    public Dataset get(Long datasetId) {
        return datasetRepository.findById(datasetId)
                .orElseThrow(() -> new ResourceNotFoundException("Dataset not found: " + datasetId));
    }

    @Transactional(readOnly = true)
    public List<Dataset> list(Long projectId) {
        if (!projectRepository.existsById(projectId)) {
            throw new ResourceNotFoundException("Project not found: " + projectId);
        }
        return datasetRepository.findAllByProject_IdOrderByCreatedAtDesc(projectId);
    }

    @Transactional(readOnly = true)
    public List<DatasetTransition> transitions(Long datasetId) {
        get(datasetId);
        return datasetTransitionRepository.findAllByDataset_IdOrderByRevisionAsc(datasetId);
    }

    @Transactional(readOnly = true)
    public List<IngestionRun> runs(Long datasetId) {
        get(datasetId);
        return ingestionRunService.runs(datasetId);
    }

    private Dataset runIngestion(Dataset dataset, ColumnMapping snapshot, DatasetStatus from) {
        Long datasetId = dataset.getId();
        // registered before INGESTING is visible so no cancel request can fall in between
        AtomicBoolean cancelled = cancellationRegistry.register(datasetId);
        if (cancelled == null) {
            throw new StaleTransitionException(datasetId, dataset.getStatus(), dataset.getRevision(),
                    "Dataset " + datasetId + " is already being ingested");
        }
        try (RawTable table = openOrFail(dataset, from)) {
            Dataset ingesting = transitionService.transition(datasetId, Set.of(from), dataset.getRevision(),
                    DatasetStatus.INGESTING, "ingestion started", d -> { });
            IngestionRun run = ingestionRunService.start(ingesting, snapshot);
            try {
                IngestResult result = etlEngine.ingest(ingesting, snapshot, table, cancelled::get);
                ingestionRunService.markSuccess(run, result);
                String message = "ingested " + result.entitiesWritten() + " entities and "
                        + result.readingsWritten() + " readings, " + result.errorCount() + " rows with errors";
                return transitionService.transition(datasetId, Set.of(DatasetStatus.INGESTING), null,
                        DatasetStatus.INGESTED, message, d -> {
                            d.setMapping(snapshot);
                            d.setRowCount(result.rowsRead());
                        });
            } catch (IngestException e) {
                ingestionRunService.markFailure(run, e);
                throw fail(datasetId, DatasetStatus.INGESTING, e.getMessage(), e.isRetryable(), e);
            } catch (RuntimeException e) {
                log.error("[ingest] Unexpected failure for dataset {}", datasetId, e);
                IngestException wrapped = new IngestException(IngestErrorCode.STORAGE_UNAVAILABLE,
                        "Ingestion failed: " + e.getMessage(), e);
                ingestionRunService.markFailure(run, wrapped);
                throw fail(datasetId, DatasetStatus.INGESTING, wrapped.getMessage(), true, wrapped);
            }
        } finally {
            cancellationRegistry.clear(datasetId, cancelled);
        }
    }

    private RawTable openOrFail(Dataset dataset, DatasetStatus from) {
        try {
            return rawRecordStore.open(dataset);
        } catch (IngestException e) {
            throw fail(dataset.getId(), from, e.getMessage(), e.isRetryable(), e);
        }
    }

    /**
     * Moves the dataset to FAILED and returns {@code cause} for the caller to rethrow.
     */
    private <E extends RuntimeException> E fail(Long datasetId, DatasetStatus from, String message,
                                                 boolean retryable, E cause) {
        try {
            transitionService.transition(datasetId, Set.of(from), null, DatasetStatus.FAILED, message, d -> {
                d.setError(message);
                d.setRetryable(retryable);
                d.setFailedStage(from);
            });
            log.warn("[lifecycle] Dataset {} failed during {} (retryable={}): {}", datasetId, from, retryable, message);
        } catch (StaleTransitionException stale) {
            log.error("[lifecycle] Could not record failure of dataset {}: {}", datasetId, stale.getMessage());
            cause.addSuppressed(stale);
        }
        return cause;
    }
}
