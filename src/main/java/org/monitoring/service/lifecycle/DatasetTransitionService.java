package org.monitoring.service.lifecycle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.monitoring.exceptions.ResourceNotFoundException;
import org.monitoring.exceptions.StaleTransitionException;
import org.monitoring.models.entity.Dataset;
import org.monitoring.models.entity.DatasetTransition;
import org.monitoring.models.enums.DatasetStatus;
import org.monitoring.repository.DatasetRepository;
import org.monitoring.repository.DatasetTransitionRepository;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * The only writer of {@link Dataset#getStatus()}. Each call is a short transaction guarded by the
 * expected pre-states, an optional expected revision and the entity's JPA version.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetTransitionService {

    private final DatasetRepository datasetRepository;
    private final DatasetTransitionRepository datasetTransitionRepository;

    /**
     * @param expectedFrom     statuses the dataset must currently be in
     * @param expectedRevision revision the caller last saw, or null to skip the check
     * @param mutation         changes applied together with the status change
     * @throws StaleTransitionException when the dataset moved on or a concurrent transition won
     */
    @Transactional
    public Dataset transition(Long datasetId,
                              Set<DatasetStatus> expectedFrom,
                              Long expectedRevision,
                              DatasetStatus to,
                              String message,
                              Consumer<Dataset> mutation) {
        Dataset dataset = datasetRepository.findById(datasetId)
                .orElseThrow(() -> new ResourceNotFoundException("Dataset not found: " + datasetId));
        DatasetStatus from = dataset.getStatus();
        Long revision = dataset.getRevision();

        if (!expectedFrom.contains(from)) {
            throw new StaleTransitionException(datasetId, from, revision,
                    "Dataset " + datasetId + " is " + from + ", expected one of " + expectedFrom);
        }
        if (expectedRevision != null && !Objects.equals(expectedRevision, revision)) {
            throw new StaleTransitionException(datasetId, from, revision,
                    "Dataset " + datasetId + " is at revision " + revision + ", expected " + expectedRevision);
        }
        if (!DatasetStateMachine.canTransition(from, Boolean.TRUE.equals(dataset.getRetryable()), to)) {
            throw new StaleTransitionException(datasetId, from, revision,
                    "Dataset " + datasetId + " cannot move from " + describe(dataset) + " to " + to);
        }

        mutation.accept(dataset);
        dataset.setStatus(to);
        if (to != DatasetStatus.FAILED) {
            dataset.setError(null);
            dataset.setRetryable(false);
            dataset.setFailedStage(null);
        } else if (dataset.getFailedStage() == null) {
            dataset.setFailedStage(from);
        }
        // a failure keeps the mapping it failed with so a confirmed one can be re-ingested
        if (!to.holdsMapping() && to != DatasetStatus.FAILED) {
            dataset.setMapping(null);
        }
        dataset.setUpdatedAt(Instant.now());

        Dataset saved;
        try {
            saved = datasetRepository.saveAndFlush(dataset);
        } catch (ConcurrencyFailureException e) {
            throw new StaleTransitionException(datasetId, from, revision,
                    "Dataset " + datasetId + " was changed concurrently while moving to " + to);
        }

        DatasetTransition transition = new DatasetTransition();
        transition.setDataset(saved);
        transition.setFromStatus(from);
        transition.setToStatus(to);
        transition.setRevision(saved.getRevision());
        transition.setMessage(message);
        transition.setTransitionedAt(saved.getUpdatedAt());
        datasetTransitionRepository.save(transition);

        log.info("[lifecycle] Dataset {} {} -> {} (revision {})", datasetId, from, to, saved.getRevision());
        return saved;
    }

    /**
     * Records the creation of a dataset as its first audit row.
     */
    @Transactional
    public void recordCreated(Dataset dataset) {
        DatasetTransition transition = new DatasetTransition();
        transition.setDataset(dataset);
        transition.setFromStatus(null);
        transition.setToStatus(dataset.getStatus());
        transition.setRevision(dataset.getRevision());
        transition.setMessage("uploaded " + dataset.getOriginalFilename());
        transition.setTransitionedAt(dataset.getCreatedAt());
        datasetTransitionRepository.save(transition);
    }

    private String describe(Dataset dataset) {
        if (dataset.getStatus() == DatasetStatus.FAILED) {
            return Boolean.TRUE.equals(dataset.getRetryable()) ? "FAILED(retryable)" : "FAILED(permanent)";
        }
        return dataset.getStatus().name();
    }
}
