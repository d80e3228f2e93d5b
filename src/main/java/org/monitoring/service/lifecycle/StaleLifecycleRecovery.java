package org.monitoring.service.lifecycle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.monitoring.configuration.MonitoringProperties;
import org.monitoring.exceptions.StaleTransitionException;
import org.monitoring.models.entity.Dataset;
import org.monitoring.models.enums.DatasetStatus;
import org.monitoring.repository.DatasetRepository;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * On startup, fails datasets that were left ANALYZING or INGESTING by a stopped process so they
 * can be retried.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleLifecycleRecovery implements ApplicationRunner {

    private final DatasetRepository datasetRepository;
    private final DatasetTransitionService transitionService;
    private final IngestionRunService ingestionRunService;
    private final MonitoringProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        recover(Instant.now().minus(properties.getIngestion().getStaleAfter()));
    }

    public int recover(Instant cutoff) {
        Set<DatasetStatus> inFlight = Arrays.stream(DatasetStatus.values())
                .filter(DatasetStatus::isInFlight)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(DatasetStatus.class)));
        List<Dataset> stale = datasetRepository.findAllByStatusInAndUpdatedAtBefore(inFlight, cutoff);
        int recovered = 0;
        for (Dataset dataset : stale) {
            DatasetStatus stage = dataset.getStatus();
            String message = "Interrupted while " + stage + "; retry to continue";
            try {
                transitionService.transition(dataset.getId(), Set.of(stage), dataset.getRevision(),
                        DatasetStatus.FAILED, "interrupted", d -> {
                            d.setError(message);
                            d.setRetryable(true);
                            d.setFailedStage(stage);
                        });
                int closed = ingestionRunService.closeInterrupted(dataset.getId(), message);
                log.warn("[lifecycle] Recovered dataset {} stuck in {} ({} runs closed)", dataset.getId(), stage, closed);
                recovered++;
            } catch (StaleTransitionException e) {
                log.info("[lifecycle] Dataset {} moved on before recovery: {}", dataset.getId(), e.getMessage());
            }
        }
        return recovered;
    }
}
