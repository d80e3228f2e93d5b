package org.monitoring.service.lifecycle;

import lombok.RequiredArgsConstructor;
import org.monitoring.exceptions.IngestException;
import org.monitoring.models.entity.Dataset;
import org.monitoring.models.entity.IngestionRun;
import org.monitoring.models.enums.IngestErrorCode;
import org.monitoring.models.enums.RunStatus;
import org.monitoring.models.mapping.ColumnMapping;
import org.monitoring.repository.IngestionRunRepository;
import org.monitoring.service.etl.IngestResult;
import org.monitoring.utils.AppUtils;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class IngestionRunService {

    private final IngestionRunRepository ingestionRunRepository;

    @Transactional
    public IngestionRun start(Dataset dataset, ColumnMapping snapshot) {
        IngestionRun run = new IngestionRun();
        run.setIngestionUid(AppUtils.generateUUID());
        run.setDataset(dataset);
        run.setRunStatus(RunStatus.RUNNING);
        run.setMappingSnapshot(snapshot.copy());
        run.setStartedAt(Instant.now());
        run.setRowsRead(0L);
        run.setRowsRejected(0L);
        run.setEntitiesWritten(0L);
        run.setReadingsWritten(0L);
        return ingestionRunRepository.save(run);
    }

    @Transactional
    public IngestionRun markSuccess(IngestionRun run, IngestResult result) {
        run.setRunStatus(RunStatus.SUCCESS);
        run.setRowsRead(result.rowsRead());
        run.setRowsRejected(result.rowsRejected());
        run.setEntitiesWritten(result.entitiesWritten());
        run.setReadingsWritten(result.readingsWritten());
        run.setReport(result.toReport());
        run.setEndedAt(Instant.now());
        run.setErrorCode(null);
        run.setErrorMessage(null);
        return ingestionRunRepository.save(run);
    }

    @Transactional
    public IngestionRun markFailure(IngestionRun run, IngestException failure) {
        run.setRunStatus(failure.getCode() == IngestErrorCode.CANCELLED ? RunStatus.CANCELLED : RunStatus.FAILED);
        run.setEndedAt(Instant.now());
        run.setErrorCode(failure.getCode());
        run.setErrorMessage(failure.getMessage());
        // nothing was committed, so the counters stay at zero
        if (!failure.getRejections().isEmpty()) {
            Map<String, Object> report = new LinkedHashMap<>();
            report.put("rejections", IngestResult.rejectionsAsMaps(failure.getRejections()));
            run.setReport(report);
        }
        return ingestionRunRepository.save(run);
    }

    /**
     * Closes RUNNING runs left behind by a process that stopped mid-ingestion.
     */
    @Transactional
    public int closeInterrupted(Long datasetId, String message) {
        List<IngestionRun> running = ingestionRunRepository.findAllByDataset_IdAndRunStatus(datasetId, RunStatus.RUNNING);
        for (IngestionRun run : running) {
            run.setRunStatus(RunStatus.FAILED);
            run.setEndedAt(Instant.now());
            run.setErrorMessage(message);
        }
        ingestionRunRepository.saveAll(running);
        return running.size();
    }

    @Transactional(readOnly = true)
    public Optional<ColumnMapping> latestSnapshot(Long datasetId) {
        return ingestionRunRepository.findFirstByDataset_IdOrderByIdDesc(datasetId)
                .map(IngestionRun::getMappingSnapshot)
                .map(ColumnMapping::copy);
    }

    @Transactional(readOnly = true)
    public List<IngestionRun> runs(Long datasetId) {
        return ingestionRunRepository.findAllByDataset_IdOrderByStartedAtDesc(datasetId);
    }
}
