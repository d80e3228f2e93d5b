package org.monitoring.service.etl;

import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.monitoring.configuration.MonitoringProperties;
import org.monitoring.exceptions.IngestException;
import org.monitoring.exceptions.MappingValidationException;
import org.monitoring.models.entity.Dataset;
import org.monitoring.models.enums.IngestErrorCode;
import org.monitoring.models.enums.IngestionMode;
import org.monitoring.models.mapping.ColumnMapping;
import org.monitoring.service.ingestion.RawRow;
import org.monitoring.service.ingestion.RawTable;
import org.monitoring.service.mapping.MappingValidator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Loads a dataset's rows into the normalized store under a confirmed mapping.
 *
 * <p>The whole run is one transaction: every accepted row becomes visible, or none does. Rows
 * are read lazily and processed in batches; parsing of a batch is parallel, writing is not.
 * Re-running the same dataset upserts onto the same keys.
 */
@Slf4j
@Service
public class EtlEngine {

    private final MappingValidator mappingValidator;
    private final TimestampParser timestampParser;
    private final NormalizedStoreWriter writer;
    private final MonitoringProperties properties;
    private final TransactionTemplate transactionTemplate;

    public EtlEngine(MappingValidator mappingValidator,
                     TimestampParser timestampParser,
                     NormalizedStoreWriter writer,
                     MonitoringProperties properties,
                     PlatformTransactionManager transactionManager) {
        this.mappingValidator = mappingValidator;
        this.timestampParser = timestampParser;
        this.writer = writer;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * @param cancelled polled between batches; a {@code true} answer aborts and rolls back the run
     * @throws IngestException when the dataset as a whole cannot be ingested
     */
    public IngestResult ingest(Dataset dataset, ColumnMapping mapping, RawTable table, BooleanSupplier cancelled) {
        ColumnMapping confirmed;
        try {
            confirmed = mappingValidator.validate(mapping, table.headers());
        } catch (MappingValidationException e) {
            throw new IngestException(IngestErrorCode.MAPPING_DRIFT,
                    "Confirmed mapping no longer matches the file: " + e.getMessage(), e);
        }

        MonitoringProperties.Ingestion settings = properties.getIngestion();
        RowTransformer transformer = new RowTransformer(confirmed, table.headers(), timestampParser,
                "dataset-" + dataset.getDatasetUid());
        log.info("[ingest] Dataset {} starting in {} mode", dataset.getId(), transformer.mode());

        try {
            return transactionTemplate.execute(status ->
                    run(dataset, confirmed, table, transformer, settings, cancelled));
        } catch (IngestException e) {
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.error("[ingest] Storage failure for dataset {}: {}", dataset.getId(), e.getMessage());
            throw new IngestException(IngestErrorCode.STORAGE_UNAVAILABLE,
                    "Normalized store unavailable: " + e.getMostSpecificCause().getMessage(), e);
        } catch (PersistenceException e) {
            log.error("[ingest] Persistence failure for dataset {}: {}", dataset.getId(), e.getMessage());
            throw new IngestException(IngestErrorCode.STORAGE_UNAVAILABLE,
                    "Normalized store unavailable: " + e.getMessage(), e);
        }
    }

    private IngestResult run(Dataset dataset, ColumnMapping mapping, RawTable table, RowTransformer transformer,
                             MonitoringProperties.Ingestion settings, BooleanSupplier cancelled) {
        IngestionMode mode = transformer.mode();
        Long projectId = dataset.getProjectId() != null ? dataset.getProjectId() : dataset.getProject().getId();
        NormalizedStoreWriter.RunState state = new NormalizedStoreWriter.RunState(
                projectId, dataset.getId(), mapping.getMetricUnit());
        RowRejectionCollector collector = new RowRejectionCollector(settings.getMaxRowErrors());
        int batchSize = Math.max(1, settings.getBatchSize());

        long rowsRead = 0;
        long rowsRejected = 0;
        List<RawRow> batch = new ArrayList<>(batchSize);
        for (RawRow row : table) {
            batch.add(row);
            if (batch.size() >= batchSize) {
                rowsRejected += processBatch(batch, transformer, collector, state, mode);
                rowsRead += batch.size();
                batch.clear();
                checkCancelled(dataset, cancelled, rowsRead);
            }
        }
        if (!batch.isEmpty()) {
            rowsRejected += processBatch(batch, transformer, collector, state, mode);
            rowsRead += batch.size();
        }

        if (rowsRead > 0 && (double) rowsRejected / rowsRead >= settings.getRejectionThreshold()) {
            throw new IngestException(IngestErrorCode.REJECTION_THRESHOLD_EXCEEDED,
                    rowsRejected + " of " + rowsRead + " rows rejected, at or above the threshold of "
                            + settings.getRejectionThreshold(), null, collector.rejections());
        }

        String summary = collector.summary().orElse(null);
        IngestResult result = new IngestResult(mode, rowsRead, rowsRejected, collector.total(),
                state.entitiesWritten(), state.readingsWritten(), collector.rejections(), summary);
        log.info("[ingest] Dataset {} read {} rows: {} entities, {} readings, {} rows with errors",
                dataset.getId(), rowsRead, result.entitiesWritten(), result.readingsWritten(), result.errorCount());
        return result;
    }

    /**
     * @return number of rows in the batch that did not contribute to the mode's primary output
     */
    private long processBatch(List<RawRow> batch, RowTransformer transformer, RowRejectionCollector collector,
                              NormalizedStoreWriter.RunState state, IngestionMode mode) {
        List<RowOutcome> outcomes = batch.parallelStream()
                .map(transformer::transform)
                .toList();

        long rejected = 0;
        for (RowOutcome outcome : outcomes) {
            if (outcome.rejected()) {
                collector.add(outcome.rejection());
            }
            boolean contributed = mode.writesReadings() ? outcome.reading() != null : outcome.entity() != null;
            if (!contributed) {
                rejected++;
            }
        }
        writer.writeBatch(state, outcomes);
        return rejected;
    }

    private void checkCancelled(Dataset dataset, BooleanSupplier cancelled, long rowsRead) {
        if (cancelled.getAsBoolean()) {
            log.warn("[ingest] Dataset {} cancelled after {} rows", dataset.getId(), rowsRead);
            throw new IngestException(IngestErrorCode.CANCELLED,
                    "Ingestion cancelled after " + rowsRead + " rows; nothing was committed");
        }
    }
}
