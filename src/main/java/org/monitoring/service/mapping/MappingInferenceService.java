package org.monitoring.service.mapping;

import lombok.extern.slf4j.Slf4j;
import org.monitoring.configuration.MonitoringProperties;
import org.monitoring.exceptions.InferenceUnavailableException;
import org.monitoring.models.enums.CanonicalRole;
import org.monitoring.models.enums.ColumnClassification;
import org.monitoring.models.enums.MappingOrigin;
import org.monitoring.models.mapping.ColumnMapping;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Produces a mapping proposal for a dataset. Pure with respect to stored state: the caller
 * persists the result.
 */
@Slf4j
@Service
public class MappingInferenceService {

    public static final int MAX_SAMPLE_ROWS = 10;

    private final MappingInferenceClient client;
    private final AsyncTaskExecutor inferenceExecutor;
    private final MonitoringProperties properties;

    public MappingInferenceService(MappingInferenceClient client,
                                   @Qualifier("inferenceExecutor") AsyncTaskExecutor inferenceExecutor,
                                   MonitoringProperties properties) {
        this.client = client;
        this.inferenceExecutor = inferenceExecutor;
        this.properties = properties;
    }

    public ColumnMapping propose(List<String> headers, List<Map<String, String>> sampleRows) {
        return propose(headers, sampleRows, properties.getInference().getSampleRows(), properties.getInference().getTimeout());
    }

    /**
     * Proposes a mapping from at most {@code rowLimit} sample rows (never more than ten).
     * An unusable answer yields {@link ColumnMapping#fallback(List)}.
     *
     * @throws InferenceUnavailableException when the capability is unreachable or exceeds {@code timeout}
     */
    public ColumnMapping propose(List<String> headers, List<Map<String, String>> sampleRows, int rowLimit, Duration timeout) {
        int limit = Math.max(0, Math.min(Math.min(rowLimit, MAX_SAMPLE_ROWS), sampleRows.size()));
        List<Map<String, String>> sample = List.copyOf(sampleRows.subList(0, limit));
        List<String> columns = List.copyOf(headers);

        ColumnMapping raw;
        Future<ColumnMapping> future;
        try {
            future = inferenceExecutor.submit(() -> client.propose(columns, sample));
        } catch (TaskRejectedException e) {
            throw new InferenceUnavailableException("Mapping inference is saturated, try again later", e);
        }
        try {
            raw = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[inference] {} did not answer within {}", client.name(), timeout);
            throw new InferenceUnavailableException("Mapping inference timed out after " + timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new InferenceUnavailableException("Interrupted while waiting for mapping inference", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InferenceUnavailableException unavailable) {
                throw unavailable;
            }
            log.warn("[inference] {} returned an unusable answer, falling back: {}", client.name(),
                    cause != null ? cause.getMessage() : e.getMessage());
            return ColumnMapping.fallback(columns);
        }

        return sanitize(raw, columns).orElseGet(() -> {
            log.info("[inference] {} proposal referenced no known column, falling back", client.name());
            return ColumnMapping.fallback(columns);
        });
    }

    /**
     * Drops references to unknown columns and second references to an already used column.
     * Empty when nothing in the proposal refers to a real column.
     */
    Optional<ColumnMapping> sanitize(ColumnMapping proposal, List<String> headers) {
        if (proposal == null) {
            return Optional.empty();
        }
        Set<String> known = new LinkedHashSet<>(headers);
        Set<String> used = new HashSet<>();
        ColumnMapping clean = new ColumnMapping();
        clean.setOrigin(proposal.getOrigin() == MappingOrigin.USER ? MappingOrigin.INFERRED : proposal.getOrigin());
        clean.setDefaultMetricName(proposal.getDefaultMetricName());
        clean.setMetricUnit(proposal.getMetricUnit());

        boolean anyKnown = false;
        for (CanonicalRole role : CanonicalRole.values()) {
            Optional<String> column = proposal.column(role);
            double score = clamp(proposal.getConfidence() == null ? null : proposal.getConfidence().get(role));
            if (column.isPresent() && known.contains(column.get()) && used.add(column.get())) {
                clean.assign(role, column.get());
                clean.getConfidence().put(role, score);
                anyKnown = true;
            } else {
                if (column.isPresent()) {
                    log.debug("[inference] Dropping {} -> {} from proposal", role, column.get());
                }
                clean.getConfidence().put(role, 0.0);
            }
        }

        Map<String, ColumnClassification> proposed = proposal.getClassifications();
        for (String header : headers) {
            if (used.contains(header)) {
                continue;
            }
            ColumnClassification classification = proposed == null ? null : proposed.get(header);
            if (classification != null) {
                anyKnown = true;
            }
            clean.getClassifications().put(header, classification != null ? classification : ColumnClassification.TEXT);
        }
        return anyKnown ? Optional.of(clean) : Optional.empty();
    }

    private double clamp(Double value) {
        if (value == null || value.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
