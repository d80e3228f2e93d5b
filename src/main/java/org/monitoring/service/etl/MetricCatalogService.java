package org.monitoring.service.etl;

import lombok.extern.slf4j.Slf4j;
import org.monitoring.exceptions.ResourceNotFoundException;
import org.monitoring.models.entity.MetricCatalog;
import org.monitoring.models.entity.Project;
import org.monitoring.repository.MetricCatalogRepository;
import org.monitoring.repository.ProjectRepository;
import org.monitoring.utils.ColumnNameNormalizer;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Per-project metric identity. Entries are created in their own short transactions so a
 * concurrent creator of the same key is resolved by re-reading instead of failing the caller.
 */
@Slf4j
@Service
public class MetricCatalogService {

    static final int MAX_KEY_LENGTH = 100;

    private static final Pattern UNICODE_NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final MetricCatalogRepository metricCatalogRepository;
    private final ProjectRepository projectRepository;
    private final TransactionTemplate requiresNew;

    public MetricCatalogService(MetricCatalogRepository metricCatalogRepository,
                                ProjectRepository projectRepository,
                                PlatformTransactionManager transactionManager) {
        this.metricCatalogRepository = metricCatalogRepository;
        this.projectRepository = projectRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Lowercase slug of the name over Unicode letters and digits. Names with no letters or
     * digits, and names whose slug does not fit {@value #MAX_KEY_LENGTH} characters, get a
     * hash suffix of the trimmed name so distinct names never share a key.
     */
    public static String metricKey(String metricName) {
        String trimmed = metricName == null ? "" : metricName.trim();
        String slug = ColumnNameNormalizer.slugify(trimmed, UNICODE_NON_ALPHANUMERIC);
        if (slug.isEmpty()) {
            return "metric_" + shortHash(trimmed);
        }
        if (slug.length() > MAX_KEY_LENGTH) {
            String suffix = "_" + shortHash(trimmed);
            return slug.substring(0, MAX_KEY_LENGTH - suffix.length()) + suffix;
        }
        return slug;
    }

    private static String shortHash(String value) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 digest algorithm not available", e);
        }
    }

    /**
     * Returns the id of the catalog entry for {@code metricName}, creating it on first encounter.
     */
    public Long resolve(Long projectId, String metricName, String unit) {
        String key = metricKey(metricName);
        try {
            return requiresNew.execute(status -> metricCatalogRepository.findByProject_IdAndMetricKey(projectId, key)
                    .map(MetricCatalog::getId)
                    .orElseGet(() -> create(projectId, key, metricName, unit)));
        } catch (DataIntegrityViolationException conflict) {
            log.debug("[ingest] Metric {} created concurrently in project {}, re-reading", key, projectId);
            return requiresNew.execute(status -> metricCatalogRepository.findByProject_IdAndMetricKey(projectId, key)
                    .map(MetricCatalog::getId)
                    .orElseThrow(() -> conflict));
        }
    }

    @Transactional(readOnly = true)
    public List<MetricCatalog> list(Long projectId) {
        return metricCatalogRepository.findAllByProject_IdOrderByMetricKeyAsc(projectId);
    }

    @Transactional
    public MetricCatalog update(Long projectId, String metricKey, String label, String unit, String description) {
        MetricCatalog metric = metricCatalogRepository.findByProject_IdAndMetricKey(projectId, metricKey)
                .orElseThrow(() -> new ResourceNotFoundException("Metric not found: " + metricKey));
        if (label != null && !label.isBlank()) {
            metric.setLabel(label.trim());
        }
        if (unit != null) {
            metric.setUnit(unit.isBlank() ? null : unit.trim());
        }
        if (description != null) {
            metric.setDescription(description.isBlank() ? null : description.trim());
        }
        return metricCatalogRepository.save(metric);
    }

    private Long create(Long projectId, String key, String metricName, String unit) {
        Project project = projectRepository.getReferenceById(projectId);
        MetricCatalog metric = new MetricCatalog();
        metric.setProject(project);
        metric.setMetricKey(key);
        String label = metricName.trim();
        metric.setLabel(label.length() > 255 ? label.substring(0, 255) : label);
        metric.setUnit(unit);
        metric.setIsCore(false);
        metric.setCreatedAt(Instant.now());
        MetricCatalog saved = metricCatalogRepository.saveAndFlush(metric);
        log.info("[ingest] Registered metric {} in project {}", key, projectId);
        return saved.getId();
    }
}
