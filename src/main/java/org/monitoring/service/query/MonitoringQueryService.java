package org.monitoring.service.query;

import jakarta.persistence.criteria.JoinType;
import lombok.RequiredArgsConstructor;
import org.monitoring.exceptions.ResourceNotFoundException;
import org.monitoring.models.dto.MetricDTO;
import org.monitoring.models.dto.ProjectDTO;
import org.monitoring.models.dto.ProjectSummaryDTO;
import org.monitoring.models.dto.ReadingDTO;
import org.monitoring.models.dto.UnifiedObjectDTO;
import org.monitoring.models.entity.Project;
import org.monitoring.models.entity.UnifiedTimeSeries;
import org.monitoring.repository.MetricCatalogRepository;
import org.monitoring.repository.ProjectRepository;
import org.monitoring.repository.UnifiedObjectRepository;
import org.monitoring.repository.UnifiedTimeSeriesRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.List;

/**
 * Read-only access to the normalized store, scoped by project.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class MonitoringQueryService {

    public static final int MAX_READINGS = 10_000;

    private final ProjectRepository projectRepository;
    private final UnifiedObjectRepository unifiedObjectRepository;
    private final UnifiedTimeSeriesRepository unifiedTimeSeriesRepository;
    private final MetricCatalogRepository metricCatalogRepository;

    public Page<UnifiedObjectDTO> objects(Long projectId, Pageable pageable) {
        requireProject(projectId);
        return unifiedObjectRepository.findByProject_Id(projectId, pageable).map(UnifiedObjectDTO::from);
    }

    public UnifiedObjectDTO object(Long projectId, String externalId) {
        requireProject(projectId);
        return unifiedObjectRepository.findByProject_IdAndExternalId(projectId, externalId)
                .map(UnifiedObjectDTO::from)
                .orElseThrow(() -> new ResourceNotFoundException("Object not found: " + externalId));
    }

    /**
     * Readings ordered by time, optionally narrowed by entity, metric key and a half-open
     * {@code [from, to)} interval.
     */
    public List<ReadingDTO> readings(Long projectId, String entity, String metric, Instant from, Instant to, int limit) {
        requireProject(projectId);
        if (from != null && to != null && !from.isBefore(to)) {
            throw new IllegalArgumentException("'from' must be before 'to'");
        }
        Specification<UnifiedTimeSeries> spec = inProject(projectId);
        if (StringUtils.hasText(entity)) {
            spec = spec.and((root, query, cb) ->
                    cb.equal(root.join("unifiedObject", JoinType.INNER).get("externalId"), entity));
        }
        if (StringUtils.hasText(metric)) {
            spec = spec.and((root, query, cb) ->
                    cb.equal(root.join("metric", JoinType.INNER).get("metricKey"), metric));
        }
        if (from != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.get("observedAt"), from));
        }
        if (to != null) {
            spec = spec.and((root, query, cb) -> cb.lessThan(root.get("observedAt"), to));
        }
        int size = Math.max(1, Math.min(limit, MAX_READINGS));
        return unifiedTimeSeriesRepository.findAll(spec, PageRequest.of(0, size, Sort.by("observedAt").ascending()))
                .map(ReadingDTO::from)
                .getContent();
    }

    public List<MetricDTO> metrics(Long projectId) {
        requireProject(projectId);
        return metricCatalogRepository.findAllByProject_IdOrderByMetricKeyAsc(projectId).stream()
                .map(MetricDTO::from)
                .toList();
    }

    public ProjectSummaryDTO summary(Project project) {
        return new ProjectSummaryDTO(
                ProjectDTO.from(project),
                unifiedObjectRepository.countByProject_Id(project.getId()),
                unifiedTimeSeriesRepository.countByProject_Id(project.getId()),
                metricCatalogRepository.countByProject_Id(project.getId())
        );
    }

    private Specification<UnifiedTimeSeries> inProject(Long projectId) {
        return (root, query, cb) -> cb.equal(root.get("project").get("id"), projectId);
    }

    private void requireProject(Long projectId) {
        if (!projectRepository.existsById(projectId)) {
            throw new ResourceNotFoundException("Project not found: " + projectId);
        }
    }
}
