package org.monitoring.controllers;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.monitoring.models.dto.MetricDTO;
import org.monitoring.models.dto.MetricUpdateRequest;
import org.monitoring.models.dto.ReadingDTO;
import org.monitoring.models.dto.UnifiedObjectDTO;
import org.monitoring.service.etl.MetricCatalogService;
import org.monitoring.service.query.MonitoringQueryService;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Read side of the normalized store for reporting clients.
 */
@RestController
@RequestMapping("/api/projects/{projectId}")
@RequiredArgsConstructor
public class MonitoringDataController {

    private final MonitoringQueryService queryService;
    private final MetricCatalogService metricCatalogService;

    @GetMapping("/objects")
    public Page<UnifiedObjectDTO> objects(@PathVariable Long projectId,
                                          @RequestParam(defaultValue = "0") int page,
                                          @RequestParam(defaultValue = "100") int size) {
        PageRequest pageRequest = PageRequest.of(Math.max(0, page), Math.max(1, Math.min(size, 1000)),
                Sort.by("externalId").ascending());
        return queryService.objects(projectId, pageRequest);
    }

    @GetMapping("/objects/{externalId}")
    public UnifiedObjectDTO object(@PathVariable Long projectId, @PathVariable String externalId) {
        return queryService.object(projectId, externalId);
    }

    @GetMapping("/readings")
    public List<ReadingDTO> readings(@PathVariable Long projectId,
                                     @RequestParam(required = false) String entity,
                                     @RequestParam(required = false) String metric,
                                     @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
                                     @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
                                     @RequestParam(defaultValue = "1000") int limit) {
        return queryService.readings(projectId, entity, metric, from, to, limit);
    }

    @GetMapping("/metrics")
    public List<MetricDTO> metrics(@PathVariable Long projectId) {
        return queryService.metrics(projectId);
    }

    @PutMapping("/metrics/{metricKey}")
    public MetricDTO updateMetric(@PathVariable Long projectId,
                                  @PathVariable String metricKey,
                                  @Valid @RequestBody MetricUpdateRequest request) {
        return MetricDTO.from(metricCatalogService.update(projectId, metricKey,
                request.label(), request.unit(), request.description()));
    }
}
