package org.monitoring.controllers;

import lombok.RequiredArgsConstructor;
import org.monitoring.models.dto.ConfirmMappingRequest;
import org.monitoring.models.dto.DatasetDTO;
import org.monitoring.models.dto.DatasetTransitionDTO;
import org.monitoring.models.dto.IngestionRunDTO;
import org.monitoring.service.lifecycle.DatasetLifecycleService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/datasets")
@RequiredArgsConstructor
public class DatasetController {

    private final DatasetLifecycleService lifecycleService;

    @GetMapping("/{datasetId}")
    public DatasetDTO getDataset(@PathVariable Long datasetId) {
        return DatasetDTO.from(lifecycleService.get(datasetId));
    }

    @GetMapping("/{datasetId}/transitions")
    public List<DatasetTransitionDTO> transitions(@PathVariable Long datasetId) {
        return lifecycleService.transitions(datasetId).stream().map(DatasetTransitionDTO::from).toList();
    }

    @GetMapping("/{datasetId}/runs")
    public List<IngestionRunDTO> runs(@PathVariable Long datasetId) {
        return lifecycleService.runs(datasetId).stream().map(IngestionRunDTO::from).toList();
    }

    @PostMapping("/{datasetId}/analyze")
    public DatasetDTO analyze(@PathVariable Long datasetId) {
        return DatasetDTO.from(lifecycleService.analyze(datasetId));
    }

    @PostMapping("/{datasetId}/confirm")
    public DatasetDTO confirm(@PathVariable Long datasetId,
                              @RequestBody(required = false) ConfirmMappingRequest request) {
        return DatasetDTO.from(lifecycleService.confirm(datasetId, request));
    }

    @PostMapping("/{datasetId}/retry")
    public DatasetDTO retry(@PathVariable Long datasetId) {
        return DatasetDTO.from(lifecycleService.retry(datasetId));
    }

    @PostMapping("/{datasetId}/cancel")
    public ResponseEntity<DatasetDTO> cancel(@PathVariable Long datasetId) {
        return ResponseEntity.accepted().body(DatasetDTO.from(lifecycleService.cancel(datasetId)));
    }
}
