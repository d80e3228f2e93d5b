package org.monitoring.controllers;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.monitoring.models.dto.DatasetDTO;
import org.monitoring.models.dto.ProjectDTO;
import org.monitoring.models.dto.ProjectRequest;
import org.monitoring.models.dto.ProjectSummaryDTO;
import org.monitoring.service.ProjectService;
import org.monitoring.service.lifecycle.DatasetLifecycleService;
import org.monitoring.service.query.MonitoringQueryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ProjectController {

    private final ProjectService projectService;
    private final DatasetLifecycleService lifecycleService;
    private final MonitoringQueryService queryService;

    @PostMapping("/projects")
    public ResponseEntity<ProjectDTO> createProject(@Valid @RequestBody ProjectRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ProjectDTO.from(projectService.create(request)));
    }

    @GetMapping("/projects")
    public List<ProjectDTO> listProjects(@RequestParam("owner") String owner) {
        return projectService.listForOwner(owner).stream().map(ProjectDTO::from).toList();
    }

    @GetMapping("/projects/{projectId}")
    public ProjectDTO getProject(@PathVariable Long projectId) {
        return ProjectDTO.from(projectService.get(projectId));
    }

    @PutMapping("/projects/{projectId}")
    public ProjectDTO updateProject(@PathVariable Long projectId, @Valid @RequestBody ProjectRequest request) {
        return ProjectDTO.from(projectService.update(projectId, request));
    }

    @GetMapping("/public/projects/{slug}")
    public ProjectSummaryDTO publicProject(@PathVariable String slug) {
        return queryService.summary(projectService.getPublic(slug));
    }

    @PostMapping("/projects/{projectId}/datasets")
    public ResponseEntity<DatasetDTO> uploadDataset(@PathVariable Long projectId,
                                                    @RequestParam("file") MultipartFile file) {
        log.info("[upload] Received {} for project {}", file.getOriginalFilename(), projectId);
        return ResponseEntity.status(HttpStatus.CREATED).body(DatasetDTO.from(lifecycleService.upload(projectId, file)));
    }

    @GetMapping("/projects/{projectId}/datasets")
    public List<DatasetDTO> listDatasets(@PathVariable Long projectId) {
        return lifecycleService.list(projectId).stream().map(DatasetDTO::from).toList();
    }
}
