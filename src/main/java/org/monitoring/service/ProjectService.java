package org.monitoring.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.monitoring.exceptions.ResourceNotFoundException;
import org.monitoring.models.dto.ProjectRequest;
import org.monitoring.models.entity.Project;
import org.monitoring.repository.ProjectRepository;
import org.monitoring.utils.AppUtils;
import org.monitoring.utils.ColumnNameNormalizer;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectService {

    private final ProjectRepository projectRepository;

    @Transactional
    public Project create(ProjectRequest request) {
        Project project = new Project();
        project.setProjectUid(AppUtils.generateUUID());
        project.setOwnerRef(request.ownerRef().trim());
        Instant now = Instant.now();
        project.setCreatedAt(now);
        apply(project, request);
        project.setUpdatedAt(now);
        Project saved = projectRepository.save(project);
        log.info("Created project {} ({}) for {}", saved.getId(), saved.getName(), saved.getOwnerRef());
        return saved;
    }

    @Transactional
    public Project update(Long projectId, ProjectRequest request) {
        Project project = get(projectId);
        apply(project, request);
        project.setUpdatedAt(Instant.now());
        return projectRepository.save(project);
    }

    @Transactional(readOnly = true)
    public Project get(Long projectId) {
        return projectRepository.findById(projectId)
                .orElseThrow(() -> new ResourceNotFoundException("Project not found: " + projectId));
    }

    @Transactional(readOnly = true)
    public List<Project> listForOwner(String ownerRef) {
        if (!StringUtils.hasText(ownerRef)) {
            throw new IllegalArgumentException("owner is required");
        }
        return projectRepository.findAllByOwnerRefOrderByCreatedAtDesc(ownerRef.trim());
    }

    /**
     * Public lookup; private projects are reported as not found.
     */
    @Transactional(readOnly = true)
    public Project getPublic(String slug) {
        return projectRepository.findByPublicSlugAndIsPublicTrue(slug)
                .orElseThrow(() -> new ResourceNotFoundException("Public project not found: " + slug));
    }

    private void apply(Project project, ProjectRequest request) {
        project.setName(request.name().trim());
        project.setDescription(request.description());
        boolean isPublic = Boolean.TRUE.equals(request.isPublic());
        project.setIsPublic(isPublic);

        String slug = StringUtils.hasText(request.publicSlug()) ? request.publicSlug().trim() : project.getPublicSlug();
        if (isPublic && !StringUtils.hasText(slug)) {
            slug = generateSlug(project);
        }
        if (slug != null && !Objects.equals(slug, project.getPublicSlug()) && projectRepository.existsByPublicSlug(slug)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Public slug already in use: " + slug);
        }
        project.setPublicSlug(slug);
    }

    private String generateSlug(Project project) {
        String base = ColumnNameNormalizer.slugify(project.getName()).replace('_', '-');
        if (base.isEmpty()) {
            base = "project";
        }
        if (base.length() > 70) {
            base = base.substring(0, 70);
        }
        String slug = base;
        if (projectRepository.existsByPublicSlug(slug)) {
            slug = base + "-" + project.getProjectUid().substring(0, 8);
        }
        return slug;
    }
}
