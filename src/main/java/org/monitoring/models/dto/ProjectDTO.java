package org.monitoring.models.dto;

import org.monitoring.models.entity.Project;

import java.time.Instant;

public record ProjectDTO(
        Long id,
        String uid,
        String ownerRef,
        String name,
        String description,
        boolean isPublic,
        String publicSlug,
        Instant createdAt,
        Instant updatedAt
) {

    public static ProjectDTO from(Project project) {
        return new ProjectDTO(
                project.getId(),
                project.getProjectUid(),
                project.getOwnerRef(),
                project.getName(),
                project.getDescription(),
                Boolean.TRUE.equals(project.getIsPublic()),
                project.getPublicSlug(),
                project.getCreatedAt(),
                project.getUpdatedAt()
        );
    }
}
