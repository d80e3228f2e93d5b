package org.monitoring.repository;

import org.monitoring.models.entity.Project;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProjectRepository extends JpaRepository<Project, Long> {

    List<Project> findAllByOwnerRefOrderByCreatedAtDesc(String ownerRef);

    Optional<Project> findByPublicSlugAndIsPublicTrue(String publicSlug);

    boolean existsByPublicSlug(String publicSlug);
}
