package org.monitoring.repository;

import org.monitoring.models.entity.UnifiedObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface UnifiedObjectRepository extends JpaRepository<UnifiedObject, Long> {

    Optional<UnifiedObject> findByProject_IdAndExternalId(Long projectId, String externalId);

    List<UnifiedObject> findAllByProject_IdAndExternalIdIn(Long projectId, Collection<String> externalIds);

    Page<UnifiedObject> findByProject_Id(Long projectId, Pageable pageable);

    long countByProject_Id(Long projectId);
}
