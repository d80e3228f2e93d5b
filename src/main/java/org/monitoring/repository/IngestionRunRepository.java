package org.monitoring.repository;

import org.monitoring.models.entity.IngestionRun;
import org.monitoring.models.enums.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface IngestionRunRepository extends JpaRepository<IngestionRun, Long> {

    List<IngestionRun> findAllByDataset_IdOrderByStartedAtDesc(Long datasetId);

    Optional<IngestionRun> findFirstByDataset_IdOrderByIdDesc(Long datasetId);

    List<IngestionRun> findAllByDataset_IdAndRunStatus(Long datasetId, RunStatus runStatus);
}
