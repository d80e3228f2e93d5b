package org.monitoring.repository;

import org.monitoring.models.entity.Dataset;
import org.monitoring.models.enums.DatasetStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface DatasetRepository extends JpaRepository<Dataset, Long> {

    List<Dataset> findAllByProject_IdOrderByCreatedAtDesc(Long projectId);

    List<Dataset> findAllByStatusInAndUpdatedAtBefore(Collection<DatasetStatus> statuses, Instant cutoff);
}
