package org.monitoring.repository;

import org.monitoring.models.entity.DatasetTransition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DatasetTransitionRepository extends JpaRepository<DatasetTransition, Long> {

    List<DatasetTransition> findAllByDataset_IdOrderByRevisionAsc(Long datasetId);
}
