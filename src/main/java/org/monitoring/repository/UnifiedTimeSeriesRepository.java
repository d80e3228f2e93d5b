package org.monitoring.repository;

import org.monitoring.models.entity.UnifiedTimeSeries;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface UnifiedTimeSeriesRepository extends JpaRepository<UnifiedTimeSeries, Long>,
        JpaSpecificationExecutor<UnifiedTimeSeries> {

    Optional<UnifiedTimeSeries> findByUnifiedObject_IdAndMetric_IdAndObservedAt(Long objectId, Long metricId, Instant observedAt);

    List<UnifiedTimeSeries> findAllByUnifiedObject_IdInAndObservedAtIn(Collection<Long> objectIds, Collection<Instant> observedAt);

    long countByProject_Id(Long projectId);

    long countByUnifiedObject_Id(Long objectId);
}
