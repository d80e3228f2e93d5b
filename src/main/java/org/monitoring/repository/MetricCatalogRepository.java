package org.monitoring.repository;

import org.monitoring.models.entity.MetricCatalog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MetricCatalogRepository extends JpaRepository<MetricCatalog, Long> {

    Optional<MetricCatalog> findByProject_IdAndMetricKey(Long projectId, String metricKey);

    List<MetricCatalog> findAllByProject_IdOrderByMetricKeyAsc(Long projectId);

    long countByProject_Id(Long projectId);
}
