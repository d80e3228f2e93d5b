package org.monitoring.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/**
 * One metric per project, shared by every dataset that reports it.
 */
@Getter
@Setter
@Entity
@Table(name = "metric_catalog", schema = "monitoring",
        uniqueConstraints = @UniqueConstraint(name = "uq_metric_project_key", columnNames = {"project_id", "metric_key"}))
public class MetricCatalog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "metric_id", nullable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JoinColumn(name = "project_id", nullable = false)
    private Project project;

    @Column(name = "metric_key", nullable = false, length = 100)
    private String metricKey;

    @Column(name = "label", nullable = false)
    private String label;

    @Column(name = "unit", length = 50)
    private String unit;

    @Column(name = "description", length = Integer.MAX_VALUE)
    private String description;

    @ColumnDefault("false")
    @Column(name = "is_core", nullable = false)
    private Boolean isCore = false;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
