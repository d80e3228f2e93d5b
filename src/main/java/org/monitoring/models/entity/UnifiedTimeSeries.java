package org.monitoring.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Entity
@Table(name = "unified_time_series", schema = "monitoring",
        uniqueConstraints = @UniqueConstraint(name = "uq_reading_object_metric_ts",
                columnNames = {"unified_object_id", "metric_id", "observed_at"}),
        indexes = {
                @Index(name = "ix_reading_project_object_ts", columnList = "project_id, unified_object_id, observed_at"),
                @Index(name = "ix_reading_project_metric_ts", columnList = "project_id, metric_id, observed_at")
        })
public class UnifiedTimeSeries {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "reading_id", nullable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JoinColumn(name = "project_id", nullable = false)
    private Project project;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JoinColumn(name = "unified_object_id", nullable = false)
    private UnifiedObject unifiedObject;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "metric_id", nullable = false)
    private MetricCatalog metric;

    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;

    @Column(name = "reading_value", nullable = false)
    private Double value;

    @Column(name = "extra", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> extra = new LinkedHashMap<>();

    @Column(name = "last_dataset_id")
    private Long lastDatasetId;

    @ColumnDefault("now()")
    @Column(name = "ingested_at", nullable = false)
    private Instant ingestedAt;
}
