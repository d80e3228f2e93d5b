package org.monitoring.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.type.SqlTypes;
import org.monitoring.models.enums.DatasetStatus;
import org.monitoring.models.mapping.ColumnMapping;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Entity
@Table(name = "dataset", schema = "monitoring")
public class Dataset {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "dataset_id", nullable = false)
    private Long id;

    @Column(name = "dataset_uid", nullable = false, length = 40)
    private String datasetUid;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JoinColumn(name = "project_id", nullable = false)
    private Project project;

    @Column(name = "project_id", insertable = false, updatable = false)
    private Long projectId;

    @Column(name = "original_filename", nullable = false)
    private String originalFilename;

    @Column(name = "storage_handle", nullable = false, length = Integer.MAX_VALUE)
    private String storageHandle;

    @Column(name = "format", nullable = false, length = 10)
    private String format;

    @Column(name = "headers", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> headers = new ArrayList<>();

    @ColumnDefault("0")
    @Column(name = "row_count", nullable = false)
    private Long rowCount = 0L;

    @Enumerated(EnumType.STRING)
    @ColumnDefault("'UPLOADED'")
    @Column(name = "status", nullable = false, length = 20)
    private DatasetStatus status;

    @Column(name = "mapping")
    @JdbcTypeCode(SqlTypes.JSON)
    private ColumnMapping mapping;

    @Column(name = "error", length = Integer.MAX_VALUE)
    private String error;

    @ColumnDefault("false")
    @Column(name = "retryable", nullable = false)
    private Boolean retryable = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "failed_stage", length = 20)
    private DatasetStatus failedStage;

    @Version
    @Column(name = "revision", nullable = false)
    private Long revision;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
