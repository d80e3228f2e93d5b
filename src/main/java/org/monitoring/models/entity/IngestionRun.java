package org.monitoring.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.type.SqlTypes;
import org.monitoring.models.enums.IngestErrorCode;
import org.monitoring.models.enums.RunStatus;
import org.monitoring.models.mapping.ColumnMapping;

import java.time.Instant;
import java.util.Map;

@Setter
@Getter
@Entity
@Table(name = "ingestion_run", schema = "monitoring")
public class IngestionRun {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "ingestion_id", nullable = false)
    private Long id;

    @Column(name = "ingestion_uid", nullable = false, length = 40)
    private String ingestionUid;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JoinColumn(name = "dataset_id", nullable = false)
    private Dataset dataset;

    @Enumerated(EnumType.STRING)
    @ColumnDefault("'RUNNING'")
    @Column(name = "run_status", nullable = false, length = 20)
    private RunStatus runStatus;

    @Column(name = "mapping_snapshot", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private ColumnMapping mappingSnapshot;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @ColumnDefault("0")
    @Column(name = "rows_read")
    private Long rowsRead;

    @ColumnDefault("0")
    @Column(name = "rows_rejected")
    private Long rowsRejected;

    @ColumnDefault("0")
    @Column(name = "entities_written")
    private Long entitiesWritten;

    @ColumnDefault("0")
    @Column(name = "readings_written")
    private Long readingsWritten;

    @Column(name = "report")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> report;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_code", length = 40)
    private IngestErrorCode errorCode;

    @Column(name = "error_message", length = Integer.MAX_VALUE)
    private String errorMessage;
}
