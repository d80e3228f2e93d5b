package org.monitoring.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.monitoring.models.enums.DatasetStatus;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "dataset_transition", schema = "monitoring")
public class DatasetTransition {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "dataset_transition_id", nullable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JoinColumn(name = "dataset_id", nullable = false)
    private Dataset dataset;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", length = 20)
    private DatasetStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false, length = 20)
    private DatasetStatus toStatus;

    @Column(name = "revision", nullable = false)
    private Long revision;

    @Column(name = "message", length = Integer.MAX_VALUE)
    private String message;

    @ColumnDefault("now()")
    @Column(name = "transitioned_at", nullable = false)
    private Instant transitionedAt;
}
