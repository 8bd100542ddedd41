package com.airforecast.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(
    name = "prediction_records",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_pred_city_asof_version", columnNames = {"city_id", "as_of", "model_version"}),
    indexes = {
        @Index(name = "idx_pred_city_asof", columnList = "city_id, as_of"),
        @Index(name = "idx_pred_version",   columnList = "model_version"),
        @Index(name = "idx_pred_created",   columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PredictionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "city_id", nullable = false, length = 50)
    private String cityId;

    /** Newest observed hour the forecast was conditioned on. */
    @Column(name = "as_of", nullable = false)
    private Instant asOf;

    @Column(name = "model_version", nullable = false, length = 80)
    private String modelVersion;

    @Column(name = "generated_at", nullable = false)
    private Instant generatedAt;

    @Column(name = "imputed_hours")
    private int imputedHours;

    private boolean evaluated;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "prediction_steps", joinColumns = @JoinColumn(name = "prediction_id"))
    @OrderColumn(name = "step_index")
    private List<ForecastStep> steps = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "request_id", length = 64)
    private String requestId;
}
