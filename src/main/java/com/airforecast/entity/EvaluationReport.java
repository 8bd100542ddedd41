package com.airforecast.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Accuracy of one stored forecast against realised observations. Metrics are null
 * when no horizon step could be matched.
 */
@Entity
@Table(
    name = "evaluation_reports",
    indexes = @Index(name = "idx_eval_city_time", columnList = "city_id, evaluated_at")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluationReport {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "city_id", nullable = false, length = 50)
    private String cityId;

    @Column(name = "prediction_id", nullable = false)
    private UUID predictionId;

    @Column(name = "model_version", nullable = false, length = 80)
    private String modelVersion;

    @Column(name = "evaluated_at", nullable = false)
    private Instant evaluatedAt;

    @Column(name = "sample_count")
    private int sampleCount;

    private Double mae;
    private Double rmse;
    private Double coverage;

    @Column(name = "mean_interval_width")
    private Double meanIntervalWidth;
}
