package com.airforecast.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.time.Instant;

/**
 * One horizon step of a stored forecast, in concentration units.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ForecastStep {

    @Column(name = "target_time", nullable = false)
    private Instant targetTime;

    @Column(name = "point_value", nullable = false)
    private double point;

    @Column(name = "lower_bound", nullable = false)
    private double lower;

    @Column(name = "upper_bound", nullable = false)
    private double upper;
}
