package com.airforecast.entity;

import com.airforecast.model.Observation;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(
    name = "no2_observations",
    uniqueConstraints = @UniqueConstraint(name = "uk_obs_city_hour", columnNames = {"city_id", "observed_at"}),
    indexes = @Index(name = "idx_obs_city_time", columnList = "city_id, observed_at")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ObservationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "city_id", nullable = false, length = 50)
    private String cityId;

    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;

    @Column(name = "no2")
    private double no2;

    private double temperature;
    private double humidity;

    @Column(name = "wind_speed")
    private double windSpeed;

    @Column(name = "wind_direction")
    private double windDirection;

    private double pressure;

    @Column(name = "is_valid", nullable = false)
    private boolean valid;

    public Observation toObservation() {
        return new Observation(cityId, observedAt, no2, temperature, humidity,
            windSpeed, windDirection, pressure, valid);
    }

    public static ObservationRecord from(Observation o) {
        return ObservationRecord.builder()
            .cityId(o.cityId())
            .observedAt(o.observedAt())
            .no2(o.no2())
            .temperature(o.temperature())
            .humidity(o.humidity())
            .windSpeed(o.windSpeed())
            .windDirection(o.windDirection())
            .pressure(o.pressure())
            .valid(o.valid())
            .build();
    }
}
