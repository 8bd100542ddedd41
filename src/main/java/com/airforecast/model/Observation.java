package com.airforecast.model;

import java.time.Instant;

/**
 * One hourly measurement for a city as supplied by the observation store.
 * Wind direction is in degrees; concentrations in µg/m³.
 */
public record Observation(
    String cityId,
    Instant observedAt,
    double no2,
    double temperature,
    double humidity,
    double windSpeed,
    double windDirection,
    double pressure,
    boolean valid
) {

    public Observation withTimestamp(Instant timestamp) {
        return new Observation(cityId, timestamp, no2, temperature, humidity,
            windSpeed, windDirection, pressure, valid);
    }

    public Observation withNo2(double value) {
        return new Observation(cityId, observedAt, value, temperature, humidity,
            windSpeed, windDirection, pressure, valid);
    }
}
