package com.airforecast.model;

import java.time.Instant;
import java.util.List;

/**
 * Contiguous hourly observations for one city, oldest first, ending at {@code endHour}.
 * {@code imputedHours} counts hours that were filled in rather than observed.
 */
public record ObservationWindow(String cityId, Instant endHour, List<Observation> observations, int imputedHours) {

    public ObservationWindow {
        observations = List.copyOf(observations);
    }

    public int size() {
        return observations.size();
    }

    public Instant startHour() {
        return observations.get(0).observedAt();
    }
}
