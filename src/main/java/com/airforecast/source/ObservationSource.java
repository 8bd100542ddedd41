package com.airforecast.source;

import com.airforecast.model.Observation;

import java.time.Instant;
import java.util.List;

/**
 * Read access to the hourly observation store. Implementations return observations
 * for {@code [from, to]} inclusive, ordered by timestamp.
 */
public interface ObservationSource {

    List<Observation> fetch(String cityId, Instant from, Instant to);
}
