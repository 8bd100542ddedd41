package com.airforecast.model;

import java.time.Instant;
import java.util.List;

/**
 * Model-ready rows derived from a window. {@code values[row][column]} follows {@code columns};
 * {@code target[row]} is the NO2 value of the same hour, scaled or raw depending on {@code scaled}.
 */
public record FeatureMatrix(
    String cityId,
    String featureSetVersion,
    List<String> columns,
    List<Instant> timestamps,
    double[][] values,
    double[] target,
    boolean scaled
) {

    public int rows() {
        return values.length;
    }

    public int width() {
        return columns.size();
    }

    public double[] row(int index) {
        return values[index];
    }

    public Instant lastTimestamp() {
        return timestamps.get(timestamps.size() - 1);
    }
}
