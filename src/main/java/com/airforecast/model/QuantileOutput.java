package com.airforecast.model;

/**
 * Raw trajectories produced by a {@link QuantileModel} for one input row, in scaled target units.
 */
public record QuantileOutput(double[] point, double[] low, double[] high) {

    public int horizon() {
        return point.length;
    }
}
