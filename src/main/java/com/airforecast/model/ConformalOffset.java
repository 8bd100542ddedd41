package com.airforecast.model;

/**
 * Per-horizon-step widening applied symmetrically to the raw quantile interval.
 * Offsets are non-negative and expressed in scaled target units.
 */
public record ConformalOffset(double[] perStep, double alpha, int calibrationSamples) {

    public double at(int step) {
        return perStep[step];
    }
}
