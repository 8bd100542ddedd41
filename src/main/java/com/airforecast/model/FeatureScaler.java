package com.airforecast.model;

import java.util.List;

/**
 * Per-city standardisation parameters fitted at training time.
 * Columns with zero spread keep a scale of 1 so they pass through centred.
 */
public record FeatureScaler(
    String featureSetVersion,
    List<String> columns,
    double[] means,
    double[] scales,
    double targetMean,
    double targetScale
) {

    public double[] transformRow(double[] raw) {
        double[] out = new double[raw.length];
        for (int c = 0; c < raw.length; c++) {
            out[c] = transformFeature(c, raw[c]);
        }
        return out;
    }

    public double transformFeature(int column, double raw) {
        return (raw - means[column]) / scales[column];
    }

    public double inverseFeature(int column, double scaled) {
        return scaled * scales[column] + means[column];
    }

    public double transformTarget(double raw) {
        return (raw - targetMean) / targetScale;
    }

    public double inverseTarget(double scaled) {
        return scaled * targetScale + targetMean;
    }
}
