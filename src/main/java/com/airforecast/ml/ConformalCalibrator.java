package com.airforecast.ml;

import com.airforecast.exception.InsufficientCalibrationDataException;

import java.util.Arrays;

/**
 * Split-conformal offsets for quantile intervals (CQR).
 *
 * <p>Each calibration example contributes, per horizon step, the conformity score
 * {@code max(low - actual, actual - high)}. The offset for a step is the
 * {@code ceil((n + 1)(1 - alpha))}-th smallest score over the n examples, floored at zero.
 */
public final class ConformalCalibrator {

    private static final double INDEX_TOLERANCE = 1e-9;

    private ConformalCalibrator() {
    }

    public static double conformityScore(double low, double high, double actual) {
        return Math.max(low - actual, actual - high);
    }

    /**
     * @param scores {@code scores[example][step]}
     * @return one non-negative offset per step
     */
    public static double[] offsets(double[][] scores, double alpha) {
        int n = scores.length;
        if (n == 0) {
            throw new InsufficientCalibrationDataException(0, 1);
        }
        int k = rank(n, alpha);
        if (k > n) {
            throw new InsufficientCalibrationDataException(n, minimumSamples(alpha));
        }
        int horizon = scores[0].length;
        double[] offsets = new double[horizon];
        double[] column = new double[n];
        for (int t = 0; t < horizon; t++) {
            for (int i = 0; i < n; i++) {
                column[i] = scores[i][t];
            }
            Arrays.sort(column);
            offsets[t] = Math.max(0.0, column[k - 1]);
        }
        return offsets;
    }

    /** 1-based rank of the finite-sample corrected quantile. */
    public static int rank(int n, double alpha) {
        return (int) Math.ceil((n + 1) * (1.0 - alpha) - INDEX_TOLERANCE);
    }

    /** Smallest n for which the corrected rank stays within the sample. */
    public static int minimumSamples(double alpha) {
        int n = 1;
        while (rank(n, alpha) > n) {
            n++;
        }
        return n;
    }
}
