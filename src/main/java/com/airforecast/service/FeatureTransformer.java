package com.airforecast.service;

import com.airforecast.config.ForecastProperties;
import com.airforecast.exception.DataInsufficientException;
import com.airforecast.exception.ScalerMismatchException;
import com.airforecast.model.FeatureMatrix;
import com.airforecast.model.FeatureScaler;
import com.airforecast.model.Observation;
import com.airforecast.model.ObservationWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns an observation window into model-ready rows.
 *
 * <p>Each row describes one hour: cyclical time of day and day of week, the weather
 * covariates, wind direction as sine/cosine, and the NO2 value with two lags and a
 * rolling mean and variance. The first rows of the window, whose lags or rolling
 * statistics would reach before it, are dropped.
 */
@Service
@RequiredArgsConstructor
public class FeatureTransformer {

    public static final List<String> COLUMNS = List.of(
        "hour_sin", "hour_cos", "dow_sin", "dow_cos", "is_weekend",
        "temperature", "humidity", "wind_speed", "wind_dir_sin", "wind_dir_cos", "pressure",
        "no2", "no2_lag1", "no2_lag2", "no2_roll_mean", "no2_roll_var"
    );

    private static final int MAX_LAG = 2;
    private static final double MIN_SCALE = 1e-12;

    private final ForecastProperties properties;

    public String featureSetVersion() {
        return properties.getFeatures().getVersion();
    }

    /** Rows dropped from the start of every window. */
    public int warmupRows() {
        return Math.max(properties.getFeatures().getRollingHours() - 1, MAX_LAG);
    }

    /** Unscaled rows for the window. */
    public FeatureMatrix extract(ObservationWindow window) {
        List<Observation> obs = window.observations();
        int rolling = properties.getFeatures().getRollingHours();
        int warmup = warmupRows();
        int rows = obs.size() - warmup;
        if (rows < 1) {
            throw new DataInsufficientException(window.cityId(), window.startHour(), window.endHour(),
                "window of " + obs.size() + " hours is shorter than the feature warm-up");
        }

        double[] no2 = new double[obs.size()];
        for (int i = 0; i < obs.size(); i++) {
            no2[i] = obs.get(i).no2();
        }

        double[][] values = new double[rows][];
        double[] target = new double[rows];
        List<Instant> timestamps = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            int w = r + warmup;
            Observation o = obs.get(w);
            values[r] = row(o, no2, w, rolling);
            target[r] = no2[w];
            timestamps.add(o.observedAt());
        }
        return new FeatureMatrix(window.cityId(), featureSetVersion(), COLUMNS, timestamps, values, target, false);
    }

    /** Fits standardisation on the first {@code fitRows} rows only. */
    public FeatureScaler fit(FeatureMatrix raw, int fitRows) {
        if (fitRows < 2 || fitRows > raw.rows()) {
            throw new IllegalArgumentException("Cannot fit scaler on " + fitRows + " of " + raw.rows() + " rows");
        }
        int width = raw.width();
        double[] means = new double[width];
        double[] scales = new double[width];
        double[] column = new double[fitRows];
        for (int c = 0; c < width; c++) {
            for (int r = 0; r < fitRows; r++) {
                column[r] = raw.values()[r][c];
            }
            means[c] = mean(column, fitRows);
            scales[c] = scale(column, fitRows, means[c]);
        }
        double targetMean = mean(raw.target(), fitRows);
        double targetScale = scale(raw.target(), fitRows, targetMean);
        return new FeatureScaler(raw.featureSetVersion(), raw.columns(), means, scales, targetMean, targetScale);
    }

    /** Applies a previously fitted scaler. */
    public FeatureMatrix transform(FeatureMatrix raw, FeatureScaler scaler) {
        if (!scaler.featureSetVersion().equals(raw.featureSetVersion())
                || !scaler.columns().equals(raw.columns())) {
            throw new ScalerMismatchException(raw.featureSetVersion(), scaler.featureSetVersion());
        }
        double[][] values = new double[raw.rows()][];
        double[] target = new double[raw.rows()];
        for (int r = 0; r < raw.rows(); r++) {
            values[r] = scaler.transformRow(raw.row(r));
            target[r] = scaler.transformTarget(raw.target()[r]);
        }
        return new FeatureMatrix(raw.cityId(), raw.featureSetVersion(), raw.columns(),
            raw.timestamps(), values, target, true);
    }

    public FeatureMatrix transform(ObservationWindow window, FeatureScaler scaler) {
        if (!scaler.featureSetVersion().equals(featureSetVersion())) {
            throw new ScalerMismatchException(featureSetVersion(), scaler.featureSetVersion());
        }
        return transform(extract(window), scaler);
    }

    private static double[] row(Observation o, double[] no2, int w, int rolling) {
        ZonedDateTime t = o.observedAt().atZone(ZoneOffset.UTC);
        double hourAngle = 2 * Math.PI * t.getHour() / 24.0;
        DayOfWeek dow = t.getDayOfWeek();
        double dowAngle = 2 * Math.PI * (dow.getValue() - 1) / 7.0;
        boolean weekend = dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
        double windAngle = Math.toRadians(o.windDirection());

        double sum = 0.0;
        for (int k = w - rolling + 1; k <= w; k++) {
            sum += no2[k];
        }
        double rollMean = sum / rolling;
        double sq = 0.0;
        for (int k = w - rolling + 1; k <= w; k++) {
            double d = no2[k] - rollMean;
            sq += d * d;
        }

        return new double[] {
            Math.sin(hourAngle), Math.cos(hourAngle),
            Math.sin(dowAngle), Math.cos(dowAngle),
            weekend ? 1.0 : 0.0,
            o.temperature(), o.humidity(), o.windSpeed(),
            Math.sin(windAngle), Math.cos(windAngle),
            o.pressure(),
            no2[w], no2[w - 1], no2[w - 2],
            rollMean, sq / rolling
        };
    }

    private static double mean(double[] values, int n) {
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += values[i];
        }
        return sum / n;
    }

    private static double scale(double[] values, int n, double mean) {
        double sq = 0.0;
        for (int i = 0; i < n; i++) {
            double d = values[i] - mean;
            sq += d * d;
        }
        double std = Math.sqrt(sq / n);
        return std < MIN_SCALE ? 1.0 : std;
    }
}
