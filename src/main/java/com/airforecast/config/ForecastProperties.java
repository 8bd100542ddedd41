package com.airforecast.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine configuration bound from {@code forecast.*}.
 *
 * <p>Every numeric knob the engine reads lives here; nothing in the training or
 * prediction code carries its own constant. Values are shared by all cities.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "forecast")
public class ForecastProperties {

    /** Number of hourly steps forecast per call (H). */
    @Min(1)
    private int horizonHours = 24;

    /** Lower quantile level (τ_lo) trained by the low head. */
    @DecimalMin("0.0") @DecimalMax("0.5")
    private double quantileLow = 0.05;

    /** Upper quantile level (τ_hi) trained by the high head. */
    @DecimalMin("0.5") @DecimalMax("1.0")
    private double quantileHigh = 0.95;

    /** Target miscoverage; intervals aim at 1 - alpha marginal coverage. */
    @DecimalMin("0.001") @DecimalMax("0.5")
    private double alpha = 0.10;

    @Valid
    private List<CityProperties> cities = new ArrayList<>();

    @Valid
    private Window window = new Window();

    @Valid
    private Features features = new Features();

    @Valid
    private Training training = new Training();

    @Valid
    private Evaluation evaluation = new Evaluation();

    @Valid
    private Registry registry = new Registry();

    @Valid
    private Prediction prediction = new Prediction();

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class CityProperties {
        @NotBlank
        private String id;
        private String name;
        /** Preset seed; when absent one is derived from the id. */
        private Integer seed;
    }

    @Data
    public static class Window {
        /** Window length W in hours. */
        @Min(48)
        private int hours = 720;
        /** Longest run of missing hours that may be imputed. */
        @Min(0)
        private int maxGapHours = 2;
        /** Hours between "now" and the newest hour expected in the store. */
        @Min(0)
        private int ingestionLagHours = 1;
    }

    @Data
    public static class Features {
        @NotBlank
        private String version = "no2-hourly-v1";
        /** Length of the rolling mean / variance of the target. */
        @Min(2)
        private int rollingHours = 6;
    }

    @Data
    public static class Training {
        @Min(1)
        private int epochs = 150;
        @DecimalMin("0.0000001")
        private double learningRate = 0.004;
        @Min(2)
        private int batchSize = 32;
        @Min(1)
        private int hiddenUnits = 32;
        /** Weight of the non-crossing penalty. */
        @DecimalMin("0.0")
        private double crossingPenalty = 1.0;
        @DecimalMin("0.01") @DecimalMax("0.9")
        private double calibrationFraction = 0.2;
        @Min(1)
        private int minCalibrationSamples = 50;
        /** Epochs without training-loss improvement before stopping; 0 disables. */
        @Min(0)
        private int earlyStoppingPatience = 0;
        private long baseSeed = 42L;
    }

    @Data
    public static class Evaluation {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double coverageFloor = 0.80;
        /** MAE bound in concentration units; null disables the check. */
        private Double maeCeiling = 25.0;
        @Min(1)
        private int rollingReports = 7;
        @Min(1)
        private int minSamples = 24;
    }

    @Data
    public static class Registry {
        @NotBlank
        private String directory = "./data/model-registry";
        @Min(0)
        private int retentionDays = 7;
    }

    @Data
    public static class Prediction {
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Scheduler {
        private boolean enabled = false;
        @NotBlank
        private String dailyCron = "0 30 2 * * *";
        @NotNull
        private Duration signalSweep = Duration.ofMinutes(15);
    }
}
