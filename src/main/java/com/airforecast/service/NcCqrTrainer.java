package com.airforecast.service;

import com.airforecast.config.ForecastProperties;
import com.airforecast.exception.DataInsufficientException;
import com.airforecast.exception.InsufficientCalibrationDataException;
import com.airforecast.exception.TrainingCancelledException;
import com.airforecast.exception.TrainingDivergedException;
import com.airforecast.ml.ConformalCalibrator;
import com.airforecast.ml.NonCrossingQuantileLoss;
import com.airforecast.ml.QuantileNetwork;
import com.airforecast.model.ConformalOffset;
import com.airforecast.model.FeatureMatrix;
import com.airforecast.model.FeatureScaler;
import com.airforecast.model.ObservationWindow;
import com.airforecast.model.QuantileModel;
import com.airforecast.model.QuantileOutput;
import com.airforecast.model.TrainingDiagnostics;
import com.airforecast.model.TrainingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.deeplearning4j.nn.graph.ComputationGraph;
import org.nd4j.linalg.dataset.DataSet;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Random;

/**
 * Non-crossing conformalized quantile regression for one city.
 *
 * <p>Every hour of the feature matrix that has a full horizon after it becomes one
 * example: its scaled feature row is the input, the next H scaled NO2 values the
 * target. Examples are split chronologically into a training part and a trailing
 * calibration part, separated by H embargoed examples whose targets would overlap
 * the calibration inputs. The scaler only sees rows used by training examples.
 *
 * <p>The network is a DL4J graph fitted with mini-batch Adam on pinball loss plus the
 * crossing penalty, fed in an order shuffled by the run's seeded {@link Random}. The
 * calibration part then yields one conformal offset per horizon step.
 * The run checks the thread's interrupt flag between epochs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NcCqrTrainer {

    private static final int PROGRESS_LOG_EVERY = 50;

    private final FeatureTransformer featureTransformer;
    private final ReproducibilityService reproducibility;
    private final ForecastProperties properties;

    public TrainingResult train(ObservationWindow window, long seed) {
        String cityId = window.cityId();
        ForecastProperties.Training cfg = properties.getTraining();
        int horizon = properties.getHorizonHours();

        FeatureMatrix raw = featureTransformer.extract(window);
        int examples = raw.rows() - horizon;
        if (examples < 1) {
            throw new DataInsufficientException(cityId, window.startHour(), window.endHour(),
                "window yields no example with a full " + horizon + "-hour horizon");
        }
        int calibration = (int) Math.round(examples * cfg.getCalibrationFraction());
        if (calibration < cfg.getMinCalibrationSamples()) {
            throw new InsufficientCalibrationDataException(calibration, cfg.getMinCalibrationSamples());
        }
        int calibrationStart = examples - calibration;
        int trainCount = calibrationStart - horizon;
        if (trainCount < 2) {
            throw new DataInsufficientException(cityId, window.startHour(), window.endHour(),
                "only " + trainCount + " training examples after the calibration split");
        }

        FeatureScaler scaler = featureTransformer.fit(raw, calibrationStart);
        FeatureMatrix scaled = featureTransformer.transform(raw, scaler);
        double[][] x = scaled.values();
        double[] y = scaled.target();

        log.info("Training started | city={} | seed={} | trainExamples={} | calibrationExamples={} | epochs={}",
                 cityId, seed, trainCount, calibration, cfg.getEpochs());

        Random random = reproducibility.newRandom(seed);
        NonCrossingQuantileLoss loss = new NonCrossingQuantileLoss(
            properties.getQuantileLow(), properties.getQuantileHigh(), cfg.getCrossingPenalty(), horizon);
        ComputationGraph network = QuantileNetwork.build(raw.width(), cfg.getHiddenUnits(), loss,
            cfg.getLearningRate(), seed);
        QuantileModel model = new QuantileModel(scaler.featureSetVersion(), horizon,
            properties.getQuantileLow(), properties.getQuantileHigh(), network);

        double lastLoss = Double.NaN;
        double best = Double.POSITIVE_INFINITY;
        int sinceImprovement = 0;
        int epochsRun = 0;
        int[] order = new int[trainCount];
        for (int i = 0; i < trainCount; i++) {
            order[i] = i;
        }

        for (int epoch = 1; epoch <= cfg.getEpochs(); epoch++) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Training cancelled | city={} | epoch={}", cityId, epoch);
                throw new TrainingCancelledException(cityId);
            }
            shuffle(order, random);
            lastLoss = runEpoch(network, x, y, order, Math.min(cfg.getBatchSize(), trainCount), horizon);
            epochsRun = epoch;
            if (!Double.isFinite(lastLoss) || !QuantileNetwork.isFinite(network)) {
                throw new TrainingDivergedException(cityId, epoch);
            }
            if (epoch % PROGRESS_LOG_EVERY == 0) {
                log.debug("Epoch {} | city={} | loss={}", epoch, cityId, lastLoss);
            }
            if (cfg.getEarlyStoppingPatience() > 0) {
                if (lastLoss < best) {
                    best = lastLoss;
                    sinceImprovement = 0;
                } else if (++sinceImprovement >= cfg.getEarlyStoppingPatience()) {
                    log.info("Early stop | city={} | epoch={} | bestLoss={}", cityId, epoch, best);
                    break;
                }
            }
        }

        double meanCrossing = meanCrossing(model.forward(Arrays.copyOfRange(x, 0, trainCount)));

        QuantileOutput[] calibrationOutputs = model.forward(Arrays.copyOfRange(x, calibrationStart, examples));
        double[][] scores = new double[calibration][horizon];
        for (int c = 0; c < calibration; c++) {
            int origin = calibrationStart + c;
            for (int t = 0; t < horizon; t++) {
                double actual = y[origin + 1 + t];
                scores[c][t] = ConformalCalibrator.conformityScore(
                    calibrationOutputs[c].low()[t], calibrationOutputs[c].high()[t], actual);
            }
        }
        double[] offsets = ConformalCalibrator.offsets(scores, properties.getAlpha());
        double coverage = calibrationCoverage(calibrationOutputs, offsets, y, calibrationStart);

        String fingerprint = reproducibility.fingerprint(model.parameters());
        TrainingDiagnostics diagnostics = new TrainingDiagnostics(epochsRun, lastLoss, meanCrossing,
            trainCount, calibration, coverage, seed, fingerprint);

        log.info("Training finished | city={} | epochs={} | loss={} | calibrationCoverage={} | meanOffset={} | fingerprint={}",
                 cityId, epochsRun, lastLoss, coverage, Arrays.stream(offsets).average().orElse(0.0),
                 fingerprint.substring(0, 12));
        return new TrainingResult(cityId, model,
            new ConformalOffset(offsets, properties.getAlpha(), calibration), scaler, diagnostics);
    }

    /** One pass over full mini-batches; returns the mean batch score. */
    private static double runEpoch(ComputationGraph network, double[][] x, double[] y, int[] order,
                                   int batchSize, int horizon) {
        int batches = order.length / batchSize;
        double scoreSum = 0.0;
        for (int b = 0; b < batches; b++) {
            double[][] features = new double[batchSize][];
            double[][] targets = new double[batchSize][horizon];
            for (int j = 0; j < batchSize; j++) {
                int origin = order[b * batchSize + j];
                features[j] = x[origin];
                System.arraycopy(y, origin + 1, targets[j], 0, horizon);
            }
            DataSet batch = new DataSet(QuantileNetwork.features(features), QuantileNetwork.labels(targets, horizon));
            network.fit(batch);
            scoreSum += network.score();
        }
        return scoreSum / batches;
    }

    private static double meanCrossing(QuantileOutput[] outputs) {
        double sum = 0.0;
        int n = 0;
        for (QuantileOutput out : outputs) {
            for (int t = 0; t < out.horizon(); t++) {
                sum += Math.max(0.0, out.low()[t] - out.high()[t]);
                n++;
            }
        }
        return sum / n;
    }

    private static double calibrationCoverage(QuantileOutput[] outputs, double[] offsets,
                                              double[] y, int calibrationStart) {
        int covered = 0;
        int total = 0;
        for (int c = 0; c < outputs.length; c++) {
            for (int t = 0; t < offsets.length; t++) {
                double actual = y[calibrationStart + c + 1 + t];
                if (actual >= outputs[c].low()[t] - offsets[t] && actual <= outputs[c].high()[t] + offsets[t]) {
                    covered++;
                }
                total++;
            }
        }
        return (double) covered / total;
    }

    private static void shuffle(int[] order, Random random) {
        for (int i = order.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
    }
}
