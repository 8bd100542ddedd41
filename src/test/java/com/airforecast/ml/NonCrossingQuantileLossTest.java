package com.airforecast.ml;

import org.junit.jupiter.api.Test;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.activations.IActivation;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class NonCrossingQuantileLossTest {

    private static final IActivation IDENTITY = Activation.IDENTITY.getActivationFunction();

    @Test
    void pinball_weightsUnderAndOverPredictionByQuantileLevel() {
        assertThat(NonCrossingQuantileLoss.pinball(0.9, 10.0, 8.0)).isCloseTo(1.8, within(1e-12));
        assertThat(NonCrossingQuantileLoss.pinball(0.9, 10.0, 12.0)).isCloseTo(0.2, within(1e-12));
        assertThat(NonCrossingQuantileLoss.pinball(0.5, 3.0, 3.0)).isZero();
    }

    @Test
    void computeScoreArray_orderedHeads_isMeanPinballOverHorizon() {
        NonCrossingQuantileLoss loss = new NonCrossingQuantileLoss(0.05, 0.95, 2.0, 2);
        INDArray output = row(1.0, 1.0, 0.0, 0.0, 2.0, 2.0);
        INDArray labels = row(1.5, 0.5, 1.5, 0.5, 1.5, 0.5);

        double expected = (NonCrossingQuantileLoss.pinball(0.5, 1.5, 1.0)
            + NonCrossingQuantileLoss.pinball(0.5, 0.5, 1.0)
            + NonCrossingQuantileLoss.pinball(0.05, 1.5, 0.0)
            + NonCrossingQuantileLoss.pinball(0.05, 0.5, 0.0)
            + NonCrossingQuantileLoss.pinball(0.95, 1.5, 2.0)
            + NonCrossingQuantileLoss.pinball(0.95, 0.5, 2.0)) / 2.0;

        assertThat(loss.crossing(output).sumNumber().doubleValue()).isZero();
        assertThat(loss.computeScoreArray(labels, output, IDENTITY, null).getDouble(0, 0))
            .isCloseTo(expected, within(1e-12));
    }

    @Test
    void computeScoreArray_crossedHeads_addWeightedPenalty() {
        NonCrossingQuantileLoss loss = new NonCrossingQuantileLoss(0.05, 0.95, 2.0, 1);
        INDArray output = row(0.0, 1.0, -1.0);
        INDArray labels = row(0.0, 0.0, 0.0);

        double pinball = NonCrossingQuantileLoss.pinball(0.05, 0.0, 1.0)
            + NonCrossingQuantileLoss.pinball(0.95, 0.0, -1.0);

        assertThat(loss.crossing(output).getDouble(0, 0)).isCloseTo(2.0, within(1e-12));
        assertThat(loss.computeScoreArray(labels, output, IDENTITY, null).getDouble(0, 0))
            .isCloseTo(pinball + 2.0 * 2.0, within(1e-12));
    }

    @Test
    void computeGradient_crossedHeads_pushesLowDownAndHighUp() {
        NonCrossingQuantileLoss loss = new NonCrossingQuantileLoss(0.05, 0.95, 2.0, 1);

        INDArray gradient = loss.computeGradient(row(0.0, 0.0, 0.0), row(0.0, 1.0, -1.0), IDENTITY, null);

        // low head: overshoot gradient (1 - 0.05) plus penalty
        assertThat(gradient.getDouble(0, 1)).isCloseTo(0.95 + 2.0, within(1e-12));
        // high head: undershoot gradient -0.95 minus penalty
        assertThat(gradient.getDouble(0, 2)).isCloseTo(-0.95 - 2.0, within(1e-12));
    }

    @Test
    void computeGradient_matchesFiniteDifferencesOfScore() {
        NonCrossingQuantileLoss loss = new NonCrossingQuantileLoss(0.1, 0.9, 1.5, 3);
        Random random = new Random(11);
        double[][] out = new double[4][9];
        double[][] lab = new double[4][9];
        for (int i = 0; i < 4; i++) {
            for (int t = 0; t < 3; t++) {
                double y = random.nextGaussian();
                for (int head = 0; head < 3; head++) {
                    lab[i][head * 3 + t] = y;
                    out[i][head * 3 + t] = random.nextGaussian();
                }
            }
        }
        INDArray labels = Nd4j.create(lab);
        INDArray output = Nd4j.create(out);

        INDArray gradient = loss.computeGradient(labels, output, IDENTITY, null);

        double eps = 1e-6;
        for (int i = 0; i < 4; i++) {
            for (int o = 0; o < 9; o++) {
                double saved = output.getDouble(i, o);
                output.putScalar(i, o, saved + eps);
                double plus = loss.computeScore(labels, output, IDENTITY, null, false);
                output.putScalar(i, o, saved - eps);
                double minus = loss.computeScore(labels, output, IDENTITY, null, false);
                output.putScalar(i, o, saved);
                assertThat(gradient.getDouble(i, o)).as("example %d output %d", i, o)
                    .isCloseTo((plus - minus) / (2 * eps), within(1e-5));
            }
        }
    }

    @Test
    void computeScore_averageDividesByBatch() {
        NonCrossingQuantileLoss loss = new NonCrossingQuantileLoss(0.05, 0.95, 1.0, 1);
        INDArray labels = Nd4j.create(new double[][] {{1.0, 1.0, 1.0}, {3.0, 3.0, 3.0}});
        INDArray output = Nd4j.create(new double[][] {{0.0, 0.0, 2.0}, {0.0, 0.0, 2.0}});

        double sum = loss.computeScore(labels, output, IDENTITY, null, false);

        assertThat(loss.computeScore(labels, output, IDENTITY, null, true)).isCloseTo(sum / 2.0, within(1e-12));
    }

    @Test
    void computeScoreArray_rejectsWrongWidth() {
        NonCrossingQuantileLoss loss = new NonCrossingQuantileLoss(0.05, 0.95, 1.0, 2);

        assertThatThrownBy(() -> loss.computeScoreArray(row(0.0, 0.0, 0.0), row(0.0, 0.0, 0.0), IDENTITY, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_rejectsUnorderedQuantiles() {
        assertThatThrownBy(() -> new NonCrossingQuantileLoss(0.9, 0.1, 1.0, 24))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static INDArray row(double... values) {
        return Nd4j.create(new double[][] {values});
    }
}
