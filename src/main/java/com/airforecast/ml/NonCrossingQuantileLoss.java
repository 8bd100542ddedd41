package com.airforecast.ml;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.nd4j.common.primitives.Pair;
import org.nd4j.linalg.activations.IActivation;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.indexing.NDArrayIndex;
import org.nd4j.linalg.lossfunctions.ILossFunction;
import org.nd4j.linalg.ops.transforms.Transforms;
import org.nd4j.shade.jackson.annotation.JsonCreator;
import org.nd4j.shade.jackson.annotation.JsonProperty;

/**
 * Pinball loss on the point (τ = 0.5), low and high heads plus a penalty on any step
 * where the low head exceeds the high head.
 *
 * <p>Network outputs are laid out {@code [point | low | high]}, each block {@code horizon}
 * wide. Labels use the same layout with the realised value repeated in every block
 * (see {@link QuantileNetwork#labels}). The per-example score is averaged over the
 * horizon so it does not grow with H.
 */
@Getter
@EqualsAndHashCode
public class NonCrossingQuantileLoss implements ILossFunction {

    private static final double MEDIAN = 0.5;

    private final double tauLow;
    private final double tauHigh;
    private final double crossingWeight;
    private final int horizon;

    @JsonCreator
    public NonCrossingQuantileLoss(@JsonProperty("tauLow") double tauLow,
                                   @JsonProperty("tauHigh") double tauHigh,
                                   @JsonProperty("crossingWeight") double crossingWeight,
                                   @JsonProperty("horizon") int horizon) {
        if (!(tauLow > 0.0 && tauLow < tauHigh && tauHigh < 1.0)) {
            throw new IllegalArgumentException("Quantile levels must satisfy 0 < low < high < 1, got "
                + tauLow + " / " + tauHigh);
        }
        if (horizon < 1) {
            throw new IllegalArgumentException("Horizon must be positive, got " + horizon);
        }
        this.tauLow = tauLow;
        this.tauHigh = tauHigh;
        this.crossingWeight = crossingWeight;
        this.horizon = horizon;
    }

    @Override
    public double computeScore(INDArray labels, INDArray preOutput, IActivation activationFn,
                               INDArray mask, boolean average) {
        double sum = computeScoreArray(labels, preOutput, activationFn, mask).sumNumber().doubleValue();
        return average ? sum / labels.size(0) : sum;
    }

    /** Per-example score, shape {@code [batch, 1]}. */
    @Override
    public INDArray computeScoreArray(INDArray labels, INDArray preOutput, IActivation activationFn, INDArray mask) {
        checkShape(labels, preOutput);
        INDArray output = activationFn.getActivation(preOutput.dup(), true);
        INDArray error = labels.sub(output);
        INDArray tau = tauRow(output);

        // pinball(τ, e) = τ·e + max(-e, 0)
        INDArray pinball = error.mulRowVector(tau).addi(Transforms.relu(error.neg()));
        INDArray score = pinball.sum(true, 1)
            .addi(crossing(output).sum(true, 1).muli(crossingWeight))
            .divi(horizon);
        if (mask != null) {
            applyMask(score, mask);
        }
        return score;
    }

    @Override
    public INDArray computeGradient(INDArray labels, INDArray preOutput, IActivation activationFn, INDArray mask) {
        checkShape(labels, preOutput);
        INDArray output = activationFn.getActivation(preOutput.dup(), true);
        INDArray error = labels.sub(output);

        // d pinball / d output = -τ where the realised value is above, 1 - τ where below
        INDArray dLdOut = error.lt(0.0).castTo(output.dataType()).subiRowVector(tauRow(output));
        INDArray violated = crossingViolation(output).gt(0.0).castTo(output.dataType()).muli(crossingWeight);
        lowBlock(dLdOut).addi(violated);
        highBlock(dLdOut).subi(violated);
        dLdOut.divi(horizon);

        INDArray gradient = activationFn.backprop(preOutput.dup(), dLdOut).getFirst();
        if (mask != null) {
            applyMask(gradient, mask);
        }
        return gradient;
    }

    @Override
    public Pair<Double, INDArray> computeGradientAndScore(INDArray labels, INDArray preOutput,
                                                          IActivation activationFn, INDArray mask, boolean average) {
        return new Pair<>(computeScore(labels, preOutput, activationFn, mask, average),
                          computeGradient(labels, preOutput, activationFn, mask));
    }

    @Override
    public String name() {
        return toString();
    }

    @Override
    public String toString() {
        return "NonCrossingQuantileLoss(tauLow=" + tauLow + ", tauHigh=" + tauHigh
            + ", crossingWeight=" + crossingWeight + ", horizon=" + horizon + ")";
    }

    /** Amount by which low exceeds high, per example and step; zero where ordered. */
    public INDArray crossing(INDArray output) {
        return Transforms.relu(crossingViolation(output));
    }

    public static double pinball(double tau, double actual, double predicted) {
        double e = actual - predicted;
        return e >= 0.0 ? tau * e : (tau - 1.0) * e;
    }

    private INDArray crossingViolation(INDArray output) {
        return lowBlock(output).sub(highBlock(output));
    }

    private INDArray lowBlock(INDArray array) {
        return array.get(NDArrayIndex.all(), NDArrayIndex.interval(horizon, 2L * horizon));
    }

    private INDArray highBlock(INDArray array) {
        return array.get(NDArrayIndex.all(), NDArrayIndex.interval(2L * horizon, 3L * horizon));
    }

    private INDArray tauRow(INDArray like) {
        double[] tau = new double[3 * horizon];
        for (int t = 0; t < horizon; t++) {
            tau[t] = MEDIAN;
            tau[horizon + t] = tauLow;
            tau[2 * horizon + t] = tauHigh;
        }
        return Nd4j.create(tau).castTo(like.dataType()).reshape(1, 3L * horizon);
    }

    private static void applyMask(INDArray target, INDArray mask) {
        if (mask.equalShapes(target)) {
            target.muli(mask);
        } else if (mask.size(0) == target.size(0) && mask.length() == mask.size(0)) {
            target.muliColumnVector(mask.reshape(mask.size(0), 1));
        } else {
            throw new IllegalArgumentException("Unsupported mask shape " + mask.shapeInfoToString());
        }
    }

    private void checkShape(INDArray labels, INDArray preOutput) {
        if (preOutput.size(1) != 3L * horizon || !labels.equalShapes(preOutput)) {
            throw new IllegalArgumentException("Expected labels and outputs of width " + 3 * horizon
                + ", got " + labels.shapeInfoToString() + " / " + preOutput.shapeInfoToString());
        }
    }
}
