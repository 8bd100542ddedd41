package com.airforecast.ml;

import com.airforecast.model.QuantileOutput;
import org.deeplearning4j.nn.conf.ComputationGraphConfiguration;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.distribution.NormalDistribution;
import org.deeplearning4j.nn.conf.graph.MergeVertex;
import org.deeplearning4j.nn.conf.layers.DenseLayer;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.graph.ComputationGraph;
import org.deeplearning4j.nn.params.DefaultParamInitializer;
import org.deeplearning4j.nn.weights.WeightInit;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.learning.config.Adam;

import java.util.Arrays;

/**
 * Builds the multi-horizon quantile regressor: one ReLU hidden layer whose activations
 * are concatenated with the raw inputs (a linear skip path) before an identity output
 * layer of {@code 3·horizon} units laid out {@code [point | low | high]}.
 */
public final class QuantileNetwork {

    public static final String INPUT = "features";
    public static final String HIDDEN = "hidden";
    public static final String SKIP = "skip";
    public static final String OUTPUT = "quantiles";

    private static final double INITIAL_LOW_BIAS = -1.0;
    private static final double INITIAL_HIGH_BIAS = 1.0;
    private static final double OUTPUT_INIT_STD = 0.01;

    private QuantileNetwork() {
    }

    /**
     * Creates an initialised graph. Weights are drawn from {@code seed}; low and high
     * biases start one standard unit either side of the point head so the heads begin ordered.
     */
    public static ComputationGraph build(int inputSize, int hiddenSize, NonCrossingQuantileLoss loss,
                                         double learningRate, long seed) {
        int horizon = loss.getHorizon();
        ComputationGraphConfiguration conf = new NeuralNetConfiguration.Builder()
            .seed(seed)
            .dataType(DataType.DOUBLE)
            .updater(new Adam(learningRate))
            .weightInit(WeightInit.RELU)
            .graphBuilder()
            .addInputs(INPUT)
            .addLayer(HIDDEN, new DenseLayer.Builder()
                .nIn(inputSize)
                .nOut(hiddenSize)
                .activation(Activation.RELU)
                .build(), INPUT)
            .addVertex(SKIP, new MergeVertex(), HIDDEN, INPUT)
            .addLayer(OUTPUT, new OutputLayer.Builder(loss)
                .nIn(hiddenSize + inputSize)
                .nOut(3 * horizon)
                .activation(Activation.IDENTITY)
                .weightInit(new NormalDistribution(0.0, OUTPUT_INIT_STD))
                .build(), SKIP)
            .setOutputs(OUTPUT)
            .build();

        ComputationGraph graph = new ComputationGraph(conf);
        graph.init();
        INDArray bias = graph.getLayer(OUTPUT).getParam(DefaultParamInitializer.BIAS_KEY);
        for (int t = 0; t < horizon; t++) {
            bias.putScalar(horizon + t, INITIAL_LOW_BIAS);
            bias.putScalar(2L * horizon + t, INITIAL_HIGH_BIAS);
        }
        return graph;
    }

    public static INDArray features(double[][] rows) {
        return Nd4j.create(rows);
    }

    /** Training labels: each target trajectory repeated once per head. */
    public static INDArray labels(double[][] targets, int horizon) {
        double[][] labels = new double[targets.length][3 * horizon];
        for (int i = 0; i < targets.length; i++) {
            for (int head = 0; head < 3; head++) {
                System.arraycopy(targets[i], 0, labels[i], head * horizon, horizon);
            }
        }
        return Nd4j.create(labels);
    }

    public static QuantileOutput split(double[] output, int horizon) {
        return new QuantileOutput(
            Arrays.copyOfRange(output, 0, horizon),
            Arrays.copyOfRange(output, horizon, 2 * horizon),
            Arrays.copyOfRange(output, 2 * horizon, 3 * horizon));
    }

    public static double[] parameters(ComputationGraph graph) {
        return graph.params().toDoubleVector();
    }

    /** False once any parameter has become NaN or infinite. */
    public static boolean isFinite(ComputationGraph graph) {
        return Double.isFinite(graph.params().sumNumber().doubleValue());
    }
}
