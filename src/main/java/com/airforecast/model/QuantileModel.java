package com.airforecast.model;

import com.airforecast.ml.QuantileNetwork;
import org.deeplearning4j.nn.graph.ComputationGraph;
import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * Frozen network for one city. Outputs are in scaled target units and are not yet
 * widened by the conformal offset.
 *
 * <p>The graph is shared by concurrent predictions; inference calls are serialised on it.
 */
public record QuantileModel(
    String featureSetVersion,
    int horizon,
    double quantileLow,
    double quantileHigh,
    ComputationGraph network
) {

    public QuantileOutput forward(double[] features) {
        return forward(new double[][] {features})[0];
    }

    /** One output per input row. */
    public QuantileOutput[] forward(double[][] rows) {
        double[][] out;
        synchronized (network) {
            INDArray result = network.outputSingle(false, QuantileNetwork.features(rows));
            out = result.toDoubleMatrix();
        }
        QuantileOutput[] outputs = new QuantileOutput[rows.length];
        for (int i = 0; i < rows.length; i++) {
            outputs[i] = QuantileNetwork.split(out[i], horizon);
        }
        return outputs;
    }

    public double[] parameters() {
        return QuantileNetwork.parameters(network);
    }
}
