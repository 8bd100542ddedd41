package com.airforecast.service;

import com.airforecast.ml.NonCrossingQuantileLoss;
import com.airforecast.ml.QuantileNetwork;
import com.airforecast.store.FileSystemArtifactStore;
import org.deeplearning4j.nn.graph.ComputationGraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nd4j.linalg.api.ndarray.INDArray;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class NetworkStoreTest {

    private static final String CITY = "wuhan";
    private static final String VERSION = "wuhan-20250601T100000Z";

    @TempDir
    Path root;

    @Test
    void save_thenLoad_restoresSameOutputsAndLoss() {
        NetworkStore store = new NetworkStore(new FileSystemArtifactStore(root));
        NonCrossingQuantileLoss loss = new NonCrossingQuantileLoss(0.05, 0.95, 1.0, 2);
        ComputationGraph graph = QuantileNetwork.build(3, 5, loss, 0.01, 9L);
        INDArray input = QuantileNetwork.features(new double[][] {{0.2, -0.4, 1.1}, {1.0, 0.0, -1.0}});

        store.save(CITY, VERSION, graph);
        ComputationGraph restored = store.load(CITY, VERSION).orElseThrow();

        assertThat(Files.exists(root.resolve(CITY).resolve("networks").resolve(VERSION + ".zip"))).isTrue();
        assertThat(QuantileNetwork.parameters(restored)).containsExactly(QuantileNetwork.parameters(graph));
        assertThat(restored.outputSingle(false, input).toDoubleMatrix())
            .isDeepEqualTo(graph.outputSingle(false, input).toDoubleMatrix());
        assertThat(restored.getConfiguration().toJson()).contains("NonCrossingQuantileLoss");
    }

    @Test
    void load_missingVersion_isEmpty() {
        assertThat(new NetworkStore(new FileSystemArtifactStore(root)).load(CITY, VERSION)).isEmpty();
    }

    @Test
    void delete_removesStoredNetwork() {
        NetworkStore store = new NetworkStore(new FileSystemArtifactStore(root));
        store.save(CITY, VERSION, QuantileNetwork.build(1, 1,
            new NonCrossingQuantileLoss(0.05, 0.95, 1.0, 1), 0.01, 1L));

        assertThat(store.delete(CITY, VERSION)).isTrue();
        assertThat(store.load(CITY, VERSION)).isEmpty();
    }
}
