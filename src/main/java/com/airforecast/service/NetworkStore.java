package com.airforecast.service;

import com.airforecast.exception.ArtifactStoreException;
import com.airforecast.store.ArtifactStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.deeplearning4j.nn.graph.ComputationGraph;
import org.deeplearning4j.util.ModelSerializer;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Optional;

/**
 * Persists trained networks in the DL4J model format, keyed by (city, model version).
 * Updater state is not kept; stored networks are only used for inference.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NetworkStore {

    private final ArtifactStore artifactStore;

    public void save(String cityId, String versionId, ComputationGraph network) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try {
            ModelSerializer.writeModel(network, bytes, false);
        } catch (IOException e) {
            throw new ArtifactStoreException("Cannot serialise network for " + versionId, e);
        }
        artifactStore.write(key(cityId, versionId), bytes.toByteArray());
        log.debug("Network stored | city={} | version={} | bytes={}", cityId, versionId, bytes.size());
    }

    public Optional<ComputationGraph> load(String cityId, String versionId) {
        return artifactStore.read(key(cityId, versionId)).map(bytes -> {
            try {
                return ModelSerializer.restoreComputationGraph(new ByteArrayInputStream(bytes), false);
            } catch (IOException e) {
                throw new ArtifactStoreException("Corrupt network for " + versionId, e);
            }
        });
    }

    public boolean delete(String cityId, String versionId) {
        return artifactStore.delete(key(cityId, versionId));
    }

    private static String key(String cityId, String versionId) {
        return cityId + "/networks/" + versionId + ".zip";
    }
}
