package com.airforecast.service;

import com.airforecast.exception.ArtifactStoreException;
import com.airforecast.model.FeatureScaler;
import com.airforecast.store.ArtifactStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;

/**
 * Persists fitted scalers keyed by (city, feature-set version, model version).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScalerStore {

    private final ArtifactStore artifactStore;
    private final ObjectMapper objectMapper;

    public void save(String cityId, String versionId, FeatureScaler scaler) {
        try {
            artifactStore.write(key(cityId, scaler.featureSetVersion(), versionId),
                                objectMapper.writeValueAsBytes(scaler));
        } catch (JsonProcessingException e) {
            throw new ArtifactStoreException("Cannot serialise scaler for " + versionId, e);
        }
        log.debug("Scaler stored | city={} | version={} | featureSet={}",
                  cityId, versionId, scaler.featureSetVersion());
    }

    public Optional<FeatureScaler> load(String cityId, String featureSetVersion, String versionId) {
        return artifactStore.read(key(cityId, featureSetVersion, versionId)).map(bytes -> {
            try {
                return objectMapper.readValue(bytes, FeatureScaler.class);
            } catch (IOException e) {
                throw new ArtifactStoreException("Corrupt scaler for " + versionId, e);
            }
        });
    }

    public boolean delete(String cityId, String featureSetVersion, String versionId) {
        return artifactStore.delete(key(cityId, featureSetVersion, versionId));
    }

    private static String key(String cityId, String featureSetVersion, String versionId) {
        return cityId + "/scalers/" + featureSetVersion + "/" + versionId + ".json";
    }
}
