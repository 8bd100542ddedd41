package com.airforecast.service;

import com.airforecast.config.CityCatalog;
import com.airforecast.config.ForecastProperties;
import com.airforecast.exception.ArtifactStoreException;
import com.airforecast.exception.ModelPromotionException;
import com.airforecast.model.City;
import com.airforecast.model.FeatureScaler;
import com.airforecast.model.ModelArtifact;
import com.airforecast.model.ModelVersion;
import com.airforecast.model.QuantileModel;
import com.airforecast.model.TrainingResult;
import com.airforecast.store.ArtifactStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.deeplearning4j.nn.graph.ComputationGraph;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Versioned model storage with a per-city "current" pointer.
 *
 * <p>Versions are written once under a fresh id and never modified. Promotion swaps the
 * in-memory pointer after the pointer file has been atomically replaced, so a reader sees
 * either the previous or the new version in full. Writers for the same city are serialised
 * by a per-city lock; readers take no lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelRegistryService {

    private static final DateTimeFormatter VERSION_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
    private static final Pattern VERSION_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+-\\d{8}T\\d{6}Z$");
    private static final int TIMESTAMP_LENGTH = 16;
    private static final String POINTER_FILE = "CURRENT.json";

    private final ArtifactStore artifactStore;
    private final ScalerStore scalerStore;
    private final NetworkStore networkStore;
    private final ObjectMapper objectMapper;
    private final CityCatalog cityCatalog;
    private final ForecastProperties properties;

    private final ConcurrentHashMap<String, VersionPointer> current = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> writeLocks = new ConcurrentHashMap<>();

    @PostConstruct
    void restorePointers() {
        for (City city : cityCatalog.all()) {
            artifactStore.read(pointerKey(city.id())).ifPresent(bytes -> {
                try {
                    VersionPointer pointer = objectMapper.readValue(bytes, VersionPointer.class);
                    current.put(city.id(), pointer);
                    log.info("Restored current model | city={} | version={}", city.id(), pointer.versionId());
                } catch (IOException e) {
                    log.error("Unreadable pointer for city {}, treating as untrained: {}", city.id(), e.getMessage());
                }
            });
        }
    }

    /**
     * Stores a training result as a new version. The id is derived from
     * {@code versionTimestamp}; if that is not after the newest stored version it is
     * moved to one second past it.
     */
    public String put(String cityId, Instant versionTimestamp, TrainingResult result) {
        ReentrantLock lock = lockFor(cityId);
        lock.lock();
        try {
            Instant timestamp = versionTimestamp.truncatedTo(ChronoUnit.SECONDS);
            Optional<Instant> latest = listVersions(cityId).stream()
                .map(ModelRegistryService::timestampOf)
                .max(Instant::compareTo);
            if (latest.isPresent() && !timestamp.isAfter(latest.get())) {
                timestamp = latest.get().plus(Duration.ofSeconds(1));
            }
            String versionId = versionId(cityId, timestamp);

            QuantileModel model = result.model();
            scalerStore.save(cityId, versionId, result.scaler());
            networkStore.save(cityId, versionId, model.network());
            ModelArtifact artifact = new ModelArtifact(cityId, versionId, timestamp,
                result.scaler().featureSetVersion(), model.horizon(), model.quantileLow(), model.quantileHigh(),
                result.offset(), result.diagnostics());
            artifactStore.write(versionKey(cityId, versionId), serialise(artifact));

            log.info("Model version stored | city={} | version={} | fingerprint={}",
                     cityId, versionId, result.diagnostics().fingerprint());
            return versionId;
        } finally {
            lock.unlock();
        }
    }

    public void promote(String cityId, String versionId) {
        if (versionId == null || !VERSION_PATTERN.matcher(versionId).matches()) {
            throw new ModelPromotionException("Malformed version id '" + versionId + "'");
        }
        ReentrantLock lock = lockFor(cityId);
        lock.lock();
        try {
            ModelArtifact artifact = readArtifact(cityId, versionId)
                .orElseThrow(() -> new ModelPromotionException(
                    "Version '" + versionId + "' does not exist for city '" + cityId + "'"));
            VersionPointer previous = current.get(cityId);
            if (previous != null && artifact.versionTimestamp().isBefore(previous.versionTimestamp())) {
                throw new ModelPromotionException("Version '" + versionId + "' is older than current version '"
                    + previous.versionId() + "'");
            }
            VersionPointer pointer = new VersionPointer(versionId, artifact.versionTimestamp());
            artifactStore.write(pointerKey(cityId), serialise(pointer));
            current.put(cityId, pointer);
            log.info("Model promoted | city={} | version={} | previous={}",
                     cityId, versionId, previous != null ? previous.versionId() : "none");
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> currentVersionId(String cityId) {
        VersionPointer pointer = current.get(cityId);
        return pointer != null ? Optional.of(pointer.versionId()) : Optional.empty();
    }

    public Optional<ModelVersion> getCurrent(String cityId) {
        return currentVersionId(cityId).map(versionId -> load(cityId, versionId));
    }

    public ModelVersion load(String cityId, String versionId) {
        ModelArtifact artifact = readArtifact(cityId, versionId)
            .orElseThrow(() -> new ArtifactStoreException("Model version '" + versionId + "' is missing"));
        FeatureScaler scaler = scalerStore.load(cityId, artifact.featureSetVersion(), versionId)
            .orElseThrow(() -> new ArtifactStoreException("Scaler for version '" + versionId + "' is missing"));
        ComputationGraph network = networkStore.load(cityId, versionId)
            .orElseThrow(() -> new ArtifactStoreException("Network for version '" + versionId + "' is missing"));
        QuantileModel model = new QuantileModel(artifact.featureSetVersion(), artifact.horizon(),
            artifact.quantileLow(), artifact.quantileHigh(), network);
        return new ModelVersion(cityId, versionId, artifact.versionTimestamp(), model,
            artifact.offset(), scaler, artifact.diagnostics());
    }

    /** Stored version ids for the city, oldest first. */
    public List<String> listVersions(String cityId) {
        String prefix = cityId + "/versions";
        return artifactStore.list(prefix).stream()
            .map(key -> key.substring(prefix.length() + 1, key.length() - ".json".length()))
            .filter(id -> VERSION_PATTERN.matcher(id).matches())
            .sorted()
            .toList();
    }

    /**
     * Deletes versions older than the retention window. The current version and the one
     * before it are kept regardless of age, so a reader that resolved the pointer just
     * before a promotion can still load what it resolved.
     *
     * @return number of versions removed
     */
    public int purgeExpired(String cityId, Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(properties.getRegistry().getRetentionDays()));
        ReentrantLock lock = lockFor(cityId);
        lock.lock();
        try {
            String currentId = currentVersionId(cityId).orElse(null);
            List<String> versions = listVersions(cityId);
            int currentIndex = versions.indexOf(currentId);
            String previousId = currentIndex > 0 ? versions.get(currentIndex - 1) : null;
            int removed = 0;
            for (String versionId : versions) {
                if (versionId.equals(currentId) || versionId.equals(previousId)
                        || !timestampOf(versionId).isBefore(cutoff)) {
                    continue;
                }
                Optional<ModelArtifact> artifact = readArtifact(cityId, versionId);
                artifactStore.delete(versionKey(cityId, versionId));
                networkStore.delete(cityId, versionId);
                artifact.ifPresent(a -> scalerStore.delete(cityId, a.featureSetVersion(), versionId));
                removed++;
            }
            if (removed > 0) {
                log.info("Expired model versions purged | city={} | removed={} | cutoff={}", cityId, removed, cutoff);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    static String versionId(String cityId, Instant timestamp) {
        return cityId + "-" + VERSION_FORMAT.format(timestamp);
    }

    static Instant timestampOf(String versionId) {
        String stamp = versionId.substring(versionId.length() - TIMESTAMP_LENGTH);
        return VERSION_FORMAT.parse(stamp, Instant::from);
    }

    private Optional<ModelArtifact> readArtifact(String cityId, String versionId) {
        return artifactStore.read(versionKey(cityId, versionId)).map(bytes -> {
            try {
                return objectMapper.readValue(bytes, ModelArtifact.class);
            } catch (IOException e) {
                throw new ArtifactStoreException("Corrupt model artifact '" + versionId + "'", e);
            }
        });
    }

    private byte[] serialise(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new ArtifactStoreException("Cannot serialise " + value.getClass().getSimpleName(), e);
        }
    }

    private ReentrantLock lockFor(String cityId) {
        return writeLocks.computeIfAbsent(cityId, id -> new ReentrantLock());
    }

    private static String versionKey(String cityId, String versionId) {
        return cityId + "/versions/" + versionId + ".json";
    }

    private static String pointerKey(String cityId) {
        return cityId + "/" + POINTER_FILE;
    }

    record VersionPointer(String versionId, Instant versionTimestamp) {
    }
}
