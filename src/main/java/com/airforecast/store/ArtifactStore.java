package com.airforecast.store;

import java.util.List;
import java.util.Optional;

/**
 * Durable key/value storage for model artifacts. Keys are slash-separated paths.
 * A completed {@link #write} is visible in full or not at all.
 */
public interface ArtifactStore {

    void write(String key, byte[] content);

    Optional<byte[]> read(String key);

    /** Keys directly under {@code prefix}, sorted. */
    List<String> list(String prefix);

    boolean delete(String key);
}
