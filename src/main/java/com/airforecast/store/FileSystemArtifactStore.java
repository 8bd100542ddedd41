package com.airforecast.store;

import com.airforecast.exception.ArtifactStoreException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Artifact store rooted at a local directory. Writes go to a temporary file in the
 * target directory and are then renamed over the destination.
 */
@Slf4j
public class FileSystemArtifactStore implements ArtifactStore {

    private static final String TEMP_SUFFIX = ".tmp";

    private final Path root;

    public FileSystemArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new ArtifactStoreException("Cannot create artifact root " + this.root, e);
        }
        log.info("Artifact store ready | root={}", this.root);
    }

    @Override
    public void write(String key, byte[] content) {
        Path target = resolve(key);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), TEMP_SUFFIX);
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move unsupported, falling back to replace | key={}", key);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new ArtifactStoreException("Failed to write artifact '" + key + "'", e);
        }
    }

    @Override
    public Optional<byte[]> read(String key) {
        try {
            return Optional.of(Files.readAllBytes(resolve(key)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to read artifact '" + key + "'", e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        Path dir = resolve(prefix);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                .filter(Files::isRegularFile)
                .map(p -> p.getFileName().toString())
                .filter(name -> !name.endsWith(TEMP_SUFFIX))
                .sorted()
                .map(name -> prefix + "/" + name)
                .toList();
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to list artifacts under '" + prefix + "'", e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to delete artifact '" + key + "'", e);
        }
    }

    private Path resolve(String key) {
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root)) {
            throw new ArtifactStoreException("Artifact key escapes the store root: " + key);
        }
        return resolved;
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary artifact {}: {}", temp, e.getMessage());
        }
    }
}
