package com.initialone.jyardify.manifest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.initialone.jyardify.model.ManifestData;
import com.initialone.jyardify.model.ManifestEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Incremental-processing ledger persisted as {@code manifest.json}.
 *
 * <p>Every mutation is one critical section: read, modify and write to disk happen under a single
 * acquisition of {@link #lock}, and nothing called from inside it takes the lock again. The file is
 * rewritten after each mutation, so a killed run loses at most the record of the file in flight.
 */
public class ProcessingManifest {

    private static final Logger log = LoggerFactory.getLogger(ProcessingManifest.class);

    private final Path file;
    private final String providerName;
    private final boolean incremental;
    private final Function<Path, Path> outputLocator;
    private final ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final ReentrantLock lock = new ReentrantLock();

    private final ManifestData data;

    ProcessingManifest(Path file, String providerName, boolean incremental,
                       Function<Path, Path> outputLocator, ManifestData data) {
        this.file = file;
        this.providerName = providerName;
        this.incremental = incremental;
        this.outputLocator = outputLocator;
        this.data = data;
        if (data.processedFiles == null) data.processedFiles = new LinkedHashMap<>();
        if (data.failedFiles == null) data.failedFiles = new ArrayList<>();
    }

    /**
     * Loads the manifest, or starts an empty one when the file is missing or unreadable.
     *
     * @param outputLocator maps a source path to where its documented copy is written
     */
    public static ProcessingManifest load(Path file, String providerName, boolean incremental,
                                          Function<Path, Path> outputLocator) {
        ManifestData data = null;
        if (Files.exists(file)) {
            try {
                data = new ObjectMapper().readValue(file.toFile(), ManifestData.class);
                log.info("Loaded manifest with {} processed files", data.processedFiles == null ? 0 : data.processedFiles.size());
            } catch (IOException e) {
                log.warn("Failed to load manifest {}: {}", file, e.getMessage());
            }
        }
        if (data == null) {
            data = new ManifestData();
            data.timestamp = LocalDateTime.now().toString();
        }
        return new ProcessingManifest(file, providerName, incremental, outputLocator, data);
    }

    public static String key(Path source) {
        return source.normalize().toString();
    }

    /**
     * True only when incremental mode is on, the path has an entry, its documented output still exists,
     * and the current code hash equals the stored one.
     */
    public boolean isProcessed(Path source) {
        if (!incremental) return false;

        String key = key(source);
        String storedHash;
        lock.lock();
        try {
            ManifestEntry entry = data.processedFiles.get(key);
            if (entry == null) {
                log.info("  File NOT in manifest: {}", source.getFileName());
                return false;
            }
            storedHash = entry.contentHash;
        } finally {
            lock.unlock();
        }

        Path output = outputLocator.apply(source);
        if (output == null || !Files.exists(output)) {
            log.info("  Output file missing, reprocessing: {}", source.getFileName());
            return false;
        }

        try {
            String currentHash = ContentHasher.computeHash(Files.readString(source, StandardCharsets.UTF_8));
            log.debug("  Hash check for {}: stored={} current={}", source.getFileName(), storedHash, currentHash);
            if (!currentHash.equals(storedHash)) {
                log.info("  Source file changed, reprocessing: {}", source.getFileName());
                return false;
            }
            return true;
        } catch (IOException e) {
            log.warn("  Error checking file hash, reprocessing: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Records the outcome for one file and persists immediately.
     *
     * @param content source content the hash is computed from; read from disk when null
     */
    public void markProcessed(Path source, boolean success, String content) {
        String key = key(source);
        String hash = null;
        if (success) {
            hash = hashOf(source, content);
        }

        lock.lock();
        try {
            if (success) {
                data.processedFiles.put(key, new ManifestEntry(
                        LocalDateTime.now().toString(), providerName, hash, String.valueOf(source.getFileName())));
                data.failedFiles.remove(key);
            } else if (!data.failedFiles.contains(key)) {
                data.failedFiles.add(key);
            }
            persistLocked();
        } finally {
            lock.unlock();
        }
    }

    public void markProcessed(Path source, boolean success) {
        markProcessed(source, success, null);
    }

    public ManifestEntry entry(Path source) {
        lock.lock();
        try {
            return data.processedFiles.get(key(source));
        } finally {
            lock.unlock();
        }
    }

    public Map<String, ManifestEntry> processedFiles() {
        lock.lock();
        try {
            return new LinkedHashMap<>(data.processedFiles);
        } finally {
            lock.unlock();
        }
    }

    public List<String> failedFiles() {
        lock.lock();
        try {
            return new ArrayList<>(data.failedFiles);
        } finally {
            lock.unlock();
        }
    }

    public boolean isIncremental() {
        return incremental;
    }

    public Path file() {
        return file;
    }

    private String hashOf(Path source, String content) {
        if (content != null) return ContentHasher.computeHash(content);
        try {
            return ContentHasher.computeHash(Files.readString(source, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Could not compute hash for {}: {}", source, e.getMessage());
            return null;
        }
    }

    /** Caller holds {@link #lock}. Failures are logged; the next run just reprocesses. */
    private void persistLocked() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, om.writeValueAsString(data), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("Failed to save manifest {}: {}", file, e.getMessage());
        }
    }
}
