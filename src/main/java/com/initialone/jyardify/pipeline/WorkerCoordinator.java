package com.initialone.jyardify.pipeline;

import com.initialone.jyardify.manifest.ProcessingManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the pipeline over a fixed list of files on a bounded pool. Workers share only the manifest and
 * {@link #writeLock}; a failing file is recorded and never stops the others.
 */
public class WorkerCoordinator {

    private static final Logger log = LoggerFactory.getLogger(WorkerCoordinator.class);

    private final DocumentationPipeline pipeline;
    private final ProcessingManifest manifest;
    private final OutputLayout layout;
    private final int workers;
    private final ReentrantLock writeLock = new ReentrantLock();

    public WorkerCoordinator(DocumentationPipeline pipeline, ProcessingManifest manifest,
                             OutputLayout layout, int workers) {
        this.pipeline = pipeline;
        this.manifest = manifest;
        this.layout = layout;
        this.workers = Math.max(1, workers);
    }

    /** Outcome of one {@link #run}; completion order is whatever the scheduler produced. */
    public static class Outcome {
        public final List<DocumentedFile> documented = Collections.synchronizedList(new ArrayList<>());
        public final List<Path> failed = Collections.synchronizedList(new ArrayList<>());
    }

    public Outcome run(List<Path> files) {
        Outcome outcome = new Outcome();
        if (files.isEmpty()) return outcome;

        int total = files.size();
        if (workers == 1 || total == 1) {
            for (int i = 0; i < total; i++) {
                processOne(files.get(i), i + 1, total, outcome);
            }
            return outcome;
        }

        log.info("Starting parallel processing with {} workers...", workers);
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, total));
        try {
            List<Future<Boolean>> futures = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                final Path file = files.get(i);
                final int index = i + 1;
                futures.add(pool.submit(() -> processOne(file, index, total, outcome)));
            }
            for (int i = 0; i < futures.size(); i++) {
                Path file = files.get(i);
                try {
                    if (futures.get(i).get()) {
                        log.info("Completed: {}", file.getFileName());
                    } else {
                        log.warn("Failed: {}", file.getFileName());
                    }
                } catch (ExecutionException ee) {
                    log.error("Exception processing {}: {}", file.getFileName(), String.valueOf(ee.getCause()));
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for workers; {} files documented so far", outcome.documented.size());
        } finally {
            pool.shutdown();
        }
        return outcome;
    }

    /** Never throws; every failure ends up in the manifest's failed list. */
    boolean processOne(Path file, int index, int total, Outcome outcome) {
        try {
            log.info("[{}/{}] Processing: {}", index, total, file.getFileName());
            String original = Files.readString(file, StandardCharsets.UTF_8);
            String documented = pipeline.document(file, original);

            Path out = layout.documentedFile(file);
            Files.createDirectories(out.getParent());
            writeLock.lock();
            try {
                Files.writeString(out, documented, StandardCharsets.UTF_8);
            } finally {
                writeLock.unlock();
            }

            manifest.markProcessed(file, true, original);
            outcome.documented.add(new DocumentedFile(file, out, documented, LocalDateTime.now().toString()));
            log.info("  Successfully documented {}", file.getFileName());
            return true;
        } catch (Exception e) {
            log.error("  Failed to process {}: {}", file.getFileName(), e.getMessage());
            log.debug("  Failure detail", e);
        }
        manifest.markProcessed(file, false);
        outcome.failed.add(file);
        return false;
    }
}
