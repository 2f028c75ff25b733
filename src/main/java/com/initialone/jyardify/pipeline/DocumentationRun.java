package com.initialone.jyardify.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.initialone.jyardify.llm.TextGenerator;
import com.initialone.jyardify.manifest.ProcessingManifest;
import com.initialone.jyardify.model.RunStats;
import com.initialone.jyardify.util.SourceFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One {@code generate} invocation: incremental filtering, the worker run, and the run's metadata.
 */
public class DocumentationRun {

    private static final Logger log = LoggerFactory.getLogger(DocumentationRun.class);

    private final TextGenerator generator;
    private final OutputLayout layout;
    private final ProcessingManifest manifest;
    private final WorkerCoordinator coordinator;
    private final ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final List<DocumentedFile> documented = new ArrayList<>();

    public DocumentationRun(TextGenerator generator, OutputLayout layout, ProcessingManifest manifest, int workers) {
        this.generator = generator;
        this.layout = layout;
        this.manifest = manifest;
        this.coordinator = new WorkerCoordinator(new DocumentationPipeline(generator, layout), manifest, layout, workers);
    }

    public RunStats processDirectory(Path directory, String pattern, List<String> excludedDirs) throws IOException {
        log.info("Processing directory: {}", directory);
        List<Path> files = SourceFiles.list(directory, pattern, excludedDirs);
        log.info("Found {} files to process", files.size());
        if (files.isEmpty()) {
            log.warn("No files matching {} found!", pattern);
        }
        return process(files);
    }

    /** Files already documented with unchanged code count as processed. */
    public RunStats process(List<Path> files) throws IOException {
        long start = System.nanoTime();
        int skipped = 0;
        List<Path> todo = new ArrayList<>();
        for (Path f : files) {
            if (manifest.isProcessed(f)) {
                skipped++;
                log.info("Skipping (already processed): {}", f.getFileName());
            } else {
                todo.add(f);
            }
        }
        log.info("Files to process: {}", todo.size());
        log.info("Already processed: {}", skipped);
        if (!todo.isEmpty()) {
            generator.estimateJob(todo.size()).ifPresent(e -> {
                log.info("Feasibility check: {}", e.recommendation());
                if (!e.canCompleteToday) {
                    log.warn("Job may exceed daily quota. Consider processing in batches.");
                }
            });
        }

        WorkerCoordinator.Outcome outcome = coordinator.run(todo);
        documented.addAll(outcome.documented);

        RunStats stats = new RunStats();
        stats.processed = skipped + outcome.documented.size();
        stats.failed = outcome.failed.size();
        stats.total = files.size();
        stats.elapsedTime = Math.round((System.nanoTime() - start) / 1e7) / 100.0;
        stats.provider = generator.name();
        for (Path p : outcome.failed) {
            stats.failedFiles.add(p.getFileName().toString());
        }
        writeMetadata(stats);
        return stats;
    }

    /** Single-file mode: no incremental check; returns the written output or null on failure. */
    public Path processFile(Path file) {
        WorkerCoordinator.Outcome outcome = coordinator.run(List.of(file));
        documented.addAll(outcome.documented);
        return outcome.documented.isEmpty() ? null : outcome.documented.get(0).output;
    }

    void writeMetadata(RunStats stats) throws IOException {
        Map<String, Object> docs = new LinkedHashMap<>();
        for (DocumentedFile df : documented) {
            docs.put(df.fileName(), Map.of("timestamp", df.timestamp));
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("stats", stats);
        meta.put("documentation", docs);
        meta.put("provider_stats", generator.stats());
        Files.createDirectories(layout.outputDir());
        om.writeValue(layout.metadataFile().toFile(), meta);
    }

    public int exportYard() throws IOException {
        return YardCommentExport.export(documented, layout);
    }
}
