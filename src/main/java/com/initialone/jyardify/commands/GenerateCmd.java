package com.initialone.jyardify.commands;

import com.initialone.jyardify.llm.GeneratorFactory;
import com.initialone.jyardify.llm.LlmOptions;
import com.initialone.jyardify.llm.TextGenerator;
import com.initialone.jyardify.manifest.ProcessingManifest;
import com.initialone.jyardify.model.RunStats;
import com.initialone.jyardify.pipeline.DocumentationRun;
import com.initialone.jyardify.pipeline.OutputLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * generate:
 *   directory mode  -> every file under <input> matching --pattern, skipping unchanged ones
 *   single-file mode -> exactly --file, always reprocessed, exit 1 on failure
 *
 * Failed files in directory mode do not change the exit code; they stay out of the manifest and are
 * picked up again by the next run.
 */
@CommandLine.Command(
        name = "generate",
        description = "Insert YARD documentation comments into Ruby sources."
)
public class GenerateCmd implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCmd.class);

    @CommandLine.Mixin
    LlmOptions llm;

    @CommandLine.Parameters(index = "0", arity = "0..1",
            description = "Input directory containing Ruby files (not needed with --file)")
    String input;

    @CommandLine.Option(names = "--file",
            description = "Process a single Ruby file instead of a directory")
    String file;

    @CommandLine.Option(names = "--output", defaultValue = "output/latest",
            description = "Output directory (default: ${DEFAULT-VALUE})")
    String output;

    @CommandLine.Option(names = "--output-structure", defaultValue = "flat",
            description = "flat (all files in one dir) | mirror (preserve source structure)")
    String outputStructure;

    @CommandLine.Option(names = "--pattern", defaultValue = "*.rb",
            description = "File name glob (default: ${DEFAULT-VALUE})")
    String pattern;

    @CommandLine.Option(names = "--exclude", split = ",", defaultValue = "critranks",
            description = "Directory names to skip (default: ${DEFAULT-VALUE})")
    List<String> excludes;

    @CommandLine.Option(names = "--workers",
            description = "Parallel workers (default: openai 8, anthropic 4, others 1)")
    Integer workers;

    @CommandLine.Option(names = {"--force-rebuild", "--no-incremental"},
            description = "Reprocess every file, ignoring the manifest")
    boolean forceRebuild;

    @CommandLine.Option(names = "--yard",
            description = "Also export comment lines to <output>/yard/<file>.yard")
    boolean yard;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        if ((input == null) == (file == null)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Either an input directory or --file must be specified (not both)");
        }
        OutputLayout.Structure structure;
        try {
            structure = OutputLayout.Structure.valueOf(outputStructure.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--output-structure must be flat or mirror: " + outputStructure);
        }

        String provider = llm.resolvedProvider();
        GeneratorFactory.Validation validation = GeneratorFactory.validateEnvironment(provider);
        if (!validation.valid) {
            log.error("Environment validation failed for provider {}!", validation.provider);
            if (!validation.missing.isEmpty()) {
                log.error("Missing environment variables: {}", String.join(", ", validation.missing));
            }
            for (String w : validation.warnings) log.error(w);
            return 1;
        }
        for (String w : validation.warnings) log.warn(w);

        Path inputPath;
        Path sourceRoot;
        if (file != null) {
            inputPath = Paths.get(file);
            if (!Files.isRegularFile(inputPath)) {
                System.err.println("[generate] file not found: " + file);
                return 1;
            }
            sourceRoot = inputPath.toAbsolutePath().getParent();
        } else {
            inputPath = Paths.get(input);
            if (!Files.isDirectory(inputPath)) {
                System.err.println("[generate] input directory does not exist: " + inputPath);
                return 1;
            }
            sourceRoot = inputPath;
        }

        TextGenerator generator;
        try {
            generator = GeneratorFactory.create(llm);
        } catch (IllegalArgumentException | IllegalStateException e) {
            System.err.println("[generate] " + e.getMessage());
            return 1;
        }

        OutputLayout layout = new OutputLayout(Paths.get(output), sourceRoot, structure);
        Files.createDirectories(layout.documentedDir());
        boolean incremental = !forceRebuild;
        ProcessingManifest manifest = ProcessingManifest.load(
                layout.manifestFile(), generator.name(), incremental, layout::documentedFile);
        if (incremental) {
            System.out.println("[generate] incremental mode: " + manifest.processedFiles().size() + " files in manifest");
        } else {
            System.out.println("[generate] force rebuild: all files will be processed");
        }

        int n = workers != null ? Math.max(1, workers) : GeneratorFactory.defaultWorkers(provider);
        DocumentationRun run = new DocumentationRun(generator, layout, manifest, n);

        if (file != null) {
            Path out = run.processFile(inputPath);
            if (out == null) {
                System.out.println("[generate] FAILED to generate documentation for " + inputPath.getFileName());
                return 1;
            }
            System.out.println("[generate] documented: " + inputPath.getFileName());
            System.out.println("[generate] output: " + out);
            return 0;
        }

        System.out.println("[generate] provider=" + generator.name() + " workers=" + n + " output=" + layout.outputDir());
        RunStats stats = run.processDirectory(inputPath, pattern, excludes);
        if (yard) {
            int written = run.exportYard();
            System.out.println("[generate] yard files: " + written);
        }
        printSummary(stats, layout, generator.stats());
        if (stats.failed > 0) {
            log.warn("{} file(s) failed but will be retried on next run", stats.failed);
        }
        return 0;
    }

    static void printSummary(RunStats stats, OutputLayout layout, Map<String, Object> providerStats) {
        String rule = "=".repeat(60);
        System.out.println();
        System.out.println(rule);
        System.out.println("DOCUMENTATION GENERATION COMPLETE");
        System.out.println(rule);
        System.out.println("Provider: " + stats.provider);
        System.out.println("Processed: " + stats.processed + "/" + stats.total + " files");
        System.out.println("Failed: " + stats.failed + " files");
        System.out.println("Time: " + stats.elapsedTime + " seconds");
        System.out.println("Output: " + layout.outputDir());
        if (!stats.failedFiles.isEmpty()) {
            System.out.println();
            System.out.println("Failed files:");
            for (String f : stats.failedFiles) System.out.println("  - " + f);
        }
        System.out.println();
        System.out.println("Provider statistics:");
        System.out.println("  Requests: " + providerStats.getOrDefault("requests", 0));
        if (providerStats.containsKey("daily_requests")) {
            System.out.println("  Daily requests: " + providerStats.get("daily_requests"));
        }
        if (providerStats.containsKey("estimated_cost")) {
            System.out.println("  Estimated cost: " + providerStats.get("estimated_cost"));
        }
        System.out.println(rule);
    }
}
