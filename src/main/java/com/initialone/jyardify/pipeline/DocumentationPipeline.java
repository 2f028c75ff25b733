package com.initialone.jyardify.pipeline;

import com.initialone.jyardify.llm.GenerationException;
import com.initialone.jyardify.llm.PromptFactory;
import com.initialone.jyardify.llm.TextGenerator;
import com.initialone.jyardify.model.EditDirective;
import com.initialone.jyardify.patch.DirectiveExtractor;
import com.initialone.jyardify.patch.ExtractionException;
import com.initialone.jyardify.patch.PatchApplier;
import com.initialone.jyardify.patch.PatchResult;
import com.initialone.jyardify.util.SourceText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * One file, start to finish: prompt, generate, extract, apply. Holds no per-file state, so a single
 * instance is shared by all workers.
 */
public class DocumentationPipeline {

    private static final Logger log = LoggerFactory.getLogger(DocumentationPipeline.class);

    private final TextGenerator generator;
    private final DirectiveExtractor extractor;
    private final PatchApplier applier;
    private final OutputLayout layout;

    public DocumentationPipeline(TextGenerator generator, OutputLayout layout) {
        this(generator, new DirectiveExtractor(), new PatchApplier(), layout);
    }

    public DocumentationPipeline(TextGenerator generator, DirectiveExtractor extractor,
                                 PatchApplier applier, OutputLayout layout) {
        this.generator = generator;
        this.extractor = extractor;
        this.applier = applier;
        this.layout = layout;
    }

    public String document(Path file) throws IOException, GenerationException, ExtractionException {
        return document(file, Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * @return the documented content; the original content unchanged when the generator proposes nothing
     * @throws ExtractionException after the raw response has been saved next to the outputs
     */
    public String document(Path file, String original) throws GenerationException, ExtractionException {
        String fileName = file.getFileName().toString();
        log.info("Processing: {}", fileName);
        log.info("  Lines: {}, Characters: {}", SourceText.lineCount(original), original.length());

        log.info("  Requesting documentation from {}...", generator.name());
        String response = generator.generate(
                PromptFactory.documentationPrompt(fileName, original), PromptFactory.SYSTEM_PROMPT);

        List<EditDirective> directives;
        try {
            directives = extractor.extract(response);
        } catch (ExtractionException e) {
            log.error("  No comments extracted from response ({} characters)", response == null ? 0 : response.length());
            saveFailedResponse(file, response);
            throw e;
        }

        if (directives.isEmpty()) {
            log.info("  No documentation needed for {}", fileName);
            return original;
        }

        log.info("  Extracted {} documentation entries", directives.size());
        PatchResult result = applier.apply(SourceText.lines(original), directives);
        log.info("  Inserted {} comments ({} invalid, {} duplicate, {} unresolved)",
                result.applied(), result.invalid(), result.duplicates(), result.unresolved());
        return SourceText.join(result.lines(), SourceText.lineSeparator(original));
    }

    void saveFailedResponse(Path file, String response) {
        String body = response == null ? "" : response;
        Path target = layout.failedResponseFile(file);
        StringBuilder sb = new StringBuilder()
                .append("Failed to parse JSON for: ").append(file.getFileName()).append('\n')
                .append("AI Response Length: ").append(body.length()).append(" characters\n")
                .append("=".repeat(80)).append('\n')
                .append(body);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, sb.toString(), StandardCharsets.UTF_8);
            log.info("  Saved failed response to: {}", target.getFileName());
        } catch (IOException e) {
            log.error("  Could not save failed response to {}: {}", target, e.getMessage());
        }
    }
}
