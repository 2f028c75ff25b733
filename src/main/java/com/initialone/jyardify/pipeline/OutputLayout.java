package com.initialone.jyardify.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Where everything under the output directory goes. Used both for writing documented files and for the
 * manifest's "output still exists" check, so the two always agree.
 */
public class OutputLayout {

    private static final Logger log = LoggerFactory.getLogger(OutputLayout.class);

    public enum Structure { FLAT, MIRROR }

    private final Path outputDir;
    private final Path sourceRoot;
    private final Structure structure;

    public OutputLayout(Path outputDir, Path sourceRoot, Structure structure) {
        this.outputDir = outputDir;
        this.sourceRoot = sourceRoot == null ? null : sourceRoot.toAbsolutePath().normalize();
        this.structure = structure == null ? Structure.FLAT : structure;
    }

    public Path outputDir() {
        return outputDir;
    }

    public Path documentedDir() {
        return outputDir.resolve("documented");
    }

    public Path manifestFile() {
        return outputDir.resolve("manifest.json");
    }

    public Path metadataFile() {
        return outputDir.resolve("metadata.json");
    }

    public Path yardDir() {
        return outputDir.resolve("yard");
    }

    /**
     * flat: {@code documented/<name>}; mirror: {@code documented/<path relative to source root>}.
     * A file outside the source root falls back to flat.
     */
    public Path documentedFile(Path source) {
        Path name = source.getFileName();
        if (structure == Structure.MIRROR && sourceRoot != null) {
            Path abs = source.toAbsolutePath().normalize();
            if (abs.startsWith(sourceRoot)) {
                return documentedDir().resolve(sourceRoot.relativize(abs).toString());
            }
            log.warn("File {} is not under source root {}, using flat structure", source, sourceRoot);
        }
        return documentedDir().resolve(name.toString());
    }

    public Path failedResponseFile(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return outputDir.resolve(stem + "_failed_response.txt");
    }

    public Path yardFile(String fileName) {
        return yardDir().resolve(fileName + ".yard");
    }
}
