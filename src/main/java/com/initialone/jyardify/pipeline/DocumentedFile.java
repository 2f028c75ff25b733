package com.initialone.jyardify.pipeline;

import java.nio.file.Path;

/** A file documented during the current run. */
public class DocumentedFile {
    public final Path source;
    public final Path output;
    public final String content;
    public final String timestamp;

    public DocumentedFile(Path source, Path output, String content, String timestamp) {
        this.source = source;
        this.output = output;
        this.content = content;
        this.timestamp = timestamp;
    }

    public String fileName() {
        return source.getFileName().toString();
    }
}
