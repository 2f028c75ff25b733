package com.initialone.jyardify.pipeline;

import com.initialone.jyardify.util.SourceText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Side output for --yard: the comment lines of each documented file, one {@code .yard} file each. */
public final class YardCommentExport {

    private static final Logger log = LoggerFactory.getLogger(YardCommentExport.class);

    private YardCommentExport() {
    }

    /** @return number of {@code .yard} files written */
    public static int export(List<DocumentedFile> documented, OutputLayout layout) throws IOException {
        log.info("Generating YARD documentation...");
        Files.createDirectories(layout.yardDir());
        int written = 0;
        for (DocumentedFile df : documented) {
            List<String> comments = commentLines(df.content);
            if (comments.isEmpty()) continue;
            Path out = layout.yardFile(df.fileName());
            Files.writeString(out, String.join("\n", comments), StandardCharsets.UTF_8);
            log.info("  Generated YARD: {}", out.getFileName());
            written++;
        }
        log.info("YARD documentation saved to: {}", layout.yardDir());
        return written;
    }

    static List<String> commentLines(String content) {
        List<String> out = new ArrayList<>();
        for (String line : SourceText.lines(content)) {
            if (line.strip().startsWith("#")) out.add(line);
        }
        return out;
    }
}
