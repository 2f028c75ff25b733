package com.initialone.jyardify.patch;

import com.initialone.jyardify.model.EditDirective;
import com.initialone.jyardify.util.SourceText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Inserts every placeable directive's comment block into one file.
 *
 * <p>Directives are handled in descending declared line number. All of them are resolved against the
 * unmodified original lines, so declared numbers and claimed indices always refer to the same buffer;
 * the blocks are then spliced in bottom-up by resolved index, which leaves every pending index valid.
 * When two directives resolve to one line the first to claim it wins, i.e. the one with the higher
 * declared line number.
 *
 * <p>Same inputs always give the same output.
 */
public class PatchApplier {

    private static final Logger log = LoggerFactory.getLogger(PatchApplier.class);

    private final AnchorResolver resolver;

    public PatchApplier() {
        this(new AnchorResolver());
    }

    public PatchApplier(AnchorResolver resolver) {
        this.resolver = resolver;
    }

    public PatchResult apply(List<String> originalLines, List<EditDirective> directives) {
        final List<String> source = new ArrayList<>(originalLines);
        if (directives == null || directives.isEmpty()) {
            log.warn("No comments to insert");
            return new PatchResult(source, List.of(), 0, 0, 0);
        }

        List<EditDirective> ordered = new ArrayList<>(directives);
        ordered.sort(Comparator.comparingInt(EditDirective::sortLine).reversed());

        Set<Integer> claimed = new HashSet<>();
        Set<String> placedAnchors = new HashSet<>();
        List<ResolvedInsertion> insertions = new ArrayList<>();
        int invalid = 0, duplicates = 0, unresolved = 0;

        for (EditDirective d : ordered) {
            String anchor = d.anchor == null ? "" : d.anchor.trim();
            String comment = d.comment == null ? "" : d.comment.trim();

            if (d.lineNumber == null || d.lineNumber == 0 || anchor.isEmpty() || comment.isEmpty()) {
                log.warn("Skipping invalid entry: missing required fields ({})", d);
                invalid++;
                continue;
            }
            if (d.lineNumber < 1 || d.lineNumber > source.size()) {
                log.warn("Line number {} out of bounds (file has {} lines)", d.lineNumber, source.size());
                invalid++;
                continue;
            }

            String normalized = anchor.toLowerCase(Locale.ROOT);
            if (placedAnchors.contains(normalized)) {
                log.debug("Skipping duplicate anchor: {}", AnchorResolver.abbreviate(anchor, 40));
                duplicates++;
                continue;
            }

            Optional<Resolution> found = resolver.resolve(source, d.lineNumber, anchor, claimed);
            if (found.isEmpty()) {
                unresolved++;
                continue;
            }

            int idx = found.get().index();
            String indent = leadingWhitespace(source.get(idx));
            insertions.add(new ResolvedInsertion(d, found.get(), indent, indentBlock(comment, indent)));
            claimed.add(idx);
            placedAnchors.add(normalized);
            log.debug("Resolved comment at line {} for anchor: {}", idx + 1, AnchorResolver.abbreviate(anchor, 30));
        }

        List<ResolvedInsertion> bottomUp = new ArrayList<>(insertions);
        bottomUp.sort(Comparator.comparingInt(ResolvedInsertion::index).reversed());
        List<String> out = new ArrayList<>(source);
        for (ResolvedInsertion ins : bottomUp) {
            out.addAll(ins.index(), ins.block());
            log.debug("Inserted {} lines before line {} ({}, indent {})",
                    ins.block().size(), ins.index() + 1, ins.kind(), ins.indent().length());
        }

        return new PatchResult(out, insertions, invalid, duplicates, unresolved);
    }

    /** Convenience for whole-file content; keeps the input's line-ending convention. */
    public String apply(String content, List<EditDirective> directives) {
        PatchResult r = apply(SourceText.lines(content), directives);
        return SourceText.join(r.lines(), SourceText.lineSeparator(content));
    }

    /** Non-blank comment lines get the anchor line's indentation; blank ones stay empty. */
    static List<String> indentBlock(String comment, String indent) {
        List<String> block = new ArrayList<>();
        for (String cl : SourceText.lines(comment)) {
            block.add(cl.isBlank() ? "" : indent + cl);
        }
        return block;
    }

    static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) i++;
        return line.substring(0, i);
    }
}
