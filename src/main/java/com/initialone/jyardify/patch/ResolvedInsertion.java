package com.initialone.jyardify.patch;

import com.initialone.jyardify.model.EditDirective;

import java.util.List;

/** A directive bound to a concrete line of the original buffer, with its ready-to-insert block. */
public final class ResolvedInsertion {
    private final EditDirective directive;
    private final Resolution resolution;
    private final String indent;
    private final List<String> block;

    ResolvedInsertion(EditDirective directive, Resolution resolution, String indent, List<String> block) {
        this.directive = directive;
        this.resolution = resolution;
        this.indent = indent;
        this.block = List.copyOf(block);
    }

    public EditDirective directive() {
        return directive;
    }

    /** 0-based index in the original lines; the block goes immediately before it */
    public int index() {
        return resolution.index();
    }

    public MatchKind kind() {
        return resolution.kind();
    }

    /** leading whitespace of the matched line */
    public String indent() {
        return indent;
    }

    public List<String> block() {
        return block;
    }
}
