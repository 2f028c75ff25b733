package com.initialone.jyardify.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One documentation edit proposed by the text generator.
 *
 * <p>Nothing in here is trusted: {@code lineNumber} refers to the original file and may have drifted,
 * {@code indent} is advisory only, and any field may be missing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EditDirective {

    /** 1-based line in the original, unmodified file; null when absent or not numeric. */
    @JsonProperty("line_number")
    public Integer lineNumber;

    public String anchor;

    /** Advisory only; the applier measures indentation from the matched line. */
    public Integer indent;

    public String comment;

    public EditDirective() {
    }

    public EditDirective(Integer lineNumber, String anchor, Integer indent, String comment) {
        this.lineNumber = lineNumber;
        this.anchor = anchor;
        this.indent = indent;
        this.comment = comment;
    }

    /** Sort key for bottom-up application; missing line numbers sort last. */
    public int sortLine() {
        return lineNumber == null ? 0 : lineNumber;
    }

    @Override
    public String toString() {
        return "EditDirective{line=" + lineNumber + ", anchor='" + anchor + "'}";
    }
}
