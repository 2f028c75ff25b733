package com.initialone.jyardify.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Line-level view of a source file that round-trips its line-ending convention. */
public final class SourceText {

    private SourceText() {
    }

    /** Splits on LF or CRLF; a trailing newline yields a trailing empty element. */
    public static List<String> lines(String content) {
        if (content == null) return new ArrayList<>();
        return new ArrayList<>(Arrays.asList(content.split("\r?\n", -1)));
    }

    /** CRLF when the content uses it anywhere, LF otherwise. */
    public static String lineSeparator(String content) {
        return content != null && content.contains("\r\n") ? "\r\n" : "\n";
    }

    public static String join(List<String> lines, String separator) {
        return String.join(separator, lines);
    }

    /** Number of lines a block of text occupies once split the same way as a file. */
    public static int lineCount(String text) {
        return text == null ? 0 : text.split("\r?\n", -1).length;
    }
}
