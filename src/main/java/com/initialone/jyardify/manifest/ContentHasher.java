package com.initialone.jyardify.manifest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Hash of the code in a Ruby file, ignoring documentation comments.
 *
 * <p>Dropped before hashing: comment lines carrying a YARD tag, and prose comment lines
 * ({@code "# "} followed by text). Shebang and magic encoding comments are kept. The remaining lines are
 * SHA-256 hashed and the hex digest is cut to {@link #LENGTH} characters.
 */
public final class ContentHasher {

    public static final int LENGTH = 16;

    private static final String[] DOC_TAGS = {"@param", "@return", "@example", "@note", "@see", "@yield"};

    private ContentHasher() {
    }

    public static String computeHash(String content) {
        List<String> code = new ArrayList<>();
        for (String line : (content == null ? "" : content).split("\n", -1)) {
            if (isCodeLine(line)) code.add(line);
        }
        return sha256Hex(String.join("\n", code)).substring(0, LENGTH);
    }

    static boolean isCodeLine(String line) {
        String s = line.strip();
        if (!s.startsWith("#")) return true;
        if (hasDocTag(s)) return false;
        if (s.length() > 1 && s.charAt(1) == ' ') {
            return s.startsWith("#!") || s.contains("coding:") || s.contains("encoding:");
        }
        return true;
    }

    private static boolean hasDocTag(String s) {
        for (String tag : DOC_TAGS) {
            if (s.contains(tag)) return true;
        }
        return false;
    }

    private static String sha256Hex(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
