package com.initialone.jyardify.patch;

/**
 * Repairs invalid JSON escape sequences in generator output.
 *
 * <p>Models routinely emit regex or Windows-path fragments such as {@code \d} or {@code \s} inside
 * JSON strings. Valid escapes are {@code \" \\ \/ \b \f \n \r \t} and {@code \}{@code uXXXX} with
 * exactly four hex digits; for anything else the backslash is doubled so it survives parsing as a
 * literal. Single forward pass, no character is ever dropped.
 */
public final class ResponseSanitizer {

    private static final String SIMPLE_ESCAPES = "\"\\/bfnrt";
    private static final String HEX = "0123456789abcdefABCDEF";

    private ResponseSanitizer() {
    }

    public static String sanitize(String text) {
        if (text == null || text.isEmpty()) return text == null ? "" : text;

        final int n = text.length();
        StringBuilder sb = new StringBuilder(n + 16);
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 >= n) {
                sb.append(c);
                i++;
                continue;
            }
            char next = text.charAt(i + 1);
            if (SIMPLE_ESCAPES.indexOf(next) >= 0) {
                sb.append('\\').append(next);
                i += 2;
            } else if (next == 'u' && i + 5 < n && isHex4(text, i + 2)) {
                sb.append(text, i, i + 6);
                i += 6;
            } else {
                // stray backslash: keep it as a literal
                sb.append("\\\\").append(next);
                i += 2;
            }
        }
        return sb.toString();
    }

    private static boolean isHex4(String s, int from) {
        for (int k = from; k < from + 4; k++) {
            if (HEX.indexOf(s.charAt(k)) < 0) return false;
        }
        return true;
    }
}
