package com.initialone.jyardify.patch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the line a directive should be inserted before.
 *
 * <p>Declared line numbers drift, so the lookup is progressive: exact substring at the declared line,
 * category soft match at the declared line, then the near window around it, then the whole file.
 * Ruby declarations are assumed unique within a file, which is what makes the whole-file scan safe.
 * Claimed lines are never returned.
 */
public class AnchorResolver {

    private static final Logger log = LoggerFactory.getLogger(AnchorResolver.class);

    /** lines on each side of the declared line searched before the rest of the file */
    public static final int NEAR_WINDOW = 5;

    /**
     * @param lines              current file lines
     * @param expectedLineNumber 1-based line number from the directive
     * @param anchor             anchor text, already trimmed
     * @param claimed            0-based indices already used by an inserted block
     * @return the 0-based index to insert before, or empty when the anchor cannot be placed
     */
    public Optional<Resolution> resolve(List<String> lines, int expectedLineNumber, String anchor, Set<Integer> claimed) {
        final int expected = expectedLineNumber - 1;

        if (expected < 0 || expected >= lines.size()) {
            log.warn("Line number {} out of bounds (file has {} lines)", expectedLineNumber, lines.size());
            return Optional.empty();
        }
        if (claimed.contains(expected)) {
            log.debug("Line {} already has a comment, skipping", expectedLineNumber);
            return Optional.empty();
        }

        String line = lines.get(expected);
        if (line.contains(anchor)) {
            log.debug("Exact match at line {}", expectedLineNumber);
            return Optional.of(new Resolution(expected, MatchKind.EXACT, 0));
        }

        AnchorMatcher matcher = AnchorCategory.matcherFor(anchor);
        if (matcher.matches(line)) {
            log.debug("Soft match at line {} for anchor: {}", expectedLineNumber, abbreviate(anchor, 30));
            return Optional.of(new Resolution(expected, MatchKind.SOFT, 0));
        }

        for (int idx : searchOrder(lines.size(), expected)) {
            if (claimed.contains(idx) || !matcher.matches(lines.get(idx))) continue;

            int offset = idx - expected;
            if (Math.abs(offset) <= NEAR_WINDOW) {
                log.info("Found anchor at line {} (expected {}, offset {})", idx + 1, expectedLineNumber, signed(offset));
                return Optional.of(new Resolution(idx, MatchKind.NEAR, offset));
            }
            log.warn("Found anchor at line {} (expected {}, offset {})", idx + 1, expectedLineNumber, signed(offset));
            return Optional.of(new Resolution(idx, MatchKind.DISTANT, offset));
        }

        log.warn("Could not find anchor: {} (expected line {})", abbreviate(anchor, 50), expectedLineNumber);
        return Optional.empty();
    }

    /** -5..-1, +1..+5 (clipped to the file), then every other line top to bottom */
    static List<Integer> searchOrder(int size, int expected) {
        List<Integer> order = new ArrayList<>(size);
        boolean[] queued = new boolean[size];
        queued[expected] = true;

        for (int offset = -NEAR_WINDOW; offset <= NEAR_WINDOW; offset++) {
            int idx = expected + offset;
            if (offset == 0 || idx < 0 || idx >= size) continue;
            order.add(idx);
            queued[idx] = true;
        }
        for (int idx = 0; idx < size; idx++) {
            if (!queued[idx]) order.add(idx);
        }
        return order;
    }

    private static String signed(int offset) {
        return offset >= 0 ? "+" + offset : Integer.toString(offset);
    }

    static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
