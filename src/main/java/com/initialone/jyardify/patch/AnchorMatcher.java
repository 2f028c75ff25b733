package com.initialone.jyardify.patch;

/** A compiled soft-match test for one anchor, applied to candidate source lines. */
@FunctionalInterface
public interface AnchorMatcher {
    boolean matches(String line);
}
