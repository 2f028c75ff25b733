package com.initialone.jyardify.patch;

/** How an anchor was located relative to the directive's declared line. */
public enum MatchKind {
    /** anchor text is a substring of the declared line */
    EXACT,
    /** category soft match on the declared line */
    SOFT,
    /** soft match within the near window around the declared line */
    NEAR,
    /** soft match found by scanning the rest of the file */
    DISTANT
}
