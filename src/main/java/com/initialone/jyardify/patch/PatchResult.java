package com.initialone.jyardify.patch;

import java.util.List;

/** Output of {@link PatchApplier#apply}: the new lines plus what happened to each directive. */
public final class PatchResult {
    private final List<String> lines;
    private final List<ResolvedInsertion> insertions;
    private final int invalid;
    private final int duplicates;
    private final int unresolved;

    PatchResult(List<String> lines, List<ResolvedInsertion> insertions, int invalid, int duplicates, int unresolved) {
        this.lines = lines;
        this.insertions = List.copyOf(insertions);
        this.invalid = invalid;
        this.duplicates = duplicates;
        this.unresolved = unresolved;
    }

    public List<String> lines() {
        return lines;
    }

    /** applied insertions, in the order they were resolved */
    public List<ResolvedInsertion> insertions() {
        return insertions;
    }

    public int applied() {
        return insertions.size();
    }

    /** missing fields or out-of-range line numbers */
    public int invalid() {
        return invalid;
    }

    public int duplicates() {
        return duplicates;
    }

    /** anchor not found, or its line already claimed */
    public int unresolved() {
        return unresolved;
    }
}
