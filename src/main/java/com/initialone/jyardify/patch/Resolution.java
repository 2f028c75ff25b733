package com.initialone.jyardify.patch;

/** Result of a successful anchor lookup: a 0-based line index plus how it was found. */
public final class Resolution {
    private final int index;
    private final MatchKind kind;
    private final int offset;

    public Resolution(int index, MatchKind kind, int offset) {
        this.index = index;
        this.kind = kind;
        this.offset = offset;
    }

    public int index() {
        return index;
    }

    public MatchKind kind() {
        return kind;
    }

    /** resolved index minus expected index */
    public int offset() {
        return offset;
    }

    @Override
    public String toString() {
        return "Resolution{index=" + index + ", kind=" + kind + ", offset=" + offset + "}";
    }
}
