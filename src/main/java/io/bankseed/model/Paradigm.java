package io.bankseed.model;

public enum Paradigm {
    PROFILE(0),
    ARCHIVE(0),
    DOCUMENT(1),
    EVENT(1);

    private final int phase;

    Paradigm(int phase) {
        this.phase = phase;
    }

    /**
     * Phase 0 types must be complete before any phase 1 type starts.
     */
    public int phase() {
        return phase;
    }
}
