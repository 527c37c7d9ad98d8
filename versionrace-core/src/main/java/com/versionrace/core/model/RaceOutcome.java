package com.versionrace.core.model;

/**
 * Affected-row counts observed by one writer: the first attempt (rolled back)
 * and the second attempt (committed only when both agree).
 */
public record RaceOutcome(long firstCount, long secondCount) {

    /**
     * True when both attempts affected the same number of rows.
     */
    public boolean isConsistent() {
        return firstCount == secondCount;
    }

    /**
     * True when the second attempt changed the row.
     */
    public boolean advanced() {
        return secondCount > 0;
    }
}
