package com.versionrace.core.model;

/**
 * Final state of one racing writer.
 */
public enum WriterStatus {
    /**
     * Both attempts agreed and the second transaction was committed.
     */
    SUCCEEDED,

    /**
     * Attempts disagreed; the second transaction was discarded.
     */
    CONFLICT,

    /**
     * An infrastructure error or timeout ended the writer.
     */
    FAILED
}
