package com.versionrace.engine.coordinator;

/**
 * Result of comparing a writer's two affected-row counts.
 */
public enum ConsistencyVerdict {
    OK,
    CONFLICT
}
