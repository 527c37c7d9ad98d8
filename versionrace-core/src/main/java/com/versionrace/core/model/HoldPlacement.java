package com.versionrace.core.model;

/**
 * Where a racing writer spends its hold delay relative to its first transaction.
 */
public enum HoldPlacement {
    /**
     * Hold while the first transaction is still open, keeping its row lock alive.
     */
    INSIDE_TRANSACTION,

    /**
     * Release the first transaction immediately and hold afterwards.
     */
    AFTER_ROLLBACK
}
