package com.versionrace.core.model;

import java.sql.Connection;

/**
 * Transaction isolation levels a store call or race can run under.
 */
public enum IsolationLevel {
    /** Dirty reads allowed */
    READ_UNCOMMITTED(Connection.TRANSACTION_READ_UNCOMMITTED),
    
    /** Only committed data is visible; each statement sees the latest commit */
    READ_COMMITTED(Connection.TRANSACTION_READ_COMMITTED),
    
    /** Rows read once stay stable for the rest of the transaction */
    REPEATABLE_READ(Connection.TRANSACTION_REPEATABLE_READ),
    
    /** Transactions behave as if run one after another */
    SERIALIZABLE(Connection.TRANSACTION_SERIALIZABLE);

    private final int jdbcLevel;

    IsolationLevel(int jdbcLevel) {
        this.jdbcLevel = jdbcLevel;
    }

    /**
     * The matching {@code java.sql.Connection} isolation constant.
     */
    public int jdbcLevel() {
        return jdbcLevel;
    }
}
