package com.versionrace.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Parameters of one forced-interleaving race.
 */
public record RaceSettings(
    IsolationLevel isolationLevel,
    Duration holdDuration,
    HoldPlacement holdPlacement,
    Duration timeout
) {
    public static final Duration DEFAULT_HOLD = Duration.ofSeconds(1);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    public RaceSettings {
        Objects.requireNonNull(isolationLevel, "isolationLevel");
        Objects.requireNonNull(holdDuration, "holdDuration");
        Objects.requireNonNull(holdPlacement, "holdPlacement");
        Objects.requireNonNull(timeout, "timeout");
        if (holdDuration.isNegative()) {
            throw new IllegalArgumentException("holdDuration must not be negative: " + holdDuration);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
    }

    /**
     * Read committed, one second hold inside the first transaction, one minute timeout.
     */
    public static RaceSettings defaults() {
        return new RaceSettings(IsolationLevel.READ_COMMITTED, DEFAULT_HOLD,
            HoldPlacement.INSIDE_TRANSACTION, DEFAULT_TIMEOUT);
    }

    public RaceSettings withIsolationLevel(IsolationLevel level) {
        return new RaceSettings(level, holdDuration, holdPlacement, timeout);
    }

    public RaceSettings withHoldDuration(Duration hold) {
        return new RaceSettings(isolationLevel, hold, holdPlacement, timeout);
    }

    public RaceSettings withHoldPlacement(HoldPlacement placement) {
        return new RaceSettings(isolationLevel, holdDuration, placement, timeout);
    }

    public RaceSettings withTimeout(Duration newTimeout) {
        return new RaceSettings(isolationLevel, holdDuration, holdPlacement, newTimeout);
    }
}
