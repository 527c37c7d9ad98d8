package com.versionrace.core.model;

import com.versionrace.core.exception.OperationTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Absolute point in time by which an operation must finish.
 * Shared by every step of one logical operation so that nested waits
 * never extend the caller's time limit.
 */
public record Deadline(Instant expiresAt, Clock clock) {

    public Deadline {
        Objects.requireNonNull(expiresAt, "expiresAt");
        Objects.requireNonNull(clock, "clock");
    }

    /**
     * Create a deadline the given duration from now.
     */
    public static Deadline after(Duration timeout) {
        return after(timeout, Clock.systemUTC());
    }

    /**
     * Create a deadline the given duration from the clock's now.
     */
    public static Deadline after(Duration timeout, Clock clock) {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        return new Deadline(clock.instant().plus(timeout), clock);
    }

    /**
     * Time left before expiry, never negative.
     */
    public Duration remaining() {
        Duration remaining = Duration.between(clock.instant(), expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public long remainingMillis() {
        return remaining().toMillis();
    }

    /**
     * Remaining time rounded up to whole seconds, at least 1.
     * JDBC query timeouts only accept seconds.
     */
    public int remainingSeconds() {
        long millis = remainingMillis();
        long seconds = (millis + 999) / 1000;
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, seconds));
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * Fail with {@link OperationTimeoutException} if the deadline has passed.
     */
    public void check(String operation) {
        if (isExpired()) {
            throw new OperationTimeoutException(operation);
        }
    }
}
