package com.versionrace.core.model;

import com.versionrace.core.exception.ConcurrentUpdateException;
import com.versionrace.core.exception.VersionRaceException;

import java.util.Objects;
import java.util.Optional;

/**
 * Fate of one writer in a race.
 * 
 * Invariants:
 * - SUCCEEDED carries a consistent outcome and no error
 * - CONFLICT carries a {@link ConcurrentUpdateException}
 * - FAILED carries the error that stopped the writer; outcome may be null
 *   when the writer never reached its second attempt
 * - firstCount is the first attempt's affected rows whenever it is known,
 *   including for writers that failed before their second attempt
 */
public record WriterResult(
    String writerName,
    WriterStatus status,
    Long firstCount,
    RaceOutcome outcome,
    VersionRaceException error
) {
    public WriterResult {
        Objects.requireNonNull(writerName, "writerName");
        Objects.requireNonNull(status, "status");
        if (outcome != null) {
            if (firstCount != null && firstCount != outcome.firstCount()) {
                throw new IllegalArgumentException("firstCount " + firstCount
                    + " does not match outcome " + outcome);
            }
            firstCount = outcome.firstCount();
        }
        if (status == WriterStatus.SUCCEEDED && (outcome == null || error != null)) {
            throw new IllegalArgumentException("A succeeded writer needs an outcome and no error");
        }
        if (status == WriterStatus.CONFLICT && !(error instanceof ConcurrentUpdateException)) {
            throw new IllegalArgumentException("A conflicting writer needs a ConcurrentUpdateException");
        }
        if (status == WriterStatus.FAILED && error == null) {
            throw new IllegalArgumentException("A failed writer needs an error");
        }
    }

    public WriterResult(String writerName, WriterStatus status, RaceOutcome outcome, VersionRaceException error) {
        this(writerName, status, null, outcome, error);
    }

    public static WriterResult succeeded(String writerName, RaceOutcome outcome) {
        return new WriterResult(writerName, WriterStatus.SUCCEEDED, outcome, null);
    }

    public static WriterResult conflict(String writerName, RaceOutcome outcome, ConcurrentUpdateException error) {
        return new WriterResult(writerName, WriterStatus.CONFLICT, outcome, error);
    }

    public static WriterResult failed(String writerName, RaceOutcome outcome, VersionRaceException error) {
        return new WriterResult(writerName, WriterStatus.FAILED, outcome, error);
    }

    /**
     * A writer that completed its first attempt but failed before an outcome existed.
     */
    public static WriterResult failedAfterFirstAttempt(String writerName, long firstCount, VersionRaceException error) {
        return new WriterResult(writerName, WriterStatus.FAILED, firstCount, null, error);
    }

    /**
     * True when this writer committed an advance of the stored version.
     */
    public boolean committedAdvance() {
        return status == WriterStatus.SUCCEEDED && outcome.advanced();
    }

    public Optional<VersionRaceException> errorIfAny() {
        return Optional.ofNullable(error);
    }
}
