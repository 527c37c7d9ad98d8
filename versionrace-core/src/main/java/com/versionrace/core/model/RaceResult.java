package com.versionrace.core.model;

import com.versionrace.core.exception.ConcurrentUpdateException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Aggregate of every writer's fate in one race.
 * Nothing is dropped: conflicts and failures of each writer stay visible.
 */
public record RaceResult(
    UUID key,
    long expectedVersion,
    IsolationLevel isolationLevel,
    List<WriterResult> writers
) {
    public RaceResult {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(isolationLevel, "isolationLevel");
        writers = List.copyOf(writers);
    }

    public long successCount() {
        return count(WriterStatus.SUCCEEDED);
    }

    public long conflictCount() {
        return count(WriterStatus.CONFLICT);
    }

    public long failureCount() {
        return count(WriterStatus.FAILED);
    }

    /**
     * Number of writers whose committed second attempt advanced the version.
     */
    public long committedAdvances() {
        return writers.stream().filter(WriterResult::committedAdvance).count();
    }

    public boolean conflictDetected() {
        return conflictCount() > 0;
    }

    public boolean allSucceeded() {
        return successCount() == writers.size();
    }

    public List<WriterResult> failures() {
        return writers.stream()
            .filter(w -> w.status() == WriterStatus.FAILED)
            .toList();
    }

    public Optional<ConcurrentUpdateException> firstConflict() {
        return writers.stream()
            .filter(w -> w.status() == WriterStatus.CONFLICT)
            .map(w -> (ConcurrentUpdateException) w.error())
            .findFirst();
    }

    /**
     * Rethrow the first writer conflict, mirroring an await-all over both writers.
     */
    public void throwIfConflict() {
        Optional<ConcurrentUpdateException> conflict = firstConflict();
        if (conflict.isPresent()) {
            throw conflict.get();
        }
    }

    private long count(WriterStatus status) {
        return writers.stream().filter(w -> w.status() == status).count();
    }
}
