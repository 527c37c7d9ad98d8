package com.versionrace.engine.coordinator;

import com.versionrace.core.exception.ConcurrentUpdateException;
import com.versionrace.core.model.RaceOutcome;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Decides whether a writer's second conditional update saw the same row state
 * as its first. A difference means a peer moved the version in between.
 */
@Component
public class ConflictDetector {

    public ConsistencyVerdict evaluate(RaceOutcome outcome) {
        return outcome.isConsistent() ? ConsistencyVerdict.OK : ConsistencyVerdict.CONFLICT;
    }

    /**
     * @throws ConcurrentUpdateException if the two counts differ
     */
    public void requireConsistent(UUID key, long expectedVersion, RaceOutcome outcome) {
        if (evaluate(outcome) == ConsistencyVerdict.CONFLICT) {
            throw new ConcurrentUpdateException(
                key, expectedVersion, outcome.firstCount(), outcome.secondCount());
        }
    }
}
