package com.versionrace.engine.scenario;

import com.versionrace.core.model.IsolationLevel;
import com.versionrace.core.model.RaceResult;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one end-to-end scenario run.
 * 
 * @param passed True when no protocol violation was found
 * @param conflictObserved True when at least one writer raised a concurrent update conflict
 * @param finalVersion Version read back right after the race
 * @param violations Human-readable description of each broken expectation
 */
public record ScenarioReport(
    UUID key,
    IsolationLevel isolationLevel,
    boolean passed,
    boolean conflictObserved,
    long finalVersion,
    RaceResult race,
    List<String> violations
) {
    public ScenarioReport {
        violations = List.copyOf(violations);
    }
}
