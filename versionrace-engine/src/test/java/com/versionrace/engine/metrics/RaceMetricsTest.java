package com.versionrace.engine.metrics;

import com.versionrace.core.exception.ConcurrentUpdateException;
import com.versionrace.core.exception.OperationTimeoutException;
import com.versionrace.core.model.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

public class RaceMetricsTest {

    private final UUID key = UUID.randomUUID();
    private SimpleMeterRegistry registry;
    private RaceMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RaceMetrics(registry);
    }

    @Test
    @DisplayName("Conflicting race should be counted under the conflict outcome")
    void testConflictRaceRecorded() {
        RaceResult result = race(
            WriterResult.succeeded("writer-A", new RaceOutcome(1, 1)),
            WriterResult.conflict("writer-B", new RaceOutcome(1, 0),
                new ConcurrentUpdateException(key, 2, 1, 0)));

        metrics.raceCompleted(result, Duration.ofMillis(600));

        assertThat(metrics.racesRecorded(IsolationLevel.READ_COMMITTED, RaceMetrics.OUTCOME_CONFLICT))
            .isEqualTo(1.0);
        assertThat(registry.get(RaceMetrics.WRITERS).tag("status", "conflict").counter().count())
            .isEqualTo(1.0);
        assertThat(registry.get(RaceMetrics.RACE_DURATION).timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Any failed writer should mark the race as failed")
    void testFailedOutcomeTakesPrecedence() {
        RaceResult result = race(
            WriterResult.conflict("writer-A", new RaceOutcome(1, 0),
                new ConcurrentUpdateException(key, 2, 1, 0)),
            WriterResult.failed("writer-B", null, new OperationTimeoutException("hold")));

        assertThat(RaceMetrics.outcomeOf(result)).isEqualTo(RaceMetrics.OUTCOME_FAILED);
    }

    @Test
    @DisplayName("Race without conflict should be clean")
    void testCleanOutcome() {
        RaceResult result = race(
            WriterResult.succeeded("writer-A", new RaceOutcome(0, 0)),
            WriterResult.succeeded("writer-B", new RaceOutcome(0, 0)));

        assertThat(RaceMetrics.outcomeOf(result)).isEqualTo(RaceMetrics.OUTCOME_CLEAN);
        assertThat(metrics.racesRecorded(IsolationLevel.READ_COMMITTED, RaceMetrics.OUTCOME_CLEAN)).isZero();
    }

    private RaceResult race(WriterResult... writers) {
        return new RaceResult(key, 2, IsolationLevel.READ_COMMITTED, List.of(writers));
    }
}
