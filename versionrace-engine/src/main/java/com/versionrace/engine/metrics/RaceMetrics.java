package com.versionrace.engine.metrics;

import com.versionrace.core.model.IsolationLevel;
import com.versionrace.core.model.RaceResult;
import com.versionrace.core.model.WriterResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer metrics for optimistic update races.
 * 
 * Metrics exposed:
 * - Race counts by isolation level and outcome
 * - Writer counts by final status
 * - Race duration
 */
@Component
public class RaceMetrics {

    // Metric names
    public static final String RACES = "versionrace.races";
    public static final String WRITERS = "versionrace.writers";
    public static final String RACE_DURATION = "versionrace.race.duration";

    // Race outcomes
    public static final String OUTCOME_CONFLICT = "conflict";
    public static final String OUTCOME_CLEAN = "clean";
    public static final String OUTCOME_FAILED = "failed";

    private final MeterRegistry registry;

    public RaceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void raceCompleted(RaceResult result, Duration elapsed) {
        String isolation = result.isolationLevel().name();

        Counter.builder(RACES)
            .tag("isolation", isolation)
            .tag("outcome", outcomeOf(result))
            .description("Completed optimistic update races")
            .register(registry)
            .increment();

        for (WriterResult writer : result.writers()) {
            Counter.builder(WRITERS)
                .tag("status", writer.status().name().toLowerCase())
                .description("Racing writers by final status")
                .register(registry)
                .increment();
        }

        Timer.builder(RACE_DURATION)
            .tag("isolation", isolation)
            .description("Wall-clock duration of a race")
            .register(registry)
            .record(elapsed);
    }

    /**
     * Races recorded so far for an isolation level and outcome.
     */
    public double racesRecorded(IsolationLevel isolationLevel, String outcome) {
        Counter counter = registry.find(RACES)
            .tag("isolation", isolationLevel.name())
            .tag("outcome", outcome)
            .counter();
        return counter != null ? counter.count() : 0.0;
    }

    static String outcomeOf(RaceResult result) {
        if (result.failureCount() > 0) {
            return OUTCOME_FAILED;
        }
        return result.conflictDetected() ? OUTCOME_CONFLICT : OUTCOME_CLEAN;
    }
}
