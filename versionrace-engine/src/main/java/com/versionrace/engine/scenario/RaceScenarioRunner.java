package com.versionrace.engine.scenario;

import com.versionrace.core.exception.NotFoundException;
import com.versionrace.core.model.*;
import com.versionrace.core.repository.EntityStore;
import com.versionrace.engine.config.RaceProperties;
import com.versionrace.engine.coordinator.RaceCoordinator;
import com.versionrace.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs the full create / advance / race / delete sequence against one key
 * and checks every expectation along the way.
 *
 * Store steps each get their own per-command deadline, the race gets the
 * settings' timeout. Store errors outside the race propagate unchanged;
 * everything observed inside the race is reported in {@link ScenarioReport}.
 */
@Service
public class RaceScenarioRunner {

    private static final Logger log = LoggerFactory.getLogger(RaceScenarioRunner.class);

    private final EntityStore entityStore;
    private final RaceCoordinator raceCoordinator;
    private final Duration operationTimeout;

    public RaceScenarioRunner(EntityStore entityStore, RaceCoordinator raceCoordinator, RaceProperties properties) {
        this.entityStore = entityStore;
        this.raceCoordinator = raceCoordinator;
        this.operationTimeout = properties.getOperationTimeout();
    }

    public ScenarioReport run(ScenarioRequest request) {
        RaceSettings settings = request.settings();
        UUID key = request.key() != null ? request.key() : UUID.randomUUID();
        IsolationLevel isolation = settings.isolationLevel();
        List<String> violations = new ArrayList<>();

        try (LoggingContext ctx = LoggingContext.forEntity(key, isolation)) {
            entityStore.create(key, isolation, step());
            expectVersion("after create", entityStore.read(key, isolation, step()),
                VersionedEntity.INITIAL_VERSION, violations);

            expectRows("advance from version 1",
                entityStore.advance(key, VersionedEntity.INITIAL_VERSION, isolation, step()), 1, violations);
            long baseline = entityStore.read(key, isolation, step()).version();
            expectVersion("after advance", baseline, VersionedEntity.INITIAL_VERSION + 1, violations);

            expectRows("stale advance from version 1",
                entityStore.advance(key, VersionedEntity.INITIAL_VERSION, isolation, step()), 0, violations);
            expectVersion("after stale advance", entityStore.read(key, isolation, step()).version(),
                baseline, violations);

            RaceResult race = raceCoordinator.race(key, baseline, settings);
            long finalVersion = entityStore.read(key, isolation, step()).version();
            checkRace(race, baseline, finalVersion, violations);

            expectRows("delete", entityStore.delete(key, isolation, step()), 1, violations);
            expectGone(key, isolation, violations);

            boolean passed = violations.isEmpty();
            if (passed) {
                log.info("Scenario passed: final version {}, conflict observed: {}",
                    finalVersion, race.conflictDetected());
            } else {
                log.warn("Scenario failed with {} violation(s): {}", violations.size(), violations);
            }
            return new ScenarioReport(key, isolation, passed, race.conflictDetected(),
                finalVersion, race, violations);
        }
    }

    private void checkRace(RaceResult race, long baseline, long finalVersion, List<String> violations) {
        for (WriterResult failure : race.failures()) {
            violations.add(String.format("%s failed [%s]: %s", failure.writerName(),
                failure.error().getErrorCode(), failure.error().getMessage()));
        }

        long committed = race.committedAdvances();
        if (committed > 1) {
            violations.add(String.format("version advanced %d times in a single race", committed));
        }
        // A race on the live version ends with a conflict or a single advance
        if (!race.conflictDetected() && committed != 1) {
            violations.add(String.format(
                "race ended without a conflict and with %d committed advance(s) instead of 1", committed));
        }
        if (finalVersion != baseline + committed) {
            violations.add(String.format(
                "final version %d does not match baseline %d plus %d committed advance(s)",
                finalVersion, baseline, committed));
        }
    }

    private void expectGone(UUID key, IsolationLevel isolation, List<String> violations) {
        try {
            VersionedEntity survivor = entityStore.read(key, isolation, step());
            violations.add("entity still readable after delete at version " + survivor.version());
        } catch (NotFoundException expected) {
            log.debug("Entity {} is gone", key);
        }
    }

    private Deadline step() {
        return Deadline.after(operationTimeout);
    }

    private static void expectVersion(String step, VersionedEntity entity, long expected, List<String> violations) {
        expectVersion(step, entity.version(), expected, violations);
    }

    private static void expectVersion(String step, long actual, long expected, List<String> violations) {
        if (actual != expected) {
            violations.add(String.format("%s: expected version %d but found %d", step, expected, actual));
        }
    }

    private static void expectRows(String step, int actual, int expected, List<String> violations) {
        if (actual != expected) {
            violations.add(String.format("%s: expected %d affected row(s) but got %d", step, expected, actual));
        }
    }
}
