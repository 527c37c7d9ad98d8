package com.versionrace.engine.coordinator;

import com.versionrace.core.exception.ConcurrentUpdateException;
import com.versionrace.core.exception.OperationTimeoutException;
import com.versionrace.core.exception.VersionRaceException;
import com.versionrace.core.model.*;
import com.versionrace.core.repository.StorageTransaction;
import com.versionrace.core.repository.TransactionalStorage;
import com.versionrace.engine.config.EngineConfiguration;
import com.versionrace.engine.logging.LoggingContext;
import com.versionrace.engine.metrics.RaceMetrics;
import com.versionrace.engine.persistence.jdbc.VersionCheckedUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;

/**
 * Runs two writers through the same conditional update at the same time.
 *
 * Each writer:
 * 1. advances inside transaction T1 and records the affected rows
 * 2. arrives at the rendezvous barrier
 * 3. holds the barrier gate (inside T1 or after releasing it, per settings)
 * 4. rolls T1 back
 * 5. waits until every writer has finished its first attempt
 * 6. advances again inside T2 and commits only if both counts agree
 *
 * On a row-locking database the second writer's first update blocks until
 * the first writer rolls T1 back, so its arrival always follows that
 * rollback. Step 5 therefore never waits on a lock owned by a waiting writer,
 * and no T2 can commit before both first attempts saw the original version.
 */
@Service
public class RaceCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RaceCoordinator.class);

    public static final List<String> WRITER_NAMES = List.of("writer-A", "writer-B");

    /**
     * Extra time granted past the deadline before a writer is cancelled.
     * JDBC query timeouts round up to whole seconds.
     */
    private static final Duration CANCEL_GRACE = Duration.ofSeconds(2);

    private final TransactionalStorage storage;
    private final VersionCheckedUpdater updater;
    private final ConflictDetector conflictDetector;
    private final ExecutorService writerExecutor;
    private final RaceMetrics metrics;

    public RaceCoordinator(
            TransactionalStorage storage,
            VersionCheckedUpdater updater,
            ConflictDetector conflictDetector,
            @Qualifier(EngineConfiguration.WRITER_EXECUTOR) ExecutorService writerExecutor,
            RaceMetrics metrics) {
        this.storage = storage;
        this.updater = updater;
        this.conflictDetector = conflictDetector;
        this.writerExecutor = writerExecutor;
        this.metrics = metrics;
    }

    /**
     * Race both writers on {@code (key, expectedVersion)}.
     *
     * @param key The entity key
     * @param expectedVersion Version both writers expect
     * @param settings Isolation level, hold and timeout
     * @return Every writer's fate; conflicts and failures are reported, not thrown
     */
    public RaceResult race(UUID key, long expectedVersion, RaceSettings settings) {
        try (LoggingContext ctx = LoggingContext.forEntity(key, settings.isolationLevel())) {
            Deadline deadline = Deadline.after(settings.timeout());
            RendezvousBarrier barrier = new RendezvousBarrier(WRITER_NAMES.size(), settings.holdDuration());
            String traceId = LoggingContext.getTraceId();
            long startNanos = System.nanoTime();

            log.info("Starting race on {} at version {} ({}, hold {} ms {})",
                key, expectedVersion, settings.isolationLevel(),
                settings.holdDuration().toMillis(), settings.holdPlacement());

            Map<String, Future<WriterResult>> writers = new LinkedHashMap<>();
            for (String writerName : WRITER_NAMES) {
                writers.put(writerName, writerExecutor.submit(
                    () -> runWriter(writerName, key, expectedVersion, settings, barrier, deadline, traceId)));
            }

            List<WriterResult> results = new ArrayList<>();
            for (Map.Entry<String, Future<WriterResult>> entry : writers.entrySet()) {
                results.add(awaitWriter(entry.getKey(), entry.getValue(), deadline));
            }

            RaceResult result = new RaceResult(key, expectedVersion, settings.isolationLevel(), results);
            metrics.raceCompleted(result, Duration.ofNanos(System.nanoTime() - startNanos));

            log.info("Race on {} finished: {} succeeded, {} conflict(s), {} failure(s)",
                key, result.successCount(), result.conflictCount(), result.failureCount());
            return result;
        }
    }

    private WriterResult runWriter(
            String writerName,
            UUID key,
            long expectedVersion,
            RaceSettings settings,
            RendezvousBarrier barrier,
            Deadline deadline,
            String traceId) {
        IsolationLevel isolation = settings.isolationLevel();
        boolean arrived = false;
        Long firstCount = null;
        RaceOutcome outcome = null;

        try (LoggingContext ctx = LoggingContext.forWriter(key, writerName, isolation, traceId)) {
            try (StorageTransaction first = storage.begin(isolation, deadline)) {
                firstCount = (long) updater.tryAdvance(first, key, expectedVersion);
                barrier.arrive();
                arrived = true;
                log.debug("First attempt affected {} row(s)", firstCount);

                if (settings.holdPlacement() == HoldPlacement.INSIDE_TRANSACTION) {
                    barrier.hold(deadline);
                }
                first.rollback();
            }
            if (settings.holdPlacement() == HoldPlacement.AFTER_ROLLBACK) {
                barrier.hold(deadline);
            }

            barrier.awaitArrivals(deadline);

            try (StorageTransaction second = storage.begin(isolation, deadline)) {
                long secondCount = updater.tryAdvance(second, key, expectedVersion);
                outcome = new RaceOutcome(firstCount, secondCount);
                conflictDetector.requireConsistent(key, expectedVersion, outcome);
                second.commit();
                log.info("Committed second attempt ({} row(s))", secondCount);
                return WriterResult.succeeded(writerName, outcome);
            }
        } catch (ConcurrentUpdateException e) {
            log.warn("{}", e.getMessage());
            return WriterResult.conflict(writerName,
                new RaceOutcome(e.getFirstCount(), e.getSecondCount()), e);
        } catch (VersionRaceException e) {
            log.warn("Writer {} failed [{}]: {}", writerName, e.getErrorCode(), e.getMessage());
            if (outcome == null && firstCount != null) {
                return WriterResult.failedAfterFirstAttempt(writerName, firstCount, e);
            }
            return WriterResult.failed(writerName, outcome, e);
        } finally {
            if (!arrived) {
                barrier.arrive();
            }
        }
    }

    private WriterResult awaitWriter(String writerName, Future<WriterResult> future, Deadline deadline) {
        try {
            return future.get(deadline.remainingMillis() + CANCEL_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Writer {} did not finish before the deadline; cancelled", writerName);
            return WriterResult.failed(writerName, null, new OperationTimeoutException("race " + writerName, e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return WriterResult.failed(writerName, null, new OperationTimeoutException("race " + writerName, e));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.error("Writer {} crashed", writerName, cause);
            return WriterResult.failed(writerName, null, new VersionRaceException(
                "WRITER_CRASHED", "Writer " + writerName + " crashed: " + cause, cause));
        }
    }
}
