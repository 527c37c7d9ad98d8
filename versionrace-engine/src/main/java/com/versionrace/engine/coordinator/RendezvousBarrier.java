package com.versionrace.engine.coordinator;

import com.versionrace.core.exception.OperationTimeoutException;
import com.versionrace.core.model.Deadline;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Synchronization point that forces racing writers into one interleaving.
 * 
 * Two parts:
 * - an arrival latch: nobody passes {@link #awaitArrivals} until every party
 *   has called {@link #arrive}
 * - an exclusive gate: {@link #hold} lets one party at a time spend the
 *   minimum hold time, the others queue behind it in arrival order
 * 
 * Every wait is bounded by a {@link Deadline}. Interruption counts as
 * cancellation and surfaces as {@link OperationTimeoutException}.
 * One barrier serves exactly one race.
 */
public class RendezvousBarrier {

    private final int parties;
    private final Duration minimumHold;
    private final CountDownLatch arrivals;
    private final Semaphore gate = new Semaphore(1, true);

    public RendezvousBarrier(int parties, Duration minimumHold) {
        if (parties < 1) {
            throw new IllegalArgumentException("parties must be >= 1: " + parties);
        }
        if (minimumHold.isNegative()) {
            throw new IllegalArgumentException("minimumHold must not be negative: " + minimumHold);
        }
        this.parties = parties;
        this.minimumHold = minimumHold;
        this.arrivals = new CountDownLatch(parties);
    }

    /**
     * Barrier for two writers.
     */
    public static RendezvousBarrier forPair(Duration minimumHold) {
        return new RendezvousBarrier(2, minimumHold);
    }

    /**
     * Signal that the calling party reached the rendezvous.
     * Each party must call this exactly once, including on failure paths.
     */
    public void arrive() {
        arrivals.countDown();
    }

    /**
     * Block until all parties have arrived.
     */
    public void awaitArrivals(Deadline deadline) {
        try {
            if (!arrivals.await(deadline.remainingMillis(), TimeUnit.MILLISECONDS)) {
                throw new OperationTimeoutException(String.format(
                    "rendezvous (%d of %d parties arrived)", arrivedCount(), parties));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationTimeoutException("rendezvous", e);
        }
    }

    /**
     * Take the gate, keep it for the minimum hold, then hand it to the next party.
     */
    public void hold(Deadline deadline) {
        try {
            if (!gate.tryAcquire(deadline.remainingMillis(), TimeUnit.MILLISECONDS)) {
                throw new OperationTimeoutException("rendezvous gate");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationTimeoutException("rendezvous gate", e);
        }
        try {
            sleep(deadline);
        } finally {
            gate.release();
        }
    }

    public int arrivedCount() {
        return parties - (int) arrivals.getCount();
    }

    private void sleep(Deadline deadline) {
        long holdMillis = minimumHold.toMillis();
        if (holdMillis == 0) {
            return;
        }
        long remaining = deadline.remainingMillis();
        try {
            TimeUnit.MILLISECONDS.sleep(Math.min(holdMillis, remaining));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationTimeoutException("hold", e);
        }
        if (remaining < holdMillis) {
            throw new OperationTimeoutException("hold");
        }
    }
}
