package com.versionrace.core.model;

import com.versionrace.core.exception.ConcurrentUpdateException;
import com.versionrace.core.exception.OperationTimeoutException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class RaceResultTest {

    private final UUID key = UUID.randomUUID();

    @Test
    void shouldCountOneWinnerAndOneConflict() {
        ConcurrentUpdateException conflict = new ConcurrentUpdateException(key, 2, 1, 0);
        RaceResult result = new RaceResult(key, 2, IsolationLevel.READ_COMMITTED, List.of(
            WriterResult.succeeded("writer-A", new RaceOutcome(1, 1)),
            WriterResult.conflict("writer-B", new RaceOutcome(1, 0), conflict)
        ));

        assertThat(result.successCount()).isEqualTo(1);
        assertThat(result.conflictCount()).isEqualTo(1);
        assertThat(result.failureCount()).isZero();
        assertThat(result.committedAdvances()).isEqualTo(1);
        assertThat(result.conflictDetected()).isTrue();
        assertThat(result.allSucceeded()).isFalse();
        assertThat(result.firstConflict()).containsSame(conflict);
    }

    @Test
    void throwIfConflict_shouldRethrowTheConflict() {
        ConcurrentUpdateException conflict = new ConcurrentUpdateException(key, 2, 1, 0);
        RaceResult result = new RaceResult(key, 2, IsolationLevel.READ_COMMITTED, List.of(
            WriterResult.succeeded("writer-A", new RaceOutcome(1, 1)),
            WriterResult.conflict("writer-B", new RaceOutcome(1, 0), conflict)
        ));

        assertThatThrownBy(result::throwIfConflict)
            .isSameAs(conflict)
            .hasMessageContaining(key.toString());
    }

    @Test
    void throwIfConflict_shouldDoNothingWithoutConflict() {
        RaceResult result = new RaceResult(key, 2, IsolationLevel.SERIALIZABLE, List.of(
            WriterResult.succeeded("writer-A", new RaceOutcome(0, 0)),
            WriterResult.succeeded("writer-B", new RaceOutcome(0, 0))
        ));

        assertThatCode(result::throwIfConflict).doesNotThrowAnyException();
        assertThat(result.allSucceeded()).isTrue();
        assertThat(result.committedAdvances()).isZero();
    }

    @Test
    void failures_shouldKeepEveryFailedWriter() {
        OperationTimeoutException timeout = new OperationTimeoutException("rendezvous");
        RaceResult result = new RaceResult(key, 2, IsolationLevel.READ_COMMITTED, List.of(
            WriterResult.succeeded("writer-A", new RaceOutcome(1, 1)),
            WriterResult.failed("writer-B", null, timeout)
        ));

        assertThat(result.failures())
            .singleElement()
            .satisfies(w -> {
                assertThat(w.writerName()).isEqualTo("writer-B");
                assertThat(w.errorIfAny()).containsSame(timeout);
            });
        assertThat(result.conflictDetected()).isFalse();
    }

    @Test
    void writerResult_shouldKeepFirstCountOfWriterFailingAfterFirstAttempt() {
        OperationTimeoutException timeout = new OperationTimeoutException("hold");

        WriterResult failed = WriterResult.failedAfterFirstAttempt("writer-A", 1, timeout);

        assertThat(failed.status()).isEqualTo(WriterStatus.FAILED);
        assertThat(failed.firstCount()).isEqualTo(1L);
        assertThat(failed.outcome()).isNull();
        assertThat(failed.committedAdvance()).isFalse();
    }

    @Test
    void writerResult_shouldTakeFirstCountFromOutcome() {
        assertThat(WriterResult.succeeded("writer-A", new RaceOutcome(1, 1)).firstCount()).isEqualTo(1L);
        assertThat(WriterResult.failed("writer-B", null, new OperationTimeoutException("x")).firstCount()).isNull();
        assertThatThrownBy(() -> new WriterResult("w", WriterStatus.FAILED, 0L, new RaceOutcome(1, 1),
                new OperationTimeoutException("x")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void writerResult_shouldRejectInconsistentCombinations() {
        assertThatThrownBy(() -> new WriterResult("w", WriterStatus.SUCCEEDED, null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WriterResult("w", WriterStatus.CONFLICT, new RaceOutcome(1, 0),
                new OperationTimeoutException("x")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WriterResult("w", WriterStatus.FAILED, null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void raceOutcome_shouldReportConsistency() {
        assertThat(new RaceOutcome(1, 1).isConsistent()).isTrue();
        assertThat(new RaceOutcome(1, 0).isConsistent()).isFalse();
        assertThat(new RaceOutcome(0, 0).advanced()).isFalse();
        assertThat(new RaceOutcome(1, 1).advanced()).isTrue();
    }
}
