package com.versionrace.engine.coordinator;

import com.versionrace.core.exception.ConcurrentUpdateException;
import com.versionrace.core.model.RaceOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

public class ConflictDetectorTest {

    private final ConflictDetector detector = new ConflictDetector();

    @Test
    @DisplayName("Matching counts should be consistent")
    void testMatchingCounts() {
        assertThat(detector.evaluate(new RaceOutcome(1, 1))).isEqualTo(ConsistencyVerdict.OK);
        assertThat(detector.evaluate(new RaceOutcome(0, 0))).isEqualTo(ConsistencyVerdict.OK);
    }

    @Test
    @DisplayName("Differing counts should be a conflict")
    void testDifferingCounts() {
        assertThat(detector.evaluate(new RaceOutcome(1, 0))).isEqualTo(ConsistencyVerdict.CONFLICT);
        assertThat(detector.evaluate(new RaceOutcome(0, 1))).isEqualTo(ConsistencyVerdict.CONFLICT);
    }

    @Test
    @DisplayName("Conflict should carry the key, expected version and both counts")
    void testRequireConsistentThrows() {
        UUID key = UUID.randomUUID();

        assertThatThrownBy(() -> detector.requireConsistent(key, 2, new RaceOutcome(1, 0)))
            .isInstanceOfSatisfying(ConcurrentUpdateException.class, e -> {
                assertThat(e.getKey()).isEqualTo(key);
                assertThat(e.getExpectedVersion()).isEqualTo(2);
                assertThat(e.getFirstCount()).isEqualTo(1);
                assertThat(e.getSecondCount()).isZero();
                assertThat(e.getErrorCode()).isEqualTo(ConcurrentUpdateException.ERROR_CODE);
            });
    }

    @Test
    @DisplayName("Consistent outcome should pass without error")
    void testRequireConsistentPasses() {
        assertThatCode(() -> detector.requireConsistent(UUID.randomUUID(), 2, new RaceOutcome(1, 1)))
            .doesNotThrowAnyException();
    }
}
