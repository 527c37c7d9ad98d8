package com.versionrace.core.model;

import com.versionrace.core.exception.OperationTimeoutException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineTest {

    private static final Instant START = Instant.parse("2024-01-15T10:00:00Z");

    @Test
    void after_shouldExpireAtClockPlusTimeout() {
        Clock clock = Clock.fixed(START, ZoneOffset.UTC);
        
        Deadline deadline = Deadline.after(Duration.ofSeconds(10), clock);
        
        assertEquals(START.plusSeconds(10), deadline.expiresAt());
        assertEquals(Duration.ofSeconds(10), deadline.remaining());
        assertFalse(deadline.isExpired());
    }

    @Test
    void remaining_shouldReturnZeroOncePassed() {
        Deadline deadline = new Deadline(START, Clock.fixed(START.plusSeconds(5), ZoneOffset.UTC));
        
        assertEquals(Duration.ZERO, deadline.remaining());
        assertTrue(deadline.isExpired());
    }

    @Test
    void isExpired_shouldBeTrueExactlyAtExpiry() {
        Deadline deadline = new Deadline(START, Clock.fixed(START, ZoneOffset.UTC));
        
        assertTrue(deadline.isExpired());
    }

    @Test
    void remainingSeconds_shouldRoundUpAndNeverDropBelowOne() {
        Clock clock = Clock.fixed(START, ZoneOffset.UTC);
        
        assertEquals(2, Deadline.after(Duration.ofMillis(1500), clock).remainingSeconds());
        assertEquals(1, Deadline.after(Duration.ofMillis(1), clock).remainingSeconds());
        assertEquals(1, new Deadline(START.minusSeconds(3), clock).remainingSeconds());
    }

    @Test
    void check_shouldThrowTimeoutWhenExpired() {
        Deadline deadline = new Deadline(START, Clock.fixed(START.plusMillis(1), ZoneOffset.UTC));
        
        OperationTimeoutException ex = assertThrows(OperationTimeoutException.class,
            () -> deadline.check("read"));
        
        assertEquals(OperationTimeoutException.ERROR_CODE, ex.getErrorCode());
        assertTrue(ex.getMessage().contains("read"));
    }

    @Test
    void check_shouldPassWhileTimeRemains() {
        Deadline deadline = Deadline.after(Duration.ofMinutes(1), Clock.fixed(START, ZoneOffset.UTC));
        
        assertDoesNotThrow(() -> deadline.check("read"));
    }

    @Test
    void after_shouldRejectNegativeTimeout() {
        assertThrows(IllegalArgumentException.class, () -> Deadline.after(Duration.ofSeconds(-1)));
    }
}
