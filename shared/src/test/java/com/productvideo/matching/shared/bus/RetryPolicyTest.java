package com.productvideo.matching.shared.bus;

import static org.junit.jupiter.api.Assertions.*;

import com.productvideo.matching.shared.events.InvalidEventException;
import java.io.IOException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {
    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(10));

    @Test
    void transientFailures_areRetryable() {
        assertTrue(policy.isRetryable(new RetryableException("busy")));
        assertTrue(policy.isRetryable(new IOException("reset")));
        assertTrue(policy.isRetryable(new RuntimeException(new SQLTransientConnectionException("gone"))));
    }

    @Test
    void invalidEvent_isFatalEvenWhenWrapped() {
        assertFalse(policy.isRetryable(new InvalidEventException("no job_id")));
        assertFalse(policy.isRetryable(new RetryableException("wrap", new InvalidEventException("no job_id"))));
        assertFalse(policy.isRetryable(new IllegalStateException("bug")));
    }

    @Test
    void shouldRetry_stopsAtMaxRetries() {
        IOException error = new IOException("reset");

        assertTrue(policy.shouldRetry(error, 0));
        assertTrue(policy.shouldRetry(error, 2));
        assertFalse(policy.shouldRetry(error, 3));
    }

    @Test
    void backoff_doublesUpToCap() {
        assertEquals(Duration.ofSeconds(1), policy.backoff(0));
        assertEquals(Duration.ofSeconds(2), policy.backoff(1));
        assertEquals(Duration.ofSeconds(8), policy.backoff(3));
        assertEquals(Duration.ofSeconds(10), policy.backoff(4));
        assertEquals(Duration.ofSeconds(10), policy.backoff(40));
    }
}
