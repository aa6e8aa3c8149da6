package com.productvideo.matching.shared.bus;

import com.productvideo.matching.shared.events.InvalidEventException;
import java.io.IOException;
import java.sql.SQLTransientException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

public class RetryPolicy {
    private final int maxRetries;
    private final Duration maxBackoff;

    public RetryPolicy(int maxRetries, Duration maxBackoff) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (maxBackoff == null || maxBackoff.isNegative() || maxBackoff.isZero()) {
            throw new IllegalArgumentException("maxBackoff must be positive");
        }
        this.maxRetries = maxRetries;
        this.maxBackoff = maxBackoff;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public boolean shouldRetry(Throwable error, int retryCount) {
        return retryCount < maxRetries && isRetryable(error);
    }

    /** Walks the cause chain; an {@link InvalidEventException} anywhere is fatal. */
    public boolean isRetryable(Throwable error) {
        boolean retryable = false;
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof InvalidEventException) {
                return false;
            }
            if (t instanceof RetryableException
                    || t instanceof IOException
                    || t instanceof TimeoutException
                    || t instanceof SQLTransientException) {
                retryable = true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return retryable;
    }

    /** 1s, 2s, 4s, ... capped at {@code maxBackoff}. */
    public Duration backoff(int retryCount) {
        if (retryCount >= 30) {
            return maxBackoff;
        }
        Duration delay = Duration.ofSeconds(1L << Math.max(0, retryCount));
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }
}
