package com.productvideo.matching.vision.progress;

import java.util.Objects;

public class JobProgressState {
    private final TrackingKey key;
    private ExpectedCount expected;
    private int done;

    public JobProgressState(TrackingKey key, ExpectedCount expected) {
        this.key = Objects.requireNonNull(key, "key is null");
        this.expected = Objects.requireNonNull(expected, "expected is null");
    }

    public TrackingKey getKey() {
        return key;
    }

    public synchronized ExpectedCount getExpected() {
        return expected;
    }

    public synchronized void setExpected(ExpectedCount expected) {
        this.expected = Objects.requireNonNull(expected, "expected is null");
    }

    public synchronized int getDone() {
        return done;
    }

    public synchronized void addDone(int increment) {
        if (increment < 0) {
            throw new IllegalArgumentException("increment must be >= 0");
        }
        this.done += increment;
    }
}
