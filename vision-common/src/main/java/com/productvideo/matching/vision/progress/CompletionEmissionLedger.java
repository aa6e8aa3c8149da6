package com.productvideo.matching.vision.progress;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Completion and stage-transition events already handed to the bus. Entries are
 * only removed when their publish fails or on shutdown.
 */
public class CompletionEmissionLedger {
    private final Set<String> emitted = ConcurrentHashMap.newKeySet();

    /** Atomically claims the completion of {@code key}; {@code false} if already claimed. */
    public boolean claim(TrackingKey key) {
        return emitted.add(key.toString());
    }

    public boolean contains(TrackingKey key) {
        return emitted.contains(key.toString());
    }

    public void release(TrackingKey key) {
        emitted.remove(key.toString());
    }

    public boolean claimTransition(String jobId, String topic) {
        return emitted.add(jobId + ":" + topic);
    }

    public void releaseTransition(String jobId, String topic) {
        emitted.remove(jobId + ":" + topic);
    }

    public int size() {
        return emitted.size();
    }

    public void clear() {
        emitted.clear();
    }
}
