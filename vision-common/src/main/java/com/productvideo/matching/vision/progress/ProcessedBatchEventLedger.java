package com.productvideo.matching.vision.progress;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Batch-announced event ids already accepted. Survives job cleanup. */
public class ProcessedBatchEventLedger {
    private final Set<String> seen = ConcurrentHashMap.newKeySet();

    public boolean markIfNew(String jobId, String eventId) {
        return seen.add(jobId + ":" + eventId);
    }

    public void clear() {
        seen.clear();
    }
}
