package com.productvideo.matching.vision.progress;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Assets already accepted per job, so a redelivered item event is never processed twice. */
public class ProcessedAssetLedger {
    private final Map<String, Set<String>> assetsByJob = new ConcurrentHashMap<>();

    /** Returns {@code true} if the asset is new for the job and marks it. */
    public boolean markAndCheck(String jobId, String assetId) {
        return assetsByJob.computeIfAbsent(jobId, k -> ConcurrentHashMap.newKeySet()).add(assetId);
    }

    /** Forgets an asset whose processing failed so that its redelivery is accepted. */
    public void release(String jobId, String assetId) {
        Set<String> assets = assetsByJob.get(jobId);
        if (assets != null) {
            assets.remove(assetId);
        }
    }

    public boolean contains(String jobId, String assetId) {
        Set<String> assets = assetsByJob.get(jobId);
        return assets != null && assets.contains(assetId);
    }

    public void clearJob(String jobId) {
        assetsByJob.remove(jobId);
    }

    public void clear() {
        assetsByJob.clear();
    }
}
