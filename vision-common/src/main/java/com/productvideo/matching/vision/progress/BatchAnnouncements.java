package com.productvideo.matching.vision.progress;

import com.productvideo.matching.shared.events.AssetType;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Announced totals per (job, asset type). Presence of an entry is the batch
 * initialization marker; the value is the side-channel expected total.
 */
public class BatchAnnouncements {
    private final Map<String, Map<AssetType, Integer>> totalsByJob = new ConcurrentHashMap<>();

    public void record(String jobId, AssetType assetType, int total) {
        if (total < 0) {
            throw new IllegalArgumentException("total must be >= 0");
        }
        Map<AssetType, Integer> totals = totalsByJob.computeIfAbsent(jobId, k -> new EnumMap<>(AssetType.class));
        synchronized (totals) {
            totals.put(assetType, total);
        }
    }

    public boolean isInitialized(String jobId, AssetType assetType) {
        return announcedTotal(jobId, assetType) != null;
    }

    /** The announced total, or {@code null} if no batch was accepted yet. */
    public Integer announcedTotal(String jobId, AssetType assetType) {
        Map<AssetType, Integer> totals = totalsByJob.get(jobId);
        if (totals == null) {
            return null;
        }
        synchronized (totals) {
            return totals.get(assetType);
        }
    }

    public void remove(String jobId, AssetType assetType) {
        Map<AssetType, Integer> totals = totalsByJob.get(jobId);
        if (totals == null) {
            return;
        }
        synchronized (totals) {
            totals.remove(assetType);
            if (totals.isEmpty()) {
                totalsByJob.remove(jobId, totals);
            }
        }
    }

    public void clearJob(String jobId) {
        totalsByJob.remove(jobId);
    }

    public void clear() {
        totalsByJob.clear();
    }
}
