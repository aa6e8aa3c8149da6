package com.productvideo.matching.shared.events;

import java.util.Objects;

/** Declares how many items of one asset type a job will produce. */
public class BatchAnnouncedEvent {
    private final String jobId;
    private final String eventId;
    private final AssetType assetType;
    private final int totalItems;

    public BatchAnnouncedEvent(String jobId, String eventId, AssetType assetType, int totalItems) {
        this.jobId = Objects.requireNonNull(jobId, "jobId is null");
        this.eventId = Objects.requireNonNull(eventId, "eventId is null");
        this.assetType = Objects.requireNonNull(assetType, "assetType is null");
        if (totalItems < 0) {
            throw new IllegalArgumentException("totalItems must be >= 0");
        }
        this.totalItems = totalItems;
    }

    public String getJobId() {
        return jobId;
    }

    public String getEventId() {
        return eventId;
    }

    public AssetType getAssetType() {
        return assetType;
    }

    public int getTotalItems() {
        return totalItems;
    }
}
