package com.productvideo.matching.shared.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

/** Per-asset notification, e.g. {@code image.embedding.ready}. */
@JsonPropertyOrder({"job_id", "asset_id", "event_id"})
public class AssetReadyEvent {
    private final String jobId;
    private final String assetId;
    private final String eventId;

    public AssetReadyEvent(String jobId, String assetId, String eventId) {
        this.jobId = Objects.requireNonNull(jobId, "jobId is null");
        this.assetId = Objects.requireNonNull(assetId, "assetId is null");
        this.eventId = Objects.requireNonNull(eventId, "eventId is null");
    }

    @JsonProperty("job_id")
    public String getJobId() {
        return jobId;
    }

    @JsonProperty("asset_id")
    public String getAssetId() {
        return assetId;
    }

    @JsonProperty("event_id")
    public String getEventId() {
        return eventId;
    }
}
