package com.productvideo.matching.shared.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

/**
 * Body of {@code <assetType>.<stage>.completed}. The minimal form carries only the
 * job and event ids; subscribers treat missing counts as "counts unavailable".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"job_id", "event_id", "total_assets", "processed_assets", "failed_assets",
        "has_partial_completion", "watermark_ttl", "idempotent"})
public class CompletionEvent {
    private final String jobId;
    private final String eventId;
    private final Integer totalAssets;
    private final Integer processedAssets;
    private final Integer failedAssets;
    private final Boolean hasPartialCompletion;
    private final Long watermarkTtl;
    private final Boolean idempotent;

    private CompletionEvent(
            String jobId,
            String eventId,
            Integer totalAssets,
            Integer processedAssets,
            Integer failedAssets,
            Boolean hasPartialCompletion,
            Long watermarkTtl,
            Boolean idempotent
    ) {
        this.jobId = Objects.requireNonNull(jobId, "jobId is null");
        this.eventId = Objects.requireNonNull(eventId, "eventId is null");
        this.totalAssets = totalAssets;
        this.processedAssets = processedAssets;
        this.failedAssets = failedAssets;
        this.hasPartialCompletion = hasPartialCompletion;
        this.watermarkTtl = watermarkTtl;
        this.idempotent = idempotent;
    }

    public static CompletionEvent full(
            String jobId,
            String eventId,
            int totalAssets,
            int processedAssets,
            boolean hasPartialCompletion,
            long watermarkTtlSeconds
    ) {
        // failed_assets is not tracked per item yet
        return new CompletionEvent(jobId, eventId, totalAssets, processedAssets, 0,
                hasPartialCompletion, watermarkTtlSeconds, Boolean.TRUE);
    }

    public static CompletionEvent minimal(String jobId, String eventId) {
        return new CompletionEvent(jobId, eventId, null, null, null, null, null, null);
    }

    @JsonProperty("job_id")
    public String getJobId() {
        return jobId;
    }

    @JsonProperty("event_id")
    public String getEventId() {
        return eventId;
    }

    @JsonProperty("total_assets")
    public Integer getTotalAssets() {
        return totalAssets;
    }

    @JsonProperty("processed_assets")
    public Integer getProcessedAssets() {
        return processedAssets;
    }

    @JsonProperty("failed_assets")
    public Integer getFailedAssets() {
        return failedAssets;
    }

    @JsonProperty("has_partial_completion")
    public Boolean getHasPartialCompletion() {
        return hasPartialCompletion;
    }

    @JsonProperty("watermark_ttl")
    public Long getWatermarkTtl() {
        return watermarkTtl;
    }

    @JsonProperty("idempotent")
    public Boolean getIdempotent() {
        return idempotent;
    }
}
