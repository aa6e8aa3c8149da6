package com.productvideo.matching.shared.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

/**
 * Announces the input of the next pipeline stage, e.g.
 * {@code products.images.masked.batch} or {@code video.keyframes.masked.batch}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"event_id", "job_id", "total_images", "total_keyframes"})
public class BatchTransitionEvent {
    private final String eventId;
    private final String jobId;
    private final Integer totalImages;
    private final Integer totalKeyframes;

    private BatchTransitionEvent(String eventId, String jobId, Integer totalImages, Integer totalKeyframes) {
        this.eventId = Objects.requireNonNull(eventId, "eventId is null");
        this.jobId = Objects.requireNonNull(jobId, "jobId is null");
        this.totalImages = totalImages;
        this.totalKeyframes = totalKeyframes;
    }

    public static BatchTransitionEvent images(String eventId, String jobId, int totalImages) {
        return new BatchTransitionEvent(eventId, jobId, totalImages, null);
    }

    public static BatchTransitionEvent keyframes(String eventId, String jobId, int totalKeyframes) {
        return new BatchTransitionEvent(eventId, jobId, null, totalKeyframes);
    }

    @JsonProperty("event_id")
    public String getEventId() {
        return eventId;
    }

    @JsonProperty("job_id")
    public String getJobId() {
        return jobId;
    }

    @JsonProperty("total_images")
    public Integer getTotalImages() {
        return totalImages;
    }

    @JsonProperty("total_keyframes")
    public Integer getTotalKeyframes() {
        return totalKeyframes;
    }
}
