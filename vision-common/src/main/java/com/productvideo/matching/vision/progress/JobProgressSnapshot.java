package com.productvideo.matching.vision.progress;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"job_id", "asset_type", "stage", "expected_kind", "expected", "done", "timer_running"})
public class JobProgressSnapshot {
    private final TrackingKey key;
    private final ExpectedCount expected;
    private final int done;
    private final boolean timerRunning;

    public JobProgressSnapshot(TrackingKey key, ExpectedCount expected, int done, boolean timerRunning) {
        this.key = key;
        this.expected = expected;
        this.done = done;
        this.timerRunning = timerRunning;
    }

    @JsonProperty("job_id")
    public String getJobId() {
        return key.getJobId();
    }

    @JsonProperty("asset_type")
    public String getAssetType() {
        return key.getAssetType().wireName();
    }

    @JsonProperty("stage")
    public String getStage() {
        return key.getStage().wireName();
    }

    @JsonProperty("expected_kind")
    public String getExpectedKind() {
        return expected.getKind().name();
    }

    @JsonProperty("expected")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Integer getExpected() {
        return expected.isKnown() ? expected.getValue() : null;
    }

    @JsonProperty("done")
    public int getDone() {
        return done;
    }

    @JsonProperty("timer_running")
    public boolean isTimerRunning() {
        return timerRunning;
    }
}
