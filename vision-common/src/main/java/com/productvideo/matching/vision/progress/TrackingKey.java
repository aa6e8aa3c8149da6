package com.productvideo.matching.vision.progress;

import com.productvideo.matching.shared.events.AssetType;
import com.productvideo.matching.shared.events.PipelineStage;
import java.util.Objects;

/** Identifies one tracked stream: a job's assets of one type going through one stage. */
public final class TrackingKey {
    private final String jobId;
    private final AssetType assetType;
    private final PipelineStage stage;

    public TrackingKey(String jobId, AssetType assetType, PipelineStage stage) {
        this.jobId = Objects.requireNonNull(jobId, "jobId is null");
        this.assetType = Objects.requireNonNull(assetType, "assetType is null");
        this.stage = Objects.requireNonNull(stage, "stage is null");
    }

    public String getJobId() {
        return jobId;
    }

    public AssetType getAssetType() {
        return assetType;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public String completedTopic() {
        return stage.completedTopic(assetType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TrackingKey other)) {
            return false;
        }
        return jobId.equals(other.jobId) && assetType == other.assetType && stage == other.stage;
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, assetType, stage);
    }

    @Override
    public String toString() {
        return jobId + ":" + assetType.wireName() + ":" + stage.wireName();
    }
}
