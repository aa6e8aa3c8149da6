package com.productvideo.matching.shared.events;

public enum PipelineStage {
    EMBEDDINGS("embeddings"),
    KEYPOINTS("keypoints"),
    SEGMENTATION("segmentation");

    private final String wireName;

    PipelineStage(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** e.g. {@code image.embeddings.completed}, {@code video.keypoints.completed}. */
    public String completedTopic(AssetType assetType) {
        return assetType.wireName() + "." + wireName + ".completed";
    }
}
