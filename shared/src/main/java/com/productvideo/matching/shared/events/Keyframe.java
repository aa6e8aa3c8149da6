package com.productvideo.matching.shared.events;

import java.util.Objects;

/**
 * One frame inside a keyframe event. Ready events carry {@code localPath},
 * masked events carry {@code maskPath}.
 */
public class Keyframe {
    private final String frameId;
    private final Double timestamp;
    private final String localPath;
    private final String maskPath;

    public Keyframe(String frameId, Double timestamp, String localPath, String maskPath) {
        this.frameId = Objects.requireNonNull(frameId, "frameId is null");
        this.timestamp = timestamp;
        this.localPath = localPath;
        this.maskPath = maskPath;
    }

    public String getFrameId() {
        return frameId;
    }

    public Double getTimestamp() {
        return timestamp;
    }

    public String getLocalPath() {
        return localPath;
    }

    public String getMaskPath() {
        return maskPath;
    }
}
