package com.productvideo.matching.shared.events;

import java.util.List;
import java.util.Objects;

public class KeyframesReadyEvent {
    private final String jobId;
    private final String videoId;
    private final List<Keyframe> frames;

    public KeyframesReadyEvent(String jobId, String videoId, List<Keyframe> frames) {
        this.jobId = Objects.requireNonNull(jobId, "jobId is null");
        this.videoId = videoId;
        this.frames = List.copyOf(Objects.requireNonNull(frames, "frames is null"));
    }

    public String getJobId() {
        return jobId;
    }

    public String getVideoId() {
        return videoId;
    }

    public List<Keyframe> getFrames() {
        return frames;
    }
}
