package com.productvideo.matching.shared.events;

import java.util.Objects;

public class ProductImageMaskedEvent {
    private final String jobId;
    private final String imageId;
    private final String maskPath;

    public ProductImageMaskedEvent(String jobId, String imageId, String maskPath) {
        this.jobId = Objects.requireNonNull(jobId, "jobId is null");
        this.imageId = Objects.requireNonNull(imageId, "imageId is null");
        this.maskPath = Objects.requireNonNull(maskPath, "maskPath is null");
    }

    public String getJobId() {
        return jobId;
    }

    public String getImageId() {
        return imageId;
    }

    public String getMaskPath() {
        return maskPath;
    }
}
