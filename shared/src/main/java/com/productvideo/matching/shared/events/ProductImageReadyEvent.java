package com.productvideo.matching.shared.events;

import java.util.Objects;

public class ProductImageReadyEvent {
    private final String jobId;
    private final String productId;
    private final String imageId;
    private final String localPath;

    public ProductImageReadyEvent(String jobId, String productId, String imageId, String localPath) {
        this.jobId = Objects.requireNonNull(jobId, "jobId is null");
        this.productId = productId;
        this.imageId = Objects.requireNonNull(imageId, "imageId is null");
        this.localPath = Objects.requireNonNull(localPath, "localPath is null");
    }

    public String getJobId() {
        return jobId;
    }

    public String getProductId() {
        return productId;
    }

    public String getImageId() {
        return imageId;
    }

    public String getLocalPath() {
        return localPath;
    }
}
