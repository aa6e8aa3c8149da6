package com.productvideo.matching.shared.events;

/** Routing keys shared across services. */
public final class Topics {
    public static final String PRODUCTS_IMAGES_READY_BATCH = "products.images.ready.batch";
    public static final String PRODUCTS_IMAGE_READY = "products.image.ready";
    public static final String PRODUCTS_IMAGES_MASKED_BATCH = "products.images.masked.batch";
    public static final String PRODUCTS_IMAGE_MASKED = "products.image.masked";

    public static final String VIDEOS_KEYFRAMES_READY_BATCH = "videos.keyframes.ready.batch";
    public static final String VIDEOS_KEYFRAMES_READY = "videos.keyframes.ready";
    public static final String VIDEO_KEYFRAMES_MASKED_BATCH = "video.keyframes.masked.batch";
    public static final String VIDEO_KEYFRAMES_MASKED = "video.keyframes.masked";

    private Topics() {}

    /** e.g. {@code image.embedding.ready}. */
    public static String assetReady(AssetType assetType, String feature) {
        return assetType.wireName() + "." + feature + ".ready";
    }
}
