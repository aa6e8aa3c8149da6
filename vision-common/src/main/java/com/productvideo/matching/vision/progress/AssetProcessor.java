package com.productvideo.matching.vision.progress;

/** The per-item work run between accepting an item and counting it. */
@FunctionalInterface
public interface AssetProcessor {
    /**
     * @return {@code false} if the item cannot be processed because its upstream
     *         record is missing; it is then skipped without being counted
     * @throws Exception on a processing failure, which leaves the item uncounted and
     *                   eligible for redelivery
     */
    boolean process() throws Exception;
}
