package com.productvideo.matching.keypoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.productvideo.matching.keypoint.db.KeypointRepository;
import com.productvideo.matching.shared.bus.EventBus;
import com.productvideo.matching.shared.events.AssetReadyEvent;
import com.productvideo.matching.shared.events.AssetType;
import com.productvideo.matching.shared.events.EventCodec;
import com.productvideo.matching.shared.events.Keyframe;
import com.productvideo.matching.shared.events.KeyframesReadyEvent;
import com.productvideo.matching.shared.events.PipelineStage;
import com.productvideo.matching.shared.events.ProductImageReadyEvent;
import com.productvideo.matching.shared.events.Topics;
import com.productvideo.matching.vision.progress.JobProgressManager;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Extracts keypoints for ready product images and keyframes and reports
 * per-job completion of the {@code keypoints} stage.
 */
public class VisionKeypointService {
    private static final Logger LOGGER = LogManager.getLogger(VisionKeypointService.class);

    static final PipelineStage STAGE = PipelineStage.KEYPOINTS;
    static final String FEATURE = "keypoint";

    private final KeypointRepository repository;
    private final KeypointExtractor extractor;
    private final JobProgressManager progress;
    private final EventBus bus;

    public VisionKeypointService(
            KeypointRepository repository,
            KeypointExtractor extractor,
            JobProgressManager progress,
            EventBus bus
    ) {
        this.repository = Objects.requireNonNull(repository, "repository is null");
        this.extractor = Objects.requireNonNull(extractor, "extractor is null");
        this.progress = Objects.requireNonNull(progress, "progress is null");
        this.bus = Objects.requireNonNull(bus, "bus is null");
    }

    public void register(EventBus subscriptions) {
        subscriptions.subscribe(Topics.PRODUCTS_IMAGES_READY_BATCH, this::handleProductImagesReadyBatch);
        subscriptions.subscribe(Topics.VIDEOS_KEYFRAMES_READY_BATCH, this::handleVideoKeyframesReadyBatch);
        subscriptions.subscribe(Topics.PRODUCTS_IMAGE_READY, this::handleProductImageReady);
        subscriptions.subscribe(Topics.VIDEOS_KEYFRAMES_READY, this::handleVideoKeyframesReady);
        LOGGER.info("Subscribed to ready image and keyframe topics");
    }

    void handleProductImagesReadyBatch(JsonNode payload) {
        progress.onBatchAnnounced(EventCodec.batchAnnounced(payload, AssetType.IMAGE, "total_images"), STAGE);
    }

    void handleVideoKeyframesReadyBatch(JsonNode payload) {
        progress.onBatchAnnounced(EventCodec.batchAnnounced(payload, AssetType.VIDEO, "total_keyframes"), STAGE);
    }

    void handleProductImageReady(JsonNode payload) throws Exception {
        ProductImageReadyEvent event = EventCodec.productImageReady(payload);
        progress.onItemReady(event.getJobId(), AssetType.IMAGE, event.getImageId(), STAGE,
                () -> processProductImage(event));
    }

    void handleVideoKeyframesReady(JsonNode payload) throws Exception {
        KeyframesReadyEvent event = EventCodec.keyframesReady(payload);
        LOGGER.info("Keyframes received job={} video={} frames={}",
                event.getJobId(), event.getVideoId(), event.getFrames().size());
        for (Keyframe frame : event.getFrames()) {
            progress.onItemReady(event.getJobId(), AssetType.VIDEO, frame.getFrameId(), STAGE,
                    () -> processVideoFrame(event.getJobId(), frame));
        }
    }

    private boolean processProductImage(ProductImageReadyEvent event) throws IOException {
        Optional<Path> blob = extractor.extract(Path.of(event.getLocalPath()), event.getImageId());
        if (blob.isEmpty()) {
            return false;
        }
        if (!repository.updateProductImageKeypoints(event.getImageId(), blob.get().toString())) {
            LOGGER.error("Product image {} not found for job {}", event.getImageId(), event.getJobId());
            return false;
        }
        publishReady(AssetType.IMAGE, event.getJobId(), event.getImageId());
        return true;
    }

    private boolean processVideoFrame(String jobId, Keyframe frame) throws IOException {
        Optional<Path> blob = extractor.extract(Path.of(frame.getLocalPath()), frame.getFrameId());
        if (blob.isEmpty()) {
            return false;
        }
        if (!repository.updateVideoFrameKeypoints(frame.getFrameId(), blob.get().toString())) {
            LOGGER.error("Video frame {} not found for job {}", frame.getFrameId(), jobId);
            return false;
        }
        publishReady(AssetType.VIDEO, jobId, frame.getFrameId());
        return true;
    }

    private void publishReady(AssetType assetType, String jobId, String assetId) {
        bus.publish(Topics.assetReady(assetType, FEATURE),
                new AssetReadyEvent(jobId, assetId, UUID.randomUUID().toString()), jobId);
        LOGGER.debug("Keypoints stored for {} {} job={}", assetType.wireName(), assetId, jobId);
    }
}
