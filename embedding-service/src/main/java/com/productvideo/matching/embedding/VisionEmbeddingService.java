package com.productvideo.matching.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.productvideo.matching.embedding.db.EmbeddingRepository;
import com.productvideo.matching.shared.bus.EventBus;
import com.productvideo.matching.shared.events.AssetReadyEvent;
import com.productvideo.matching.shared.events.AssetType;
import com.productvideo.matching.shared.events.EventCodec;
import com.productvideo.matching.shared.events.Keyframe;
import com.productvideo.matching.shared.events.KeyframesMaskedEvent;
import com.productvideo.matching.shared.events.PipelineStage;
import com.productvideo.matching.shared.events.ProductImageMaskedEvent;
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
 * Computes embeddings for masked product images and keyframes and reports
 * per-job completion of the {@code embeddings} stage.
 */
public class VisionEmbeddingService {
    private static final Logger LOGGER = LogManager.getLogger(VisionEmbeddingService.class);

    static final PipelineStage STAGE = PipelineStage.EMBEDDINGS;
    static final String FEATURE = "embedding";

    private final EmbeddingRepository repository;
    private final EmbeddingExtractor extractor;
    private final JobProgressManager progress;
    private final EventBus bus;

    public VisionEmbeddingService(
            EmbeddingRepository repository,
            EmbeddingExtractor extractor,
            JobProgressManager progress,
            EventBus bus
    ) {
        this.repository = Objects.requireNonNull(repository, "repository is null");
        this.extractor = Objects.requireNonNull(extractor, "extractor is null");
        this.progress = Objects.requireNonNull(progress, "progress is null");
        this.bus = Objects.requireNonNull(bus, "bus is null");
    }

    public void register(EventBus subscriptions) {
        subscriptions.subscribe(Topics.PRODUCTS_IMAGES_MASKED_BATCH, this::handleProductImagesMaskedBatch);
        subscriptions.subscribe(Topics.VIDEO_KEYFRAMES_MASKED_BATCH, this::handleVideoKeyframesMaskedBatch);
        subscriptions.subscribe(Topics.PRODUCTS_IMAGE_MASKED, this::handleProductImageMasked);
        subscriptions.subscribe(Topics.VIDEO_KEYFRAMES_MASKED, this::handleVideoKeyframesMasked);
        LOGGER.info("Subscribed to masked image and keyframe topics");
    }

    // ── Batch announcements ────────────────────────────────────────────────────

    void handleProductImagesMaskedBatch(JsonNode payload) {
        progress.onBatchAnnounced(EventCodec.batchAnnounced(payload, AssetType.IMAGE, "total_images"), STAGE);
    }

    void handleVideoKeyframesMaskedBatch(JsonNode payload) {
        progress.onBatchAnnounced(EventCodec.batchAnnounced(payload, AssetType.VIDEO, "total_keyframes"), STAGE);
    }

    // ── Items ──────────────────────────────────────────────────────────────────

    void handleProductImageMasked(JsonNode payload) throws Exception {
        ProductImageMaskedEvent event = EventCodec.productImageMasked(payload);
        progress.onItemReady(event.getJobId(), AssetType.IMAGE, event.getImageId(), STAGE,
                () -> processProductImage(event));
    }

    void handleVideoKeyframesMasked(JsonNode payload) throws Exception {
        KeyframesMaskedEvent event = EventCodec.keyframesMasked(payload);
        LOGGER.info("Masked keyframes received job={} video={} frames={}",
                event.getJobId(), event.getVideoId(), event.getFrames().size());
        for (Keyframe frame : event.getFrames()) {
            progress.onItemReady(event.getJobId(), AssetType.VIDEO, frame.getFrameId(), STAGE,
                    () -> processVideoFrame(event.getJobId(), frame));
        }
    }

    private boolean processProductImage(ProductImageMaskedEvent event) throws IOException {
        Optional<String> localPath = repository.findProductImagePath(event.getImageId());
        if (localPath.isEmpty()) {
            LOGGER.error("Product image {} not found for job {}", event.getImageId(), event.getJobId());
            return false;
        }
        Optional<Embedding> embedding = extractor.extract(Path.of(localPath.get()), Path.of(event.getMaskPath()));
        if (embedding.isEmpty()) {
            return false;
        }
        if (!repository.updateProductImageEmbedding(event.getImageId(),
                embedding.get().getRgb(), embedding.get().getGray())) {
            LOGGER.error("Product image {} disappeared before its embedding was stored", event.getImageId());
            return false;
        }
        publishReady(AssetType.IMAGE, event.getJobId(), event.getImageId());
        return true;
    }

    private boolean processVideoFrame(String jobId, Keyframe frame) throws IOException {
        Optional<String> localPath = repository.findVideoFramePath(frame.getFrameId());
        if (localPath.isEmpty()) {
            LOGGER.error("Video frame {} not found for job {}", frame.getFrameId(), jobId);
            return false;
        }
        Optional<Embedding> embedding = extractor.extract(Path.of(localPath.get()), Path.of(frame.getMaskPath()));
        if (embedding.isEmpty()) {
            return false;
        }
        if (!repository.updateVideoFrameEmbedding(frame.getFrameId(),
                embedding.get().getRgb(), embedding.get().getGray())) {
            LOGGER.error("Video frame {} disappeared before its embedding was stored", frame.getFrameId());
            return false;
        }
        publishReady(AssetType.VIDEO, jobId, frame.getFrameId());
        return true;
    }

    private void publishReady(AssetType assetType, String jobId, String assetId) {
        bus.publish(Topics.assetReady(assetType, FEATURE),
                new AssetReadyEvent(jobId, assetId, UUID.randomUUID().toString()), jobId);
        LOGGER.info("Embedding stored for {} {} job={}", assetType.wireName(), assetId, jobId);
    }
}
