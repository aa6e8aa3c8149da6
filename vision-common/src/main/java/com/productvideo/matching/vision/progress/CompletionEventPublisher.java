package com.productvideo.matching.vision.progress;

import com.productvideo.matching.shared.bus.EventBus;
import com.productvideo.matching.shared.events.AssetType;
import com.productvideo.matching.shared.events.BatchTransitionEvent;
import com.productvideo.matching.shared.events.CompletionEvent;
import com.productvideo.matching.shared.events.PipelineStage;
import com.productvideo.matching.shared.events.Topics;
import java.util.Objects;
import java.util.UUID;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Emits at most one {@code <asset>.<stage>.completed} event per tracked stream and
 * at most one of each stage-transition event per job. A ledger entry is claimed
 * before the bus call and released again if the bus call fails.
 */
public class CompletionEventPublisher {
    private static final Logger logger = LogManager.getLogger(CompletionEventPublisher.class);

    private final EventBus bus;
    private final JobProgressTracker tracker;
    private final CompletionEmissionLedger ledger;
    private final ProgressSettings settings;

    public CompletionEventPublisher(
            EventBus bus,
            JobProgressTracker tracker,
            CompletionEmissionLedger ledger,
            ProgressSettings settings
    ) {
        this.bus = Objects.requireNonNull(bus, "bus is null");
        this.tracker = Objects.requireNonNull(tracker, "tracker is null");
        this.ledger = Objects.requireNonNull(ledger, "ledger is null");
        this.settings = Objects.requireNonNull(settings, "settings is null");
    }

    /**
     * Publishes the completion of {@code key} from the tracked counters.
     *
     * @return {@code true} if an event was published, {@code false} if the stream is
     *         not tracked or its completion was already emitted
     */
    public boolean publish(TrackingKey key, boolean isTimeout) {
        JobProgressState state = tracker.get(key);
        if (state == null) {
            logger.warn("No tracking for {}, nothing to complete", key);
            return false;
        }
        ExpectedCount expected = state.getExpected();
        int done = state.getDone();
        int total;
        boolean partial;
        if (expected.isKnown() && expected.getValue() == 0 && tracker.isAnnouncedEmpty(key)) {
            logger.info("Completing zero-asset stream {}", key);
            total = 0;
            done = 0;
            partial = false;
        } else if (expected.isKnown()) {
            total = expected.getValue();
            partial = done < total;
        } else {
            // real count never arrived
            total = done;
            partial = true;
        }
        return emit(key, total, done, partial || isTimeout, isTimeout);
    }

    /**
     * Publishes the completion of {@code key} with caller-supplied counts. A
     * segmentation completion also announces the masked batch to the next stage.
     */
    public boolean publishWithExplicitCount(TrackingKey key, int expected, int done) {
        if (expected < 0 || done < 0) {
            throw new IllegalArgumentException("counts must be >= 0");
        }
        boolean partial = expected > 0 && done < expected;
        boolean published = emit(key, expected, done, partial, false);
        if (published && key.getStage() == PipelineStage.SEGMENTATION) {
            if (key.getAssetType() == AssetType.IMAGE) {
                publishProductsImagesMaskedBatch(key.getJobId(), done);
            } else {
                publishVideoKeyframesMaskedBatch(key.getJobId(), done);
            }
        }
        return published;
    }

    public boolean publishProductsImagesMaskedBatch(String jobId, int totalImages) {
        return publishTransition(jobId, Topics.PRODUCTS_IMAGES_MASKED_BATCH,
                BatchTransitionEvent.images(UUID.randomUUID().toString(), jobId, totalImages));
    }

    public boolean publishVideoKeyframesMaskedBatch(String jobId, int totalKeyframes) {
        return publishTransition(jobId, Topics.VIDEO_KEYFRAMES_MASKED_BATCH,
                BatchTransitionEvent.keyframes(UUID.randomUUID().toString(), jobId, totalKeyframes));
    }

    public boolean publishVideosKeyframesReadyBatch(String jobId, int totalKeyframes) {
        return publishTransition(jobId, Topics.VIDEOS_KEYFRAMES_READY_BATCH,
                BatchTransitionEvent.keyframes(UUID.randomUUID().toString(), jobId, totalKeyframes));
    }

    private boolean emit(TrackingKey key, int total, int done, boolean partial, boolean isTimeout) {
        if (!ledger.claim(key)) {
            logger.info("Completion for {} already emitted, skipping duplicate", key);
            return false;
        }
        String eventId = UUID.randomUUID().toString();
        CompletionEvent event = settings.getPayloadMode() == ProgressSettings.PayloadMode.MINIMAL
                ? CompletionEvent.minimal(key.getJobId(), eventId)
                : CompletionEvent.full(key.getJobId(), eventId, total, done, partial,
                        settings.getWatermarkTtl(key.getStage()).toSeconds());
        try {
            bus.publish(key.completedTopic(), event, key.getJobId());
        } catch (RuntimeException e) {
            ledger.release(key);
            logger.error("Failed to publish {} for job {}", key.completedTopic(), key.getJobId(), e);
            throw e;
        }
        logger.info("Emitted {} job={} eventId={} total={} processed={} partial={} timeout={}",
                key.completedTopic(), key.getJobId(), eventId, total, done, partial, isTimeout);
        return true;
    }

    private boolean publishTransition(String jobId, String topic, BatchTransitionEvent event) {
        if (!ledger.claimTransition(jobId, topic)) {
            logger.info("{} already emitted for job {}, skipping duplicate", topic, jobId);
            return false;
        }
        try {
            bus.publish(topic, event, jobId);
        } catch (RuntimeException e) {
            ledger.releaseTransition(jobId, topic);
            logger.error("Failed to publish {} for job {}", topic, jobId, e);
            throw e;
        }
        logger.info("Emitted {} job={} eventId={}", topic, jobId, event.getEventId());
        return true;
    }
}
