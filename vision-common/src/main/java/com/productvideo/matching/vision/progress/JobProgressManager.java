package com.productvideo.matching.vision.progress;

import com.productvideo.matching.shared.bus.EventBus;
import com.productvideo.matching.shared.events.AssetType;
import com.productvideo.matching.shared.events.BatchAnnouncedEvent;
import com.productvideo.matching.shared.events.PipelineStage;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point for event handlers. Decides, after every batch or item event, whether
 * a tracked stream is complete and publishes its single completion event.
 *
 * <p>Every read-modify-write of tracking state happens while holding this object's
 * monitor, which the watermark timers share. Item processing itself runs outside it.
 */
public class JobProgressManager {
    private static final Logger logger = LogManager.getLogger(JobProgressManager.class);

    private final JobRegistry registry;
    private final ProgressSettings settings;
    private final CompletionEventPublisher publisher;
    private final WatermarkTimerManager timers;

    public JobProgressManager(EventBus bus, ProgressSettings settings, ScheduledExecutorService scheduler) {
        this(new JobRegistry(settings.getCompletionThresholdPercentage()), bus, settings, scheduler);
    }

    public JobProgressManager(
            JobRegistry registry,
            EventBus bus,
            ProgressSettings settings,
            ScheduledExecutorService scheduler
    ) {
        this.registry = Objects.requireNonNull(registry, "registry is null");
        this.settings = Objects.requireNonNull(settings, "settings is null");
        this.publisher = new CompletionEventPublisher(
                bus, registry.getTracker(), registry.getCompletions(), settings);
        this.timers = new WatermarkTimerManager(registry.getTracker(), this::forceComplete, this, scheduler);
    }

    public void onBatchAnnounced(BatchAnnouncedEvent event, PipelineStage stage) {
        onBatchAnnounced(event.getJobId(), event.getAssetType(), event.getEventId(), event.getTotalItems(), stage);
    }

    /**
     * Records the announced total for a (job, asset type). A zero total completes the
     * stream immediately; otherwise a stream whose items already arrived is re-checked.
     */
    public synchronized void onBatchAnnounced(
            String jobId,
            AssetType assetType,
            String eventId,
            int totalCount,
            PipelineStage stage
    ) {
        TrackingKey key = new TrackingKey(jobId, assetType, stage);
        if (registry.getCompletions().contains(key)) {
            logger.info("Ignoring batch event {} for already completed {}", eventId, key);
            return;
        }
        if (!registry.getProcessedBatchEvents().markIfNew(jobId, eventId)) {
            logger.info("Ignoring duplicate batch event {} for {}", eventId, key);
            retryPendingCompletion(key);
            return;
        }
        logger.info("Batch announced for {}: eventId={} total={}", key, eventId, totalCount);
        registry.getAnnouncements().record(jobId, assetType, totalCount);

        JobProgressTracker tracker = registry.getTracker();
        if (totalCount == 0) {
            tracker.initialize(key, ExpectedCount.known(0));
            // armed first so a failed publish below is retried on expiry
            startTimer(key);
            if (publisher.publishWithExplicitCount(key, 0, 0)) {
                finish(key);
            }
            return;
        }

        if (tracker.initialize(key, ExpectedCount.known(totalCount))) {
            startTimer(key);
            return;
        }
        recheck(key, totalCount);
    }

    /**
     * Replaces a placeholder expected count with the real one and completes the
     * stream if enough items already arrived.
     */
    public synchronized boolean onExpectedCountUpdated(
            String jobId,
            AssetType assetType,
            int realExpected,
            PipelineStage stage
    ) {
        TrackingKey key = new TrackingKey(jobId, assetType, stage);
        if (registry.getCompletions().contains(key)) {
            logger.info("Ignoring expected count update for already completed {}", key);
            return false;
        }
        return recheck(key, realExpected);
    }

    /**
     * Accepts one item, runs {@code processor} for it and counts it.
     *
     * @return {@code true} if the item was processed and counted
     * @throws Exception whatever {@code processor} throws; the item is then released
     *                   so that a redelivery is processed
     */
    public boolean onItemReady(
            String jobId,
            AssetType assetType,
            String assetId,
            PipelineStage stage,
            AssetProcessor processor
    ) throws Exception {
        Objects.requireNonNull(processor, "processor is null");
        TrackingKey key = new TrackingKey(jobId, assetType, stage);
        if (!accept(key, assetId)) {
            return false;
        }

        boolean processed;
        try {
            processed = processor.process();
        } catch (Exception e) {
            synchronized (this) {
                registry.getProcessedAssets().release(jobId, assetId);
            }
            logger.error("Processing failed for asset {} of {}", assetId, key, e);
            throw e;
        }
        if (!processed) {
            logger.error("Skipping asset {} of {}: upstream record not found", assetId, key);
            return false;
        }

        count(key);
        return true;
    }

    public synchronized boolean publishProductsImagesMaskedBatch(String jobId, int totalImages) {
        return publisher.publishProductsImagesMaskedBatch(jobId, totalImages);
    }

    public synchronized boolean publishVideoKeyframesMaskedBatch(String jobId, int totalKeyframes) {
        return publisher.publishVideoKeyframesMaskedBatch(jobId, totalKeyframes);
    }

    public synchronized boolean publishVideosKeyframesReadyBatch(String jobId, int totalKeyframes) {
        return publisher.publishVideosKeyframesReadyBatch(jobId, totalKeyframes);
    }

    /** Publishes a completion with known counts, e.g. from a stage that already has its totals. */
    public synchronized boolean publishWithExplicitCount(TrackingKey key, int expected, int done) {
        boolean published = publisher.publishWithExplicitCount(key, expected, done);
        if (published) {
            finish(key);
        }
        return published;
    }

    /** Cancels every timer and forgets all tracking state, completions included. */
    public synchronized void cleanupAll() {
        timers.cancelAll();
        registry.clear();
        logger.info("Cleared all job progress state");
    }

    public synchronized List<JobProgressSnapshot> snapshot() {
        return registry.getTracker().states().stream()
                .map(s -> new JobProgressSnapshot(s.getKey(), s.getExpected(), s.getDone(), timers.isRunning(s.getKey())))
                .sorted(Comparator.comparing(JobProgressSnapshot::getJobId)
                        .thenComparing(JobProgressSnapshot::getAssetType)
                        .thenComparing(JobProgressSnapshot::getStage))
                .toList();
    }

    public synchronized int trackedStreamCount() {
        return registry.getTracker().states().size();
    }

    JobRegistry getRegistry() {
        return registry;
    }

    WatermarkTimerManager getTimers() {
        return timers;
    }

    private synchronized boolean accept(TrackingKey key, String assetId) {
        if (registry.getCompletions().contains(key)) {
            logger.info("Ignoring asset {} for already completed {}", assetId, key);
            return false;
        }
        if (!registry.getProcessedAssets().markAndCheck(key.getJobId(), assetId)) {
            logger.info("Skipping duplicate asset {} for {}", assetId, key);
            retryPendingCompletion(key);
            return false;
        }
        JobProgressTracker tracker = registry.getTracker();
        if (!tracker.contains(key)) {
            Integer announced = registry.getAnnouncements().announcedTotal(key.getJobId(), key.getAssetType());
            if (announced != null) {
                tracker.initialize(key, ExpectedCount.known(announced));
            } else {
                tracker.initializeWithPlaceholder(key);
            }
            startTimer(key);
        }
        return true;
    }

    private synchronized void count(TrackingKey key) {
        if (registry.getCompletions().contains(key)) {
            logger.info("{} completed while an item was processing, not counting it", key);
            return;
        }
        Integer announced = registry.getAnnouncements().announcedTotal(key.getJobId(), key.getAssetType());
        ExpectedCount hint = announced != null ? ExpectedCount.known(announced) : ExpectedCount.placeholder();
        JobProgressTracker tracker = registry.getTracker();
        tracker.recordItemDone(key, hint);
        if (!timers.isRunning(key) && tracker.isOpen(key)) {
            startTimer(key);
        }
        if (announced == null) {
            logger.debug("Batch for {} not announced yet, deferring completion check", key);
            return;
        }
        if (tracker.isComplete(key) && publisher.publish(key, false)) {
            finish(key);
        }
    }

    private boolean recheck(TrackingKey key, int realExpected) {
        if (registry.getTracker().setRealExpectedAndRecheck(key, realExpected)) {
            logger.info("{} complete after expected count update to {}", key, realExpected);
            if (publisher.publish(key, false)) {
                finish(key);
            }
            return true;
        }
        if (registry.getTracker().contains(key) && !timers.isRunning(key)) {
            startTimer(key);
        }
        return false;
    }

    private void forceComplete(TrackingKey key) {
        if (registry.getTracker().isComplete(key)) {
            retryPendingCompletion(key);
            return;
        }
        publisher.publish(key, true);
        finish(key);
    }

    /**
     * Emits the completion of a stream that reached its count but whose earlier
     * publish failed. Called on redelivered batch and item events and on timer expiry.
     */
    private void retryPendingCompletion(TrackingKey key) {
        JobProgressTracker tracker = registry.getTracker();
        if (!tracker.isComplete(key)) {
            return;
        }
        if (registry.getCompletions().contains(key)) {
            finish(key);
            return;
        }
        logger.warn("{} is complete but its completion was never emitted, publishing now", key);
        boolean published = tracker.isAnnouncedEmpty(key)
                ? publisher.publishWithExplicitCount(key, 0, 0)
                : publisher.publish(key, false);
        if (published) {
            finish(key);
        }
    }

    private void startTimer(TrackingKey key) {
        timers.start(key, settings.getWatermarkTtl(key.getStage()));
    }

    private void finish(TrackingKey key) {
        timers.cancel(key);
        JobProgressTracker tracker = registry.getTracker();
        tracker.cleanup(key);
        if (!tracker.hasJob(key.getJobId())) {
            registry.getProcessedAssets().clearJob(key.getJobId());
        }
        logger.debug("Cleaned up tracking for {}", key);
    }
}
