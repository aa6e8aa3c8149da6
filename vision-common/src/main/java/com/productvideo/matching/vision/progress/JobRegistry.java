package com.productvideo.matching.vision.progress;

/** All per-job tracking state of one service instance. */
public class JobRegistry {
    private final ProcessedAssetLedger processedAssets = new ProcessedAssetLedger();
    private final ProcessedBatchEventLedger processedBatchEvents = new ProcessedBatchEventLedger();
    private final CompletionEmissionLedger completions = new CompletionEmissionLedger();
    private final JobProgressTracker tracker;

    public JobRegistry(int thresholdPercentage) {
        this.tracker = new JobProgressTracker(new BatchAnnouncements(), thresholdPercentage);
    }

    public ProcessedAssetLedger getProcessedAssets() {
        return processedAssets;
    }

    public ProcessedBatchEventLedger getProcessedBatchEvents() {
        return processedBatchEvents;
    }

    public CompletionEmissionLedger getCompletions() {
        return completions;
    }

    public JobProgressTracker getTracker() {
        return tracker;
    }

    public BatchAnnouncements getAnnouncements() {
        return tracker.getAnnouncements();
    }

    public void clear() {
        processedAssets.clear();
        processedBatchEvents.clear();
        completions.clear();
        tracker.clear();
    }
}
