package com.productvideo.matching.vision.progress;

import com.productvideo.matching.shared.events.AssetType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Expected and done counters per tracked stream, plus the batch announcements
 * that tell a real count from a placeholder.
 */
public class JobProgressTracker {
    private static final Logger logger = LogManager.getLogger(JobProgressTracker.class);

    private final Map<TrackingKey, JobProgressState> states = new ConcurrentHashMap<>();
    private final BatchAnnouncements announcements;
    private final int thresholdPercentage;

    public JobProgressTracker(BatchAnnouncements announcements, int thresholdPercentage) {
        this.announcements = Objects.requireNonNull(announcements, "announcements is null");
        if (thresholdPercentage < 0 || thresholdPercentage > 100) {
            throw new IllegalArgumentException("thresholdPercentage must be in [0, 100]");
        }
        this.thresholdPercentage = thresholdPercentage;
    }

    public BatchAnnouncements getAnnouncements() {
        return announcements;
    }

    public JobProgressState get(TrackingKey key) {
        return states.get(key);
    }

    public boolean contains(TrackingKey key) {
        return states.containsKey(key);
    }

    /** Creates the state with the given expected count if absent; returns whether it was created. */
    public boolean initialize(TrackingKey key, ExpectedCount expected) {
        boolean[] created = new boolean[1];
        states.computeIfAbsent(key, k -> {
            created[0] = true;
            return new JobProgressState(k, expected);
        });
        return created[0];
    }

    /** Used when item events arrive before the batch announcement. */
    public void initializeWithPlaceholder(TrackingKey key) {
        if (!initialize(key, ExpectedCount.placeholder())) {
            states.get(key).setExpected(ExpectedCount.placeholder());
            logger.info("Tracking for {} reset to placeholder expected count", key);
        } else {
            logger.info("Tracking for {} initialized with placeholder expected count", key);
        }
    }

    /**
     * Replaces the expected count with the announced one.
     *
     * @return whether the stream is complete under the new count
     */
    public boolean setRealExpectedAndRecheck(TrackingKey key, int realExpected) {
        JobProgressState state = states.get(key);
        if (state == null) {
            logger.warn("No tracking for {} when updating expected count to {}", key, realExpected);
            return false;
        }
        state.setExpected(ExpectedCount.known(realExpected));
        int done = state.getDone();
        boolean complete = hasReachedCompletion(done, realExpected);
        logger.debug("Expected count for {} set to {} (done={}, complete={})", key, realExpected, done, complete);
        return complete;
    }

    public void recordItemDone(TrackingKey key, ExpectedCount expectedHint) {
        recordItemDone(key, expectedHint, 1);
    }

    public void recordItemDone(TrackingKey key, ExpectedCount expectedHint, int increment) {
        Objects.requireNonNull(expectedHint, "expectedHint is null");
        initialize(key, expectedHint);
        JobProgressState state = states.get(key);
        state.addDone(increment);

        ExpectedCount actual = expectedHint;
        if (key.getAssetType() == AssetType.VIDEO) {
            Integer announced = announcements.announcedTotal(key.getJobId(), AssetType.VIDEO);
            if (announced != null) {
                actual = ExpectedCount.known(announced);
            }
        }

        ExpectedCount current = state.getExpected();
        if (actual.isKnown() && (actual.getValue() > 0 || !current.isKnown() || current.getValue() == 0)) {
            state.setExpected(actual);
        }
        logger.debug("Recorded item for {}: done={} expected={}", key, state.getDone(), state.getExpected());
    }

    /**
     * A stream is complete once a known expected count is reached (subject to the
     * threshold), or when it was announced with zero items.
     */
    public boolean isComplete(TrackingKey key) {
        JobProgressState state = states.get(key);
        if (state == null) {
            return false;
        }
        ExpectedCount expected = state.getExpected();
        if (!expected.isKnown()) {
            return false;
        }
        if (expected.getValue() == 0) {
            return isAnnouncedEmpty(key);
        }
        return hasReachedCompletion(state.getDone(), expected.getValue());
    }

    /** Tracked and not yet complete. */
    public boolean isOpen(TrackingKey key) {
        return states.containsKey(key) && !isComplete(key);
    }

    public boolean isAnnouncedEmpty(TrackingKey key) {
        Integer announced = announcements.announcedTotal(key.getJobId(), key.getAssetType());
        return announced != null && announced == 0;
    }

    public boolean hasJob(String jobId) {
        for (TrackingKey key : states.keySet()) {
            if (key.getJobId().equals(jobId)) {
                return true;
            }
        }
        return false;
    }

    /** Drops one stream; the batch marker goes with the last stream of its asset type. */
    public void cleanup(TrackingKey key) {
        states.remove(key);
        boolean sameTypeTracked = states.keySet().stream()
                .anyMatch(k -> k.getJobId().equals(key.getJobId()) && k.getAssetType() == key.getAssetType());
        if (!sameTypeTracked) {
            announcements.remove(key.getJobId(), key.getAssetType());
        }
    }

    public void cleanup(String jobId) {
        states.keySet().removeIf(k -> k.getJobId().equals(jobId));
        announcements.clearJob(jobId);
    }

    public void clear() {
        states.clear();
        announcements.clear();
    }

    public List<JobProgressState> states() {
        return new ArrayList<>(states.values());
    }

    int requiredCount(int expected) {
        return (int) ((expected * (long) thresholdPercentage + 99) / 100);
    }

    private boolean hasReachedCompletion(int done, int expected) {
        if (expected <= 0) {
            return done >= expected;
        }
        return done >= requiredCount(expected);
    }
}
