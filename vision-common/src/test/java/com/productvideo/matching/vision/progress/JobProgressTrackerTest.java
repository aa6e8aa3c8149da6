package com.productvideo.matching.vision.progress;

import static org.junit.jupiter.api.Assertions.*;

import com.productvideo.matching.shared.events.AssetType;
import com.productvideo.matching.shared.events.PipelineStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JobProgressTrackerTest {
    private static final TrackingKey IMAGES = new TrackingKey("J1", AssetType.IMAGE, PipelineStage.EMBEDDINGS);
    private static final TrackingKey VIDEOS = new TrackingKey("J1", AssetType.VIDEO, PipelineStage.EMBEDDINGS);

    private BatchAnnouncements announcements;
    private JobProgressTracker tracker;

    @BeforeEach
    void setUp() {
        announcements = new BatchAnnouncements();
        tracker = new JobProgressTracker(announcements, 100);
    }

    @Test
    void placeholder_isNeverComplete() {
        tracker.initializeWithPlaceholder(IMAGES);
        for (int i = 0; i < 1_000; i++) {
            tracker.recordItemDone(IMAGES, ExpectedCount.placeholder());
        }

        assertFalse(tracker.isComplete(IMAGES));
        assertTrue(tracker.isOpen(IMAGES));
    }

    @Test
    void initializeWithPlaceholder_overwritesKnownCount() {
        tracker.initialize(IMAGES, ExpectedCount.known(4));
        tracker.initializeWithPlaceholder(IMAGES);

        assertEquals(ExpectedCount.placeholder(), tracker.get(IMAGES).getExpected());
    }

    @Test
    void setRealExpected_reportsCompletion() {
        tracker.initializeWithPlaceholder(IMAGES);
        tracker.recordItemDone(IMAGES, ExpectedCount.placeholder());
        tracker.recordItemDone(IMAGES, ExpectedCount.placeholder());

        assertFalse(tracker.setRealExpectedAndRecheck(IMAGES, 3));
        assertTrue(tracker.setRealExpectedAndRecheck(IMAGES, 2));
    }

    @Test
    void setRealExpected_untrackedIsFalse() {
        assertFalse(tracker.setRealExpectedAndRecheck(IMAGES, 0));
    }

    @Test
    void knownCount_completesWhenReached() {
        tracker.recordItemDone(IMAGES, ExpectedCount.known(2));
        assertFalse(tracker.isComplete(IMAGES));

        tracker.recordItemDone(IMAGES, ExpectedCount.known(2));
        assertTrue(tracker.isComplete(IMAGES));
        assertFalse(tracker.isOpen(IMAGES));
    }

    @Test
    void zeroExpected_completeOnlyWhenAnnouncedEmpty() {
        tracker.initialize(IMAGES, ExpectedCount.known(0));
        assertFalse(tracker.isComplete(IMAGES));

        announcements.record("J1", AssetType.IMAGE, 0);
        assertTrue(tracker.isComplete(IMAGES));
    }

    @Test
    void video_prefersAnnouncedTotalOverHint() {
        announcements.record("J1", AssetType.VIDEO, 5);
        tracker.recordItemDone(VIDEOS, ExpectedCount.placeholder());

        assertEquals(ExpectedCount.known(5), tracker.get(VIDEOS).getExpected());
    }

    @Test
    void image_keepsKnownCountWhenHintIsPlaceholder() {
        tracker.initialize(IMAGES, ExpectedCount.known(3));
        tracker.recordItemDone(IMAGES, ExpectedCount.placeholder());

        assertEquals(ExpectedCount.known(3), tracker.get(IMAGES).getExpected());
        assertEquals(1, tracker.get(IMAGES).getDone());
    }

    @Test
    void threshold_roundsRequiredCountUp() {
        JobProgressTracker lenient = new JobProgressTracker(announcements, 90);
        assertEquals(9, lenient.requiredCount(10));
        assertEquals(7, lenient.requiredCount(7));
        assertEquals(3, lenient.requiredCount(3));

        for (int i = 0; i < 9; i++) {
            lenient.recordItemDone(IMAGES, ExpectedCount.known(10));
        }
        assertTrue(lenient.isComplete(IMAGES));
    }

    @Test
    void threshold_outOfRangeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new JobProgressTracker(announcements, 101));
    }

    @Test
    void cleanupKey_keepsOtherStreamsAndMarkers() {
        TrackingKey imageKeypoints = new TrackingKey("J1", AssetType.IMAGE, PipelineStage.KEYPOINTS);
        announcements.record("J1", AssetType.IMAGE, 2);
        tracker.initialize(IMAGES, ExpectedCount.known(2));
        tracker.initialize(imageKeypoints, ExpectedCount.known(2));

        tracker.cleanup(IMAGES);
        assertTrue(tracker.contains(imageKeypoints));
        assertTrue(announcements.isInitialized("J1", AssetType.IMAGE));

        tracker.cleanup(imageKeypoints);
        assertFalse(announcements.isInitialized("J1", AssetType.IMAGE));
        assertFalse(tracker.hasJob("J1"));
    }

    @Test
    void cleanupJob_removesEveryStream() {
        announcements.record("J1", AssetType.VIDEO, 3);
        tracker.initialize(IMAGES, ExpectedCount.placeholder());
        tracker.initialize(VIDEOS, ExpectedCount.known(3));
        tracker.initialize(new TrackingKey("J2", AssetType.IMAGE, PipelineStage.EMBEDDINGS), ExpectedCount.known(1));

        tracker.cleanup("J1");

        assertFalse(tracker.hasJob("J1"));
        assertTrue(tracker.hasJob("J2"));
        assertNull(announcements.announcedTotal("J1", AssetType.VIDEO));
    }
}
