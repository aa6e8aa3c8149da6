package com.productvideo.matching.vision.progress;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

import com.productvideo.matching.shared.events.AssetType;
import com.productvideo.matching.shared.events.PipelineStage;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WatermarkTimerManagerTest {
    private static final TrackingKey KEY = new TrackingKey("J1", AssetType.IMAGE, PipelineStage.KEYPOINTS);
    private static final Duration SHORT = Duration.ofMillis(150);

    private final Object lock = new Object();
    private final List<TrackingKey> forced = new CopyOnWriteArrayList<>();
    private ScheduledExecutorService scheduler;
    private JobProgressTracker tracker;
    private WatermarkTimerManager timers;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        tracker = new JobProgressTracker(new BatchAnnouncements(), 100);
        timers = new WatermarkTimerManager(tracker, forced::add, lock, scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void expiry_forcesOpenStream() {
        tracker.initialize(KEY, ExpectedCount.known(3));
        timers.start(KEY, SHORT);

        await().atMost(Duration.ofSeconds(5)).until(() -> forced.size() == 1);
        assertEquals(KEY, forced.get(0));
        assertFalse(timers.isRunning(KEY));
    }

    @Test
    void expiry_handsOverCompleteStreamStillTracked() {
        tracker.recordItemDone(KEY, ExpectedCount.known(1));
        timers.start(KEY, SHORT);

        await().atMost(Duration.ofSeconds(5)).until(() -> forced.size() == 1);
        assertEquals(KEY, forced.get(0));
        assertFalse(timers.isRunning(KEY));
    }

    @Test
    void expiry_ignoresUntrackedStream() {
        timers.start(KEY, SHORT);

        await().atMost(Duration.ofSeconds(5)).until(() -> !timers.isRunning(KEY));
        assertTrue(forced.isEmpty());
    }

    @Test
    void cancel_preventsExpiry() {
        tracker.initialize(KEY, ExpectedCount.known(3));
        timers.start(KEY, SHORT);
        assertTrue(timers.cancel(KEY));
        assertFalse(timers.cancel(KEY));

        await().during(Duration.ofMillis(400)).atMost(Duration.ofSeconds(2)).until(forced::isEmpty);
    }

    @Test
    void restart_replacesEarlierDeadline() {
        tracker.initialize(KEY, ExpectedCount.known(3));
        timers.start(KEY, SHORT);
        timers.start(KEY, Duration.ofMinutes(5));

        await().during(Duration.ofMillis(400)).atMost(Duration.ofSeconds(2)).until(forced::isEmpty);
        assertTrue(timers.isRunning(KEY));
        assertEquals(1, timers.activeCount());
    }

    @Test
    void failedForcedCompletion_isRearmed() {
        AtomicInteger attempts = new AtomicInteger();
        WatermarkTimerManager flaky = new WatermarkTimerManager(tracker, key -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("bus unavailable");
            }
            forced.add(key);
        }, lock, scheduler);
        tracker.initialize(KEY, ExpectedCount.known(3));
        flaky.start(KEY, SHORT);

        await().atMost(Duration.ofSeconds(5)).until(() -> forced.size() == 1);
        assertEquals(2, attempts.get());
    }

    @Test
    void cancelAll_stopsEveryTimer() {
        tracker.initialize(KEY, ExpectedCount.known(3));
        timers.start(KEY, SHORT);
        timers.start(new TrackingKey("J2", AssetType.VIDEO, PipelineStage.KEYPOINTS), SHORT);

        timers.cancelAll();

        assertEquals(0, timers.activeCount());
        await().during(Duration.ofMillis(400)).atMost(Duration.ofSeconds(2)).until(forced::isEmpty);
    }
}
