package com.productvideo.matching.vision.progress;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * One deadline per tracked stream. When a deadline passes while the stream is
 * still tracked, it is handed to {@link ForceCompletion}: an open stream is
 * completed as partial, a complete one whose completion is still pending is
 * published normally.
 *
 * <p>Expiry runs while holding {@code lock}, the same monitor that guards every
 * other mutation of tracking state.
 */
public class WatermarkTimerManager {
    private static final Logger logger = LogManager.getLogger(WatermarkTimerManager.class);

    @FunctionalInterface
    public interface ForceCompletion {
        void forceComplete(TrackingKey key);
    }

    private static final class Timer {
        private final Duration ttl;
        private ScheduledFuture<?> future;

        private Timer(Duration ttl) {
            this.ttl = ttl;
        }
    }

    private final JobProgressTracker tracker;
    private final ForceCompletion forceCompletion;
    private final Object lock;
    private final ScheduledExecutorService scheduler;
    private final Map<TrackingKey, Timer> timers = new ConcurrentHashMap<>();

    public WatermarkTimerManager(
            JobProgressTracker tracker,
            ForceCompletion forceCompletion,
            Object lock,
            ScheduledExecutorService scheduler
    ) {
        this.tracker = Objects.requireNonNull(tracker, "tracker is null");
        this.forceCompletion = Objects.requireNonNull(forceCompletion, "forceCompletion is null");
        this.lock = Objects.requireNonNull(lock, "lock is null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler is null");
    }

    /** Starts (or restarts) the deadline for {@code key}. */
    public void start(TrackingKey key, Duration ttl) {
        Objects.requireNonNull(key, "key is null");
        Objects.requireNonNull(ttl, "ttl is null");
        synchronized (lock) {
            cancel(key);
            Timer timer = new Timer(ttl);
            timers.put(key, timer);
            timer.future = scheduler.schedule(() -> expire(key, timer), ttl.toMillis(), TimeUnit.MILLISECONDS);
            logger.debug("Watermark timer started for {} ttl={}s", key, ttl.toSeconds());
        }
    }

    public boolean cancel(TrackingKey key) {
        synchronized (lock) {
            Timer timer = timers.remove(key);
            if (timer == null) {
                return false;
            }
            if (timer.future != null) {
                timer.future.cancel(false);
            }
            logger.debug("Watermark timer cancelled for {}", key);
            return true;
        }
    }

    public boolean isRunning(TrackingKey key) {
        return timers.containsKey(key);
    }

    public int activeCount() {
        return timers.size();
    }

    public void cancelAll() {
        synchronized (lock) {
            for (Timer timer : timers.values()) {
                if (timer.future != null) {
                    timer.future.cancel(false);
                }
            }
            timers.clear();
        }
    }

    private void expire(TrackingKey key, Timer timer) {
        synchronized (lock) {
            if (timers.get(key) != timer) {
                return;
            }
            timers.remove(key);
            if (!tracker.contains(key)) {
                logger.info("Watermark expired for {} but it is no longer tracked", key);
                return;
            }
            if (tracker.isOpen(key)) {
                logger.warn("Watermark expired for {}, forcing partial completion", key);
            } else {
                logger.warn("Watermark expired for {} which is complete but still tracked", key);
            }
            try {
                forceCompletion.forceComplete(key);
            } catch (RuntimeException e) {
                if (scheduler.isShutdown()) {
                    logger.error("Forced completion failed for {} during shutdown", key, e);
                    return;
                }
                logger.error("Forced completion failed for {}, re-arming watermark ttl={}s",
                        key, timer.ttl.toSeconds(), e);
                start(key, timer.ttl);
            }
        }
    }
}
