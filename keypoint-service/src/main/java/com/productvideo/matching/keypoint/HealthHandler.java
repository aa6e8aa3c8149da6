package com.productvideo.matching.keypoint;

import com.productvideo.matching.vision.progress.JobProgressManager;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reports DOWN (503) when keypoint blobs cannot be written, since every item
 * would then fail and be retried.
 */
public class HealthHandler {
    static final String SERVICE = "vision-keypoint";

    private final JobProgressManager progress;
    private final Path keypointDir;

    public HealthHandler(JobProgressManager progress, Path keypointDir) {
        this.progress = Objects.requireNonNull(progress, "progress is null");
        this.keypointDir = Objects.requireNonNull(keypointDir, "keypointDir is null");
    }

    public void health(Context ctx) {
        boolean writable = isWritable();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", writable ? "UP" : "DOWN");
        payload.put("service", SERVICE);
        payload.put("tracked_streams", progress.trackedStreamCount());
        payload.put("keypoint_dir", keypointDir.toString());
        payload.put("keypoint_dir_writable", writable);
        payload.put("timestamp", Instant.now().toString());
        ctx.status(writable ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).json(payload);
    }

    // the directory is created on the first blob, so an absent one only needs a writable parent
    private boolean isWritable() {
        Path target = keypointDir.toAbsolutePath();
        while (target != null && !Files.exists(target)) {
            target = target.getParent();
        }
        return target != null && Files.isDirectory(target) && Files.isWritable(target);
    }
}
