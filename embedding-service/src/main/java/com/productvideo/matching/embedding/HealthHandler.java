package com.productvideo.matching.embedding;

import com.productvideo.matching.vision.progress.JobProgressManager;
import io.javalin.http.Context;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Liveness plus the number of streams the embedding stage is still tracking. */
public class HealthHandler {
    static final String SERVICE = "vision-embedding";

    private final JobProgressManager progress;

    public HealthHandler(JobProgressManager progress) {
        this.progress = Objects.requireNonNull(progress, "progress is null");
    }

    public void health(Context ctx) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", "UP");
        payload.put("service", SERVICE);
        payload.put("tracked_streams", progress.trackedStreamCount());
        payload.put("embedding_dimensions", EmbeddingExtractor.DIMENSIONS);
        payload.put("timestamp", Instant.now().toString());
        ctx.json(payload);
    }
}
