package com.productvideo.matching.vision.progress;

import com.productvideo.matching.shared.config.EnvConfig;
import com.productvideo.matching.shared.events.PipelineStage;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class ProgressSettings {
    private static final Logger logger = LogManager.getLogger(ProgressSettings.class);

    public static final int DEFAULT_THRESHOLD_PERCENTAGE = 100;

    public enum PayloadMode {
        FULL,
        MINIMAL
    }

    private final int completionThresholdPercentage;
    private final Map<PipelineStage, Duration> watermarkTtls;
    private final PayloadMode payloadMode;

    public ProgressSettings(
            int completionThresholdPercentage,
            Map<PipelineStage, Duration> watermarkTtls,
            PayloadMode payloadMode
    ) {
        this.completionThresholdPercentage = Math.max(0, Math.min(completionThresholdPercentage, 100));
        Objects.requireNonNull(watermarkTtls, "watermarkTtls is null");
        this.watermarkTtls = new EnumMap<>(PipelineStage.class);
        for (PipelineStage stage : PipelineStage.values()) {
            Duration ttl = watermarkTtls.get(stage);
            if (ttl == null) {
                throw new IllegalArgumentException("No watermark TTL for stage " + stage.wireName());
            }
            if (ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("Watermark TTL must be positive for stage " + stage.wireName());
            }
            this.watermarkTtls.put(stage, ttl);
        }
        this.payloadMode = Objects.requireNonNull(payloadMode, "payloadMode is null");
    }

    public static ProgressSettings defaults() {
        return new ProgressSettings(DEFAULT_THRESHOLD_PERCENTAGE, defaultTtls(), PayloadMode.FULL);
    }

    /** Same TTL for every stage; mostly for tests. */
    public static ProgressSettings withTtl(Duration ttl, PayloadMode payloadMode) {
        Map<PipelineStage, Duration> ttls = new EnumMap<>(PipelineStage.class);
        for (PipelineStage stage : PipelineStage.values()) {
            ttls.put(stage, ttl);
        }
        return new ProgressSettings(DEFAULT_THRESHOLD_PERCENTAGE, ttls, payloadMode);
    }

    public static ProgressSettings fromEnv(EnvConfig env) {
        int threshold = env.getInt("COMPLETION_THRESHOLD_PERCENTAGE", DEFAULT_THRESHOLD_PERCENTAGE);
        if (threshold < 0 || threshold > 100) {
            logger.warn("COMPLETION_THRESHOLD_PERCENTAGE={} out of range, clamping to [0, 100]", threshold);
        }
        Map<PipelineStage, Duration> ttls = new EnumMap<>(PipelineStage.class);
        ttls.put(PipelineStage.EMBEDDINGS,
                Duration.ofSeconds(env.getInt("WATERMARK_TTL_EMBEDDINGS_SECONDS", 900)));
        ttls.put(PipelineStage.KEYPOINTS,
                Duration.ofSeconds(env.getInt("WATERMARK_TTL_KEYPOINTS_SECONDS", 300)));
        ttls.put(PipelineStage.SEGMENTATION,
                Duration.ofSeconds(env.getInt("WATERMARK_TTL_SEGMENTATION_SECONDS", 300)));
        return new ProgressSettings(threshold, ttls, parsePayloadMode(env.get("COMPLETION_PAYLOAD", "full")));
    }

    static PayloadMode parsePayloadMode(String value) {
        try {
            return PayloadMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown COMPLETION_PAYLOAD '{}', using full payloads", value);
            return PayloadMode.FULL;
        }
    }

    private static Map<PipelineStage, Duration> defaultTtls() {
        Map<PipelineStage, Duration> ttls = new EnumMap<>(PipelineStage.class);
        ttls.put(PipelineStage.EMBEDDINGS, Duration.ofSeconds(900));
        ttls.put(PipelineStage.KEYPOINTS, Duration.ofSeconds(300));
        ttls.put(PipelineStage.SEGMENTATION, Duration.ofSeconds(300));
        return ttls;
    }

    public int getCompletionThresholdPercentage() {
        return completionThresholdPercentage;
    }

    public Duration getWatermarkTtl(PipelineStage stage) {
        return watermarkTtls.get(stage);
    }

    public PayloadMode getPayloadMode() {
        return payloadMode;
    }

    @Override
    public String toString() {
        return "ProgressSettings{threshold=" + completionThresholdPercentage
                + "%, watermarkTtls=" + watermarkTtls
                + ", payload=" + payloadMode + "}";
    }
}
