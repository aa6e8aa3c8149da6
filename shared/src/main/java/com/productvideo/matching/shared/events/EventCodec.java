package com.productvideo.matching.shared.events;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes inbound payloads into typed events. Unknown fields are ignored;
 * a missing required field raises {@link InvalidEventException}.
 */
public final class EventCodec {
    private EventCodec() {}

    public static BatchAnnouncedEvent batchAnnounced(JsonNode node, AssetType assetType, String totalField) {
        String jobId = requireText(node, "job_id");
        String eventId = requireText(node, "event_id");
        int total = requireInt(node, totalField);
        if (total < 0) {
            throw new InvalidEventException(totalField + " must be >= 0 but was " + total);
        }
        return new BatchAnnouncedEvent(jobId, eventId, assetType, total);
    }

    public static ProductImageReadyEvent productImageReady(JsonNode node) {
        return new ProductImageReadyEvent(
                requireText(node, "job_id"),
                optionalText(node, "product_id"),
                requireText(node, "image_id"),
                requireText(node, "local_path"));
    }

    public static ProductImageMaskedEvent productImageMasked(JsonNode node) {
        return new ProductImageMaskedEvent(
                requireText(node, "job_id"),
                requireText(node, "image_id"),
                requireText(node, "mask_path"));
    }

    public static KeyframesReadyEvent keyframesReady(JsonNode node) {
        String jobId = requireText(node, "job_id");
        List<Keyframe> frames = new ArrayList<>();
        for (JsonNode frame : requireArray(node, "frames")) {
            Double ts = frame.path("ts").isNumber() ? frame.path("ts").asDouble() : null;
            frames.add(new Keyframe(requireText(frame, "frame_id"), ts, requireText(frame, "local_path"), null));
        }
        return new KeyframesReadyEvent(jobId, optionalText(node, "video_id"), frames);
    }

    public static KeyframesMaskedEvent keyframesMasked(JsonNode node) {
        String jobId = requireText(node, "job_id");
        List<Keyframe> frames = new ArrayList<>();
        for (JsonNode frame : requireArray(node, "frames")) {
            frames.add(new Keyframe(requireText(frame, "frame_id"), null, null, requireText(frame, "mask_path")));
        }
        return new KeyframesMaskedEvent(jobId, optionalText(node, "video_id"), frames);
    }

    static String requireText(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || !value.isValueNode() || value.asText().isBlank()) {
            throw new InvalidEventException("missing required field '" + field + "'");
        }
        return value.asText();
    }

    static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }

    static int requireInt(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new InvalidEventException("missing or non-integer field '" + field + "'");
        }
        return value.asInt();
    }

    static JsonNode requireArray(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isArray()) {
            throw new InvalidEventException("missing required array '" + field + "'");
        }
        return value;
    }
}
