package com.productvideo.matching.keypoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.productvideo.matching.vision.image.Images;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Harris corner detector. Keypoints of each asset are written as JSON to
 * {@code <dataRoot>/kp/<assetId>.json}.
 */
public class KeypointExtractor {
    private static final Logger logger = LogManager.getLogger(KeypointExtractor.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    static final int MAX_SIDE = 512;
    static final int MAX_KEYPOINTS = 500;
    static final float HARRIS_K = 0.04f;
    static final float RELATIVE_THRESHOLD = 0.01f;
    static final int NMS_RADIUS = 3;

    private final Path keypointDir;

    public KeypointExtractor(Path dataRoot) {
        this.keypointDir = Objects.requireNonNull(dataRoot, "dataRoot is null").resolve("kp");
    }

    public Path getKeypointDir() {
        return keypointDir;
    }

    /**
     * Detects keypoints in {@code imagePath} and writes the blob.
     *
     * @return the blob path, or empty if the image cannot be decoded
     * @throws IOException if the image is missing or the blob cannot be written
     */
    public Optional<Path> extract(Path imagePath, String assetId) throws IOException {
        Optional<BufferedImage> image = Images.read(imagePath);
        if (image.isEmpty()) {
            logger.error("Unsupported image format: {}", imagePath);
            return Optional.empty();
        }
        BufferedImage original = image.get();
        BufferedImage scaled = Images.fit(original, MAX_SIDE);
        float scale = (float) original.getWidth() / scaled.getWidth();

        List<Keypoint> detected = detect(Images.grayscale(scaled));
        List<Keypoint> keypoints = new ArrayList<>(detected.size());
        for (Keypoint kp : detected) {
            keypoints.add(new Keypoint(kp.getX() * scale, kp.getY() * scale, kp.getResponse()));
        }
        if (keypoints.isEmpty()) {
            logger.warn("No keypoints found for {}", assetId);
        }
        Path blob = write(assetId, original.getWidth(), original.getHeight(), keypoints);
        logger.info("Extracted {} keypoints for {}", keypoints.size(), assetId);
        return Optional.of(blob);
    }

    /** Strongest corners after non-maximum suppression, strongest first. */
    List<Keypoint> detect(float[][] gray) {
        int h = gray.length;
        int w = h == 0 ? 0 : gray[0].length;
        if (w < 3 || h < 3) {
            return List.of();
        }

        float[][] ixx = new float[h][w];
        float[][] iyy = new float[h][w];
        float[][] ixy = new float[h][w];
        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                float gx = (gray[y - 1][x + 1] + 2 * gray[y][x + 1] + gray[y + 1][x + 1])
                        - (gray[y - 1][x - 1] + 2 * gray[y][x - 1] + gray[y + 1][x - 1]);
                float gy = (gray[y + 1][x - 1] + 2 * gray[y + 1][x] + gray[y + 1][x + 1])
                        - (gray[y - 1][x - 1] + 2 * gray[y - 1][x] + gray[y - 1][x + 1]);
                ixx[y][x] = gx * gx;
                iyy[y][x] = gy * gy;
                ixy[y][x] = gx * gy;
            }
        }
        ixx = boxBlur(ixx);
        iyy = boxBlur(iyy);
        ixy = boxBlur(ixy);

        float[][] response = new float[h][w];
        float max = 0f;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                float det = ixx[y][x] * iyy[y][x] - ixy[y][x] * ixy[y][x];
                float trace = ixx[y][x] + iyy[y][x];
                float r = det - HARRIS_K * trace * trace;
                response[y][x] = r;
                max = Math.max(max, r);
            }
        }
        if (max <= 0f) {
            return List.of();
        }

        float threshold = max * RELATIVE_THRESHOLD;
        List<Keypoint> corners = new ArrayList<>();
        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                float r = response[y][x];
                if (r > threshold && isLocalMaximum(response, x, y, w, h)) {
                    corners.add(new Keypoint(x, y, r));
                }
            }
        }
        corners.sort(Comparator.comparingDouble(Keypoint::getResponse).reversed());
        return corners.size() > MAX_KEYPOINTS ? new ArrayList<>(corners.subList(0, MAX_KEYPOINTS)) : corners;
    }

    private static boolean isLocalMaximum(float[][] response, int x, int y, int w, int h) {
        float r = response[y][x];
        for (int dy = -NMS_RADIUS; dy <= NMS_RADIUS; dy++) {
            for (int dx = -NMS_RADIUS; dx <= NMS_RADIUS; dx++) {
                if (dx == 0 && dy == 0) {
                    continue;
                }
                int nx = x + dx;
                int ny = y + dy;
                if (nx < 0 || ny < 0 || nx >= w || ny >= h) {
                    continue;
                }
                float other = response[ny][nx];
                // ties go to the first pixel in scan order
                if (other > r || (other == r && (dy < 0 || (dy == 0 && dx < 0)))) {
                    return false;
                }
            }
        }
        return true;
    }

    private static float[][] boxBlur(float[][] src) {
        int h = src.length;
        int w = src[0].length;
        float[][] out = new float[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                float sum = 0f;
                int n = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    int ny = y + dy;
                    if (ny < 0 || ny >= h) {
                        continue;
                    }
                    for (int dx = -1; dx <= 1; dx++) {
                        int nx = x + dx;
                        if (nx < 0 || nx >= w) {
                            continue;
                        }
                        sum += src[ny][nx];
                        n++;
                    }
                }
                out[y][x] = sum / n;
            }
        }
        return out;
    }

    private Path write(String assetId, int width, int height, List<Keypoint> keypoints) throws IOException {
        Files.createDirectories(keypointDir);
        Path blob = keypointDir.resolve(assetId + ".json");
        ObjectNode root = objectMapper.createObjectNode();
        root.put("asset_id", assetId);
        root.put("detector", "harris");
        root.put("width", width);
        root.put("height", height);
        ArrayNode points = root.putArray("keypoints");
        for (Keypoint kp : keypoints) {
            points.add(objectMapper.valueToTree(kp));
        }
        Path tmp = keypointDir.resolve(assetId + ".json.tmp");
        objectMapper.writeValue(tmp.toFile(), root);
        Files.move(tmp, blob, StandardCopyOption.REPLACE_EXISTING,
                StandardCopyOption.ATOMIC_MOVE);
        return blob;
    }
}
