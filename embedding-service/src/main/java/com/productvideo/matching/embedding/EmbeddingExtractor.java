package com.productvideo.matching.embedding;

import com.productvideo.matching.vision.image.Images;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Histogram embeddings, 512 dimensions each.
 *
 * <p>RGB: joint colour histogram with 8 bins per channel. Gray: 256 intensity bins
 * followed by 256 gradient-magnitude bins. Both are computed over the mask's
 * foreground pixels only and L2-normalised.
 */
public class EmbeddingExtractor {
    private static final Logger logger = LogManager.getLogger(EmbeddingExtractor.class);

    public static final int DIMENSIONS = 512;
    static final int MAX_SIDE = 512;

    /**
     * @param maskPath {@code null} to use every pixel
     * @return empty if the image or mask cannot be decoded
     * @throws IOException if a file is missing or unreadable
     */
    public Optional<Embedding> extract(Path imagePath, Path maskPath) throws IOException {
        Optional<BufferedImage> image = Images.read(imagePath);
        if (image.isEmpty()) {
            logger.error("Unsupported image format: {}", imagePath);
            return Optional.empty();
        }
        BufferedImage pixels = Images.fit(image.get(), MAX_SIDE);
        int w = pixels.getWidth();
        int h = pixels.getHeight();

        boolean[][] foreground;
        if (maskPath != null) {
            Optional<BufferedImage> mask = Images.read(maskPath);
            if (mask.isEmpty()) {
                logger.error("Unsupported mask format: {}", maskPath);
                return Optional.empty();
            }
            foreground = Images.foreground(mask.get(), w, h);
        } else {
            foreground = null;
        }
        return Optional.of(compute(pixels, foreground));
    }

    Embedding compute(BufferedImage pixels, boolean[][] foreground) {
        int w = pixels.getWidth();
        int h = pixels.getHeight();
        float[] rgb = new float[DIMENSIONS];
        float[] gray = new float[DIMENSIONS];
        float[][] luma = Images.grayscale(pixels);
        int counted = 0;

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (foreground != null && !foreground[y][x]) {
                    continue;
                }
                counted++;
                int argb = pixels.getRGB(x, y);
                int r = (argb >> 16) & 0xff;
                int g = (argb >> 8) & 0xff;
                int b = argb & 0xff;
                rgb[((r >> 5) << 6) | ((g >> 5) << 3) | (b >> 5)]++;

                int intensity = Math.min(255, Math.round(luma[y][x]));
                gray[intensity]++;
                gray[256 + gradientBin(luma, x, y, w, h)]++;
            }
        }
        if (counted == 0) {
            logger.warn("Mask has no foreground pixels, embedding is all zeros");
        }
        return new Embedding(Images.l2Normalize(rgb), Images.l2Normalize(gray));
    }

    /** Central-difference gradient magnitude, mapped onto 256 bins. */
    private static int gradientBin(float[][] luma, int x, int y, int w, int h) {
        float gx = luma[y][Math.min(w - 1, x + 1)] - luma[y][Math.max(0, x - 1)];
        float gy = luma[Math.min(h - 1, y + 1)][x] - luma[Math.max(0, y - 1)][x];
        // max magnitude is 255 * sqrt(2)
        double magnitude = Math.sqrt(gx * gx + gy * gy) / (255.0 * Math.sqrt(2));
        return Math.min(255, (int) (magnitude * 256));
    }
}
