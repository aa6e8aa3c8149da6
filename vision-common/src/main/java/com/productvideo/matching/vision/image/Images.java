package com.productvideo.matching.vision.image;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import javax.imageio.ImageIO;

/** Image loading and pixel helpers shared by the vision services. */
public final class Images {
    private Images() {}

    /**
     * Reads an image file.
     *
     * @return empty if the file exists but is not in a decodable format
     * @throws IOException if the file is missing or cannot be read
     */
    public static Optional<BufferedImage> read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Image file not found: " + path);
        }
        return Optional.ofNullable(ImageIO.read(path.toFile()));
    }

    /** Scales {@code image} down so that its longer side is at most {@code maxSide}. */
    public static BufferedImage fit(BufferedImage image, int maxSide) {
        int w = image.getWidth();
        int h = image.getHeight();
        int longest = Math.max(w, h);
        if (longest <= maxSide) {
            return image;
        }
        double scale = (double) maxSide / longest;
        int nw = Math.max(1, (int) Math.round(w * scale));
        int nh = Math.max(1, (int) Math.round(h * scale));
        BufferedImage out = new BufferedImage(nw, nh, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, nw, nh, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    /** Luma (0-255) per pixel, row-major. */
    public static float[][] grayscale(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        float[][] gray = new float[h][w];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                gray[y][x] = luma(image.getRGB(x, y));
            }
        }
        return gray;
    }

    public static float luma(int rgb) {
        int r = (rgb >> 16) & 0xff;
        int g = (rgb >> 8) & 0xff;
        int b = rgb & 0xff;
        return 0.299f * r + 0.587f * g + 0.114f * b;
    }

    /**
     * Foreground flags for an image of {@code width x height}, sampled from
     * {@code mask} with nearest-neighbour scaling. A mask pixel is foreground when
     * its luma is above 127.
     */
    public static boolean[][] foreground(BufferedImage mask, int width, int height) {
        boolean[][] fg = new boolean[height][width];
        int mw = mask.getWidth();
        int mh = mask.getHeight();
        for (int y = 0; y < height; y++) {
            int my = Math.min(mh - 1, (int) ((long) y * mh / height));
            for (int x = 0; x < width; x++) {
                int mx = Math.min(mw - 1, (int) ((long) x * mw / width));
                fg[y][x] = luma(mask.getRGB(mx, my)) > 127f;
            }
        }
        return fg;
    }

    /** Scales {@code values} to unit L2 norm in place; an all-zero vector is left as is. */
    public static float[] l2Normalize(float[] values) {
        double sum = 0;
        for (float v : values) {
            sum += (double) v * v;
        }
        if (sum == 0) {
            return values;
        }
        float norm = (float) Math.sqrt(sum);
        for (int i = 0; i < values.length; i++) {
            values[i] /= norm;
        }
        return values;
    }
}
