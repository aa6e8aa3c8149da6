package com.productvideo.matching.embedding;

import static org.junit.jupiter.api.Assertions.*;

import com.productvideo.matching.vision.image.Images;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EmbeddingExtractorTest {
    private static final int RED_BIN = 7 << 6;
    private static final int BLUE_BIN = 7;

    @TempDir
    Path dir;

    private final EmbeddingExtractor extractor = new EmbeddingExtractor();

    /** Left half red, right half blue. */
    private Path splitImage() throws IOException {
        BufferedImage image = new BufferedImage(40, 20, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.RED);
        g.fillRect(0, 0, 20, 20);
        g.setColor(Color.BLUE);
        g.fillRect(20, 0, 20, 20);
        g.dispose();
        Path path = dir.resolve("img.png");
        ImageIO.write(image, "png", path.toFile());
        return path;
    }

    /** White (foreground) on the left half only, at a different resolution. */
    private Path leftMask() throws IOException {
        BufferedImage mask = new BufferedImage(80, 40, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = mask.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, 40, 40);
        g.dispose();
        Path path = dir.resolve("mask.png");
        ImageIO.write(mask, "png", path.toFile());
        return path;
    }

    private static double norm(float[] v) {
        double sum = 0;
        for (float f : v) {
            sum += f * f;
        }
        return Math.sqrt(sum);
    }

    @Test
    void unmasked_coversWholeImage() throws IOException {
        Embedding embedding = extractor.extract(splitImage(), null).orElseThrow();

        assertEquals(EmbeddingExtractor.DIMENSIONS, embedding.getRgb().length);
        assertEquals(EmbeddingExtractor.DIMENSIONS, embedding.getGray().length);
        assertEquals(1.0, norm(embedding.getRgb()), 1e-4);
        assertEquals(1.0, norm(embedding.getGray()), 1e-4);
        assertEquals(embedding.getRgb()[RED_BIN], embedding.getRgb()[BLUE_BIN], 1e-6);
    }

    @Test
    void mask_restrictsToForeground() throws IOException {
        Embedding embedding = extractor.extract(splitImage(), leftMask()).orElseThrow();

        assertEquals(1.0f, embedding.getRgb()[RED_BIN], 1e-6);
        assertEquals(0.0f, embedding.getRgb()[BLUE_BIN], 1e-6);
    }

    @Test
    void undecodableImage_isEmpty() throws IOException {
        Path bogus = dir.resolve("bogus.png");
        Files.writeString(bogus, "not an image");

        assertEquals(Optional.empty(), extractor.extract(bogus, null));
    }

    @Test
    void missingFile_throws() {
        assertThrows(IOException.class, () -> extractor.extract(dir.resolve("missing.png"), null));
    }

    @Test
    void largeImage_isScaledDown() {
        BufferedImage big = new BufferedImage(2048, 1024, BufferedImage.TYPE_INT_RGB);

        Embedding embedding = extractor.compute(Images.fit(big, EmbeddingExtractor.MAX_SIDE), null);

        // all black: one colour bin, one intensity bin, one gradient bin
        assertEquals(1.0f, embedding.getRgb()[0], 1e-6);
        assertEquals(Math.sqrt(0.5), embedding.getGray()[0], 1e-6);
        assertEquals(Math.sqrt(0.5), embedding.getGray()[256], 1e-6);
    }
}
