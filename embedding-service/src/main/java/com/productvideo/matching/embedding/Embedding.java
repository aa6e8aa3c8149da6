package com.productvideo.matching.embedding;

import java.util.Objects;

/** RGB and grayscale feature vectors of one asset. */
public class Embedding {
    private final float[] rgb;
    private final float[] gray;

    public Embedding(float[] rgb, float[] gray) {
        this.rgb = Objects.requireNonNull(rgb, "rgb is null");
        this.gray = Objects.requireNonNull(gray, "gray is null");
    }

    public float[] getRgb() {
        return rgb;
    }

    public float[] getGray() {
        return gray;
    }
}
