package com.productvideo.matching.keypoint;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A detected corner in the coordinates of the original image. */
public class Keypoint {
    private final float x;
    private final float y;
    private final float response;

    public Keypoint(float x, float y, float response) {
        this.x = x;
        this.y = y;
        this.response = response;
    }

    @JsonProperty("x")
    public float getX() {
        return x;
    }

    @JsonProperty("y")
    public float getY() {
        return y;
    }

    @JsonProperty("response")
    public float getResponse() {
        return response;
    }
}
