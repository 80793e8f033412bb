package com.ttennebkram.imagerouter.model;

import java.util.Objects;

/**
 * Backend-neutral pixel buffer: interleaved 8-bit RGB or RGBA, row-major, no padding.
 * Used as the common meeting point between backends that cannot read each other's images.
 */
public final class RgbImageBuffer {

    private final int width;
    private final int height;
    private final boolean alpha;
    private final byte[] data;

    public RgbImageBuffer(int width, int height, boolean alpha, byte[] data) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid buffer size: " + width + "x" + height);
        }
        Objects.requireNonNull(data, "data");
        int expected = width * height * (alpha ? 4 : 3);
        if (data.length != expected) {
            throw new IllegalArgumentException(
                "Buffer length " + data.length + " does not match " + width + "x" + height
                    + (alpha ? " RGBA" : " RGB") + " (expected " + expected + ")");
        }
        this.width = width;
        this.height = height;
        this.alpha = alpha;
        this.data = data.clone();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean hasAlpha() {
        return alpha;
    }

    public int getChannels() {
        return alpha ? 4 : 3;
    }

    public byte[] getData() {
        return data.clone();
    }

    @Override
    public String toString() {
        return "RgbImageBuffer[" + width + "x" + height + (alpha ? " RGBA]" : " RGB]");
    }
}
