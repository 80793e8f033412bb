package com.ttennebkram.imagerouter.model;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Objects;

/**
 * Raw encoded bytes of an image file in a known format.
 * The byte array is copied on the way in and out, so instances are immutable.
 */
public final class EncodedImage {

    private final ImageFormat format;
    private final byte[] data;

    public EncodedImage(ImageFormat format, byte[] data) {
        this.format = Objects.requireNonNull(format, "format");
        this.data = Objects.requireNonNull(data, "data").clone();
    }

    public ImageFormat getFormat() {
        return format;
    }

    public byte[] getData() {
        return data.clone();
    }

    public int size() {
        return data.length;
    }

    public InputStream openStream() {
        return new ByteArrayInputStream(data);
    }

    @Override
    public String toString() {
        return "EncodedImage[" + format.getFormatName() + ", " + data.length + " bytes]";
    }
}
