package com.ttennebkram.imagerouter.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Representations shared by every backend: one per encoded file format,
 * plus the neutral pixel buffer backends exchange decoded pixels through.
 */
public final class StandardRepresentations {

    public static final Representation<EncodedImage> JPEG_FILE = file(ImageFormat.JPEG);
    public static final Representation<EncodedImage> PNG_FILE = file(ImageFormat.PNG);
    public static final Representation<EncodedImage> GIF_FILE = file(ImageFormat.GIF);
    public static final Representation<EncodedImage> BMP_FILE = file(ImageFormat.BMP);
    public static final Representation<EncodedImage> TIFF_FILE = file(ImageFormat.TIFF);
    public static final Representation<EncodedImage> WEBP_FILE = file(ImageFormat.WEBP);
    public static final Representation<EncodedImage> AVIF_FILE = file(ImageFormat.AVIF);
    public static final Representation<EncodedImage> HEIC_FILE = file(ImageFormat.HEIC);
    public static final Representation<EncodedImage> ICO_FILE = file(ImageFormat.ICO);
    public static final Representation<EncodedImage> SVG_FILE = file(ImageFormat.SVG);

    /** RGB or RGBA pixels; the alpha channel travels with the buffer itself. */
    public static final Representation<RgbImageBuffer> PIXEL_BUFFER =
        Representation.of("pixel-buffer", RgbImageBuffer.class);

    private static final Map<ImageFormat, Representation<EncodedImage>> BY_FORMAT;

    static {
        Map<ImageFormat, Representation<EncodedImage>> map = new EnumMap<>(ImageFormat.class);
        map.put(ImageFormat.JPEG, JPEG_FILE);
        map.put(ImageFormat.PNG, PNG_FILE);
        map.put(ImageFormat.GIF, GIF_FILE);
        map.put(ImageFormat.BMP, BMP_FILE);
        map.put(ImageFormat.TIFF, TIFF_FILE);
        map.put(ImageFormat.WEBP, WEBP_FILE);
        map.put(ImageFormat.AVIF, AVIF_FILE);
        map.put(ImageFormat.HEIC, HEIC_FILE);
        map.put(ImageFormat.ICO, ICO_FILE);
        map.put(ImageFormat.SVG, SVG_FILE);
        BY_FORMAT = Collections.unmodifiableMap(map);
    }

    private StandardRepresentations() {
    }

    private static Representation<EncodedImage> file(ImageFormat format) {
        return Representation.of(format.getFormatName() + "-file", EncodedImage.class);
    }

    /**
     * The file representation for an encoded format.
     */
    public static Representation<EncodedImage> forFormat(ImageFormat format) {
        return BY_FORMAT.get(format);
    }

    /**
     * Wrap encoded bytes in the file representation matching their format.
     */
    public static ImageValue<EncodedImage> encoded(ImageFormat format, byte[] data) {
        return ImageValue.of(forFormat(format), new EncodedImage(format, data));
    }
}
