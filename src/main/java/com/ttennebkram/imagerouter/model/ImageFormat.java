package com.ttennebkram.imagerouter.model;

import java.util.Locale;

/**
 * Encoded image file formats known to the router.
 */
public enum ImageFormat {
    JPEG("jpeg", "image/jpeg", "jpg", "jpeg"),
    PNG("png", "image/png", "png"),
    GIF("gif", "image/gif", "gif"),
    BMP("bmp", "image/bmp", "bmp"),
    TIFF("tiff", "image/tiff", "tif", "tiff"),
    WEBP("webp", "image/webp", "webp"),
    AVIF("avif", "image/avif", "avif"),
    HEIC("heic", "image/heic", "heic", "heif"),
    ICO("ico", "image/x-icon", "ico"),
    SVG("svg", "image/svg+xml", "svg");

    private final String formatName;
    private final String mimeType;
    private final String[] extensions;

    ImageFormat(String formatName, String mimeType, String... extensions) {
        this.formatName = formatName;
        this.mimeType = mimeType;
        this.extensions = extensions;
    }

    public String getFormatName() {
        return formatName;
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getDefaultExtension() {
        return extensions[0];
    }

    /**
     * Name of the operation that encodes an image into this format, e.g. "save_as_png".
     */
    public String getSaveOperation() {
        return "save_as_" + formatName;
    }

    /**
     * Look up a format by file extension (with or without the leading dot).
     *
     * @return the format, or null if the extension is unknown
     */
    public static ImageFormat fromExtension(String extension) {
        if (extension == null) return null;
        String ext = extension.startsWith(".") ? extension.substring(1) : extension;
        ext = ext.toLowerCase(Locale.ROOT);
        for (ImageFormat format : values()) {
            for (String candidate : format.extensions) {
                if (candidate.equals(ext)) {
                    return format;
                }
            }
        }
        return null;
    }

    /**
     * Look up a format from a file name's extension.
     *
     * @return the format, or null if the file name has no known extension
     */
    public static ImageFormat fromFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) return null;
        return fromExtension(fileName.substring(dot + 1));
    }
}
