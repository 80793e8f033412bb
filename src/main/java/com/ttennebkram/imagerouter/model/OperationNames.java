package com.ttennebkram.imagerouter.model;

/**
 * Names of the operations the bundled backends register.
 * Custom backends are free to register any other name.
 */
public final class OperationNames {

    public static final String GET_SIZE = "get_size";
    public static final String HAS_ALPHA = "has_alpha";
    public static final String GET_FRAME_COUNT = "get_frame_count";
    public static final String HAS_ANIMATION = "has_animation";

    public static final String RESIZE = "resize";
    public static final String CROP = "crop";
    public static final String ROTATE = "rotate";
    public static final String SET_BACKGROUND_COLOR_RGB = "set_background_color_rgb";

    public static final String SAVE_AS_JPEG = "save_as_jpeg";
    public static final String SAVE_AS_PNG = "save_as_png";
    public static final String SAVE_AS_GIF = "save_as_gif";
    public static final String SAVE_AS_BMP = "save_as_bmp";
    public static final String SAVE_AS_TIFF = "save_as_tiff";
    public static final String SAVE_AS_WEBP = "save_as_webp";

    private OperationNames() {
    }
}
