package com.ttennebkram.imagerouter.backends.opencv;

import com.ttennebkram.imagerouter.backends.BackendInfo;
import com.ttennebkram.imagerouter.backends.ImageBackend;
import com.ttennebkram.imagerouter.config.RouterConfig;
import com.ttennebkram.imagerouter.model.CropRect;
import com.ttennebkram.imagerouter.model.EncodedImage;
import com.ttennebkram.imagerouter.model.ImageFormat;
import com.ttennebkram.imagerouter.model.OperationNames;
import com.ttennebkram.imagerouter.model.Representation;
import com.ttennebkram.imagerouter.registry.ArgumentShape;
import com.ttennebkram.imagerouter.registry.CapabilityRegistry;
import com.ttennebkram.imagerouter.registry.SourceCost;
import com.ttennebkram.imagerouter.util.MatTracker;
import org.opencv.core.Mat;

import java.io.OutputStream;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.ttennebkram.imagerouter.model.StandardRepresentations.BMP_FILE;
import static com.ttennebkram.imagerouter.model.StandardRepresentations.JPEG_FILE;
import static com.ttennebkram.imagerouter.model.StandardRepresentations.PIXEL_BUFFER;
import static com.ttennebkram.imagerouter.model.StandardRepresentations.PNG_FILE;
import static com.ttennebkram.imagerouter.model.StandardRepresentations.TIFF_FILE;
import static com.ttennebkram.imagerouter.model.StandardRepresentations.WEBP_FILE;

/**
 * OpenCV backend on the openpnp bundled native library.
 * Only offered when the native library loads on this platform.
 */
@BackendInfo(
    name = "opencv",
    priority = 20,
    description = "OpenCV Mat backend (Imgcodecs / Imgproc)"
)
public class OpenCvBackend implements ImageBackend {

    private static final Logger LOG = Logger.getLogger(OpenCvBackend.class.getName());

    /** BGR or BGRA 8-bit Mat; released through {@link MatTracker}. */
    public static final Representation<Mat> OPENCV_MAT =
        Representation.of("opencv-mat", Mat.class, MatTracker::release);

    static final int DECODE_COST = 50;
    static final int BUFFER_COST = 150;

    private static final ArgumentShape SAVE_SHAPE = ArgumentShape.of(OutputStream.class);

    private static Boolean nativeLoaded;

    /**
     * Load the OpenCV native library once per process.
     *
     * @return whether it is usable
     */
    public static synchronized boolean loadNativeLibrary() {
        if (nativeLoaded == null) {
            try {
                nu.pattern.OpenCV.loadLocally();
                nativeLoaded = true;
                LOG.fine("OpenCV native library loaded");
            } catch (Exception | LinkageError e) {
                nativeLoaded = false;
                LOG.log(Level.WARNING, "OpenCV native library not available: " + e.getMessage());
            }
        }
        return nativeLoaded;
    }

    @Override
    public boolean isAvailable() {
        return loadNativeLibrary();
    }

    @Override
    public void register(CapabilityRegistry registry, RouterConfig config) {
        List<SourceCost<EncodedImage>> decodable = List.of(
            SourceCost.of(JPEG_FILE, DECODE_COST),
            SourceCost.of(PNG_FILE, DECODE_COST),
            SourceCost.of(BMP_FILE, DECODE_COST),
            SourceCost.of(TIFF_FILE, DECODE_COST),
            SourceCost.of(WEBP_FILE, DECODE_COST));
        registry.registerConverter(decodable, OPENCV_MAT, OpenCvImageOps::decode);
        registry.registerConverter(OPENCV_MAT, PIXEL_BUFFER, BUFFER_COST, OpenCvImageOps::toBuffer);
        registry.registerConverter(PIXEL_BUFFER, OPENCV_MAT, BUFFER_COST, OpenCvImageOps::fromBuffer);

        registry.registerOperation(OPENCV_MAT, OperationNames.GET_SIZE, ArgumentShape.none(),
            OpenCvImageOps::getSize);
        registry.registerOperation(OPENCV_MAT, OperationNames.HAS_ALPHA, ArgumentShape.none(),
            OpenCvImageOps::hasAlpha);
        registry.registerOperation(OPENCV_MAT, OperationNames.GET_FRAME_COUNT, ArgumentShape.none(),
            OpenCvImageOps::getFrameCount);
        registry.registerOperation(OPENCV_MAT, OperationNames.HAS_ANIMATION, ArgumentShape.none(),
            OpenCvImageOps::hasAnimation);
        registry.registerOperation(OPENCV_MAT, OperationNames.RESIZE, ArgumentShape.of(int.class, int.class),
            OpenCvImageOps::resize);
        registry.registerOperation(OPENCV_MAT, OperationNames.CROP, ArgumentShape.of(CropRect.class),
            OpenCvImageOps::crop);
        registry.registerOperation(OPENCV_MAT, OperationNames.ROTATE, ArgumentShape.of(int.class),
            OpenCvImageOps::rotate);
        registry.registerOperation(OPENCV_MAT, OperationNames.SET_BACKGROUND_COLOR_RGB,
            ArgumentShape.of(int.class, int.class, int.class), OpenCvImageOps::setBackgroundColorRgb);

        int jpegQuality = config.getJpegQuality();
        int webpQuality = config.getWebpQuality();
        registry.registerOperation(OPENCV_MAT, OperationNames.SAVE_AS_JPEG,
            SAVE_SHAPE.withOptional(int.class, boolean.class),
            (mat, args) -> OpenCvImageOps.save(mat, ImageFormat.JPEG, (OutputStream) args[0],
                args.length > 1 ? (Integer) args[1] : jpegQuality,
                args.length > 2 && (Boolean) args[2]));
        registry.registerOperation(OPENCV_MAT, OperationNames.SAVE_AS_WEBP,
            SAVE_SHAPE.withOptional(int.class, boolean.class),
            (mat, args) -> OpenCvImageOps.save(mat, ImageFormat.WEBP, (OutputStream) args[0],
                args.length > 1 ? (Integer) args[1] : webpQuality,
                args.length > 2 && (Boolean) args[2]));
        registerSave(registry, OperationNames.SAVE_AS_PNG, ImageFormat.PNG);
        registerSave(registry, OperationNames.SAVE_AS_BMP, ImageFormat.BMP);
        registerSave(registry, OperationNames.SAVE_AS_TIFF, ImageFormat.TIFF);
    }

    private static void registerSave(CapabilityRegistry registry, String operation, ImageFormat format) {
        registry.registerOperation(OPENCV_MAT, operation, SAVE_SHAPE,
            (mat, args) -> OpenCvImageOps.save(mat, format, (OutputStream) args[0], 100, false));
    }
}
