package com.ttennebkram.imagerouter.backends.awt;

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

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.OutputStream;
import java.util.List;

import static com.ttennebkram.imagerouter.model.StandardRepresentations.BMP_FILE;
import static com.ttennebkram.imagerouter.model.StandardRepresentations.GIF_FILE;
import static com.ttennebkram.imagerouter.model.StandardRepresentations.JPEG_FILE;
import static com.ttennebkram.imagerouter.model.StandardRepresentations.PIXEL_BUFFER;
import static com.ttennebkram.imagerouter.model.StandardRepresentations.PNG_FILE;
import static com.ttennebkram.imagerouter.model.StandardRepresentations.TIFF_FILE;

/**
 * Pure-Java raster backend on Java2D and ImageIO. Always available, including headless.
 */
@BackendInfo(
    name = "awt",
    priority = 10,
    description = "Java2D / ImageIO raster backend"
)
public class AwtBackend implements ImageBackend {

    public static final Representation<BufferedImage> AWT_IMAGE =
        Representation.of("awt-image", BufferedImage.class);

    static final int DECODE_COST = 100;
    static final int BUFFER_COST = 150;

    private static final ArgumentShape SAVE_SHAPE = ArgumentShape.of(OutputStream.class);

    @Override
    public boolean isAvailable() {
        return ImageIO.getImageReadersByFormatName("png").hasNext();
    }

    @Override
    public void register(CapabilityRegistry registry, RouterConfig config) {
        List<SourceCost<EncodedImage>> decodable = List.of(
            SourceCost.of(JPEG_FILE, DECODE_COST),
            SourceCost.of(PNG_FILE, DECODE_COST),
            SourceCost.of(GIF_FILE, DECODE_COST),
            SourceCost.of(BMP_FILE, DECODE_COST),
            SourceCost.of(TIFF_FILE, DECODE_COST));
        registry.registerConverter(decodable, AWT_IMAGE, AwtImageOps::decode);
        registry.registerConverter(AWT_IMAGE, PIXEL_BUFFER, BUFFER_COST, AwtImageOps::toBuffer);
        registry.registerConverter(PIXEL_BUFFER, AWT_IMAGE, BUFFER_COST, AwtImageOps::fromBuffer);

        registry.registerOperation(AWT_IMAGE, OperationNames.GET_SIZE, ArgumentShape.none(), AwtImageOps::getSize);
        registry.registerOperation(AWT_IMAGE, OperationNames.HAS_ALPHA, ArgumentShape.none(), AwtImageOps::hasAlpha);
        registry.registerOperation(AWT_IMAGE, OperationNames.GET_FRAME_COUNT, ArgumentShape.none(),
            AwtImageOps::getFrameCount);
        registry.registerOperation(AWT_IMAGE, OperationNames.HAS_ANIMATION, ArgumentShape.none(),
            AwtImageOps::hasAnimation);
        registry.registerOperation(AWT_IMAGE, OperationNames.RESIZE, ArgumentShape.of(int.class, int.class),
            AwtImageOps::resize);
        registry.registerOperation(AWT_IMAGE, OperationNames.CROP,
            ArgumentShape.of(CropRect.class), AwtImageOps::crop);
        registry.registerOperation(AWT_IMAGE, OperationNames.ROTATE, ArgumentShape.of(int.class),
            AwtImageOps::rotate);
        registry.registerOperation(AWT_IMAGE, OperationNames.SET_BACKGROUND_COLOR_RGB,
            ArgumentShape.of(int.class, int.class, int.class), AwtImageOps::setBackgroundColorRgb);

        int jpegQuality = config.getJpegQuality();
        registry.registerOperation(AWT_IMAGE, OperationNames.SAVE_AS_JPEG,
            SAVE_SHAPE.withOptional(int.class, boolean.class),
            (image, args) -> AwtImageOps.save(image, ImageFormat.JPEG, (OutputStream) args[0],
                args.length > 1 ? (Integer) args[1] : jpegQuality,
                args.length > 2 && (Boolean) args[2]));
        registerSave(registry, OperationNames.SAVE_AS_PNG, ImageFormat.PNG);
        registerSave(registry, OperationNames.SAVE_AS_GIF, ImageFormat.GIF);
        registerSave(registry, OperationNames.SAVE_AS_BMP, ImageFormat.BMP);
        registerSave(registry, OperationNames.SAVE_AS_TIFF, ImageFormat.TIFF);

        // Frame counting reads the GIF container directly, no decode needed
        registry.registerOperation(GIF_FILE, OperationNames.GET_FRAME_COUNT, ArgumentShape.none(),
            (file, args) -> AwtImageOps.countFrames(file));
        registry.registerOperation(GIF_FILE, OperationNames.HAS_ANIMATION, ArgumentShape.none(),
            (file, args) -> AwtImageOps.countFrames(file) > 1);
    }

    private static void registerSave(CapabilityRegistry registry, String operation, ImageFormat format) {
        registry.registerOperation(AWT_IMAGE, operation, SAVE_SHAPE,
            (image, args) -> AwtImageOps.save(image, format, (OutputStream) args[0], 100, false));
    }
}
