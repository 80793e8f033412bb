package com.ttennebkram.imagerouter.backends.awt;

import com.ttennebkram.imagerouter.exceptions.BadArgumentException;
import com.ttennebkram.imagerouter.exceptions.ConversionException;
import com.ttennebkram.imagerouter.exceptions.OperationException;
import com.ttennebkram.imagerouter.model.CropRect;
import com.ttennebkram.imagerouter.model.EncodedImage;
import com.ttennebkram.imagerouter.model.ImageFormat;
import com.ttennebkram.imagerouter.model.ImageSize;
import com.ttennebkram.imagerouter.model.ImageValue;
import com.ttennebkram.imagerouter.model.RgbImageBuffer;
import com.ttennebkram.imagerouter.model.StandardRepresentations;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;

/**
 * Java2D / ImageIO implementations of the AWT backend's converters and operations.
 * Every operation returns a new image; inputs are never modified.
 */
public final class AwtImageOps {

    private AwtImageOps() {
    }

    // ========== Converters ==========

    /**
     * Decode an encoded file with ImageIO. Multi-frame files yield their first frame.
     */
    public static BufferedImage decode(EncodedImage file) throws ConversionException {
        BufferedImage image;
        try {
            image = ImageIO.read(file.openStream());
        } catch (IOException e) {
            throw new ConversionException("Cannot decode " + file + ": " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ConversionException("No ImageIO reader accepts " + file);
        }
        return image;
    }

    public static RgbImageBuffer toBuffer(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        boolean alpha = image.getColorModel().hasAlpha();
        int channels = alpha ? 4 : 3;
        byte[] data = new byte[width * height * channels];

        int[] row = new int[width];
        int index = 0;
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                int argb = row[x];
                data[index++] = (byte) ((argb >> 16) & 0xFF);
                data[index++] = (byte) ((argb >> 8) & 0xFF);
                data[index++] = (byte) (argb & 0xFF);
                if (alpha) {
                    data[index++] = (byte) ((argb >> 24) & 0xFF);
                }
            }
        }
        return new RgbImageBuffer(width, height, alpha, data);
    }

    public static BufferedImage fromBuffer(RgbImageBuffer buffer) {
        int width = buffer.getWidth();
        int height = buffer.getHeight();
        boolean alpha = buffer.hasAlpha();
        byte[] data = buffer.getData();
        BufferedImage image = new BufferedImage(width, height,
            alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);

        int[] row = new int[width];
        int index = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r = data[index++] & 0xFF;
                int g = data[index++] & 0xFF;
                int b = data[index++] & 0xFF;
                int a = alpha ? data[index++] & 0xFF : 0xFF;
                row[x] = (a << 24) | (r << 16) | (g << 8) | b;
            }
            image.setRGB(0, y, width, 1, row, 0, width);
        }
        return image;
    }

    // ========== Inspection ==========

    public static Object getSize(BufferedImage image, Object[] args) {
        return new ImageSize(image.getWidth(), image.getHeight());
    }

    public static Object hasAlpha(BufferedImage image, Object[] args) {
        return image.getColorModel().hasAlpha();
    }

    /**
     * A decoded BufferedImage always holds a single frame.
     */
    public static Object getFrameCount(BufferedImage image, Object[] args) {
        return 1;
    }

    public static Object hasAnimation(BufferedImage image, Object[] args) {
        return false;
    }

    /**
     * Count the frames of an encoded GIF without decoding pixels.
     */
    public static int countFrames(EncodedImage file) throws OperationException {
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(file.getData()))) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new OperationException("No ImageIO reader accepts " + file);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, false, true);
                return reader.getNumImages(true);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new OperationException("Cannot read frames of " + file + ": " + e.getMessage(), e);
        }
    }

    // ========== Transformations ==========

    /**
     * args: width, height
     */
    public static Object resize(BufferedImage image, Object[] args) throws BadArgumentException {
        int width = (Integer) args[0];
        int height = (Integer) args[1];
        if (width <= 0 || height <= 0) {
            throw new BadArgumentException("Invalid resize dimensions: " + width + "x" + height);
        }

        BufferedImage resized = new BufferedImage(width, height, imageTypeFor(image));
        Graphics2D g = resized.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(image, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return ImageValue.of(AwtBackend.AWT_IMAGE, resized);
    }

    /**
     * args: CropRect
     */
    public static Object crop(BufferedImage image, Object[] args) throws BadArgumentException {
        CropRect rect = ((CropRect) args[0]).clampTo(image.getWidth(), image.getHeight());
        BufferedImage cropped = copy(image.getSubimage(rect.getLeft(), rect.getTop(), rect.getWidth(), rect.getHeight()));
        return ImageValue.of(AwtBackend.AWT_IMAGE, cropped);
    }

    /**
     * args: degrees clockwise, a multiple of 90 (negative values turn anticlockwise).
     */
    public static Object rotate(BufferedImage image, Object[] args) throws BadArgumentException {
        int degrees = (Integer) args[0];
        if (degrees % 90 != 0) {
            throw new BadArgumentException("Rotation must be a multiple of 90 degrees, got " + degrees);
        }
        int quarterTurns = Math.floorMod(degrees / 90, 4);

        int width = image.getWidth();
        int height = image.getHeight();
        boolean swap = quarterTurns % 2 == 1;
        BufferedImage rotated = new BufferedImage(swap ? height : width, swap ? width : height, imageTypeFor(image));

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int argb = image.getRGB(x, y);
                switch (quarterTurns) {
                    case 1 -> rotated.setRGB(height - 1 - y, x, argb);
                    case 2 -> rotated.setRGB(width - 1 - x, height - 1 - y, argb);
                    case 3 -> rotated.setRGB(y, width - 1 - x, argb);
                    default -> rotated.setRGB(x, y, argb);
                }
            }
        }
        return ImageValue.of(AwtBackend.AWT_IMAGE, rotated);
    }

    /**
     * args: red, green, blue (0-255). Flattens transparency onto the colour;
     * images without alpha come back as an unchanged copy.
     */
    public static Object setBackgroundColorRgb(BufferedImage image, Object[] args) throws BadArgumentException {
        int red = checkChannel("red", (Integer) args[0]);
        int green = checkChannel("green", (Integer) args[1]);
        int blue = checkChannel("blue", (Integer) args[2]);

        if (!image.getColorModel().hasAlpha()) {
            return ImageValue.of(AwtBackend.AWT_IMAGE, copy(image));
        }
        return ImageValue.of(AwtBackend.AWT_IMAGE, flatten(image, new Color(red, green, blue)));
    }

    // ========== Encoding ==========

    /**
     * Encode with ImageIO, write the bytes to {@code out} and return them as a file image.
     *
     * @param quality     1-100, used by JPEG only
     * @param progressive JPEG only
     */
    public static ImageValue<EncodedImage> save(BufferedImage image, ImageFormat format, OutputStream out,
                                                int quality, boolean progressive)
            throws BadArgumentException, OperationException {
        if (quality < 1 || quality > 100) {
            throw new BadArgumentException("Quality must be between 1 and 100, got " + quality);
        }

        // JPEG and BMP writers reject alpha
        BufferedImage source = image;
        if ((format == ImageFormat.JPEG || format == ImageFormat.BMP) && image.getColorModel().hasAlpha()) {
            source = flatten(image, Color.WHITE);
        }

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.getFormatName());
        if (!writers.hasNext()) {
            throw new OperationException("No ImageIO writer for " + format.getFormatName());
        }
        ImageWriter writer = writers.next();

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(bytes)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (format == ImageFormat.JPEG) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(quality / 100f);
                if (progressive) {
                    param.setProgressiveMode(ImageWriteParam.MODE_DEFAULT);
                }
            }
            writer.setOutput(ios);
            writer.write(null, new IIOImage(source, null, null), param);
        } catch (IOException e) {
            throw new OperationException("Cannot encode " + format.getFormatName() + ": " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }

        byte[] encoded = bytes.toByteArray();
        try {
            out.write(encoded);
            out.flush();
        } catch (IOException e) {
            throw new OperationException("Cannot write " + format.getFormatName() + " output: " + e.getMessage(), e);
        }
        return StandardRepresentations.encoded(format, encoded);
    }

    // ========== Helpers ==========

    private static int imageTypeFor(BufferedImage image) {
        return image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
    }

    private static BufferedImage copy(BufferedImage image) {
        BufferedImage copy = new BufferedImage(image.getWidth(), image.getHeight(), imageTypeFor(image));
        Graphics2D g = copy.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return copy;
    }

    private static BufferedImage flatten(BufferedImage image, Color background) {
        BufferedImage flat = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = flat.createGraphics();
        try {
            g.setColor(background);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return flat;
    }

    private static int checkChannel(String name, int value) throws BadArgumentException {
        if (value < 0 || value > 255) {
            throw new BadArgumentException(name + " must be between 0 and 255, got " + value);
        }
        return value;
    }
}
