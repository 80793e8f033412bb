package com.ttennebkram.imagerouter.backends.opencv;

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
import com.ttennebkram.imagerouter.util.MatTracker;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.io.IOException;
import java.io.OutputStream;

/**
 * OpenCV implementations of the OpenCV backend's converters and operations.
 *
 * Mats handled here are 8-bit BGR or BGRA. Every Mat handed back to the router
 * is registered with {@link MatTracker}; temporaries are released before returning.
 */
public final class OpenCvImageOps {

    private OpenCvImageOps() {
    }

    // ========== Converters ==========

    /**
     * Decode with Imgcodecs, normalising grey and 16-bit images to 8-bit BGR(A).
     */
    public static Mat decode(EncodedImage file) throws ConversionException {
        MatOfByte bytes = new MatOfByte(file.getData());
        Mat decoded;
        try {
            decoded = Imgcodecs.imdecode(bytes, Imgcodecs.IMREAD_UNCHANGED);
        } finally {
            bytes.release();
        }
        if (decoded == null || decoded.empty()) {
            throw new ConversionException("OpenCV cannot decode " + file);
        }
        return MatTracker.track(normalize(decoded));
    }

    public static RgbImageBuffer toBuffer(Mat mat) throws ConversionException {
        int channels = mat.channels();
        if (channels != 3 && channels != 4) {
            throw new ConversionException("Unsupported channel count " + channels);
        }
        boolean alpha = channels == 4;
        Mat rgb = new Mat();
        try {
            Imgproc.cvtColor(mat, rgb, alpha ? Imgproc.COLOR_BGRA2RGBA : Imgproc.COLOR_BGR2RGB);
            byte[] data = new byte[mat.cols() * mat.rows() * channels];
            rgb.get(0, 0, data);
            return new RgbImageBuffer(mat.cols(), mat.rows(), alpha, data);
        } finally {
            rgb.release();
        }
    }

    public static Mat fromBuffer(RgbImageBuffer buffer) {
        boolean alpha = buffer.hasAlpha();
        Mat rgb = new Mat(buffer.getHeight(), buffer.getWidth(), alpha ? CvType.CV_8UC4 : CvType.CV_8UC3);
        try {
            rgb.put(0, 0, buffer.getData());
            Mat bgr = new Mat();
            Imgproc.cvtColor(rgb, bgr, alpha ? Imgproc.COLOR_RGBA2BGRA : Imgproc.COLOR_RGB2BGR);
            return MatTracker.track(bgr);
        } finally {
            rgb.release();
        }
    }

    // ========== Inspection ==========

    public static Object getSize(Mat mat, Object[] args) {
        return new ImageSize(mat.cols(), mat.rows());
    }

    public static Object hasAlpha(Mat mat, Object[] args) {
        return mat.channels() == 4;
    }

    public static Object getFrameCount(Mat mat, Object[] args) {
        return 1;
    }

    public static Object hasAnimation(Mat mat, Object[] args) {
        return false;
    }

    // ========== Transformations ==========

    /**
     * args: width, height
     */
    public static Object resize(Mat mat, Object[] args) throws BadArgumentException {
        int width = (Integer) args[0];
        int height = (Integer) args[1];
        if (width <= 0 || height <= 0) {
            throw new BadArgumentException("Invalid resize dimensions: " + width + "x" + height);
        }

        // INTER_AREA gives the cleanest result when shrinking
        boolean shrinking = width < mat.cols() && height < mat.rows();
        Mat output = new Mat();
        Imgproc.resize(mat, output, new Size(width, height), 0, 0,
            shrinking ? Imgproc.INTER_AREA : Imgproc.INTER_LINEAR);
        return ImageValue.of(OpenCvBackend.OPENCV_MAT, MatTracker.track(output));
    }

    /**
     * args: CropRect
     */
    public static Object crop(Mat mat, Object[] args) throws BadArgumentException {
        CropRect rect = ((CropRect) args[0]).clampTo(mat.cols(), mat.rows());
        Rect roi = new Rect(rect.getLeft(), rect.getTop(), rect.getWidth(), rect.getHeight());
        Mat view = mat.submat(roi);
        try {
            return ImageValue.of(OpenCvBackend.OPENCV_MAT, MatTracker.track(view.clone()));
        } finally {
            view.release();
        }
    }

    /**
     * args: degrees clockwise. Quarter turns are exact; other angles expand the
     * canvas to fit the rotated image and fill the corners with transparent black.
     */
    public static Object rotate(Mat mat, Object[] args) {
        int degrees = Math.floorMod((Integer) args[0], 360);
        Mat output = new Mat();
        switch (degrees) {
            case 0 -> mat.copyTo(output);
            case 90 -> Core.rotate(mat, output, Core.ROTATE_90_CLOCKWISE);
            case 180 -> Core.rotate(mat, output, Core.ROTATE_180);
            case 270 -> Core.rotate(mat, output, Core.ROTATE_90_COUNTERCLOCKWISE);
            default -> rotateArbitrary(mat, output, degrees);
        }
        return ImageValue.of(OpenCvBackend.OPENCV_MAT, MatTracker.track(output));
    }

    private static void rotateArbitrary(Mat mat, Mat output, int degrees) {
        double cx = mat.cols() / 2.0;
        double cy = mat.rows() / 2.0;
        // OpenCV angles are anticlockwise
        Mat matrix = Imgproc.getRotationMatrix2D(new Point(cx, cy), -degrees, 1.0);
        try {
            double radians = Math.toRadians(degrees);
            double cos = Math.abs(Math.cos(radians));
            double sin = Math.abs(Math.sin(radians));
            int newWidth = (int) Math.round(mat.rows() * sin + mat.cols() * cos);
            int newHeight = (int) Math.round(mat.rows() * cos + mat.cols() * sin);

            matrix.put(0, 2, matrix.get(0, 2)[0] + newWidth / 2.0 - cx);
            matrix.put(1, 2, matrix.get(1, 2)[0] + newHeight / 2.0 - cy);

            Imgproc.warpAffine(mat, output, matrix, new Size(newWidth, newHeight),
                Imgproc.INTER_LINEAR, Core.BORDER_CONSTANT, new Scalar(0, 0, 0, 0));
        } finally {
            matrix.release();
        }
    }

    /**
     * args: red, green, blue (0-255). Blends BGRA pixels over the colour;
     * images without alpha come back as an unchanged copy.
     */
    public static Object setBackgroundColorRgb(Mat mat, Object[] args) throws BadArgumentException {
        int red = checkChannel("red", (Integer) args[0]);
        int green = checkChannel("green", (Integer) args[1]);
        int blue = checkChannel("blue", (Integer) args[2]);

        if (mat.channels() != 4) {
            return ImageValue.of(OpenCvBackend.OPENCV_MAT, MatTracker.track(mat.clone()));
        }

        int pixels = mat.rows() * mat.cols();
        Mat source = mat.isContinuous() ? mat : mat.clone();
        byte[] bgra = new byte[pixels * 4];
        try {
            source.get(0, 0, bgra);
        } finally {
            if (source != mat) {
                source.release();
            }
        }

        byte[] bgr = new byte[pixels * 3];
        for (int i = 0; i < pixels; i++) {
            int a = bgra[i * 4 + 3] & 0xFF;
            bgr[i * 3] = (byte) blend(bgra[i * 4] & 0xFF, blue, a);
            bgr[i * 3 + 1] = (byte) blend(bgra[i * 4 + 1] & 0xFF, green, a);
            bgr[i * 3 + 2] = (byte) blend(bgra[i * 4 + 2] & 0xFF, red, a);
        }
        Mat output = new Mat(mat.rows(), mat.cols(), CvType.CV_8UC3);
        output.put(0, 0, bgr);
        return ImageValue.of(OpenCvBackend.OPENCV_MAT, MatTracker.track(output));
    }

    // ========== Encoding ==========

    /**
     * Encode with Imgcodecs, write the bytes to {@code out} and return them as a file image.
     *
     * @param quality 1-100; JPEG and WEBP only
     * @param flag    progressive for JPEG, lossless for WEBP
     */
    public static ImageValue<EncodedImage> save(Mat mat, ImageFormat format, OutputStream out,
                                                int quality, boolean flag)
            throws BadArgumentException, OperationException {
        if (quality < 1 || quality > 100) {
            throw new BadArgumentException("Quality must be between 1 and 100, got " + quality);
        }

        MatOfInt params = switch (format) {
            case JPEG -> flag
                ? new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, quality, Imgcodecs.IMWRITE_JPEG_PROGRESSIVE, 1)
                : new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, quality);
            // Quality above 100 selects lossless WEBP
            case WEBP -> new MatOfInt(Imgcodecs.IMWRITE_WEBP_QUALITY, flag ? 101 : quality);
            default -> new MatOfInt();
        };

        Mat source = mat;
        if (format == ImageFormat.JPEG && mat.channels() == 4) {
            source = new Mat();
            Imgproc.cvtColor(mat, source, Imgproc.COLOR_BGRA2BGR);
        }

        MatOfByte buffer = new MatOfByte();
        byte[] encoded;
        try {
            if (!Imgcodecs.imencode("." + format.getDefaultExtension(), source, buffer, params)) {
                throw new OperationException("OpenCV cannot encode " + format.getFormatName());
            }
            encoded = buffer.toArray();
        } finally {
            buffer.release();
            params.release();
            if (source != mat) {
                source.release();
            }
        }

        try {
            out.write(encoded);
            out.flush();
        } catch (IOException e) {
            throw new OperationException("Cannot write " + format.getFormatName() + " output: " + e.getMessage(), e);
        }
        return StandardRepresentations.encoded(format, encoded);
    }

    // ========== Helpers ==========

    private static Mat normalize(Mat decoded) {
        Mat current = decoded;
        if (current.depth() != CvType.CV_8U) {
            Mat eightBit = new Mat();
            double scale = current.depth() == CvType.CV_16U ? 1.0 / 256.0 : 1.0;
            current.convertTo(eightBit, CvType.CV_8U, scale);
            current.release();
            current = eightBit;
        }
        if (current.channels() == 1) {
            Mat bgr = new Mat();
            Imgproc.cvtColor(current, bgr, Imgproc.COLOR_GRAY2BGR);
            current.release();
            current = bgr;
        }
        return current;
    }

    private static int blend(int foreground, int background, int alpha) {
        return (foreground * alpha + background * (255 - alpha) + 127) / 255;
    }

    private static int checkChannel(String name, int value) throws BadArgumentException {
        if (value < 0 || value > 255) {
            throw new BadArgumentException(name + " must be between 0 and 255, got " + value);
        }
        return value;
    }
}
