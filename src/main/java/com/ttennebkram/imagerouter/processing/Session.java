package com.ttennebkram.imagerouter.processing;

import com.ttennebkram.imagerouter.exceptions.ConversionException;
import com.ttennebkram.imagerouter.exceptions.ImageRouterException;
import com.ttennebkram.imagerouter.exceptions.OperationException;
import com.ttennebkram.imagerouter.model.CropRect;
import com.ttennebkram.imagerouter.model.ImageFormat;
import com.ttennebkram.imagerouter.model.ImageSize;
import com.ttennebkram.imagerouter.model.ImageValue;
import com.ttennebkram.imagerouter.model.OperationNames;
import com.ttennebkram.imagerouter.model.Representation;
import com.ttennebkram.imagerouter.registry.ConverterEntry;
import com.ttennebkram.imagerouter.registry.OperationEntry;
import com.ttennebkram.imagerouter.routing.CapabilityGraph;
import com.ttennebkram.imagerouter.routing.ConversionPath;
import com.ttennebkram.imagerouter.routing.Router;

import java.io.OutputStream;
import java.util.Objects;
import java.util.SortedSet;

/**
 * Live handle on one backend image value and the representation describing it.
 *
 * {@link #invoke} runs an operation by name: if the current representation does not
 * support it, the session asks the {@link Router} for the cheapest conversion chain and
 * walks it, replacing its own value after each step. Conversions that succeeded stay
 * applied even if a later step fails.
 *
 * A session owns its value exclusively and is not thread-safe. Do not pass one session
 * to concurrent callers.
 */
public class Session {

    private static final Object[] NO_ARGS = new Object[0];

    private final Router router;
    private Representation<?> representation;
    private Object value;

    /**
     * Wrap a value. The session takes ownership: intermediate values it replaces are
     * released through their representation.
     */
    public Session(Router router, ImageValue<?> image) {
        this.router = Objects.requireNonNull(router, "router");
        Objects.requireNonNull(image, "image");
        this.representation = image.getRepresentation();
        this.value = image.getValue();
    }

    public Router getRouter() {
        return router;
    }

    public Representation<?> getRepresentation() {
        return representation;
    }

    public Object getValue() {
        return value;
    }

    /**
     * The held value, checked against an expected representation.
     *
     * @throws IllegalStateException if the session is in a different representation
     */
    public <T> T getValue(Representation<T> expected) {
        if (representation != expected) {
            throw new IllegalStateException("Session holds " + representation + ", not " + expected);
        }
        return expected.cast(value);
    }

    /**
     * Run an operation by name.
     *
     * @return a new Session if the operation produced an image, otherwise its terminal result
     * @throws com.ttennebkram.imagerouter.exceptions.UnsupportedImageOperationException if no
     *         conversion path leads to the operation; the session is left untouched
     * @throws ConversionException if a converter fails; the session stays at the last reached representation
     * @throws OperationException if the backend fails inside the operation
     * @throws com.ttennebkram.imagerouter.exceptions.BadArgumentException if the arguments do not fit
     */
    public Object invoke(String operation, Object... args) throws ImageRouterException {
        Object[] arguments = args != null ? args : NO_ARGS;
        CapabilityGraph graph = router.getRegistry().getGraph();

        OperationEntry<?> entry = graph.lookupOperation(representation, operation).orElse(null);
        if (entry != null) {
            entry.getShape().validate(operation, arguments);
            return apply(entry, operation, arguments);
        }

        ConversionPath path = router.resolve(representation, operation);
        entry = graph.lookupOperation(path.getDestination(), operation)
            .orElseThrow(() -> new IllegalStateException("Route ends at " + path.getDestination()
                + " which does not support " + operation));
        // Check arguments before any conversion touches the session
        entry.getShape().validate(operation, arguments);

        applyPath(path);
        return apply(entry, operation, arguments);
    }

    /**
     * Run an operation that must produce a new image.
     */
    public Session invokeForSession(String operation, Object... args) throws ImageRouterException {
        Object result = invoke(operation, args);
        if (result instanceof Session) {
            return (Session) result;
        }
        throw new OperationException("Operation did not produce an image: " + describe(result))
            .attach(representation, operation, this);
    }

    /**
     * Run an operation whose terminal result must be of the given type.
     */
    public <R> R invokeFor(Class<R> resultType, String operation, Object... args) throws ImageRouterException {
        Object result = invoke(operation, args);
        if (resultType.isInstance(result)) {
            return resultType.cast(result);
        }
        throw new OperationException("Expected " + resultType.getSimpleName() + " but got " + describe(result))
            .attach(representation, operation, this);
    }

    /**
     * Convert this session in place to a specific representation along the cheapest path.
     *
     * @return the held value in the target representation
     * @throws com.ttennebkram.imagerouter.exceptions.NoConversionPathException if unreachable
     */
    public <T> T convertTo(Representation<T> target) throws ImageRouterException {
        applyPath(router.resolveTo(representation, target));
        return target.cast(value);
    }

    /**
     * Every operation this session can run, directly or after conversion.
     */
    public SortedSet<String> availableOperations() {
        return router.availableOperations(representation);
    }

    /**
     * Release the held value (native memory etc.). The session must not be used afterwards.
     */
    public void release() {
        Object held = value;
        value = null;
        representation.release(held);
    }

    // Typed conveniences for the standard operations

    public ImageSize getSize() throws ImageRouterException {
        return invokeFor(ImageSize.class, OperationNames.GET_SIZE);
    }

    public boolean hasAlpha() throws ImageRouterException {
        return invokeFor(Boolean.class, OperationNames.HAS_ALPHA);
    }

    public int getFrameCount() throws ImageRouterException {
        return invokeFor(Integer.class, OperationNames.GET_FRAME_COUNT);
    }

    public boolean hasAnimation() throws ImageRouterException {
        return invokeFor(Boolean.class, OperationNames.HAS_ANIMATION);
    }

    public Session resize(int width, int height) throws ImageRouterException {
        return invokeForSession(OperationNames.RESIZE, width, height);
    }

    public Session crop(int left, int top, int right, int bottom) throws ImageRouterException {
        return invokeForSession(OperationNames.CROP, new CropRect(left, top, right, bottom));
    }

    /**
     * Rotate clockwise by the given number of degrees.
     */
    public Session rotate(int degrees) throws ImageRouterException {
        return invokeForSession(OperationNames.ROTATE, degrees);
    }

    public Session setBackgroundColorRgb(int red, int green, int blue) throws ImageRouterException {
        return invokeForSession(OperationNames.SET_BACKGROUND_COLOR_RGB, red, green, blue);
    }

    public Session saveAsJpeg(OutputStream out) throws ImageRouterException {
        return invokeForSession(OperationNames.SAVE_AS_JPEG, out);
    }

    public Session saveAsJpeg(OutputStream out, int quality, boolean progressive) throws ImageRouterException {
        return invokeForSession(OperationNames.SAVE_AS_JPEG, out, quality, progressive);
    }

    public Session saveAsPng(OutputStream out) throws ImageRouterException {
        return invokeForSession(OperationNames.SAVE_AS_PNG, out);
    }

    public Session saveAsGif(OutputStream out) throws ImageRouterException {
        return invokeForSession(OperationNames.SAVE_AS_GIF, out);
    }

    public Session saveAsBmp(OutputStream out) throws ImageRouterException {
        return invokeForSession(OperationNames.SAVE_AS_BMP, out);
    }

    public Session saveAsTiff(OutputStream out) throws ImageRouterException {
        return invokeForSession(OperationNames.SAVE_AS_TIFF, out);
    }

    public Session saveAsWebp(OutputStream out) throws ImageRouterException {
        return invokeForSession(OperationNames.SAVE_AS_WEBP, out);
    }

    public Session saveAsWebp(OutputStream out, int quality, boolean lossless) throws ImageRouterException {
        return invokeForSession(OperationNames.SAVE_AS_WEBP, out, quality, lossless);
    }

    /**
     * Encode into the given format with the backend's default settings.
     */
    public Session saveAs(ImageFormat format, OutputStream out) throws ImageRouterException {
        return invokeForSession(format.getSaveOperation(), out);
    }

    private void applyPath(ConversionPath path) throws ConversionException {
        for (ConverterEntry<?, ?> edge : path.getEdges()) {
            Object converted;
            try {
                converted = edge.apply(value);
            } catch (ConversionException e) {
                throw e.attach(edge, this);
            } catch (RuntimeException e) {
                throw new ConversionException(String.valueOf(e.getMessage()), e).attach(edge, this);
            }
            if (converted == null) {
                throw new ConversionException("Converter returned no value").attach(edge, this);
            }

            Object previous = value;
            Representation<?> previousRepresentation = representation;
            representation = edge.getTarget();
            value = converted;
            if (previous != converted) {
                previousRepresentation.release(previous);
            }
        }
    }

    private Object apply(OperationEntry<?> entry, String operation, Object[] args) throws ImageRouterException {
        Object result;
        try {
            result = entry.apply(value, args);
        } catch (OperationException e) {
            throw e.attach(representation, operation, this);
        } catch (RuntimeException e) {
            throw new OperationException(String.valueOf(e.getMessage()), e)
                .attach(representation, operation, this);
        }
        if (result instanceof ImageValue) {
            return new Session(router, (ImageValue<?>) result);
        }
        return result;
    }

    private static String describe(Object result) {
        return result == null ? "null" : result.getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return "Session[" + representation + "]";
    }
}
