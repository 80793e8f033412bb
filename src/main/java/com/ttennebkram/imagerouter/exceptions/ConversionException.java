package com.ttennebkram.imagerouter.exceptions;

import com.ttennebkram.imagerouter.processing.Session;
import com.ttennebkram.imagerouter.registry.ConverterEntry;

/**
 * Thrown when a converter fails while moving an image between representations.
 *
 * Converters throw this with just a message and cause. The session that ran the
 * conversion then attaches the failed edge and itself, so callers can see which
 * step failed and inspect the representation that was reached before it.
 */
public class ConversionException extends ImageRouterException {

    private ConverterEntry<?, ?> edge;
    private Session session;

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Attach the failing edge and the session left at the last reached representation.
     */
    public ConversionException attach(ConverterEntry<?, ?> edge, Session session) {
        this.edge = edge;
        this.session = session;
        return this;
    }

    /**
     * The converter edge that failed, or null if not run through a session.
     */
    public ConverterEntry<?, ?> getEdge() {
        return edge;
    }

    /**
     * The session in its last successfully reached representation, or null.
     */
    public Session getSession() {
        return session;
    }

    @Override
    public String getMessage() {
        if (edge == null) {
            return super.getMessage();
        }
        return "Conversion " + edge + " failed: " + super.getMessage();
    }
}
