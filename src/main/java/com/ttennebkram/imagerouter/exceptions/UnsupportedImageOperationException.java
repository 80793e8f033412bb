package com.ttennebkram.imagerouter.exceptions;

import com.ttennebkram.imagerouter.model.Representation;

/**
 * Thrown when no representation reachable from the start supports the requested operation.
 * This is an expected condition, e.g. asking for WebP output with no backend that writes WebP.
 */
public class UnsupportedImageOperationException extends ImageRouterException {

    private final Representation<?> start;
    private final String operation;

    public UnsupportedImageOperationException(Representation<?> start, String operation) {
        this(start, operation, "Operation '" + operation + "' is not reachable from " + start);
    }

    protected UnsupportedImageOperationException(Representation<?> start, String operation, String message) {
        super(message);
        this.start = start;
        this.operation = operation;
    }

    public Representation<?> getStart() {
        return start;
    }

    public String getOperation() {
        return operation;
    }
}
