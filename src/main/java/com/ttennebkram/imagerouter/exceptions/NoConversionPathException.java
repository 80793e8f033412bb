package com.ttennebkram.imagerouter.exceptions;

import com.ttennebkram.imagerouter.model.Representation;

/**
 * Thrown when an explicit conversion target cannot be reached from the start representation.
 */
public class NoConversionPathException extends UnsupportedImageOperationException {

    private final Representation<?> target;

    public NoConversionPathException(Representation<?> start, Representation<?> target) {
        super(start, "convert_to:" + target, "No conversion path from " + start + " to " + target);
        this.target = target;
    }

    public Representation<?> getTarget() {
        return target;
    }
}
