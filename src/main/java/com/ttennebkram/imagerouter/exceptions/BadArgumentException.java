package com.ttennebkram.imagerouter.exceptions;

/**
 * Thrown when an operation is called with arguments it cannot accept,
 * either the wrong number/types or values out of range.
 * Always raised before the backend touches the image.
 */
public class BadArgumentException extends ImageRouterException {

    public BadArgumentException(String message) {
        super(message);
    }
}
