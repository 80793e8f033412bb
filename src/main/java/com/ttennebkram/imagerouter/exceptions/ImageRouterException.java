package com.ttennebkram.imagerouter.exceptions;

/**
 * Base class for failures surfaced to callers of the image router.
 * Every runtime failure kind the router reports is a subclass of this.
 */
public class ImageRouterException extends Exception {

    public ImageRouterException(String message) {
        super(message);
    }

    public ImageRouterException(String message, Throwable cause) {
        super(message, cause);
    }
}
