package com.ttennebkram.imagerouter.exceptions;

/**
 * Thrown when input bytes do not match any known image format.
 */
public class UnrecognizedFormatException extends ImageRouterException {

    public UnrecognizedFormatException(String message) {
        super(message);
    }

    public UnrecognizedFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
