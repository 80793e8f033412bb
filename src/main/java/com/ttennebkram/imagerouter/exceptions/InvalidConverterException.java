package com.ttennebkram.imagerouter.exceptions;

/**
 * Thrown for structurally invalid converters, e.g. a self-loop.
 */
public class InvalidConverterException extends RegistrationException {

    public InvalidConverterException(String message) {
        super(message);
    }
}
