package com.ttennebkram.imagerouter.exceptions;

/**
 * Base class for configuration errors raised while backends register
 * operations and converters. These are fatal to startup.
 */
public class RegistrationException extends RuntimeException {

    public RegistrationException(String message) {
        super(message);
    }
}
