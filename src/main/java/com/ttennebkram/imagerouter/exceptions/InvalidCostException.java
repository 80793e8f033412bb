package com.ttennebkram.imagerouter.exceptions;

/**
 * Thrown when a converter is registered with a negative cost.
 */
public class InvalidCostException extends RegistrationException {

    public InvalidCostException(String message) {
        super(message);
    }
}
