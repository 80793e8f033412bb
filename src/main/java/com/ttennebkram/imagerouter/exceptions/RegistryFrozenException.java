package com.ttennebkram.imagerouter.exceptions;

/**
 * Thrown when registration is attempted after the registry left its registration phase.
 */
public class RegistryFrozenException extends RegistrationException {

    public RegistryFrozenException(String message) {
        super(message);
    }
}
