package com.ttennebkram.imagerouter.exceptions;

import com.ttennebkram.imagerouter.model.Representation;

/**
 * Thrown when an operation is registered twice for one representation without the override flag.
 */
public class DuplicateOperationException extends RegistrationException {

    public DuplicateOperationException(Representation<?> representation, String operation) {
        super("Operation '" + operation + "' is already registered for " + representation);
    }
}
