package com.ttennebkram.imagerouter.exceptions;

import com.ttennebkram.imagerouter.model.Representation;
import com.ttennebkram.imagerouter.processing.Session;

/**
 * Thrown when a backend fails while running a native operation.
 * The session that ran it attaches the operation context before rethrowing.
 */
public class OperationException extends ImageRouterException {

    private Representation<?> representation;
    private String operation;
    private Session session;

    public OperationException(String message) {
        super(message);
    }

    public OperationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Attach the representation and operation that failed, and the owning session.
     */
    public OperationException attach(Representation<?> representation, String operation, Session session) {
        this.representation = representation;
        this.operation = operation;
        this.session = session;
        return this;
    }

    public Representation<?> getRepresentation() {
        return representation;
    }

    public String getOperation() {
        return operation;
    }

    public Session getSession() {
        return session;
    }

    @Override
    public String getMessage() {
        if (operation == null) {
            return super.getMessage();
        }
        return "Operation '" + operation + "' on " + representation + " failed: " + super.getMessage();
    }
}
