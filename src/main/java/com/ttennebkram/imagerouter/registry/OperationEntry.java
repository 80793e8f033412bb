package com.ttennebkram.imagerouter.registry;

import com.ttennebkram.imagerouter.exceptions.ImageRouterException;
import com.ttennebkram.imagerouter.model.Representation;
import com.ttennebkram.imagerouter.processing.ImageOperation;

/**
 * A native operation registered for one representation.
 */
public final class OperationEntry<T> {

    private final Representation<T> representation;
    private final String name;
    private final ArgumentShape shape;
    private final ImageOperation<T> operation;
    private final String backend;

    OperationEntry(Representation<T> representation, String name, ArgumentShape shape,
                   ImageOperation<T> operation, String backend) {
        this.representation = representation;
        this.name = name;
        this.shape = shape;
        this.operation = operation;
        this.backend = backend;
    }

    public Representation<T> getRepresentation() {
        return representation;
    }

    public String getName() {
        return name;
    }

    public ArgumentShape getShape() {
        return shape;
    }

    public ImageOperation<T> getOperation() {
        return operation;
    }

    public String getBackend() {
        return backend;
    }

    /**
     * Run the operation on an untyped value held in this entry's representation.
     */
    public Object apply(Object value, Object[] args) throws ImageRouterException {
        return operation.apply(representation.cast(value), args);
    }

    @Override
    public String toString() {
        return representation + "." + name + shape;
    }
}
