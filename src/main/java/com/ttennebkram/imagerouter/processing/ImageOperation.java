package com.ttennebkram.imagerouter.processing;

import com.ttennebkram.imagerouter.exceptions.ImageRouterException;

/**
 * A native operation on one backend representation.
 * No routing or conversion happens here - just takes a backend value and applies the operation.
 *
 * Return an {@link com.ttennebkram.imagerouter.model.ImageValue} to hand back a new image
 * (the caller gets a new Session), or any other object as a terminal result.
 * Backend failures must be reported as {@code OperationException} or
 * {@code BadArgumentException}; other runtime exceptions are wrapped by the session.
 *
 * @param <T> backend value type
 */
@FunctionalInterface
public interface ImageOperation<T> {

    /**
     * @param image the session's backend value (do not release or mutate it)
     * @param args  arguments, already checked against the registered argument shape
     * @return a new ImageValue, or a terminal result
     */
    Object apply(T image, Object[] args) throws ImageRouterException;
}
