package com.ttennebkram.imagerouter.processing;

import com.ttennebkram.imagerouter.exceptions.ConversionException;

/**
 * Converts a backend value from one representation into a freshly owned value
 * of another representation.
 *
 * @param <S> source value type
 * @param <T> target value type
 */
@FunctionalInterface
public interface ImageConverter<S, T> {

    /**
     * @param source the input value (caller still owns it, do not release)
     * @return a new value, never sharing mutable buffers with the input
     */
    T convert(S source) throws ConversionException;
}
