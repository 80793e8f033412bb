package com.ttennebkram.imagerouter.model;

import java.util.Objects;

/**
 * A backend value together with the representation describing it.
 * Operations return one of these when they produce a new image.
 */
public final class ImageValue<T> {

    private final Representation<T> representation;
    private final T value;

    private ImageValue(Representation<T> representation, T value) {
        this.representation = representation;
        this.value = value;
    }

    public static <T> ImageValue<T> of(Representation<T> representation, T value) {
        Objects.requireNonNull(representation, "representation");
        Objects.requireNonNull(value, "value");
        return new ImageValue<>(representation, representation.cast(value));
    }

    public Representation<T> getRepresentation() {
        return representation;
    }

    public T getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "ImageValue[" + representation + "]";
    }
}
