package com.ttennebkram.imagerouter.model;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Names a concrete image encoding/backend pairing, e.g. "png-file" or "opencv-mat".
 * Each representation is a node in the capability graph.
 *
 * Identity is the instance itself: two representations with the same name are
 * different nodes. Declare them once as constants and share them.
 *
 * @param <T> the Java type of backend values held in this representation
 */
public final class Representation<T> {

    private final String name;
    private final Class<T> valueType;
    private final Consumer<? super T> releaser;

    private Representation(String name, Class<T> valueType, Consumer<? super T> releaser) {
        this.name = Objects.requireNonNull(name, "name");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
        this.releaser = releaser;
    }

    /**
     * Create a representation whose values need no explicit release.
     */
    public static <T> Representation<T> of(String name, Class<T> valueType) {
        return new Representation<>(name, valueType, null);
    }

    /**
     * Create a representation whose values hold resources (native memory etc.)
     * that must be released once a session no longer owns them.
     */
    public static <T> Representation<T> of(String name, Class<T> valueType, Consumer<? super T> releaser) {
        return new Representation<>(name, valueType, Objects.requireNonNull(releaser, "releaser"));
    }

    public String getName() {
        return name;
    }

    public Class<T> getValueType() {
        return valueType;
    }

    /**
     * Check that a value belongs to this representation and return it typed.
     *
     * @throws ClassCastException if the value is of the wrong type
     */
    public T cast(Object value) {
        return valueType.cast(value);
    }

    /**
     * Release a value previously held in this representation.
     * No-op for representations without a releaser.
     */
    public void release(Object value) {
        if (releaser != null && value != null) {
            releaser.accept(cast(value));
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
