package com.ttennebkram.imagerouter.registry;

import com.ttennebkram.imagerouter.exceptions.ConversionException;
import com.ttennebkram.imagerouter.model.Representation;
import com.ttennebkram.imagerouter.processing.ImageConverter;

/**
 * A directed, costed edge of the capability graph.
 * Several entries may share one (source, target) pair; the sequence number
 * records registration order and is what makes routing ties deterministic.
 */
public final class ConverterEntry<S, T> {

    private final Representation<S> source;
    private final Representation<T> target;
    private final int cost;
    private final ImageConverter<S, T> converter;
    private final String backend;
    private final long sequence;

    ConverterEntry(Representation<S> source, Representation<T> target, int cost,
                   ImageConverter<S, T> converter, String backend, long sequence) {
        this.source = source;
        this.target = target;
        this.cost = cost;
        this.converter = converter;
        this.backend = backend;
        this.sequence = sequence;
    }

    public Representation<S> getSource() {
        return source;
    }

    public Representation<T> getTarget() {
        return target;
    }

    public int getCost() {
        return cost;
    }

    public ImageConverter<S, T> getConverter() {
        return converter;
    }

    public String getBackend() {
        return backend;
    }

    public long getSequence() {
        return sequence;
    }

    /**
     * Convert an untyped value held in the source representation.
     */
    public T apply(Object value) throws ConversionException {
        return converter.convert(source.cast(value));
    }

    @Override
    public String toString() {
        return source + " -> " + target + " (cost " + cost + ", " + backend + ")";
    }
}
