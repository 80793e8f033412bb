package com.ttennebkram.imagerouter.registry;

import com.ttennebkram.imagerouter.model.Representation;

import java.util.Objects;

/**
 * One (source, cost) pair of a stacked converter registration.
 */
public final class SourceCost<S> {

    private final Representation<S> source;
    private final int cost;

    private SourceCost(Representation<S> source, int cost) {
        this.source = Objects.requireNonNull(source, "source");
        this.cost = cost;
    }

    public static <S> SourceCost<S> of(Representation<S> source, int cost) {
        return new SourceCost<>(source, cost);
    }

    public Representation<S> getSource() {
        return source;
    }

    public int getCost() {
        return cost;
    }

    @Override
    public String toString() {
        return source + "@" + cost;
    }
}
