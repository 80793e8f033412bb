package com.ttennebkram.imagerouter.routing;

import com.ttennebkram.imagerouter.model.Representation;
import com.ttennebkram.imagerouter.registry.ConverterEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered chain of converter edges from a start representation to a destination.
 * The empty path means "already there" and costs nothing.
 */
public final class ConversionPath {

    private final Representation<?> start;
    private final List<ConverterEntry<?, ?>> edges;
    private final long totalCost;

    public ConversionPath(Representation<?> start, List<ConverterEntry<?, ?>> edges) {
        this.start = start;
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
        long cost = 0;
        Representation<?> at = start;
        for (ConverterEntry<?, ?> edge : this.edges) {
            if (edge.getSource() != at) {
                throw new IllegalArgumentException("Edge " + edge + " does not continue from " + at);
            }
            cost += edge.getCost();
            at = edge.getTarget();
        }
        this.totalCost = cost;
    }

    public static ConversionPath empty(Representation<?> start) {
        return new ConversionPath(start, Collections.emptyList());
    }

    public Representation<?> getStart() {
        return start;
    }

    /**
     * The representation reached after applying every edge.
     */
    public Representation<?> getDestination() {
        return edges.isEmpty() ? start : edges.get(edges.size() - 1).getTarget();
    }

    public List<ConverterEntry<?, ?>> getEdges() {
        return edges;
    }

    public long getTotalCost() {
        return totalCost;
    }

    public boolean isEmpty() {
        return edges.isEmpty();
    }

    public int size() {
        return edges.size();
    }

    @Override
    public String toString() {
        if (edges.isEmpty()) {
            return start + " (no conversion)";
        }
        StringBuilder sb = new StringBuilder().append(start);
        for (ConverterEntry<?, ?> edge : edges) {
            sb.append(" -[").append(edge.getCost()).append("]-> ").append(edge.getTarget());
        }
        return sb.append(" (total ").append(totalCost).append(")").toString();
    }
}
