package com.ttennebkram.imagerouter.registry;

import com.ttennebkram.imagerouter.exceptions.InvalidConverterException;
import com.ttennebkram.imagerouter.exceptions.InvalidCostException;
import com.ttennebkram.imagerouter.model.Representation;
import com.ttennebkram.imagerouter.processing.ImageConverter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records the directed converter edges between representations.
 * Parallel edges are all kept, in registration order.
 * Mutated only through {@link CapabilityRegistry}, which enforces the registration phase.
 */
public class ConverterRegistry {

    private final Map<Representation<?>, List<ConverterEntry<?, ?>>> edgesBySource = new LinkedHashMap<>();
    private final List<ConverterEntry<?, ?>> allEdges = new ArrayList<>();
    private long nextSequence = 0;
    private long modificationCount = 0;

    <S, T> ConverterEntry<S, T> register(Representation<S> source, Representation<T> target, int cost,
                                         ImageConverter<S, T> converter, String backend) {
        validate(source, target, cost);
        return add(source, target, cost, converter, backend);
    }

    /**
     * Register one edge per (source, cost) pair, all sharing the same converter.
     * Either every pair is registered or, if any is invalid, none is.
     */
    <S, T> List<ConverterEntry<S, T>> register(List<SourceCost<S>> sources, Representation<T> target,
                                               ImageConverter<S, T> converter, String backend) {
        for (SourceCost<S> sourceCost : sources) {
            validate(sourceCost.getSource(), target, sourceCost.getCost());
        }
        List<ConverterEntry<S, T>> added = new ArrayList<>(sources.size());
        for (SourceCost<S> sourceCost : sources) {
            added.add(add(sourceCost.getSource(), target, sourceCost.getCost(), converter, backend));
        }
        return added;
    }

    private static void validate(Representation<?> source, Representation<?> target, int cost) {
        if (source == null || target == null) {
            throw new InvalidConverterException("Converter source and target must not be null");
        }
        if (source == target) {
            throw new InvalidConverterException("Converter from " + source + " to itself is not allowed");
        }
        if (cost < 0) {
            throw new InvalidCostException("Converter " + source + " -> " + target
                + " has negative cost " + cost);
        }
    }

    private <S, T> ConverterEntry<S, T> add(Representation<S> source, Representation<T> target, int cost,
                                            ImageConverter<S, T> converter, String backend) {
        ConverterEntry<S, T> entry =
            new ConverterEntry<>(source, target, cost, converter, backend, nextSequence++);
        edgesBySource.computeIfAbsent(source, k -> new ArrayList<>()).add(entry);
        allEdges.add(entry);
        modificationCount++;
        return entry;
    }

    /**
     * Outgoing edges of a representation, in registration order.
     */
    public List<ConverterEntry<?, ?>> edgesFrom(Representation<?> representation) {
        List<ConverterEntry<?, ?>> edges = edgesBySource.get(representation);
        if (edges == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(edges);
    }

    /**
     * Every registered edge, in registration order.
     */
    public List<ConverterEntry<?, ?>> allEdges() {
        return Collections.unmodifiableList(allEdges);
    }

    public int size() {
        return allEdges.size();
    }

    long getModificationCount() {
        return modificationCount;
    }
}
