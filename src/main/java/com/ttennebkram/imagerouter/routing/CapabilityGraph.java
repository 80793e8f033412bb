package com.ttennebkram.imagerouter.routing;

import com.ttennebkram.imagerouter.model.Representation;
import com.ttennebkram.imagerouter.registry.ConverterEntry;
import com.ttennebkram.imagerouter.registry.ConverterRegistry;
import com.ttennebkram.imagerouter.registry.OperationEntry;
import com.ttennebkram.imagerouter.registry.OperationRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of representations (nodes) and converters (edges),
 * with each node's native operations attached.
 *
 * Built from the registries by {@link #build}; the generation it was built from
 * lets the owner detect when a rebuild is needed.
 */
public final class CapabilityGraph {

    private final Set<Representation<?>> nodes;
    private final Map<Representation<?>, List<ConverterEntry<?, ?>>> adjacency;
    private final Map<Representation<?>, Map<String, OperationEntry<?>>> operations;
    private final List<ConverterEntry<?, ?>> edges;
    private final long generation;

    private CapabilityGraph(Set<Representation<?>> nodes,
                            Map<Representation<?>, List<ConverterEntry<?, ?>>> adjacency,
                            Map<Representation<?>, Map<String, OperationEntry<?>>> operations,
                            List<ConverterEntry<?, ?>> edges,
                            long generation) {
        this.nodes = nodes;
        this.adjacency = adjacency;
        this.operations = operations;
        this.edges = edges;
        this.generation = generation;
    }

    /**
     * Snapshot the current registrations.
     * Node order: representations with operations first, then converter endpoints,
     * each in registration order.
     */
    public static CapabilityGraph build(OperationRegistry operationRegistry,
                                        ConverterRegistry converterRegistry,
                                        long generation) {
        Set<Representation<?>> nodes = new LinkedHashSet<>();
        Map<Representation<?>, Map<String, OperationEntry<?>>> operations = new LinkedHashMap<>();

        for (Representation<?> representation : operationRegistry.representations()) {
            nodes.add(representation);
            operations.put(representation,
                Collections.unmodifiableMap(new LinkedHashMap<>(operationRegistry.entriesFor(representation))));
        }

        Map<Representation<?>, List<ConverterEntry<?, ?>>> adjacency = new LinkedHashMap<>();
        List<ConverterEntry<?, ?>> edges = new ArrayList<>(converterRegistry.allEdges());
        for (ConverterEntry<?, ?> edge : edges) {
            nodes.add(edge.getSource());
            nodes.add(edge.getTarget());
            adjacency.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge);
        }
        for (Map.Entry<Representation<?>, List<ConverterEntry<?, ?>>> entry : adjacency.entrySet()) {
            entry.setValue(Collections.unmodifiableList(entry.getValue()));
        }

        return new CapabilityGraph(
            Collections.unmodifiableSet(nodes),
            Collections.unmodifiableMap(adjacency),
            Collections.unmodifiableMap(operations),
            Collections.unmodifiableList(edges),
            generation);
    }

    public Set<Representation<?>> getNodes() {
        return nodes;
    }

    public boolean contains(Representation<?> representation) {
        return nodes.contains(representation);
    }

    /**
     * Every converter edge, in registration order.
     */
    public List<ConverterEntry<?, ?>> getEdges() {
        return edges;
    }

    /**
     * Outgoing edges of a node, in registration order. Empty for unknown nodes.
     */
    public List<ConverterEntry<?, ?>> edgesFrom(Representation<?> representation) {
        List<ConverterEntry<?, ?>> out = adjacency.get(representation);
        return out != null ? out : Collections.emptyList();
    }

    public boolean supports(Representation<?> representation, String operation) {
        Map<String, OperationEntry<?>> byName = operations.get(representation);
        return byName != null && byName.containsKey(operation);
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<OperationEntry<T>> lookupOperation(Representation<T> representation, String operation) {
        Map<String, OperationEntry<?>> byName = operations.get(representation);
        if (byName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable((OperationEntry<T>) byName.get(operation));
    }

    /**
     * Native operation names of a node, in registration order.
     */
    public List<String> operationsFor(Representation<?> representation) {
        Map<String, OperationEntry<?>> byName = operations.get(representation);
        if (byName == null) {
            return Collections.emptyList();
        }
        return List.copyOf(byName.keySet());
    }

    public long getGeneration() {
        return generation;
    }
}
