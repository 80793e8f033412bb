package com.ttennebkram.imagerouter.registry;

import com.ttennebkram.imagerouter.exceptions.RegistryFrozenException;
import com.ttennebkram.imagerouter.model.Representation;
import com.ttennebkram.imagerouter.processing.ImageConverter;
import com.ttennebkram.imagerouter.processing.ImageOperation;
import com.ttennebkram.imagerouter.routing.CapabilityGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Owns the operation and converter registries and their two-phase lifecycle.
 *
 * During the registration phase backends add operations and converters. {@link #freeze()}
 * moves the registry into the query phase for good; from then on it is read-only and
 * safe to share between threads. Any registration after that is a
 * {@link RegistryFrozenException}.
 *
 * Example usage:
 * <pre>
 * CapabilityRegistry registry = new CapabilityRegistry();
 * registry.registerConverter(PNG_FILE, AWT_IMAGE, 100, AwtImageOps::decode);
 * registry.registerOperation(AWT_IMAGE, "resize", ArgumentShape.of(Integer.class, Integer.class), AwtImageOps::resize);
 * registry.freeze();
 * </pre>
 */
public class CapabilityRegistry {

    private static final Logger LOG = Logger.getLogger(CapabilityRegistry.class.getName());

    /** Backend name recorded on entries registered outside {@link #registerBackend}. */
    public static final String CUSTOM_BACKEND = "custom";

    private final OperationRegistry operations = new OperationRegistry();
    private final ConverterRegistry converters = new ConverterRegistry();
    private final List<String> backends = new ArrayList<>();

    private volatile boolean frozen = false;
    private String currentBackend = CUSTOM_BACKEND;

    // Snapshot of the graph and the generation it was built from
    private volatile CapabilityGraph graph;

    /**
     * Register a native operation.
     *
     * @throws com.ttennebkram.imagerouter.exceptions.DuplicateOperationException if the
     *         representation already has an operation of this name
     */
    public synchronized <T> OperationEntry<T> registerOperation(Representation<T> representation, String name,
                                                                ArgumentShape shape, ImageOperation<T> operation) {
        checkRegistrationPhase();
        return operations.register(representation, name, shape, operation, currentBackend, false);
    }

    /**
     * Register a native operation, replacing any existing one of the same name.
     */
    public synchronized <T> OperationEntry<T> overrideOperation(Representation<T> representation, String name,
                                                                ArgumentShape shape, ImageOperation<T> operation) {
        checkRegistrationPhase();
        return operations.register(representation, name, shape, operation, currentBackend, true);
    }

    /**
     * Register a converter edge.
     *
     * @throws com.ttennebkram.imagerouter.exceptions.InvalidCostException if cost is negative
     * @throws com.ttennebkram.imagerouter.exceptions.InvalidConverterException if source == target
     */
    public synchronized <S, T> ConverterEntry<S, T> registerConverter(Representation<S> source,
                                                                      Representation<T> target, int cost,
                                                                      ImageConverter<S, T> converter) {
        checkRegistrationPhase();
        return converters.register(source, target, cost, converter, currentBackend);
    }

    /**
     * Register one converter function for several sources at once, one edge per source.
     */
    public synchronized <S, T> List<ConverterEntry<S, T>> registerConverter(List<SourceCost<S>> sources,
                                                                            Representation<T> target,
                                                                            ImageConverter<S, T> converter) {
        checkRegistrationPhase();
        return converters.register(sources, target, converter, currentBackend);
    }

    /**
     * Run a backend's registration so every entry it adds records the backend name.
     */
    public synchronized void registerBackend(String backendName, Consumer<CapabilityRegistry> registration) {
        checkRegistrationPhase();
        String previous = currentBackend;
        currentBackend = backendName;
        int opsBefore = operations.size();
        int convertersBefore = converters.size();
        try {
            registration.accept(this);
            backends.add(backendName);
        } finally {
            currentBackend = previous;
        }
        LOG.fine(() -> "Backend " + backendName + " registered "
            + (operations.size() - opsBefore) + " operations, "
            + (converters.size() - convertersBefore) + " converters");
    }

    /**
     * End the registration phase. One-way; calling it again is a no-op.
     */
    public synchronized void freeze() {
        if (frozen) return;
        graph = CapabilityGraph.build(operations, converters, getGeneration());
        frozen = true;
        LOG.info("CapabilityRegistry: frozen with " + graph.getNodes().size() + " representations, "
            + operations.size() + " operations, " + converters.size() + " converters");
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Changes whenever an operation or converter is registered.
     */
    public synchronized long getGeneration() {
        return operations.getModificationCount() + converters.getModificationCount();
    }

    /**
     * The capability graph for the current registrations, rebuilt if anything
     * was registered since the last build.
     */
    public CapabilityGraph getGraph() {
        CapabilityGraph current = graph;
        if (frozen && current != null) {
            return current;
        }
        synchronized (this) {
            long generation = getGeneration();
            if (graph == null || graph.getGeneration() != generation) {
                graph = CapabilityGraph.build(operations, converters, generation);
            }
            return graph;
        }
    }

    public <T> Optional<OperationEntry<T>> lookupOperation(Representation<T> representation, String name) {
        return getGraph().lookupOperation(representation, name);
    }

    public boolean supports(Representation<?> representation, String name) {
        return getGraph().supports(representation, name);
    }

    public List<ConverterEntry<?, ?>> edgesFrom(Representation<?> representation) {
        return getGraph().edgesFrom(representation);
    }

    /**
     * Names of the backends installed through {@link #registerBackend}, in installation order.
     */
    public synchronized List<String> getBackends() {
        return Collections.unmodifiableList(new ArrayList<>(backends));
    }

    private void checkRegistrationPhase() {
        if (frozen) {
            throw new RegistryFrozenException(
                "Registry is frozen; register operations and converters before opening images");
        }
    }
}
