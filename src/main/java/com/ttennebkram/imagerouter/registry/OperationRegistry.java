package com.ttennebkram.imagerouter.registry;

import com.ttennebkram.imagerouter.exceptions.DuplicateOperationException;
import com.ttennebkram.imagerouter.model.Representation;
import com.ttennebkram.imagerouter.processing.ImageOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Records which named operations each representation supports natively.
 * Mutated only through {@link CapabilityRegistry}, which enforces the registration phase.
 */
public class OperationRegistry {

    // Representation keys compare by identity; insertion order is registration order
    private final Map<Representation<?>, Map<String, OperationEntry<?>>> entries = new LinkedHashMap<>();
    private long modificationCount = 0;

    <T> OperationEntry<T> register(Representation<T> representation, String name, ArgumentShape shape,
                                   ImageOperation<T> operation, String backend, boolean override) {
        Map<String, OperationEntry<?>> byName =
            entries.computeIfAbsent(representation, k -> new LinkedHashMap<>());
        if (!override && byName.containsKey(name)) {
            throw new DuplicateOperationException(representation, name);
        }
        OperationEntry<T> entry = new OperationEntry<>(representation, name, shape, operation, backend);
        byName.put(name, entry);
        modificationCount++;
        return entry;
    }

    /**
     * Find the native operation for a representation.
     *
     * @return the entry, or empty if the representation does not support the operation
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<OperationEntry<T>> lookupOperation(Representation<T> representation, String name) {
        Map<String, OperationEntry<?>> byName = entries.get(representation);
        if (byName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable((OperationEntry<T>) byName.get(name));
    }

    public boolean supports(Representation<?> representation, String name) {
        Map<String, OperationEntry<?>> byName = entries.get(representation);
        return byName != null && byName.containsKey(name);
    }

    /**
     * Operation names a representation supports, in registration order.
     */
    public List<String> operationsFor(Representation<?> representation) {
        Map<String, OperationEntry<?>> byName = entries.get(representation);
        if (byName == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(byName.keySet()));
    }

    /**
     * Entries of a representation keyed by operation name, in registration order.
     */
    public Map<String, OperationEntry<?>> entriesFor(Representation<?> representation) {
        Map<String, OperationEntry<?>> byName = entries.get(representation);
        if (byName == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(byName);
    }

    /**
     * Representations with at least one operation, in registration order.
     */
    public Set<Representation<?>> representations() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public int size() {
        int count = 0;
        for (Map<String, OperationEntry<?>> byName : entries.values()) {
            count += byName.size();
        }
        return count;
    }

    long getModificationCount() {
        return modificationCount;
    }
}
