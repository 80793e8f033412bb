package com.ttennebkram.imagerouter.routing;

import com.ttennebkram.imagerouter.exceptions.NoConversionPathException;
import com.ttennebkram.imagerouter.exceptions.UnsupportedImageOperationException;
import com.ttennebkram.imagerouter.model.Representation;
import com.ttennebkram.imagerouter.registry.CapabilityRegistry;
import com.ttennebkram.imagerouter.registry.ConverterEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds the cheapest chain of converters that makes an operation available.
 *
 * Uses Dijkstra over the capability graph. The queue orders entries by cumulative
 * cost and then by insertion order, and edges are relaxed in registration order,
 * so among equally cheap routes the first one discovered always wins.
 *
 * Results are memoized per (start, goal) when the cache is enabled. The cache is
 * dropped whenever the registry generation changes. Unreachable goals are not cached.
 */
public class Router {

    private static final Logger LOG = Logger.getLogger(Router.class.getName());

    private final CapabilityRegistry registry;
    private final boolean cacheEnabled;

    private final Map<RouteKey, ConversionPath> cache = new ConcurrentHashMap<>();
    private volatile long cacheGeneration = -1;

    public Router(CapabilityRegistry registry) {
        this(registry, true);
    }

    public Router(CapabilityRegistry registry, boolean cacheEnabled) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.cacheEnabled = cacheEnabled;
    }

    public CapabilityRegistry getRegistry() {
        return registry;
    }

    /**
     * Cheapest path from {@code start} to any representation that natively supports {@code operation}.
     * Returns the empty path immediately when {@code start} supports it itself.
     *
     * @throws UnsupportedImageOperationException if no reachable representation supports the operation
     */
    public ConversionPath resolve(Representation<?> start, String operation)
            throws UnsupportedImageOperationException {
        CapabilityGraph graph = registry.getGraph();
        if (graph.supports(start, operation)) {
            return ConversionPath.empty(start);
        }

        RouteKey key = new RouteKey(start, operation);
        ConversionPath cached = cached(graph, key);
        if (cached != null) {
            return cached;
        }

        ConversionPath path = search(graph, start, node -> graph.supports(node, operation));
        if (path == null) {
            LOG.fine(() -> "No route from " + start + " to operation '" + operation + "'");
            throw new UnsupportedImageOperationException(start, operation);
        }
        store(key, path);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Route for '" + operation + "': " + path);
        }
        return path;
    }

    /**
     * Cheapest path from {@code start} to exactly {@code target}.
     *
     * @throws NoConversionPathException if {@code target} is unreachable
     */
    public ConversionPath resolveTo(Representation<?> start, Representation<?> target)
            throws NoConversionPathException {
        if (start == target) {
            return ConversionPath.empty(start);
        }
        CapabilityGraph graph = registry.getGraph();
        RouteKey key = new RouteKey(start, target);
        ConversionPath cached = cached(graph, key);
        if (cached != null) {
            return cached;
        }

        ConversionPath path = search(graph, start, node -> node == target);
        if (path == null) {
            throw new NoConversionPathException(start, target);
        }
        store(key, path);
        return path;
    }

    /**
     * Every operation that can be reached from {@code start}, natively or through conversions.
     */
    public SortedSet<String> availableOperations(Representation<?> start) {
        CapabilityGraph graph = registry.getGraph();
        SortedSet<String> result = new TreeSet<>();
        Set<Representation<?>> seen = new HashSet<>();
        Deque<Representation<?>> pending = new ArrayDeque<>();
        pending.add(start);
        seen.add(start);
        while (!pending.isEmpty()) {
            Representation<?> node = pending.poll();
            result.addAll(graph.operationsFor(node));
            for (ConverterEntry<?, ?> edge : graph.edgesFrom(node)) {
                if (seen.add(edge.getTarget())) {
                    pending.add(edge.getTarget());
                }
            }
        }
        return Collections.unmodifiableSortedSet(result);
    }

    /**
     * Dijkstra from {@code start}, stopping at the first settled node accepted by {@code goal}.
     *
     * @return the path, or null if no reachable node is accepted
     */
    static ConversionPath search(CapabilityGraph graph, Representation<?> start,
                                 Predicate<Representation<?>> goal) {
        Map<Representation<?>, Long> distance = new HashMap<>();
        Map<Representation<?>, ConverterEntry<?, ?>> reachedVia = new HashMap<>();
        Set<Representation<?>> settled = new HashSet<>();
        PriorityQueue<QueueItem> queue = new PriorityQueue<>();
        long order = 0;

        distance.put(start, 0L);
        queue.add(new QueueItem(start, 0L, order++));

        while (!queue.isEmpty()) {
            QueueItem item = queue.poll();
            Representation<?> node = item.node;
            // Stale entry superseded by a cheaper one
            if (settled.contains(node) || item.distance > distance.get(node)) {
                continue;
            }
            settled.add(node);

            if (goal.test(node)) {
                return reconstruct(start, node, reachedVia);
            }

            for (ConverterEntry<?, ?> edge : graph.edgesFrom(node)) {
                Representation<?> target = edge.getTarget();
                if (settled.contains(target)) {
                    continue;
                }
                long candidate = item.distance + edge.getCost();
                Long known = distance.get(target);
                // Strictly cheaper only: on ties the earlier discovery keeps its edge
                if (known == null || candidate < known) {
                    distance.put(target, candidate);
                    reachedVia.put(target, edge);
                    queue.add(new QueueItem(target, candidate, order++));
                }
            }
        }
        return null;
    }

    private static ConversionPath reconstruct(Representation<?> start, Representation<?> end,
                                              Map<Representation<?>, ConverterEntry<?, ?>> reachedVia) {
        List<ConverterEntry<?, ?>> edges = new ArrayList<>();
        Representation<?> at = end;
        while (at != start) {
            ConverterEntry<?, ?> edge = reachedVia.get(at);
            edges.add(edge);
            at = edge.getSource();
        }
        Collections.reverse(edges);
        return new ConversionPath(start, edges);
    }

    private ConversionPath cached(CapabilityGraph graph, RouteKey key) {
        if (!cacheEnabled) {
            return null;
        }
        if (cacheGeneration != graph.getGeneration()) {
            cache.clear();
            cacheGeneration = graph.getGeneration();
            return null;
        }
        return cache.get(key);
    }

    private void store(RouteKey key, ConversionPath path) {
        if (cacheEnabled) {
            cache.put(key, path);
        }
    }

    /**
     * Number of memoized routes, for diagnostics.
     */
    public int getCachedRouteCount() {
        return cache.size();
    }

    private static final class QueueItem implements Comparable<QueueItem> {
        final Representation<?> node;
        final long distance;
        final long order;

        QueueItem(Representation<?> node, long distance, long order) {
            this.node = node;
            this.distance = distance;
            this.order = order;
        }

        @Override
        public int compareTo(QueueItem other) {
            int byDistance = Long.compare(distance, other.distance);
            return byDistance != 0 ? byDistance : Long.compare(order, other.order);
        }
    }

    /**
     * Start representation plus either an operation name or a target representation.
     */
    private static final class RouteKey {
        final Representation<?> start;
        final Object goal;

        RouteKey(Representation<?> start, Object goal) {
            this.start = start;
            this.goal = goal;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof RouteKey)) return false;
            RouteKey other = (RouteKey) o;
            return start == other.start && goal.equals(other.goal);
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(start) + goal.hashCode();
        }
    }
}
