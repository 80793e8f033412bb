package com.ttennebkram.imagerouter.routing;

import com.ttennebkram.imagerouter.exceptions.NoConversionPathException;
import com.ttennebkram.imagerouter.exceptions.UnsupportedImageOperationException;
import com.ttennebkram.imagerouter.model.Representation;
import com.ttennebkram.imagerouter.registry.ArgumentShape;
import com.ttennebkram.imagerouter.registry.CapabilityRegistry;
import com.ttennebkram.imagerouter.registry.ConverterEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Router}.
 */
class RouterTest {

    private static final Representation<String> A = Representation.of("a", String.class);
    private static final Representation<String> B = Representation.of("b", String.class);
    private static final Representation<String> C = Representation.of("c", String.class);
    private static final Representation<String> D = Representation.of("d", String.class);

    private CapabilityRegistry registry;
    private Router router;

    @BeforeEach
    void setUp() {
        registry = new CapabilityRegistry();
        router = new Router(registry);
    }

    private void supportOp(Representation<String> representation, String operation) {
        registry.registerOperation(representation, operation, ArgumentShape.none(), (value, args) -> value);
    }

    private ConverterEntry<String, String> edge(Representation<String> source, Representation<String> target,
                                                int cost) {
        return registry.registerConverter(source, target, cost, value -> value + ">" + target.getName());
    }

    @Nested
    @DisplayName("Shortest paths")
    class ShortestPaths {

        @Test
        @DisplayName("two cheap hops beat one expensive edge")
        void cheaperIndirectRoute() throws Exception {
            edge(A, B, 3);
            ConverterEntry<String, String> ac = edge(A, C, 1);
            ConverterEntry<String, String> cb = edge(C, B, 1);
            supportOp(B, "op");

            ConversionPath path = router.resolve(A, "op");

            assertEquals(List.of(ac, cb), path.getEdges());
            assertEquals(2, path.getTotalCost());
            assertSame(B, path.getDestination());
        }

        @Test
        @DisplayName("cheapest of parallel edges is chosen")
        void parallelEdges() throws Exception {
            edge(A, B, 5);
            ConverterEntry<String, String> cheap = edge(A, B, 2);
            supportOp(B, "op");

            ConversionPath path = router.resolve(A, "op");

            assertEquals(List.of(cheap), path.getEdges());
            assertEquals(2, path.getTotalCost());
        }

        @Test
        @DisplayName("native support returns the empty path regardless of edges")
        void nativeSupport() throws Exception {
            edge(A, B, 0);
            supportOp(A, "op");
            supportOp(B, "op");

            ConversionPath path = router.resolve(A, "op");

            assertTrue(path.isEmpty());
            assertEquals(0, path.getTotalCost());
            assertSame(A, path.getDestination());
        }

        @Test
        @DisplayName("total cost does not overflow on very expensive edges")
        void largeCostsSum() throws Exception {
            edge(A, B, Integer.MAX_VALUE);
            edge(B, C, Integer.MAX_VALUE);
            supportOp(C, "op");

            ConversionPath path = router.resolve(A, "op");

            assertEquals(2L * Integer.MAX_VALUE, path.getTotalCost());
            assertEquals(2, path.size());
        }

        @Test
        @DisplayName("nearest supporting representation wins over a farther one")
        void nearestGoal() throws Exception {
            edge(A, B, 4);
            edge(A, C, 1);
            edge(C, D, 1);
            supportOp(B, "op");
            supportOp(D, "op");

            ConversionPath path = router.resolve(A, "op");

            assertSame(D, path.getDestination());
            assertEquals(2, path.getTotalCost());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("unreachable operation raises UnsupportedImageOperationException")
        void unreachable() {
            edge(A, B, 1);
            supportOp(C, "op");

            UnsupportedImageOperationException e =
                assertThrows(UnsupportedImageOperationException.class, () -> router.resolve(A, "op"));
            assertSame(A, e.getStart());
            assertEquals("op", e.getOperation());
        }

        @Test
        @DisplayName("edges only go forward")
        void directedEdges() {
            edge(B, A, 1);
            supportOp(B, "op");

            assertThrows(UnsupportedImageOperationException.class, () -> router.resolve(A, "op"));
        }

        @Test
        @DisplayName("unknown start representation is unsupported, not an error")
        void unknownStart() {
            supportOp(B, "op");
            Representation<String> stranger = Representation.of("stranger", String.class);

            assertThrows(UnsupportedImageOperationException.class, () -> router.resolve(stranger, "op"));
        }

        @Test
        @DisplayName("unsupported results are not cached")
        void noNegativeCaching() throws Exception {
            supportOp(B, "op");
            assertThrows(UnsupportedImageOperationException.class, () -> router.resolve(A, "op"));
            assertEquals(0, router.getCachedRouteCount());

            edge(A, B, 1);
            assertEquals(1, router.resolve(A, "op").size());
        }
    }

    @Nested
    @DisplayName("Determinism and caching")
    class DeterminismAndCaching {

        @Test
        @DisplayName("equal-cost routes resolve to the first registered")
        void tieBreakByRegistrationOrder() throws Exception {
            ConverterEntry<String, String> ab = edge(A, B, 1);
            edge(A, C, 1);
            ConverterEntry<String, String> bd = edge(B, D, 1);
            edge(C, D, 1);
            supportOp(D, "op");

            for (int i = 0; i < 5; i++) {
                assertEquals(List.of(ab, bd), new Router(registry, false).resolve(A, "op").getEdges());
            }
        }

        @Test
        @DisplayName("equal-cost parallel edges resolve to the first registered")
        void tieBreakParallel() throws Exception {
            ConverterEntry<String, String> first = edge(A, B, 2);
            edge(A, B, 2);
            supportOp(B, "op");

            assertSame(first, router.resolve(A, "op").getEdges().get(0));
        }

        @Test
        @DisplayName("routes are cached until the registry changes")
        void cacheInvalidation() throws Exception {
            edge(A, B, 3);
            supportOp(B, "op");

            assertEquals(3, router.resolve(A, "op").getTotalCost());
            assertEquals(3, router.resolve(A, "op").getTotalCost());
            assertEquals(1, router.getCachedRouteCount());

            edge(A, C, 1);
            edge(C, B, 1);

            assertEquals(2, router.resolve(A, "op").getTotalCost());
        }

        @Test
        @DisplayName("disabled cache stores nothing")
        void cacheDisabled() throws Exception {
            Router uncached = new Router(registry, false);
            edge(A, B, 1);
            supportOp(B, "op");

            uncached.resolve(A, "op");

            assertEquals(0, uncached.getCachedRouteCount());
        }
    }

    @Nested
    @DisplayName("Targets and reachability")
    class Targets {

        @Test
        @DisplayName("resolveTo finds the cheapest path to a representation")
        void resolveTo() throws Exception {
            edge(A, B, 1);
            edge(B, C, 1);
            edge(A, C, 5);

            ConversionPath path = router.resolveTo(A, C);

            assertEquals(2, path.getTotalCost());
            assertSame(C, path.getDestination());
            assertTrue(router.resolveTo(A, A).isEmpty());
        }

        @Test
        @DisplayName("resolveTo an unreachable target raises NoConversionPathException")
        void resolveToUnreachable() {
            edge(A, B, 1);
            edge(C, D, 1);

            NoConversionPathException e =
                assertThrows(NoConversionPathException.class, () -> router.resolveTo(A, D));
            assertSame(D, e.getTarget());
            assertSame(A, e.getStart());
        }

        @Test
        @DisplayName("availableOperations includes everything reachable")
        void availableOperations() {
            edge(A, B, 1);
            edge(B, C, 1);
            supportOp(A, "inspect");
            supportOp(C, "resize");
            supportOp(D, "unreachable");

            assertEquals(Set.of("inspect", "resize"), router.availableOperations(A));
            assertEquals(Set.of("resize"), router.availableOperations(B));
        }
    }

    @Nested
    @DisplayName("Optimality against brute force")
    class BruteForce {

        private static final int NODES = 6;
        private static final int GRAPHS = 200;

        @Test
        @DisplayName("resolve matches exhaustive search on random graphs")
        void matchesExhaustiveSearch() throws Exception {
            Random random = new Random(20240611L);
            for (int g = 0; g < GRAPHS; g++) {
                CapabilityRegistry graphRegistry = new CapabilityRegistry();
                List<Representation<Integer>> nodes = new ArrayList<>();
                for (int i = 0; i < NODES; i++) {
                    nodes.add(Representation.of("n" + i, Integer.class));
                }
                for (Representation<Integer> node : nodes) {
                    if (random.nextInt(4) == 0) {
                        graphRegistry.registerOperation(node, "op", ArgumentShape.none(), (value, args) -> value);
                    }
                }
                int edgeCount = random.nextInt(NODES * 2);
                for (int e = 0; e < edgeCount; e++) {
                    int from = random.nextInt(NODES);
                    int to = random.nextInt(NODES);
                    if (from == to) continue;
                    graphRegistry.registerConverter(nodes.get(from), nodes.get(to), random.nextInt(10),
                        value -> value + 1);
                }

                Router graphRouter = new Router(graphRegistry);
                CapabilityGraph graph = graphRegistry.getGraph();
                for (Representation<Integer> start : nodes) {
                    long best = cheapest(graph, start, new HashSet<>(), 0);
                    if (best == Long.MAX_VALUE) {
                        assertThrows(UnsupportedImageOperationException.class,
                            () -> graphRouter.resolve(start, "op"), "graph " + g + " from " + start);
                        continue;
                    }
                    ConversionPath path = graphRouter.resolve(start, "op");
                    assertEquals(best, path.getTotalCost(), "graph " + g + " from " + start);
                    assertTrue(graph.supports(path.getDestination(), "op"));
                    assertEquals(path.getEdges().stream().mapToLong(ConverterEntry::getCost).sum(),
                        path.getTotalCost());
                }
            }
        }

        // Every simple path from node; minimum cost to any node supporting "op"
        private long cheapest(CapabilityGraph graph, Representation<?> node, Set<Representation<?>> visited,
                              long cost) {
            if (graph.supports(node, "op")) {
                return cost;
            }
            visited.add(node);
            long best = Long.MAX_VALUE;
            for (ConverterEntry<?, ?> edge : graph.edgesFrom(node)) {
                if (!visited.contains(edge.getTarget())) {
                    best = Math.min(best, cheapest(graph, edge.getTarget(), visited, cost + edge.getCost()));
                }
            }
            visited.remove(node);
            return best;
        }
    }
}
