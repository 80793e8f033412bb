package com.ttennebkram.imagerouter.processing;

import com.ttennebkram.imagerouter.exceptions.BadArgumentException;
import com.ttennebkram.imagerouter.exceptions.ConversionException;
import com.ttennebkram.imagerouter.exceptions.OperationException;
import com.ttennebkram.imagerouter.exceptions.UnsupportedImageOperationException;
import com.ttennebkram.imagerouter.model.ImageValue;
import com.ttennebkram.imagerouter.model.Representation;
import com.ttennebkram.imagerouter.registry.ArgumentShape;
import com.ttennebkram.imagerouter.registry.CapabilityRegistry;
import com.ttennebkram.imagerouter.registry.ConverterEntry;
import com.ttennebkram.imagerouter.routing.Router;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Session}.
 */
class SessionTest {

    private static final List<String> RELEASED = new ArrayList<>();

    private static final Representation<String> A = Representation.of("a", String.class);
    private static final Representation<String> B = Representation.of("b", String.class);
    private static final Representation<String> C = Representation.of("c", String.class);
    private static final Representation<String> NATIVE = Representation.of("native", String.class, RELEASED::add);

    private CapabilityRegistry registry;
    private Router router;

    @BeforeEach
    void setUp() {
        RELEASED.clear();
        registry = new CapabilityRegistry();
        router = new Router(registry);
    }

    private Session open(Representation<String> representation, String value) {
        return new Session(router, ImageValue.of(representation, value));
    }

    @Nested
    @DisplayName("Invoking operations")
    class Invoking {

        @Test
        @DisplayName("native operation runs without conversion")
        void nativeOperation() throws Exception {
            registry.registerOperation(A, "len", ArgumentShape.none(), (value, args) -> value.length());
            Session session = open(A, "abcd");

            assertEquals(4, session.invoke("len"));
            assertSame(A, session.getRepresentation());
        }

        @Test
        @DisplayName("conversions run in order and the session ends in the target representation")
        void convertsAlongPath() throws Exception {
            registry.registerConverter(A, B, 1, value -> value + ">b");
            registry.registerConverter(B, C, 1, value -> value + ">c");
            registry.registerOperation(C, "show", ArgumentShape.none(), (value, args) -> "[" + value + "]");
            Session session = open(A, "a");

            assertEquals("[a>b>c]", session.invoke("show"));
            assertSame(C, session.getRepresentation());
            assertEquals("a>b>c", session.getValue(C));
        }

        @Test
        @DisplayName("an ImageValue result becomes a new session, other results are terminal")
        void sessionVersusTerminal() throws Exception {
            registry.registerOperation(A, "grow", ArgumentShape.none(),
                (value, args) -> ImageValue.of(B, value + "!"));
            registry.registerOperation(A, "len", ArgumentShape.none(), (value, args) -> value.length());
            Session session = open(A, "ab");

            Object grown = session.invoke("grow");
            Session next = assertInstanceOf(Session.class, grown);
            assertSame(B, next.getRepresentation());
            assertEquals("ab!", next.getValue());
            assertSame(A, session.getRepresentation());

            assertEquals(2, session.invokeFor(Integer.class, "len"));
        }

        @Test
        @DisplayName("arguments reach the operation")
        void argumentsPassed() throws Exception {
            registry.registerOperation(A, "repeat", ArgumentShape.of(int.class),
                (value, args) -> value.repeat((Integer) args[0]));

            assertEquals("xxx", open(A, "x").invoke("repeat", 3));
        }

        @Test
        @DisplayName("typed invocation rejects a result of the wrong type")
        void invokeForWrongType() {
            registry.registerOperation(A, "len", ArgumentShape.none(), (value, args) -> value.length());
            Session session = open(A, "ab");

            assertThrows(OperationException.class, () -> session.invokeFor(String.class, "len"));
            assertThrows(OperationException.class, () -> session.invokeForSession("len"));
        }

        @Test
        @DisplayName("converting A to B and back returns to A")
        void roundTripIdempotence() throws Exception {
            registry.registerConverter(A, B, 1, value -> value.toUpperCase());
            registry.registerConverter(B, A, 1, value -> value.toLowerCase());
            Session session = open(A, "img");

            assertEquals("IMG", session.convertTo(B));
            assertEquals("img", session.convertTo(A));
            assertSame(A, session.getRepresentation());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("unsupported operation leaves the session untouched")
        void unsupported() {
            registry.registerConverter(A, B, 1, value -> value);
            registry.registerOperation(C, "op", ArgumentShape.none(), (value, args) -> value);
            Session session = open(A, "a");

            UnsupportedImageOperationException e =
                assertThrows(UnsupportedImageOperationException.class, () -> session.invoke("op"));
            assertSame(A, e.getStart());
            assertSame(A, session.getRepresentation());
            assertEquals("a", session.getValue());
        }

        @Test
        @DisplayName("failed converter leaves the session at the last completed step")
        void conversionFailure() {
            registry.registerConverter(A, B, 1, value -> value + ">b");
            ConverterEntry<String, String> broken = registry.registerConverter(B, C, 1, value -> {
                throw new ConversionException("decoder crashed");
            });
            registry.registerOperation(C, "op", ArgumentShape.none(), (value, args) -> value);
            Session session = open(A, "a");

            ConversionException e = assertThrows(ConversionException.class, () -> session.invoke("op"));

            assertSame(broken, e.getEdge());
            assertSame(session, e.getSession());
            assertSame(B, session.getRepresentation());
            assertEquals("a>b", session.getValue());
            assertTrue(e.getMessage().contains("decoder crashed"));
        }

        @Test
        @DisplayName("runtime exceptions from converters are wrapped")
        void converterRuntimeException() {
            registry.registerConverter(A, B, 1, value -> {
                throw new IllegalStateException("out of memory");
            });
            registry.registerOperation(B, "op", ArgumentShape.none(), (value, args) -> value);
            Session session = open(A, "a");

            ConversionException e = assertThrows(ConversionException.class, () -> session.invoke("op"));
            assertInstanceOf(IllegalStateException.class, e.getCause());
            assertSame(A, session.getRepresentation());
        }

        @Test
        @DisplayName("converter returning null is a conversion failure")
        void converterReturnsNull() {
            registry.registerConverter(A, B, 1, value -> null);
            registry.registerOperation(B, "op", ArgumentShape.none(), (value, args) -> value);
            Session session = open(A, "a");

            assertThrows(ConversionException.class, () -> session.invoke("op"));
            assertSame(A, session.getRepresentation());
        }

        @Test
        @DisplayName("bad arguments are rejected before any conversion")
        void badArgumentsBeforeConversion() {
            AtomicInteger conversions = new AtomicInteger();
            registry.registerConverter(A, B, 1, value -> {
                conversions.incrementAndGet();
                return value;
            });
            registry.registerOperation(B, "resize", ArgumentShape.of(int.class, int.class), (value, args) -> value);
            Session session = open(A, "a");

            assertThrows(BadArgumentException.class, () -> session.invoke("resize", "wide", 10));
            assertThrows(BadArgumentException.class, () -> session.invoke("resize", 10));
            assertEquals(0, conversions.get());
            assertSame(A, session.getRepresentation());
        }

        @Test
        @DisplayName("operation failures carry the operation context")
        void operationFailure() {
            registry.registerOperation(A, "explode", ArgumentShape.none(), (value, args) -> {
                throw new ArithmeticException("divide by zero");
            });
            Session session = open(A, "a");

            OperationException e = assertThrows(OperationException.class, () -> session.invoke("explode"));
            assertEquals("explode", e.getOperation());
            assertSame(A, e.getRepresentation());
            assertSame(session, e.getSession());
            assertInstanceOf(ArithmeticException.class, e.getCause());
        }
    }

    @Nested
    @DisplayName("Ownership")
    class Ownership {

        @Test
        @DisplayName("replaced intermediate values are released")
        void intermediatesReleased() throws Exception {
            registry.registerConverter(A, NATIVE, 1, value -> value + ">native");
            registry.registerConverter(NATIVE, C, 1, value -> value + ">c");
            registry.registerOperation(C, "op", ArgumentShape.none(), (value, args) -> value);
            Session session = open(A, "a");

            session.invoke("op");

            assertEquals(List.of("a>native"), RELEASED);
        }

        @Test
        @DisplayName("release frees the held value")
        void releaseHeldValue() throws Exception {
            registry.registerConverter(A, NATIVE, 1, value -> value + ">native");
            Session session = open(A, "a");
            session.convertTo(NATIVE);

            session.release();

            assertEquals(List.of("a>native"), RELEASED);
            assertNull(session.getValue());
        }

        @Test
        @DisplayName("getValue with the wrong representation fails")
        void getValueMismatch() {
            Session session = open(A, "a");

            assertThrows(IllegalStateException.class, () -> session.getValue(B));
        }

        @Test
        @DisplayName("availableOperations reflects conversions")
        void availableOperations() {
            registry.registerConverter(A, B, 1, value -> value);
            registry.registerOperation(B, "op", ArgumentShape.none(), (value, args) -> value);

            assertTrue(open(A, "a").availableOperations().contains("op"));
        }
    }
}
