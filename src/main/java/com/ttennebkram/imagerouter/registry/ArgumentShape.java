package com.ttennebkram.imagerouter.registry;

import com.ttennebkram.imagerouter.exceptions.BadArgumentException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The argument list an operation accepts: required positional arguments
 * followed by optional trailing ones.
 *
 * Example usage:
 * <pre>
 * ArgumentShape.of(Integer.class, Integer.class)                        // resize(width, height)
 * ArgumentShape.of(OutputStream.class).withOptional(Integer.class)      // save_as_jpeg(out [, quality])
 * </pre>
 */
public final class ArgumentShape {

    private static final ArgumentShape NONE = new ArgumentShape(List.of(), List.of());

    private final List<Class<?>> required;
    private final List<Class<?>> optional;

    private ArgumentShape(List<Class<?>> required, List<Class<?>> optional) {
        this.required = required;
        this.optional = optional;
    }

    /**
     * Shape for operations that take no arguments.
     */
    public static ArgumentShape none() {
        return NONE;
    }

    public static ArgumentShape of(Class<?>... required) {
        return new ArgumentShape(box(required), List.of());
    }

    /**
     * Return a copy of this shape with additional optional trailing arguments.
     */
    public ArgumentShape withOptional(Class<?>... moreOptional) {
        List<Class<?>> combined = new ArrayList<>(optional);
        combined.addAll(box(moreOptional));
        return new ArgumentShape(required, Collections.unmodifiableList(combined));
    }

    public List<Class<?>> getRequired() {
        return required;
    }

    public List<Class<?>> getOptional() {
        return optional;
    }

    /**
     * Check that the given arguments fit this shape.
     *
     * @throws BadArgumentException describing the first mismatch
     */
    public void validate(String operation, Object[] args) throws BadArgumentException {
        int count = args == null ? 0 : args.length;
        int max = required.size() + optional.size();
        if (count < required.size() || count > max) {
            String expected = optional.isEmpty()
                ? String.valueOf(required.size())
                : required.size() + ".." + max;
            throw new BadArgumentException(
                "Operation '" + operation + "' expects " + expected + " argument(s), got " + count);
        }
        for (int i = 0; i < count; i++) {
            Class<?> type = i < required.size() ? required.get(i) : optional.get(i - required.size());
            Object arg = args[i];
            if (arg == null) {
                throw new BadArgumentException(
                    "Operation '" + operation + "' argument " + i + " must not be null");
            }
            if (!type.isInstance(arg)) {
                throw new BadArgumentException(
                    "Operation '" + operation + "' argument " + i + " must be "
                        + type.getSimpleName() + ", got " + arg.getClass().getSimpleName());
            }
        }
    }

    private static List<Class<?>> box(Class<?>[] types) {
        List<Class<?>> result = new ArrayList<>(types.length);
        for (Class<?> type : types) {
            result.add(boxed(type));
        }
        return Collections.unmodifiableList(result);
    }

    private static Class<?> boxed(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == boolean.class) return Boolean.class;
        if (type == double.class) return Double.class;
        if (type == long.class) return Long.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == char.class) return Character.class;
        throw new IllegalArgumentException("Unsupported argument type: " + type);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        List<String> names = new ArrayList<>();
        for (Class<?> type : required) {
            names.add(type.getSimpleName());
        }
        for (Class<?> type : optional) {
            names.add("[" + type.getSimpleName() + "]");
        }
        sb.append(String.join(", ", names));
        return sb.append(")").toString();
    }
}
