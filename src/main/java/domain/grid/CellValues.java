package domain.grid;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Coercion between raw cell values and typed values.
 *
 * <p>Supported targets: String, Integer/int, Long/long, Double/double, Float/float,
 * Boolean/boolean. A value that cannot be coerced yields the type default
 * ({@link #defaultValue(Class)}), never an exception, so bulk reads tolerate
 * half-filled sheets.</p>
 */
public final class CellValues {

    private CellValues() {
    }

    /**
     * Coerced value, or null when {@code raw} is empty or not convertible.
     * Use {@link #coerceOrDefault} when a primitive default is wanted instead.
     */
    @SuppressWarnings("unchecked")
    public static <T> T coerce(Object raw, Class<T> type) {
        if (raw == null || type == null) return null;
        Class<?> t = wrap(type);

        if (t == String.class) return (T) asString(raw);
        if (t == Double.class) {
            Double d = asDouble(raw);
            return (T) d;
        }
        if (t == Float.class) {
            Double d = asDouble(raw);
            return d == null ? null : (T) Float.valueOf(d.floatValue());
        }
        if (t == Integer.class) {
            Double d = asDouble(raw);
            if (d == null || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) return null;
            return (T) Integer.valueOf((int) Math.rint(d));
        }
        if (t == Long.class) {
            Double d = asDouble(raw);
            if (d == null || d > Long.MAX_VALUE || d < Long.MIN_VALUE) return null;
            return (T) Long.valueOf((long) Math.rint(d));
        }
        if (t == Boolean.class) return (T) asBoolean(raw);
        if (t.isInstance(raw)) return (T) raw;
        return null;
    }

    public static <T> T coerceOrDefault(Object raw, Class<T> type) {
        T v = coerce(raw, type);
        return v != null ? v : defaultValue(type);
    }

    /** Zero value of the type: 0 / 0.0 / false for numbers and booleans, null otherwise. */
    @SuppressWarnings("unchecked")
    public static <T> T defaultValue(Class<T> type) {
        if (type == null) return null;
        Class<?> t = wrap(type);
        if (t == Integer.class) return (T) Integer.valueOf(0);
        if (t == Long.class) return (T) Long.valueOf(0L);
        if (t == Double.class) return (T) Double.valueOf(0d);
        if (t == Float.class) return (T) Float.valueOf(0f);
        if (t == Boolean.class) return (T) Boolean.FALSE;
        return null;
    }

    /**
     * Case-sensitive match of {@code text} (trimmed) against enum member names.
     * Returns null when blank or unknown.
     */
    public static <E extends Enum<E>> E parseEnum(String text, Class<E> enumType) {
        if (text == null || text.isBlank()) return null;
        String name = text.trim();
        for (E e : enumType.getEnumConstants()) {
            if (e.name().equals(name)) return e;
        }
        return null;
    }

    /** Zero member of an enum (its first constant), or null if it has none. */
    public static <E extends Enum<E>> E zeroMember(Class<E> enumType) {
        E[] all = enumType.getEnumConstants();
        return all.length > 0 ? all[0] : null;
    }

    /**
     * Raw representation stored for a typed write: numbers as Double, booleans as Boolean,
     * enums by member name, anything else via toString. Null clears the cell.
     */
    public static Object toRaw(Object value) {
        if (value == null) return null;
        if (value instanceof Number) return ((Number) value).doubleValue();
        if (value instanceof Boolean) return value;
        if (value instanceof Enum<?>) return ((Enum<?>) value).name();
        if (value instanceof CharSequence) return value.toString();
        return value.toString();
    }

    static Class<?> wrap(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == boolean.class) return Boolean.class;
        return type;
    }

    private static String asString(Object raw) {
        if (raw instanceof String) return (String) raw;
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return String.valueOf(d);
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(raw);
    }

    private static Double asDouble(Object raw) {
        if (raw instanceof Number) return ((Number) raw).doubleValue();
        if (raw instanceof Boolean) return ((Boolean) raw) ? 1d : 0d;
        if (raw instanceof String) {
            String s = ((String) raw).trim();
            if (s.isEmpty()) return null;
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Boolean asBoolean(Object raw) {
        if (raw instanceof Boolean) return (Boolean) raw;
        if (raw instanceof Number) return ((Number) raw).doubleValue() != 0d;
        if (raw instanceof String) {
            String s = ((String) raw).trim().toLowerCase(Locale.ROOT);
            if (s.equals("true")) return Boolean.TRUE;
            if (s.equals("false")) return Boolean.FALSE;
        }
        return null;
    }
}
