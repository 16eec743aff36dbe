package io.lighting.ember.query;

import java.util.Objects;
import java.util.Optional;

/**
 * 查询参数的标量值。
 * <p>
 * 分为非空变体（{@link FloatValue}、{@link IntValue}、{@link TextValue}）与可空变体
 * （{@link NullFloat}、{@link NullInt}、{@link NullText}）。查询构建器只负责传递这些值，
 * 不会检查其内容。
 */
public sealed interface Scalar
    permits Scalar.FloatValue, Scalar.IntValue, Scalar.TextValue,
    Scalar.NullFloat, Scalar.NullInt, Scalar.NullText {

    /**
     * 原始 Java 值，可空变体可能返回 null。
     */
    Object raw();

    /**
     * 转为非空形式；可空变体没有值时返回 empty。
     */
    Optional<Scalar> toOptional();

    /**
     * SQL 字面量形式，仅用于日志展示。
     */
    String sqlLiteral();

    default boolean isNull() {
        return raw() == null;
    }

    static Scalar of(Object value) {
        if (value instanceof Scalar scalar) {
            return scalar;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new IntValue(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return new FloatValue(((Number) value).doubleValue());
        }
        if (value instanceof CharSequence text) {
            return new TextValue(text.toString());
        }
        throw new IllegalArgumentException(
            "Unsupported scalar type: " + (value == null ? "null" : value.getClass().getName())
        );
    }

    /**
     * 判断 {@link #of(Object)} 能否接受该类型的值（含基本类型）。
     */
    static boolean supports(Class<?> type) {
        if (type == null) {
            return false;
        }
        if (type.isPrimitive()) {
            return type == long.class || type == int.class || type == short.class || type == byte.class
                || type == double.class || type == float.class;
        }
        return type == Long.class || type == Integer.class || type == Short.class || type == Byte.class
            || type == Double.class || type == Float.class
            || CharSequence.class.isAssignableFrom(type) || Scalar.class.isAssignableFrom(type);
    }

    static Scalar of(long value) {
        return new IntValue(value);
    }

    static Scalar of(double value) {
        return new FloatValue(value);
    }

    static Scalar of(String value) {
        return new TextValue(value);
    }

    record FloatValue(double value) implements Scalar {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public Optional<Scalar> toOptional() {
            return Optional.of(this);
        }

        @Override
        public String sqlLiteral() {
            return Double.toString(value);
        }
    }

    record IntValue(long value) implements Scalar {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public Optional<Scalar> toOptional() {
            return Optional.of(this);
        }

        @Override
        public String sqlLiteral() {
            return Long.toString(value);
        }
    }

    record TextValue(String value) implements Scalar {
        public TextValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object raw() {
            return value;
        }

        @Override
        public Optional<Scalar> toOptional() {
            return Optional.of(this);
        }

        @Override
        public String sqlLiteral() {
            return quote(value);
        }
    }

    record NullFloat(Double value) implements Scalar {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public Optional<Scalar> toOptional() {
            return value == null ? Optional.empty() : Optional.of(new FloatValue(value));
        }

        @Override
        public String sqlLiteral() {
            return value == null ? "NULL" : Double.toString(value);
        }
    }

    record NullInt(Long value) implements Scalar {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public Optional<Scalar> toOptional() {
            return value == null ? Optional.empty() : Optional.of(new IntValue(value));
        }

        @Override
        public String sqlLiteral() {
            return value == null ? "NULL" : Long.toString(value);
        }
    }

    record NullText(String value) implements Scalar {
        @Override
        public Object raw() {
            return value;
        }

        @Override
        public Optional<Scalar> toOptional() {
            return value == null ? Optional.empty() : Optional.of(new TextValue(value));
        }

        @Override
        public String sqlLiteral() {
            return value == null ? "NULL" : quote(value);
        }
    }

    private static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }
}
