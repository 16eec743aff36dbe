package io.lighting.ember.sql;

import io.lighting.ember.query.Scalar;
import java.sql.Types;
import java.util.Objects;

/**
 * JDBC 绑定参数，jdbcType 取自 {@link Types}。
 */
public sealed interface Bind permits Bind.Value, Bind.NullValue {
    int jdbcType();

    static Bind of(Scalar scalar) {
        Objects.requireNonNull(scalar, "scalar");
        int jdbcType = jdbcTypeOf(scalar);
        Object raw = scalar.raw();
        return raw == null ? new NullValue(jdbcType) : new Value(raw, jdbcType);
    }

    private static int jdbcTypeOf(Scalar scalar) {
        if (scalar instanceof Scalar.FloatValue || scalar instanceof Scalar.NullFloat) {
            return Types.DOUBLE;
        }
        if (scalar instanceof Scalar.IntValue || scalar instanceof Scalar.NullInt) {
            return Types.BIGINT;
        }
        return Types.VARCHAR;
    }

    record Value(Object value, int jdbcType) implements Bind {
        public Value {
            Objects.requireNonNull(value, "value");
        }
    }

    record NullValue(int jdbcType) implements Bind {
    }
}
