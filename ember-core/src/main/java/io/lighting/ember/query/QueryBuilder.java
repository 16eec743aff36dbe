package io.lighting.ember.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Query} one WHERE condition at a time.
 * <pre>{@code
 * Query query = QueryBuilder.create()
 *     .col("c1").gt(null)              // no value yet, bind later
 *     .and("c2").eq(Scalar.of("foo"))
 *     .order("c2 DESC, c1")
 *     .limit(4711)
 *     .offset(50)
 *     .build()
 *     .orElseThrow();
 * query.setValue(1, Scalar.of(17));
 * }</pre>
 * Call sequences that make no sense, e.g. {@code create().and("x")} or {@code col("x").col("y")}, never
 * throw. The builder becomes invalid and {@link #build()} returns empty. Conditions the fluent methods
 * cannot express go through {@link #filter(String, Scalar...)}.
 */
public final class QueryBuilder {
    private enum State {
        VALID,
        GOT_COLUMN,
        INVALID
    }

    private final StringBuilder filter;
    private boolean hasFilter;
    private final List<Scalar> values;
    private Integer limit;
    private Integer offset;
    private Order order;
    private State state = State.VALID;

    private QueryBuilder() {
        this.filter = new StringBuilder();
        this.values = new ArrayList<>();
        this.order = Order.DEFAULT;
    }

    QueryBuilder(String filter, List<Scalar> values, Integer limit, Integer offset, Order order) {
        this.filter = new StringBuilder(filter == null ? "" : filter);
        this.hasFilter = filter != null;
        this.values = new ArrayList<>(values);
        this.limit = limit;
        this.offset = offset;
        this.order = Objects.requireNonNull(order, "order");
    }

    public static QueryBuilder create() {
        return new QueryBuilder();
    }

    /**
     * Starts the first condition.
     */
    public QueryBuilder col(String column) {
        if (state != State.VALID || hasFilter || !isColumn(column)) {
            return invalidate();
        }
        filter.append(column);
        hasFilter = true;
        state = State.GOT_COLUMN;
        return this;
    }

    /**
     * Starts a condition AND-ed to the previous ones.
     */
    public QueryBuilder and(String column) {
        return logical(" AND ", column);
    }

    /**
     * Starts a condition OR-ed to the previous ones.
     */
    public QueryBuilder or(String column) {
        return logical(" OR ", column);
    }

    public QueryBuilder eq(Scalar value) {
        return relational("=", value);
    }

    public QueryBuilder ne(Scalar value) {
        return relational("<>", value);
    }

    public QueryBuilder lt(Scalar value) {
        return relational("<", value);
    }

    public QueryBuilder le(Scalar value) {
        return relational("<=", value);
    }

    public QueryBuilder gt(Scalar value) {
        return relational(">", value);
    }

    public QueryBuilder ge(Scalar value) {
        return relational(">=", value);
    }

    /**
     * Adds a raw condition, the body of a WHERE clause without {@code WHERE}. Parameters are written
     * {@code $1, $2, ...} counted from 1 within {@code fragment}.
     * <p>
     * With an existing filter the parameter numbers are raised by the number of values already present
     * and the result is {@code (old) AND new}. {@code values} are appended to the existing ones; a null
     * element is a value to bind later.
     */
    public QueryBuilder filter(String fragment, Scalar... values) {
        return filter(fragment, values == null ? List.of() : Arrays.asList(values));
    }

    public QueryBuilder filter(String fragment, List<Scalar> values) {
        if (state != State.VALID || fragment == null || fragment.isBlank() || values == null) {
            return invalidate();
        }
        String shifted;
        try {
            Placeholders.indices(fragment);
            shifted = Placeholders.shift(fragment, this.values.size());
        } catch (NumberFormatException | ArithmeticException ex) {
            // $n must fit in an int, before and after shifting
            return invalidate();
        }
        if (hasFilter) {
            filter.insert(0, '(').append(") AND ").append(shifted);
        } else {
            filter.append(shifted);
            hasFilter = true;
        }
        this.values.addAll(values);
        return this;
    }

    /**
     * Sets the ORDER BY body, without {@code ORDER BY}. A null or blank body counts as a misused call
     * like any other: the builder becomes invalid instead of throwing here.
     */
    public QueryBuilder order(String body) {
        if (body == null || body.isBlank()) {
            return invalidate();
        }
        this.order = Order.custom(body);
        return this;
    }

    /**
     * Suppresses ORDER BY, including the model default.
     */
    public QueryBuilder noOrder() {
        this.order = Order.NO_ORDER;
        return this;
    }

    public QueryBuilder defaultOrder() {
        this.order = Order.DEFAULT;
        return this;
    }

    public QueryBuilder limit(int limit) {
        if (limit < 0) {
            return invalidate();
        }
        this.limit = limit;
        return this;
    }

    public QueryBuilder offset(int offset) {
        if (offset < 0) {
            return invalidate();
        }
        this.offset = offset;
        return this;
    }

    /**
     * Freezes the query. Empty if the call sequence was illegal or a condition lacks its operator. The
     * builder cannot be used after this call.
     */
    public Optional<Query> build() {
        if (state != State.VALID) {
            state = State.INVALID;
            return Optional.empty();
        }
        state = State.INVALID;
        return Optional.of(new Query(hasFilter ? filter.toString() : null, values, limit, offset, order));
    }

    public boolean isValid() {
        return state != State.INVALID;
    }

    private QueryBuilder logical(String operator, String column) {
        if (state != State.VALID || !hasFilter || !isColumn(column)) {
            return invalidate();
        }
        filter.append(operator).append(column);
        state = State.GOT_COLUMN;
        return this;
    }

    private QueryBuilder relational(String operator, Scalar value) {
        if (state != State.GOT_COLUMN) {
            return invalidate();
        }
        values.add(value);
        filter.append(' ').append(operator).append(" $").append(values.size());
        state = State.VALID;
        return this;
    }

    private QueryBuilder invalidate() {
        state = State.INVALID;
        return this;
    }

    private static boolean isColumn(String column) {
        return column != null && !column.isBlank();
    }
}
