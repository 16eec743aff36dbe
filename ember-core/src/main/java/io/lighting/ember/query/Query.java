package io.lighting.ember.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * 可复用的查询描述，由 {@link QueryBuilder#build()} 生成。
 * <p>
 * {@code filter} 是 WHERE 子句的主体（不含 "WHERE"），使用 {@code $1, $2, ...} 作为位置参数，
 * {@code values[i - 1]} 对应 {@code $i}。值为 null 的位置表示"稍后绑定"，消费方在执行前必须校验。
 * <p>
 * 构建后 filter 不再变化；绑定值、limit、offset 可通过 setter 修改，以支持"预备一次，多次绑定"。
 * 本类不是线程安全的，修改需由调用方同步。
 */
public final class Query {
    private final String filter;
    private final List<Scalar> values;
    private Integer limit;
    private Integer offset;
    private final Order order;

    Query(String filter, List<Scalar> values, Integer limit, Integer offset, Order order) {
        this.filter = filter;
        this.values = new ArrayList<>(Objects.requireNonNull(values, "values"));
        this.limit = limit;
        this.offset = offset;
        this.order = Objects.requireNonNull(order, "order");
    }

    /**
     * 以当前查询为起点创建新的构建器，原查询不受影响。
     */
    public QueryBuilder builder() {
        return new QueryBuilder(filter, values, limit, offset, order);
    }

    public Optional<String> filter() {
        return Optional.ofNullable(filter);
    }

    /**
     * 只读视图，未绑定的位置为 null。
     */
    public List<Scalar> values() {
        return Collections.unmodifiableList(values);
    }

    public OptionalInt limit() {
        return limit == null ? OptionalInt.empty() : OptionalInt.of(limit);
    }

    public OptionalInt offset() {
        return offset == null ? OptionalInt.empty() : OptionalInt.of(offset);
    }

    public Order order() {
        return order;
    }

    public Query setLimit(Integer limit) {
        this.limit = requireNonNegative(limit, "limit");
        return this;
    }

    public Query setOffset(Integer offset) {
        this.offset = requireNonNegative(offset, "offset");
        return this;
    }

    /**
     * 设置单个绑定值。
     *
     * @param index 从 1 开始的参数序号
     * @param value 新值
     * @throws IndexOutOfBoundsException 序号超出已有参数范围
     */
    public Query setValue(int index, Scalar value) {
        Objects.requireNonNull(value, "value");
        if (index < 1 || index > values.size()) {
            throw new IndexOutOfBoundsException(
                "Query value index " + index + " out of range 1.." + values.size()
            );
        }
        values.set(index - 1, value);
        return this;
    }

    /**
     * 按顺序替换全部绑定值。
     */
    public Query setValues(Scalar... values) {
        Objects.requireNonNull(values, "values");
        return setValues(Arrays.asList(values));
    }

    public Query setValues(List<Scalar> values) {
        Objects.requireNonNull(values, "values");
        List<Scalar> replaced = new ArrayList<>(values.size());
        for (Scalar value : values) {
            replaced.add(Objects.requireNonNull(value, "value"));
        }
        this.values.clear();
        this.values.addAll(replaced);
        return this;
    }

    public int placeholderCount() {
        Set<Integer> distinct = new LinkedHashSet<>(Placeholders.indices(filter));
        return distinct.size();
    }

    /**
     * 尚未绑定的参数序号（从 1 开始）。
     */
    public List<Integer> missingValues() {
        List<Integer> missing = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                missing.add(i + 1);
            }
        }
        return missing;
    }

    private static Integer requireNonNegative(Integer value, String name) {
        if (value != null && value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Query query)) {
            return false;
        }
        return Objects.equals(filter, query.filter)
            && values.equals(query.values)
            && Objects.equals(limit, query.limit)
            && Objects.equals(offset, query.offset)
            && order.equals(query.order);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filter, values, limit, offset, order);
    }

    @Override
    public String toString() {
        return "Query{filter=" + filter
            + ", values=" + values
            + ", limit=" + limit
            + ", offset=" + offset
            + ", order=" + order
            + '}';
    }
}
