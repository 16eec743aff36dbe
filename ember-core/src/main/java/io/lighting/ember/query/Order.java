package io.lighting.ember.query;

import java.util.Objects;

/**
 * ORDER BY 规格。
 * <p>
 * {@link Default} 表示由消费方（通常是模型的默认排序）决定；{@link NoOrder} 表示显式不排序。
 */
public sealed interface Order permits Order.Custom, Order.Default, Order.NoOrder {
    Order DEFAULT = new Default();
    Order NO_ORDER = new NoOrder();

    static Order custom(String body) {
        return new Custom(body);
    }

    /**
     * ORDER BY 的主体，不含 "ORDER BY"。
     */
    record Custom(String body) implements Order {
        public Custom {
            Objects.requireNonNull(body, "body");
            if (body.isBlank()) {
                throw new IllegalArgumentException("Order body must not be blank");
            }
        }
    }

    record Default() implements Order {
    }

    record NoOrder() implements Order {
    }
}
