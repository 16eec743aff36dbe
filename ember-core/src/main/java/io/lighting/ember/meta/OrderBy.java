package io.lighting.ember.meta;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 模型的默认排序列。多个字段按 {@link #priority()} 升序组合。
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface OrderBy {
    int priority() default 0;

    Direction direction() default Direction.ASC;

    enum Direction {
        ASC,
        DESC
    }
}
