package io.lighting.ember.meta;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 唯一约束分组。
 * <p>
 * 相同 label 的字段组合在一起应当唯一，例如两个字段都标注 {@code @Unique("un1")} 对应
 * {@code UNIQUE(col_a, col_b)}。主键无需标注。
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Unique {
    String value();
}
