package io.lighting.ember.meta;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 字段到列的映射。
 * <p>
 * 只有标注了 {@code @Column}、{@link Id}、{@link Unique} 或 {@link OrderBy} 的字段才参与映射；
 * 未给出列名时使用字段名。
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Column {
    /**
     * 数据库列名，为空时使用字段名。
     */
    String name() default "";
}
