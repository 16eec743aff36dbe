package io.lighting.ember.form;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 由扁平表单参数重建出的嵌套结构。
 * <p>
 * 三种节点：{@link Leaf}（字符串值）、{@link ArrayNode}（有序列表）、{@link MapNode}（键到子节点的映射）。
 * 节点在构造时拷贝为不可变集合，解析完成后整棵树只读，可在线程间共享。
 */
public sealed interface FormData permits FormData.Leaf, FormData.ArrayNode, FormData.MapNode {

    /**
     * 转为 Jackson 的 JsonNode，所有叶子保持字符串。
     */
    default JsonNode toJson() {
        return FormJson.toJsonNode(this);
    }

    record Leaf(String value) implements FormData {
        public Leaf {
            Objects.requireNonNull(value, "value");
        }
    }

    record ArrayNode(List<FormData> items) implements FormData {
        public ArrayNode {
            items = List.copyOf(items);
        }

        public FormData get(int index) {
            return items.get(index);
        }

        public int size() {
            return items.size();
        }
    }

    record MapNode(Map<String, FormData> entries) implements FormData {
        public MapNode {
            Objects.requireNonNull(entries, "entries");
            Map<String, FormData> copy = new LinkedHashMap<>();
            for (Map.Entry<String, FormData> entry : entries.entrySet()) {
                copy.put(
                    Objects.requireNonNull(entry.getKey(), "key"),
                    Objects.requireNonNull(entry.getValue(), "value")
                );
            }
            entries = Collections.unmodifiableMap(copy);
        }

        public Optional<FormData> get(String key) {
            return Optional.ofNullable(entries.get(key));
        }

        public boolean contains(String key) {
            return entries.containsKey(key);
        }
    }
}
