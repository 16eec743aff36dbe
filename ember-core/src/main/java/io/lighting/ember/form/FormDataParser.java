package io.lighting.ember.form;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 将扁平的 (参数名, 参数值) 列表解析为嵌套的 {@link FormData}，参数名使用 PHP 风格的方括号：
 * <pre>
 * smpl=1&amp;arr[]=2&amp;arr[]=3&amp;map[a]=4&amp;map[b]=5&amp;deep[c][]=6&amp;deep[c][]=7&amp;deep[d]=8&amp;mtrx[][]=9
 * -&gt; {"smpl": "1", "arr": ["2", "3"], "map": {"a": "4", "b": "5"},
 *     "deep": {"c": ["6", "7"], "d": "8"}, "mtrx": [["9"]]}
 * </pre>
 * 规则：
 * <ul>
 *   <li>空方括号 {@code []} 表示向数组追加；非空方括号表示映射的键。</li>
 *   <li>多维数组总是追加到当前层最后一个子数组，{@code m[][]=1&amp;m[][]=2} 得到 {@code [["1","2"]]}。</li>
 *   <li>同一个终端键重复出现，或同一节点既作数组又作映射，均抛出 {@link FormDataException}，
 *       整次解析作废，不返回部分结果。</li>
 * </ul>
 * 解析器本身不可变，可在线程间共享。
 */
public final class FormDataParser {
    private static final Logger LOG = LoggerFactory.getLogger(FormDataParser.class);

    public static final int DEFAULT_MAX_PARAMETERS = 1000;
    public static final int DEFAULT_MAX_DEPTH = 32;

    private static final FormDataParser DEFAULT = builder().build();

    private final int maxParameters;
    private final int maxDepth;

    private FormDataParser(Builder builder) {
        this.maxParameters = builder.maxParameters;
        this.maxDepth = builder.maxDepth;
    }

    public static FormDataParser defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int maxParameters() {
        return maxParameters;
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * 解析已 URL 解码的参数列表，同名参数可出现多次。
     *
     * @param pairs 参数名与参数值
     * @return 根节点，总是 {@link FormData.MapNode}
     * @throws FormDataException 参数结构冲突或超出限制
     */
    public FormData.MapNode parse(List<? extends Map.Entry<String, String>> pairs) {
        Objects.requireNonNull(pairs, "pairs");
        if (pairs.size() > maxParameters) {
            throw reject(new FormDataException(
                "Too many form parameters: " + pairs.size() + " > " + maxParameters,
                null,
                null
            ));
        }
        Map<String, Object> root = new LinkedHashMap<>();
        for (Map.Entry<String, String> pair : pairs) {
            String rawKey = Objects.requireNonNull(pair.getKey(), "key");
            String value = Objects.requireNonNull(pair.getValue(), "value");
            FormKey key = FormKey.parse(rawKey);
            if (key.depth() > maxDepth) {
                throw reject(new FormDataException(
                    "Form parameter nested too deep: " + key.depth() + " > " + maxDepth,
                    key.head(),
                    rawKey
                ));
            }
            try {
                insert(root, key.head(), key.head(), key, 0, value);
            } catch (FormDataException ex) {
                throw reject(ex);
            }
        }
        return (FormData.MapNode) freeze(root);
    }

    // Map node: insert at name, or descend into the array/map stored there.
    private void insert(Map<String, Object> map, String name, String path, FormKey key, int next, String value) {
        List<String> segments = key.segments();
        if (next == segments.size()) {
            if (map.containsKey(name)) {
                throw new FormDataException("\"" + path + "\" is already set", path, key.raw());
            }
            map.put(name, value);
            return;
        }
        String segment = segments.get(next);
        Object existing = map.get(name);
        if (segment.isEmpty()) {
            if (existing == null) {
                existing = new ArrayList<>();
                map.put(name, existing);
            } else if (!(existing instanceof List<?>)) {
                throw new FormDataException("\"" + path + "\" is not an array", path, key.raw());
            }
            push(asList(existing), path, key, next + 1, value);
        } else {
            if (existing == null) {
                existing = new LinkedHashMap<>();
                map.put(name, existing);
            } else if (!(existing instanceof Map<?, ?>)) {
                throw new FormDataException("\"" + path + "\" is not a map", path, key.raw());
            }
            insert(asMap(existing), segment, path + "[" + segment + "]", key, next + 1, value);
        }
    }

    // Array node: append, or descend into the last element.
    private void push(List<Object> array, String path, FormKey key, int next, String value) {
        List<String> segments = key.segments();
        if (next == segments.size()) {
            array.add(value);
            return;
        }
        String segment = segments.get(next);
        String lastPath = path + "[]";
        if (segment.isEmpty()) {
            if (array.isEmpty()) {
                array.add(new ArrayList<>());
            }
            Object last = array.get(array.size() - 1);
            if (!(last instanceof List<?>)) {
                throw new FormDataException("\"" + lastPath + "\" is not an array", lastPath, key.raw());
            }
            push(asList(last), lastPath, key, next + 1, value);
        } else {
            if (array.isEmpty()) {
                array.add(new LinkedHashMap<>());
            }
            Object last = array.get(array.size() - 1);
            if (!(last instanceof Map<?, ?>)) {
                throw new FormDataException("\"" + lastPath + "\" is not a map", lastPath, key.raw());
            }
            insert(asMap(last), segment, lastPath + "[" + segment + "]", key, next + 1, value);
        }
    }

    private static FormData freeze(Object node) {
        if (node instanceof String text) {
            return new FormData.Leaf(text);
        }
        if (node instanceof List<?> list) {
            List<FormData> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(freeze(item));
            }
            return new FormData.ArrayNode(items);
        }
        Map<String, FormData> entries = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : asMap(node).entrySet()) {
            entries.put(entry.getKey(), freeze(entry.getValue()));
        }
        return new FormData.MapNode(entries);
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object node) {
        return (List<Object>) node;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object node) {
        return (Map<String, Object>) node;
    }

    private static FormDataException reject(FormDataException ex) {
        LOG.debug("Rejected form parameters at {}: {}", ex.rawKey(), ex.getMessage());
        return ex;
    }

    public static final class Builder {
        private int maxParameters = DEFAULT_MAX_PARAMETERS;
        private int maxDepth = DEFAULT_MAX_DEPTH;

        private Builder() {
        }

        public Builder maxParameters(int maxParameters) {
            if (maxParameters < 1) {
                throw new IllegalArgumentException("maxParameters must be >= 1");
            }
            this.maxParameters = maxParameters;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 0) {
                throw new IllegalArgumentException("maxDepth must be >= 0");
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public FormDataParser build() {
            return new FormDataParser(this);
        }
    }
}
