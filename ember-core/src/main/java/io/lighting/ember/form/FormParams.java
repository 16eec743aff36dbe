package io.lighting.ember.form;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 请求参数（URL 查询串或 form-urlencoded 请求体），保留原始顺序，同名参数可重复。
 * <p>
 * 简单参数用 {@link #first(String)} / {@link #value(String, Class)} 读取；
 * 带方括号的结构化参数用 {@link #toFormData()}、{@link #toJson()} 或 {@link #bind(Class)}。
 */
public final class FormParams {
    private static final Logger LOG = LoggerFactory.getLogger(FormParams.class);

    private final List<Map.Entry<String, String>> pairs;
    private final FormDataParser parser;

    private FormParams(List<Map.Entry<String, String>> pairs, FormDataParser parser) {
        this.pairs = List.copyOf(pairs);
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public static FormParams of(List<? extends Map.Entry<String, String>> pairs) {
        return of(pairs, FormDataParser.defaults());
    }

    public static FormParams of(List<? extends Map.Entry<String, String>> pairs, FormDataParser parser) {
        Objects.requireNonNull(pairs, "pairs");
        List<Map.Entry<String, String>> copy = new ArrayList<>(pairs.size());
        for (Map.Entry<String, String> pair : pairs) {
            copy.add(Map.entry(pair.getKey(), pair.getValue()));
        }
        return new FormParams(copy, parser);
    }

    public static FormParams parseUrlEncoded(String encoded) {
        return parseUrlEncoded(encoded, FormDataParser.defaults());
    }

    /**
     * 解析 {@code a=1&b[]=2&flag} 形式的文本。没有等号的参数值为空串，空片段被忽略。
     *
     * @throws FormDataException 百分号转义不合法
     */
    public static FormParams parseUrlEncoded(String encoded, FormDataParser parser) {
        List<Map.Entry<String, String>> pairs = new ArrayList<>();
        if (encoded == null || encoded.isEmpty()) {
            return new FormParams(pairs, parser);
        }
        for (String part : encoded.split("&")) {
            if (part.isEmpty()) {
                continue;
            }
            int eq = part.indexOf('=');
            if (eq < 0) {
                pairs.add(Map.entry(decode(part, part), ""));
            } else {
                pairs.add(Map.entry(decode(part.substring(0, eq), part), decode(part.substring(eq + 1), part)));
            }
        }
        return new FormParams(pairs, parser);
    }

    public List<Map.Entry<String, String>> pairs() {
        return pairs;
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    /**
     * 第一个名为 {@code name} 的参数值，按原始参数名精确匹配。
     */
    public Optional<String> first(String name) {
        Objects.requireNonNull(name, "name");
        for (Map.Entry<String, String> pair : pairs) {
            if (pair.getKey().equals(name)) {
                return Optional.of(pair.getValue());
            }
        }
        return Optional.empty();
    }

    public List<String> all(String name) {
        Objects.requireNonNull(name, "name");
        List<String> values = new ArrayList<>();
        for (Map.Entry<String, String> pair : pairs) {
            if (pair.getKey().equals(name)) {
                values.add(pair.getValue());
            }
        }
        return values;
    }

    /**
     * 按类型读取参数：先把原文当作 JSON 解析，失败后再当作 JSON 字符串解析。
     * 例如 {@code "42"} 可读作 Integer 或 String，{@code "Hello"} 只能读作 String。
     *
     * @return 参数不存在或无法转换时返回 empty
     */
    public <T> Optional<T> value(String name, Class<T> type) {
        Objects.requireNonNull(type, "type");
        Optional<String> raw = first(name);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        ObjectMapper mapper = FormJson.mapper();
        String text = raw.get();
        try {
            return Optional.ofNullable(mapper.readValue(text, type));
        } catch (JsonProcessingException asJson) {
            try {
                return Optional.ofNullable(mapper.readValue(mapper.writeValueAsString(text), type));
            } catch (JsonProcessingException asString) {
                LOG.debug("Parameter {} is not a {}: {}", name, type.getSimpleName(), asString.getOriginalMessage());
                return Optional.empty();
            }
        }
    }

    public FormData.MapNode toFormData() {
        return parser.parse(pairs);
    }

    public JsonNode toJson() {
        return toFormData().toJson();
    }

    /**
     * 把结构化参数绑定到 {@code type}，未知属性被忽略。
     *
     * @throws FormDataException    参数结构冲突
     * @throws FormBindingException 值无法转换为目标类型
     */
    public <T> T bind(Class<T> type) {
        return FormJson.bind(toFormData(), type);
    }

    private static String decode(String text, String part) {
        try {
            return URLDecoder.decode(text, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            throw new FormDataException("Malformed form parameter: " + part, text, part, ex);
        }
    }

    @Override
    public String toString() {
        return "FormParams" + pairs;
    }
}
