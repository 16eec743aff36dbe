package io.lighting.ember.form;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import java.util.Objects;

/**
 * Jackson conversion of {@link FormData} trees.
 */
public final class FormJson {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

    private FormJson() {
    }

    static ObjectMapper mapper() {
        return MAPPER;
    }

    public static JsonNode toJsonNode(FormData data) {
        Objects.requireNonNull(data, "data");
        JsonNodeFactory factory = JsonNodeFactory.instance;
        if (data instanceof FormData.Leaf leaf) {
            return factory.textNode(leaf.value());
        }
        if (data instanceof FormData.ArrayNode array) {
            ArrayNode node = factory.arrayNode(array.size());
            for (FormData item : array.items()) {
                node.add(toJsonNode(item));
            }
            return node;
        }
        ObjectNode node = factory.objectNode();
        for (Map.Entry<String, FormData> entry : ((FormData.MapNode) data).entries().entrySet()) {
            node.set(entry.getKey(), toJsonNode(entry.getValue()));
        }
        return node;
    }

    public static String toJsonString(FormData data) {
        try {
            return MAPPER.writeValueAsString(toJsonNode(data));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize form data", ex);
        }
    }

    /**
     * Binds a tree to {@code type}; Jackson coerces the string leaves to numbers, booleans etc.
     */
    public static <T> T bind(FormData data, Class<T> type) {
        Objects.requireNonNull(type, "type");
        try {
            return MAPPER.convertValue(toJsonNode(data), type);
        } catch (IllegalArgumentException ex) {
            throw new FormBindingException(type, ex);
        }
    }
}
