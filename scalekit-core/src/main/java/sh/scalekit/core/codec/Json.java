// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.scalekit.core.codec;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.jspecify.annotations.Nullable;

/**
 * Jackson plumbing shared by codec projections and descriptor parsing.
 */
public final class Json {

    public static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT = new TypeReference<>() {
    };

    private Json() {
    }

    /**
     * Converts a Jackson tree to plain Java values: objects become ordered maps,
     * arrays become lists, numbers keep their Jackson width.
     */
    public static @Nullable Object toPlain(final JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return MAPPER.convertValue(node, Object.class);
    }

    /**
     * Parses a JSON object, keeping key order.
     *
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public static Map<String, Object> parseObject(final String json) {
        try {
            return MAPPER.readValue(json, OBJECT);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON object: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Converts plain Java values (maps, lists, strings, numbers) into a tree.
     */
    public static JsonNode toTree(final @Nullable Object value) {
        return MAPPER.valueToTree(value);
    }
}
