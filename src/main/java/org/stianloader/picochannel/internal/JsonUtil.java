package org.stianloader.picochannel.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Helpers turning the loosely shaped JSON of channel documents into plain Java values.
 * All methods throw an {@link IllegalArgumentException} describing the offending key
 * if a value has a shape that cannot be interpreted.
 */
public final class JsonUtil {

    /**
     * Reads a value that may either be a single string or a list of strings.
     * An absent or null value yields an empty list.
     *
     * @param parent The object holding the value
     * @param key The key of the value
     * @return An unmodifiable list of strings
     */
    @NotNull
    public static List<@NotNull String> optStringList(@NotNull JsonNode parent, @NotNull String key) {
        JsonNode node = parent.get(key);
        if (node == null || node.isNull()) {
            return Collections.emptyList();
        } else if (node.isValueNode()) {
            return Collections.singletonList(JsonUtil.scalarText(node, key));
        } else if (node.isArray()) {
            List<String> values = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                if (element.isNull()) {
                    continue;
                }
                values.add(JsonUtil.scalarText(element, key));
            }
            return Collections.unmodifiableList(values);
        }
        throw new IllegalArgumentException("the \"" + key + "\" key must be a string or a list of strings.");
    }

    /**
     * Reads a scalar value as text. Numbers and booleans are converted to their textual form.
     *
     * @param parent The object holding the value
     * @param key The key of the value
     * @return The text, or null if the key is absent or explicitly null
     */
    @Nullable
    public static String optText(@NotNull JsonNode parent, @NotNull String key) {
        JsonNode node = parent.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        return JsonUtil.scalarText(node, key);
    }

    /**
     * Reads an "author" style value: either a plain string or a list of names which is joined by ", ".
     *
     * @param parent The object holding the value
     * @param key The key of the value
     * @return The joined text, or null if absent
     */
    @Nullable
    public static String optJoinedText(@NotNull JsonNode parent, @NotNull String key) {
        JsonNode node = parent.get(key);
        if (node == null || node.isNull()) {
            return null;
        } else if (node.isArray()) {
            return String.join(", ", JsonUtil.optStringList(parent, key));
        }
        return JsonUtil.scalarText(node, key);
    }

    /**
     * Reads a JSON object whose values are all strings, preserving the document order.
     *
     * @param parent The object holding the map
     * @param key The key of the map
     * @return An unmodifiable map, empty if the key is absent
     */
    @NotNull
    public static Map<@NotNull String, @NotNull String> optStringMap(@NotNull JsonNode parent, @NotNull String key) {
        JsonNode node = parent.get(key);
        if (node == null || node.isNull()) {
            return Collections.emptyMap();
        } else if (!node.isObject()) {
            throw new IllegalArgumentException("the \"" + key + "\" key must be an object.");
        }
        Map<String, String> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            out.put(entry.getKey(), JsonUtil.scalarText(entry.getValue(), key));
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Reads a list of JSON objects.
     *
     * @param node The array node, may be null
     * @param key The key the array was stored under, used for error messages
     * @return An unmodifiable list of object nodes, empty if the node is absent
     */
    @NotNull
    public static List<@NotNull JsonNode> objectList(@Nullable JsonNode node, @NotNull String key) {
        if (node == null || node.isNull()) {
            return Collections.emptyList();
        } else if (!node.isArray()) {
            throw new IllegalArgumentException("the \"" + key + "\" key must be a list of objects.");
        }
        List<JsonNode> out = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (!element.isObject()) {
                throw new IllegalArgumentException("the \"" + key + "\" key must only contain objects.");
            }
            out.add(element);
        }
        return Collections.unmodifiableList(out);
    }

    @NotNull
    public static String requireText(@NotNull JsonNode parent, @NotNull String key, @NotNull String owner) {
        JsonNode node = parent.get(key);
        if (node == null || !node.isTextual()) {
            throw new IllegalArgumentException(owner + " is missing the \"" + key + "\" key.");
        }
        return node.textValue();
    }

    @NotNull
    @Contract(pure = true)
    private static String scalarText(@NotNull JsonNode node, @NotNull String key) {
        if (node.isTextual()) {
            return node.textValue();
        } else if (node.isNumber() || node.isBoolean()) {
            return node.asText();
        }
        throw new IllegalArgumentException("the \"" + key + "\" key holds a value that is not a string.");
    }

    private JsonUtil() {
        throw new AssertionError();
    }
}
