package io.pagetree.core.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Nested-key lookup and assignment over JSON objects, with paths given as key sequences.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class JsonPaths {

    private JsonPaths() {}

    /** Splits a dotted path ({@code "properties.attributes.className"}) into keys. */
    public static List<String> parse(String dotted) {
        Objects.requireNonNull(dotted, "dotted must not be null");
        if (dotted.isEmpty()) {
            return List.of();
        }
        return List.of(dotted.split("\\."));
    }

    /** Joins keys back into dotted form. */
    public static String format(List<String> path) {
        return String.join(".", path);
    }

    /**
     * Returns the value at {@code path}, or a {@link MissingNode} if any segment is absent or a
     * non-object is encountered on the way.
     */
    public static JsonNode get(JsonNode node, List<String> path) {
        JsonNode current = node;
        for (String key : path) {
            if (current == null || !current.isObject()) {
                return MissingNode.getInstance();
            }
            current = current.get(key);
        }
        return current != null ? current : MissingNode.getInstance();
    }

    /** Convenience overload taking keys as varargs. */
    public static JsonNode get(JsonNode node, String... path) {
        return get(node, Arrays.asList(path));
    }

    /** {@code true} if a non-null value exists at {@code path}. */
    public static boolean has(JsonNode node, List<String> path) {
        JsonNode value = get(node, path);
        return !value.isMissingNode() && !value.isNull();
    }

    /**
     * Assigns {@code value} at {@code path}, creating intermediate objects. Intermediates that exist
     * but are not objects are replaced.
     *
     * @throws IllegalArgumentException if {@code path} is empty
     */
    public static void set(ObjectNode target, List<String> path, JsonNode value) {
        if (path.isEmpty()) {
            throw new IllegalArgumentException("path must not be empty");
        }
        ObjectNode current = target;
        for (String key : path.subList(0, path.size() - 1)) {
            JsonNode next = current.get(key);
            if (next instanceof ObjectNode) {
                current = (ObjectNode) next;
            } else {
                current = current.putObject(key);
            }
        }
        current.set(path.get(path.size() - 1), value);
    }

    /**
     * Removes the leaf at {@code path}. Returns {@code true} if something was removed.
     */
    public static boolean remove(ObjectNode target, List<String> path) {
        if (path.isEmpty()) {
            return false;
        }
        JsonNode parent = get(target, path.subList(0, path.size() - 1));
        if (!(parent instanceof ObjectNode)) {
            return false;
        }
        return ((ObjectNode) parent).remove(path.get(path.size() - 1)) != null;
    }
}
