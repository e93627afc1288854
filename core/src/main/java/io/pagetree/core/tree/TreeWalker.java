package io.pagetree.core.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pagetree.core.model.FlatElement;
import io.pagetree.core.model.NodeId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Recursive traversal primitives over a sequence of child nodes.
 *
 * <p>
 * Every operation skips entries that are not JSON objects instead of failing: externally authored
 * trees are often partially malformed, and one bad entry must not hide the rest of the tree. A
 * {@code children} value that is not an array is treated as empty.
 *
 * <p>
 * Ids are assumed unique. When they are not, the first node in pre-order wins for
 * {@link #findById} and {@link #replaceById}; nothing stronger is guaranteed.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class TreeWalker {

    /** Callback for {@link #visit}. */
    @FunctionalInterface
    public interface ElementVisitor {
        /**
         * @param element the node
         * @param path    dot-joined array indexes from the start sequence
         * @param depth   0 for entries of the start sequence
         */
        void visit(ObjectNode element, String path, int depth);
    }

    private TreeWalker() {}

    /** Visits every object node reachable from {@code children} in pre-order. */
    public static void visit(JsonNode children, ElementVisitor visitor) {
        Objects.requireNonNull(visitor, "visitor must not be null");
        visit(children, "", 0, visitor);
    }

    private static void visit(JsonNode children, String parentPath, int depth, ElementVisitor visitor) {
        if (children == null || !children.isArray()) {
            return;
        }
        for (int i = 0; i < children.size(); i++) {
            JsonNode child = children.get(i);
            if (!child.isObject()) {
                continue;
            }
            String path = parentPath.isEmpty() ? Integer.toString(i) : parentPath + "." + i;
            visitor.visit((ObjectNode) child, path, depth);
            visit(child.get(TreeKeys.CHILDREN), path, depth + 1, visitor);
        }
    }

    /** Flat pre-order list of all nodes reachable from {@code children}. */
    public static List<FlatElement> flatten(JsonNode children) {
        List<FlatElement> elements = new ArrayList<>();
        visit(children, (element, path, depth) -> elements.add(toFlatElement(element, path, depth)));
        return elements;
    }

    /** Number of nodes reachable from {@code children}, counting every level. */
    public static int count(JsonNode children) {
        int[] count = {0};
        visit(children, (element, path, depth) -> count[0]++);
        return count[0];
    }

    /** Ids of all nodes reachable from {@code children}, in pre-order. Nodes without an id are skipped. */
    public static List<NodeId> collectIds(JsonNode children) {
        List<NodeId> ids = new ArrayList<>();
        visit(children, (element, path, depth) -> NodeId.from(element.get(TreeKeys.ID)).ifPresent(ids::add));
        return ids;
    }

    /** The first node in pre-order whose id has the same string form as {@code id}. */
    public static Optional<ObjectNode> findById(JsonNode children, NodeId id) {
        Objects.requireNonNull(id, "id must not be null");
        if (children == null || !children.isArray()) {
            return Optional.empty();
        }
        for (JsonNode child : children) {
            if (!child.isObject()) {
                continue;
            }
            if (id.matches(child.get(TreeKeys.ID))) {
                return Optional.of((ObjectNode) child);
            }
            Optional<ObjectNode> nested = findById(child.get(TreeKeys.CHILDREN), id);
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }

    /**
     * Returns a deep copy of {@code children} in which the first node matching {@code id} is
     * replaced by a copy of {@code replacement}. Without a match the copy is equal to the input.
     */
    public static ArrayNode replaceById(JsonNode children, NodeId id, ObjectNode replacement) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(replacement, "replacement must not be null");
        ArrayNode copy = children != null && children.isArray()
                ? ((ArrayNode) children).deepCopy()
                : JsonNodeFactory.instance.arrayNode();
        replaceFirst(copy, id, replacement);
        return copy;
    }

    private static boolean replaceFirst(ArrayNode children, NodeId id, ObjectNode replacement) {
        for (int i = 0; i < children.size(); i++) {
            JsonNode child = children.get(i);
            if (!child.isObject()) {
                continue;
            }
            if (id.matches(child.get(TreeKeys.ID))) {
                children.set(i, replacement.deepCopy());
                return true;
            }
            JsonNode grandChildren = child.get(TreeKeys.CHILDREN);
            if (grandChildren instanceof ArrayNode && replaceFirst((ArrayNode) grandChildren, id, replacement)) {
                return true;
            }
        }
        return false;
    }

    private static FlatElement toFlatElement(ObjectNode element, String path, int depth) {
        JsonNode id = element.has(TreeKeys.ID) ? element.get(TreeKeys.ID) : JsonNodeFactory.instance.nullNode();
        JsonNode type = JsonPaths.get(element, TreeKeys.DATA, TreeKeys.TYPE);
        JsonNode properties = JsonPaths.get(element, TreeKeys.DATA, TreeKeys.PROPERTIES);
        JsonNode children = element.get(TreeKeys.CHILDREN);
        return new FlatElement(
                id,
                type.isTextual() ? type.textValue() : "unknown",
                path,
                depth,
                properties.isMissingNode() || properties.isNull() ? JsonNodeFactory.instance.objectNode() : properties,
                children != null && children.isArray() && !children.isEmpty());
    }
}
