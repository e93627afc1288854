package io.pagetree.core.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pagetree.core.model.NodeId;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Normalizes a decoded tree into the canonical shape the page builder's strict schema accepts,
 * without discarding user-supplied structure.
 *
 * <p>
 * Canonicalization never fails and never rejects: anything it does not understand is returned as
 * given. It is idempotent, so re-running it over a stored tree is always safe.
 *
 * <p>
 * Thread-safe, stateless.
 */
public final class TreeCanonicalizer {

    /** Namespaced spellings of the root type that are rewritten to {@code "root"}. */
    static final Set<String> NAMESPACED_ROOT_TYPES = Set.of("EssentialElements\\Root", "OxygenElements\\Root");

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /**
     * Returns a canonical copy of {@code tree}. The input is not modified.
     *
     * <p>
     * A value that is not an object with a {@code root} object is returned as a plain copy: it is
     * not a tree this canonicalizer understands, and the caller may try other formats. Otherwise:
     * <ul>
     * <li>a namespaced root type becomes {@code "root"}, a missing one is added;</li>
     * <li>absent or empty {@code root.data.properties} becomes {@code null};</li>
     * <li>an absent {@code root.data} or {@code root.children} is added;</li>
     * <li>{@code _nextNodeId} is computed when absent;</li>
     * <li>{@code exportedLookupTable} is added as an empty object when absent, and an array value is
     * converted to an object;</li>
     * <li>{@code status} is set to {@code "exported"} when absent.</li>
     * </ul>
     */
    public JsonNode ensureTreeIntegrity(JsonNode tree) {
        if (tree == null) {
            return NODES.nullNode();
        }
        JsonNode copy = tree.deepCopy();
        if (!copy.isObject() || !copy.path(TreeKeys.ROOT).isObject()) {
            return copy;
        }
        ObjectNode result = (ObjectNode) copy;
        ObjectNode root = (ObjectNode) result.get(TreeKeys.ROOT);

        normalizeRootData(root);
        if (!root.has(TreeKeys.CHILDREN)) {
            root.putArray(TreeKeys.CHILDREN);
        }
        linkParents(root);

        long nextNodeId = calculateNextNodeId(result);
        JsonNode counter = result.get(TreeKeys.NEXT_NODE_ID);
        if (isUnset(counter) || !counter.isIntegralNumber() || counter.asLong() < nextNodeId) {
            result.put(TreeKeys.NEXT_NODE_ID, nextNodeId);
        }

        JsonNode lookupTable = result.get(TreeKeys.LOOKUP_TABLE);
        if (isUnset(lookupTable)) {
            result.putObject(TreeKeys.LOOKUP_TABLE);
        } else if (lookupTable.isArray()) {
            ObjectNode table = NODES.objectNode();
            for (int i = 0; i < lookupTable.size(); i++) {
                table.set(Integer.toString(i), lookupTable.get(i));
            }
            result.set(TreeKeys.LOOKUP_TABLE, table);
        }

        if (isUnset(result.get(TreeKeys.STATUS))) {
            result.put(TreeKeys.STATUS, TreeKeys.STATUS_EXPORTED);
        }
        return result;
    }

    /**
     * A fresh tree with no elements. It carries no status and no lookup table; those come from a
     * subsequent {@link #ensureTreeIntegrity} pass.
     */
    public ObjectNode createEmptyTree() {
        ObjectNode tree = NODES.objectNode();
        ObjectNode root = tree.putObject(TreeKeys.ROOT);
        root.put(TreeKeys.ID, TreeKeys.EMPTY_ROOT_ID);
        ObjectNode data = root.putObject(TreeKeys.DATA);
        data.put(TreeKeys.TYPE, TreeKeys.ROOT_TYPE);
        data.putNull(TreeKeys.PROPERTIES);
        root.putArray(TreeKeys.CHILDREN);
        tree.put(TreeKeys.NEXT_NODE_ID, 1);
        return tree;
    }

    /**
     * One more than the largest numeric id in the tree, never less than 1. Integer ids count as
     * themselves; string ids count by their trailing digit group; ids without digits are ignored.
     * Ids are gathered from the root and its descendants, from top-level {@code children} of a
     * single-element tree, and from the entries of a top-level element array.
     */
    public long calculateNextNodeId(JsonNode tree) {
        long max = 0;
        for (NodeId id : allIds(tree)) {
            var numeric = id.numericValue();
            if (numeric.isPresent()) {
                max = Math.max(max, numeric.getAsLong());
            }
        }
        return Math.max(1, max + 1);
    }

    private static List<NodeId> allIds(JsonNode tree) {
        if (tree == null) {
            return List.of();
        }
        if (tree.isArray()) {
            return TreeWalker.collectIds(tree);
        }
        List<NodeId> ids = new ArrayList<>();
        JsonNode root = tree.get(TreeKeys.ROOT);
        if (root != null && root.isObject()) {
            NodeId.from(root.get(TreeKeys.ID)).ifPresent(ids::add);
            ids.addAll(TreeWalker.collectIds(root.get(TreeKeys.CHILDREN)));
        }
        ids.addAll(TreeWalker.collectIds(tree.get(TreeKeys.CHILDREN)));
        return ids;
    }

    /** Walks the children of {@code container}, giving each element object a {@code _parentId}. */
    private static void linkParents(ObjectNode container) {
        JsonNode children = container.get(TreeKeys.CHILDREN);
        if (children == null || !children.isArray()) {
            return;
        }
        JsonNode containerId = container.get(TreeKeys.ID);
        for (JsonNode child : children) {
            if (!child.isObject()) {
                continue;
            }
            ObjectNode element = (ObjectNode) child;
            if (isUnset(element.get(TreeKeys.PARENT_ID))) {
                JsonNode alias = element.remove(TreeKeys.PARENT_ID_ALIAS);
                if (!isUnset(alias)) {
                    element.set(TreeKeys.PARENT_ID, alias);
                } else if (!isUnset(containerId)) {
                    element.set(TreeKeys.PARENT_ID, containerId.deepCopy());
                }
            } else {
                element.remove(TreeKeys.PARENT_ID_ALIAS);
            }
            linkParents(element);
        }
    }

    private static void normalizeRootData(ObjectNode root) {
        JsonNode existing = root.get(TreeKeys.DATA);
        if (existing != null && !existing.isObject()) {
            // authored value of the wrong shape: leave it for the validator to report
            return;
        }
        ObjectNode data = existing != null ? (ObjectNode) existing : root.putObject(TreeKeys.DATA);

        JsonNode type = data.get(TreeKeys.TYPE);
        if (isUnset(type) || (type.isTextual() && NAMESPACED_ROOT_TYPES.contains(type.textValue()))) {
            data.put(TreeKeys.TYPE, TreeKeys.ROOT_TYPE);
        }

        JsonNode properties = data.get(TreeKeys.PROPERTIES);
        if (properties == null || (properties.isContainerNode() && properties.isEmpty())) {
            data.putNull(TreeKeys.PROPERTIES);
        }
    }

    private static boolean isUnset(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }
}
