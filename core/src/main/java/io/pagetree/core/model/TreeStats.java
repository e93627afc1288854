package io.pagetree.core.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Summary figures of a tree.
 *
 * @param elementCount number of elements below the root
 * @param maxDepth     deepest level reached (1 for direct children of the root, 0 for no children)
 * @param elementTypes distinct type tags in first-seen order
 */
public record TreeStats(int elementCount, int maxDepth, List<String> elementTypes) {

    public static final TreeStats EMPTY = new TreeStats(0, 0, List.of());

    public TreeStats {
        elementTypes = elementTypes != null ? List.copyOf(elementTypes) : List.of();
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("element_count", elementCount);
        node.put("max_depth", maxDepth);
        var types = node.putArray("element_types");
        elementTypes.forEach(types::add);
        return node;
    }
}
