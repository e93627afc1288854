package io.pagetree.core.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.pagetree.core.model.FlatElement;
import io.pagetree.core.model.TreeStats;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-side projections over a whole tree: flat element list, element count, distinct type tags
 * and summary statistics. The root itself is not an element; projections start at its children.
 * Classic trees (a top-level element array) are projected from the array.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class TreeFlattener {

    private TreeFlattener() {}

    /** The sequence projections start from: {@code root.children}, or the tree itself if it is an array. */
    public static JsonNode elementSequence(JsonNode tree) {
        if (tree == null) {
            return MissingNode.getInstance();
        }
        if (tree.isArray()) {
            return tree;
        }
        JsonNode rootChildren = JsonPaths.get(tree, TreeKeys.ROOT, TreeKeys.CHILDREN);
        if (rootChildren.isArray()) {
            return rootChildren;
        }
        return tree.path(TreeKeys.CHILDREN);
    }

    public static List<FlatElement> flatten(JsonNode tree) {
        return TreeWalker.flatten(elementSequence(tree));
    }

    public static int countElements(JsonNode tree) {
        return TreeWalker.count(elementSequence(tree));
    }

    /** Distinct {@code data.type} tags in first-seen order; elements without a string type are skipped. */
    public static List<String> elementTypes(JsonNode tree) {
        Set<String> types = new LinkedHashSet<>();
        TreeWalker.visit(elementSequence(tree), (element, path, depth) -> {
            JsonNode type = JsonPaths.get(element, TreeKeys.DATA, TreeKeys.TYPE);
            if (type.isTextual()) {
                types.add(type.textValue());
            }
        });
        return new ArrayList<>(types);
    }

    public static TreeStats stats(JsonNode tree) {
        int[] count = {0};
        int[] maxDepth = {0};
        Set<String> types = new LinkedHashSet<>();
        TreeWalker.visit(elementSequence(tree), (element, path, depth) -> {
            count[0]++;
            maxDepth[0] = Math.max(maxDepth[0], depth + 1);
            JsonNode type = JsonPaths.get(element, TreeKeys.DATA, TreeKeys.TYPE);
            if (type.isTextual()) {
                types.add(type.textValue());
            }
        });
        return count[0] == 0 ? TreeStats.EMPTY : new TreeStats(count[0], maxDepth[0], new ArrayList<>(types));
    }
}
