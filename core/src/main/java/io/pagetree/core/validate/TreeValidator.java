package io.pagetree.core.validate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pagetree.core.model.TreeStats;
import io.pagetree.core.model.ValidationIssue;
import io.pagetree.core.model.ValidationResult;
import io.pagetree.core.spi.TypeVocabulary;
import io.pagetree.core.tree.TreeFlattener;
import io.pagetree.core.tree.TreeKeys;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates a decoded value claimed to be a document tree and reports every problem found in one
 * depth-first pass. Validation never throws: structural problems come back as
 * {@link ValidationIssue} data so callers can report everything at once.
 *
 * <p>
 * Errors block persistence. Warnings (non-null root properties, parent link mismatches, unknown
 * but namespaced types, computed fields supplied by the author) are advisory.
 *
 * <p>
 * Thread-safe: holds only immutable collaborators.
 */
public final class TreeValidator {

    private static final Logger LOG = LoggerFactory.getLogger(TreeValidator.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    static final String EXAMPLE_TYPE = "EssentialElements\\Heading";
    static final long EXAMPLE_ELEMENT_ID = 100;
    static final long DEFAULT_ROOT_ID = 1;
    static final long DEFAULT_PARENT_ID = 0;

    private final TypeVocabulary vocabulary;
    private final TypeSuggester suggester;
    private final ValidationLimits limits;

    public TreeValidator(TypeVocabulary vocabulary, ValidationLimits limits) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary must not be null");
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
        this.suggester = new TypeSuggester(vocabulary);
    }

    public TreeValidator(TypeVocabulary vocabulary) {
        this(vocabulary, ValidationLimits.DEFAULT);
    }

    /** Validates a whole tree: root, every descendant, {@code status} and computed fields. */
    public ValidationResult validate(JsonNode tree) {
        Collector out = new Collector();
        if (tree == null || !tree.isObject()) {
            out.error(ValidationIssue.of(
                    "invalid_tree_type", "tree", "Tree must be an object.", "object", exampleTree()));
            return out.result();
        }

        JsonNode root = tree.get(TreeKeys.ROOT);
        if (isUnset(root)) {
            out.error(ValidationIssue.of(
                    "missing_root", "root", "Tree must have a root property.", "object", exampleRoot()));
        } else if (!root.isObject()) {
            out.error(ValidationIssue.of(
                    "invalid_root_type", "root", "Root must be an object.", "object", exampleRoot()));
        } else {
            validateRoot(root, out);
        }

        JsonNode status = tree.get(TreeKeys.STATUS);
        if (isUnset(status)) {
            out.error(ValidationIssue.of(
                    "missing_status",
                    "status",
                    "Tree must have a status property set to \"exported\".",
                    "string",
                    NODES.textNode(TreeKeys.STATUS_EXPORTED)));
        } else if (!TreeKeys.STATUS_EXPORTED.equals(status.textValue())) {
            out.error(ValidationIssue.of(
                    "invalid_status",
                    "status",
                    "Status must be \"exported\" for valid trees.",
                    "string (literal \"exported\")",
                    NODES.textNode(TreeKeys.STATUS_EXPORTED)));
        }

        JsonNode nextNodeId = tree.get(TreeKeys.NEXT_NODE_ID);
        if (!isUnset(nextNodeId)) {
            out.warning(ValidationIssue.advisory(
                    "unnecessary_next_node_id",
                    TreeKeys.NEXT_NODE_ID,
                    "_nextNodeId should not be included in the tree. It is computed during save.",
                    "Remove this property from your tree."));
            if (!isInteger(nextNodeId)) {
                out.warning(ValidationIssue.advisory(
                                "invalid_next_node_id",
                                TreeKeys.NEXT_NODE_ID,
                                "_nextNodeId must be an integer, not " + jsonType(nextNodeId) + ".",
                                "Remove this property; it is recomputed during save.")
                        .withActual(nextNodeId));
            }
        }
        if (!isUnset(tree.get(TreeKeys.LOOKUP_TABLE))) {
            out.warning(ValidationIssue.advisory(
                    "unnecessary_exported_lookup_table",
                    TreeKeys.LOOKUP_TABLE,
                    "exportedLookupTable should not be included in the tree. It is added during save.",
                    "Remove this property from your tree."));
        }

        ValidationResult result = out.result();
        LOG.debug(
                "tree.validated valid={} errors={} warnings={} elements={}",
                result.valid(),
                result.errorCount(),
                result.warningCount(),
                out.elements);
        return result;
    }

    /**
     * Validates a single element subtree as if it were a child of {@code expectedParentId}. Paths
     * are reported relative to the prefix {@code element}.
     */
    public ValidationResult validateElement(JsonNode element, long expectedParentId) {
        Collector out = new Collector();
        validateChild(element, "element", expectedParentId, 1, out);
        return out.result();
    }

    /** Element count, deepest level and distinct types of {@code tree}. */
    public TreeStats stats(JsonNode tree) {
        return TreeFlattener.stats(tree);
    }

    private void validateRoot(JsonNode root, Collector out) {
        JsonNode id = root.get(TreeKeys.ID);
        if (isUnset(id)) {
            out.error(ValidationIssue.of(
                    "missing_root_id", "root.id", "Root must have an id property.", "integer", exampleRootId()));
        } else if (!isInteger(id)) {
            out.error(ValidationIssue.of(
                    "invalid_root_id_type",
                    "root.id",
                    "Root id must be an integer. Received: " + jsonType(id),
                    "integer",
                    exampleRootId()));
        }

        JsonNode data = root.get(TreeKeys.DATA);
        if (isUnset(data)) {
            out.error(ValidationIssue.of(
                    "missing_root_data", "root.data", "Root must have a data property.", "object", exampleRootData()));
        } else if (!data.isObject()) {
            out.error(ValidationIssue.of(
                    "invalid_root_data_type", "root.data", "Root data must be an object.", "object", exampleRootData()));
        } else {
            validateRootData(data, out);
        }

        JsonNode children = root.get(TreeKeys.CHILDREN);
        if (isUnset(children)) {
            out.error(ValidationIssue.of(
                    "missing_root_children",
                    "root.children",
                    "Root must have a children array.",
                    "array",
                    NODES.arrayNode()));
        } else if (!children.isArray()) {
            out.error(ValidationIssue.of(
                    "invalid_root_children_type",
                    "root.children",
                    "Root children must be an array.",
                    "array",
                    NODES.arrayNode()));
        } else {
            long rootId = isInteger(id) ? id.longValue() : DEFAULT_ROOT_ID;
            validateChildren(children, "root.children", rootId, 1, out);
        }
    }

    private void validateRootData(JsonNode data, Collector out) {
        JsonNode type = data.get(TreeKeys.TYPE);
        if (isUnset(type)) {
            out.error(ValidationIssue.of(
                    "missing_root_data_type",
                    "root.data.type",
                    "Root data must have a type property.",
                    "string",
                    NODES.textNode(TreeKeys.ROOT_TYPE)));
        } else if (!TreeKeys.ROOT_TYPE.equals(type.textValue())) {
            out.error(ValidationIssue.of(
                            "invalid_root_data_type_value",
                            "root.data.type",
                            "Root data type must be lowercase \"root\", not \"" + type.asText() + "\".",
                            "string (literal \"root\")",
                            NODES.textNode(TreeKeys.ROOT_TYPE))
                    .withActual(type));
        }

        if (!data.has(TreeKeys.PROPERTIES)) {
            out.error(ValidationIssue.of(
                    "missing_root_data_properties",
                    "root.data.properties",
                    "Root data must have a properties property.",
                    "null",
                    NODES.nullNode()));
        } else if (!data.get(TreeKeys.PROPERTIES).isNull()) {
            out.warning(ValidationIssue.advisory(
                    "non_null_root_properties",
                    "root.data.properties",
                    "Root data properties should be null. Found: " + jsonType(data.get(TreeKeys.PROPERTIES)),
                    "Set root.data.properties to null."));
        }
    }

    private void validateChildren(JsonNode children, String path, long parentId, int depth, Collector out) {
        if (depth > limits.maxDepth()) {
            if (!children.isEmpty()) {
                out.error(ValidationIssue.of(
                        "max_depth_exceeded",
                        path,
                        "Tree exceeds the maximum nesting depth of " + limits.maxDepth() + ".",
                        "depth <= " + limits.maxDepth(),
                        null));
            }
            return;
        }
        for (int i = 0; i < children.size(); i++) {
            validateChild(children.get(i), path + "[" + i + "]", parentId, depth, out);
        }
    }

    private void validateChild(JsonNode element, String path, long parentId, int depth, Collector out) {
        if (out.elements >= limits.maxElements()) {
            if (!out.elementLimitReported) {
                out.elementLimitReported = true;
                out.error(ValidationIssue.of(
                        "max_elements_exceeded",
                        path,
                        "Tree exceeds the maximum of " + limits.maxElements() + " elements.",
                        "element count <= " + limits.maxElements(),
                        null));
            }
            return;
        }
        out.elements++;

        if (element == null || !element.isObject()) {
            out.error(ValidationIssue.of(
                    "invalid_element_type", path, "Element must be an object.", "object", exampleElement(parentId)));
            return;
        }

        JsonNode id = element.get(TreeKeys.ID);
        if (isUnset(id)) {
            out.error(ValidationIssue.of(
                    "missing_element_id",
                    path + ".id",
                    "Element must have an id property.",
                    "integer",
                    NODES.numberNode(EXAMPLE_ELEMENT_ID)));
        } else if (!isInteger(id)) {
            out.error(ValidationIssue.of(
                    "invalid_element_id_type",
                    path + ".id",
                    "Element id must be an integer, not " + jsonType(id) + ".",
                    "integer",
                    NODES.numberNode(EXAMPLE_ELEMENT_ID)));
        }

        JsonNode data = element.get(TreeKeys.DATA);
        if (isUnset(data)) {
            out.error(ValidationIssue.of(
                    "missing_element_data",
                    path + ".data",
                    "Element must have a data property.",
                    "object",
                    exampleElementData()));
        } else if (!data.isObject()) {
            out.error(ValidationIssue.of(
                    "invalid_element_data_type",
                    path + ".data",
                    "Element data must be an object.",
                    "object",
                    exampleElementData()));
        } else {
            validateElementData(data, path + ".data", out);
        }

        JsonNode children = element.get(TreeKeys.CHILDREN);
        if (isUnset(children)) {
            out.error(ValidationIssue.of(
                    "missing_element_children",
                    path + ".children",
                    "Element must have a children array (use an empty [] for leaf elements).",
                    "array",
                    NODES.arrayNode()));
        } else if (!children.isArray()) {
            out.error(ValidationIssue.of(
                    "invalid_element_children_type",
                    path + ".children",
                    "Element children must be an array.",
                    "array",
                    NODES.arrayNode()));
        } else {
            long elementId = isInteger(id) ? id.longValue() : DEFAULT_PARENT_ID;
            validateChildren(children, path + ".children", elementId, depth + 1, out);
        }

        validateParentLink(element, path, parentId, out);
    }

    private void validateElementData(JsonNode data, String path, Collector out) {
        JsonNode type = data.get(TreeKeys.TYPE);
        if (isUnset(type)) {
            out.error(ValidationIssue.of(
                    "missing_element_type",
                    path + ".type",
                    "Element data must have a type property.",
                    "string",
                    NODES.textNode(EXAMPLE_TYPE)));
        } else if (!type.isTextual()) {
            out.error(ValidationIssue.of(
                    "invalid_element_type_type",
                    path + ".type",
                    "Element data type must be a string.",
                    "string",
                    NODES.textNode(EXAMPLE_TYPE)));
        } else {
            validateType(type.textValue(), path + ".type", out);
        }

        if (!data.has(TreeKeys.PROPERTIES)) {
            out.error(ValidationIssue.of(
                    "missing_element_properties",
                    path + ".properties",
                    "Element data must have a properties property (object or null).",
                    "object|null",
                    NODES.nullNode()));
        }
    }

    private void validateType(String type, String path, Collector out) {
        if (vocabulary.isKnown(type)) {
            return;
        }
        if (vocabulary.hasKnownNamespace(type)) {
            List<String> suggestions = suggester.suggest(type);
            String action = suggestions.isEmpty()
                    ? "Use a known element type, or make sure the custom element is registered with the builder."
                    : "Did you mean '" + suggestions.get(0) + "'?";
            out.warning(ValidationIssue.advisory(
                            "unknown_element_type",
                            path,
                            "Element type '" + type + "' is not a known element type.",
                            action)
                    .withSuggestions(suggestions));
            return;
        }

        Optional<String> exact = vocabulary.resolveShortName(type);
        List<String> suggestions = exact.map(List::of).orElseGet(() -> suggester.suggest(type));
        String namespaces = String.join(" or ", vocabulary.namespaces());
        String action = suggestions.isEmpty()
                ? "Add a " + namespaces + " prefix to the element type."
                : "Did you mean '" + suggestions.get(0) + "'?";
        out.error(ValidationIssue.of(
                        "invalid_element_namespace",
                        path,
                        "Element type '" + type + "' is missing a valid namespace prefix.",
                        "string with " + namespaces + " prefix",
                        NODES.textNode(EXAMPLE_TYPE))
                .withAction(action)
                .withSuggestions(suggestions));
    }

    private void validateParentLink(JsonNode element, String path, long parentId, Collector out) {
        String key = element.has(TreeKeys.PARENT_ID) || !element.has(TreeKeys.PARENT_ID_ALIAS)
                ? TreeKeys.PARENT_ID
                : TreeKeys.PARENT_ID_ALIAS;
        JsonNode link = element.get(key);
        String linkPath = path + "." + key;
        if (isUnset(link)) {
            out.error(ValidationIssue.of(
                    "missing_parent_id",
                    linkPath,
                    "Element must have a _parentId property referencing its parent.",
                    "integer",
                    NODES.numberNode(parentId)));
        } else if (!isInteger(link)) {
            out.error(ValidationIssue.of(
                    "invalid_parent_id_type",
                    linkPath,
                    "Element _parentId must be an integer, not " + jsonType(link) + ".",
                    "integer",
                    NODES.numberNode(parentId)));
        } else if (link.longValue() != parentId) {
            out.warning(new ValidationIssue(
                    "parent_id_mismatch",
                    linkPath,
                    "Element _parentId (" + link.longValue() + ") does not match expected parent id (" + parentId
                            + ").",
                    NODES.numberNode(parentId),
                    null,
                    link,
                    "Set _parentId to " + parentId + ".",
                    null));
        }
    }

    static boolean isUnset(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    static boolean isInteger(JsonNode node) {
        return node != null && node.isIntegralNumber() && node.canConvertToLong();
    }

    static String jsonType(JsonNode node) {
        return switch (node.getNodeType()) {
            case STRING -> "string";
            case NUMBER -> node.isIntegralNumber() ? "integer" : "number";
            case BOOLEAN -> "boolean";
            case ARRAY -> "array";
            case OBJECT, POJO -> "object";
            default -> "null";
        };
    }

    private static ObjectNode exampleTree() {
        ObjectNode tree = NODES.objectNode();
        tree.set(TreeKeys.ROOT, exampleRoot());
        tree.put(TreeKeys.STATUS, TreeKeys.STATUS_EXPORTED);
        return tree;
    }

    private static ObjectNode exampleRoot() {
        ObjectNode root = NODES.objectNode();
        root.put(TreeKeys.ID, DEFAULT_ROOT_ID);
        root.set(TreeKeys.DATA, exampleRootData());
        root.putArray(TreeKeys.CHILDREN);
        return root;
    }

    private static JsonNode exampleRootId() {
        return NODES.numberNode(DEFAULT_ROOT_ID);
    }

    private static ObjectNode exampleRootData() {
        ObjectNode data = NODES.objectNode();
        data.put(TreeKeys.TYPE, TreeKeys.ROOT_TYPE);
        data.putNull(TreeKeys.PROPERTIES);
        return data;
    }

    private static ObjectNode exampleElementData() {
        ObjectNode data = NODES.objectNode();
        data.put(TreeKeys.TYPE, EXAMPLE_TYPE);
        data.putNull(TreeKeys.PROPERTIES);
        return data;
    }

    private static ObjectNode exampleElement(long parentId) {
        ObjectNode element = NODES.objectNode();
        element.put(TreeKeys.ID, EXAMPLE_ELEMENT_ID);
        element.set(TreeKeys.DATA, exampleElementData());
        element.putArray(TreeKeys.CHILDREN);
        element.put(TreeKeys.PARENT_ID, parentId);
        return element;
    }

    /** Mutable accumulator for one validation pass. */
    private static final class Collector {
        private final List<ValidationIssue> errors = new ArrayList<>();
        private final List<ValidationIssue> warnings = new ArrayList<>();
        private int elements;
        private boolean elementLimitReported;

        void error(ValidationIssue issue) {
            errors.add(issue);
        }

        void warning(ValidationIssue issue) {
            warnings.add(issue);
        }

        ValidationResult result() {
            return new ValidationResult(errors, warnings);
        }
    }
}
