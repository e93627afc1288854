package io.pagetree.core.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pagetree.core.model.NodeId;
import io.pagetree.core.spi.TypeVocabulary;
import java.security.SecureRandom;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Authors a document tree element by element.
 *
 * <p>
 * Elements are appended to the current parent, which starts as the root. Adding a container
 * element makes it the current parent until {@link #end()} is called:
 *
 * <pre>{@code
 * JsonNode tree = TreeBuilder.sequential(vocabulary)
 *         .createDocument()
 *         .addContainer("section", null)
 *             .addElement("heading", properties)
 *         .end()
 *         .build();
 * }</pre>
 *
 * <p>
 * Every element gets {@code id}, {@code data.type}, {@code data.properties}, {@code children} and a
 * {@code _parentId} naming its container. Unprefixed type names are resolved through the
 * {@link TypeVocabulary}; names it does not know are kept as given for the validator to report.
 *
 * <p>
 * Two id schemes are supported. {@link #sequential} numbers the root 1 and elements upward from the
 * tree's next free id, which is what the page builder itself writes. {@link #randomIds} gives every
 * element an {@code "el-"} id with 16 random hex digits, the form update tools use for elements they
 * create.
 *
 * <p>
 * Not thread-safe.
 */
public final class TreeBuilder {

    /** Prefix of generated string ids. */
    public static final String ID_PREFIX = "el-";

    static final long SEQUENTIAL_ROOT_ID = 1;

    private static final int RANDOM_ID_BYTES = 8;
    private static final HexFormat HEX = HexFormat.of();
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final TypeVocabulary vocabulary;
    private final TreeCanonicalizer canonicalizer = new TreeCanonicalizer();
    /** Source of string ids; {@code null} selects sequential integer ids. */
    private final Random random;

    private ObjectNode tree;
    private ObjectNode current;
    private final Deque<ObjectNode> parents = new ArrayDeque<>();
    private final Map<NodeId, ObjectNode> elements = new LinkedHashMap<>();
    private long nextSequentialId = SEQUENTIAL_ROOT_ID;

    private TreeBuilder(TypeVocabulary vocabulary, Random random) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary must not be null");
        this.random = random;
    }

    /** A builder that numbers the root 1 and each new element with the next free integer. */
    public static TreeBuilder sequential(TypeVocabulary vocabulary) {
        return new TreeBuilder(vocabulary, null);
    }

    /** A builder that gives every new element a random {@code "el-"} id. */
    public static TreeBuilder randomIds(TypeVocabulary vocabulary) {
        return new TreeBuilder(vocabulary, SECURE_RANDOM);
    }

    /** As {@link #randomIds(TypeVocabulary)}, drawing from {@code random}. */
    public static TreeBuilder randomIds(TypeVocabulary vocabulary, Random random) {
        return new TreeBuilder(vocabulary, Objects.requireNonNull(random, "random must not be null"));
    }

    /** A fresh {@code "el-"} id with 16 hex digits from a secure random source. */
    public static String generateElementId() {
        return generateElementId(SECURE_RANDOM);
    }

    static String generateElementId(Random random) {
        byte[] bytes = new byte[RANDOM_ID_BYTES];
        random.nextBytes(bytes);
        return ID_PREFIX + HEX.formatHex(bytes);
    }

    /**
     * Starts a new document with an empty root, discarding anything built so far. The root id is
     * 1 for sequential builders and {@code "el-root"} otherwise.
     */
    public TreeBuilder createDocument() {
        reset();
        tree = canonicalizer.createEmptyTree();
        ObjectNode root = (ObjectNode) tree.get(TreeKeys.ROOT);
        if (random == null) {
            root.put(TreeKeys.ID, SEQUENTIAL_ROOT_ID);
            nextSequentialId = SEQUENTIAL_ROOT_ID + 1;
        }
        current = root;
        return this;
    }

    /** Appends a leaf element of {@code type}. {@code properties} may be null. */
    public TreeBuilder addElement(String type, JsonNode properties) {
        return add(type, properties, false);
    }

    /** Appends a container element of {@code type} and makes it the current parent. */
    public TreeBuilder addContainer(String type, JsonNode properties) {
        return add(type, properties, true);
    }

    /**
     * Appends an element whose {@code data} is taken as given. {@code type} is filled in only when
     * {@code data} has none, and it is not resolved.
     *
     * @param container whether the element becomes the current parent
     */
    public TreeBuilder addRawElement(String type, ObjectNode data, boolean container) {
        Objects.requireNonNull(data, "data must not be null");
        ObjectNode copy = data.deepCopy();
        if (!copy.hasNonNull(TreeKeys.TYPE)) {
            copy.put(TreeKeys.TYPE, type);
        }
        return append(copy, container);
    }

    /** Makes the parent of the current container current again. At the root this does nothing. */
    public TreeBuilder end() {
        if (!parents.isEmpty()) {
            current = parents.pop();
        }
        return this;
    }

    /** Returns to the root. */
    public TreeBuilder endAll() {
        parents.clear();
        if (tree != null) {
            current = (ObjectNode) tree.get(TreeKeys.ROOT);
        }
        return this;
    }

    /**
     * Continues building on a copy of {@code existing}, canonicalized first so every element
     * carries its parent link. New elements are added under the root.
     *
     * @throws IllegalArgumentException if {@code existing} has no root object
     */
    public TreeBuilder importTree(JsonNode existing) {
        if (existing == null || !existing.path(TreeKeys.ROOT).isObject()) {
            throw new IllegalArgumentException("Tree to import must have a root object");
        }
        reset();
        tree = (ObjectNode) canonicalizer.ensureTreeIntegrity(existing);
        current = (ObjectNode) tree.get(TreeKeys.ROOT);
        TreeWalker.visit(current.get(TreeKeys.CHILDREN), (element, path, depth) ->
                NodeId.from(element.get(TreeKeys.ID)).ifPresent(id -> elements.putIfAbsent(id, element)));
        nextSequentialId = canonicalizer.calculateNextNodeId(tree);
        return this;
    }

    /** A copy of the element with {@code id}. The root is not an element. */
    public Optional<ObjectNode> getElement(NodeId id) {
        ObjectNode element = elements.get(id);
        return element == null ? Optional.empty() : Optional.of(element.deepCopy());
    }

    /** Ids of all elements in insertion order (pre-order for imported trees), root excluded. */
    public List<NodeId> elementIds() {
        return new ArrayList<>(elements.keySet());
    }

    public int elementCount() {
        return elements.size();
    }

    /**
     * The canonical tree built so far; an empty document when nothing was added. The builder keeps
     * its state, so more elements may be added and the tree built again.
     */
    public JsonNode build() {
        if (tree == null) {
            createDocument();
        }
        return canonicalizer.ensureTreeIntegrity(tree);
    }

    /** Discards the tree and all builder state. */
    public TreeBuilder reset() {
        tree = null;
        current = null;
        parents.clear();
        elements.clear();
        nextSequentialId = SEQUENTIAL_ROOT_ID;
        return this;
    }

    private TreeBuilder add(String type, JsonNode properties, boolean container) {
        Objects.requireNonNull(type, "type must not be null");
        ObjectNode data = NODES.objectNode();
        data.put(TreeKeys.TYPE, resolveType(type));
        if (properties == null || properties.isNull() || (properties.isContainerNode() && properties.isEmpty())) {
            data.putNull(TreeKeys.PROPERTIES);
        } else {
            data.set(TreeKeys.PROPERTIES, properties.deepCopy());
        }
        return append(data, container);
    }

    private TreeBuilder append(ObjectNode data, boolean container) {
        if (tree == null) {
            createDocument();
        }
        JsonNode id = nextId();
        ObjectNode element = NODES.objectNode();
        element.set(TreeKeys.ID, id);
        element.set(TreeKeys.DATA, data);
        element.putArray(TreeKeys.CHILDREN);
        JsonNode parentId = current.get(TreeKeys.ID);
        if (parentId != null && !parentId.isNull()) {
            element.set(TreeKeys.PARENT_ID, parentId.deepCopy());
        }

        JsonNode children = current.get(TreeKeys.CHILDREN);
        if (children == null || !children.isArray()) {
            children = current.putArray(TreeKeys.CHILDREN);
        }
        ((ArrayNode) children).add(element);
        NodeId.from(id).ifPresent(key -> elements.put(key, element));

        if (container) {
            parents.push(current);
            current = element;
        }
        return this;
    }

    private JsonNode nextId() {
        if (random == null) {
            return NODES.numberNode(nextSequentialId++);
        }
        String id;
        do {
            id = generateElementId(random);
        } while (elements.containsKey(NodeId.of(id)));
        return NODES.textNode(id);
    }

    private String resolveType(String type) {
        if (type.indexOf('\\') >= 0) {
            return type;
        }
        return vocabulary.resolveShortName(type).orElse(type);
    }
}
