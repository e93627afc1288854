package io.pagetree.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pagetree.core.classes.ElementClasses;
import io.pagetree.core.error.ClassOperationException;
import io.pagetree.core.error.TreeEncodeException;
import io.pagetree.core.format.TreeFormatChain;
import io.pagetree.core.format.WrappedTreeFormat;
import io.pagetree.core.model.BuilderMode;
import io.pagetree.core.model.DocumentResult;
import io.pagetree.core.model.FlatElement;
import io.pagetree.core.model.NodeId;
import io.pagetree.core.model.ValidationIssue;
import io.pagetree.core.model.ValidationResult;
import io.pagetree.core.spi.CacheInvalidator;
import io.pagetree.core.spi.DocumentListener;
import io.pagetree.core.spi.DocumentStore;
import io.pagetree.core.tree.TreeCanonicalizer;
import io.pagetree.core.tree.TreeFlattener;
import io.pagetree.core.tree.TreeKeys;
import io.pagetree.core.tree.TreeWalker;
import io.pagetree.core.validate.CanonicalCheckMode;
import io.pagetree.core.validate.CanonicalTreeSchema;
import io.pagetree.core.validate.ElementTypeCatalog;
import io.pagetree.core.validate.TreeValidator;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Read/write contract of the engine: composes the format chain, canonicalizer, validator and
 * class mutator with the storage and cache-invalidation collaborators.
 *
 * <p>
 * Every write is a whole-tree read-modify-write. The service holds no cross-call state and takes
 * no locks; two writers to the same document race and the store keeps whichever write landed last.
 * Storage and invalidation outcomes are booleans; nothing is retried or rolled back.
 *
 * <p>
 * Thread-safe provided the collaborators are.
 */
public final class DocumentService {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentService.class);

    /** MDC key carrying the document id for the duration of a call. */
    public static final String MDC_DOCUMENT_ID = "documentId";

    public static final String CODE_SCHEMA_VIOLATION = "canonical_schema_violation";
    public static final String CODE_CACHE_INVALIDATION_FAILED = "cache_invalidation_failed";

    private final DocumentStore store;
    private final CacheInvalidator cacheInvalidator;
    private final TreeValidator validator;
    private final CanonicalTreeSchema canonicalSchema;
    private final CanonicalCheckMode checkMode;
    private final BuilderMode builderMode;
    private final DocumentListener listener;
    private final ObjectMapper mapper;
    private final TreeFormatChain formats;
    private final WrappedTreeFormat envelope;
    private final TreeCanonicalizer canonicalizer = new TreeCanonicalizer();

    /** Creates a service with the bundled vocabulary and schema, lenient schema checks and no listener. */
    public DocumentService(DocumentStore store, CacheInvalidator cacheInvalidator) {
        this(
                store,
                cacheInvalidator,
                new TreeValidator(ElementTypeCatalog.defaults()),
                CanonicalTreeSchema.defaults(),
                CanonicalCheckMode.LENIENT,
                BuilderMode.OXYGEN,
                null,
                new ObjectMapper());
    }

    /**
     * Creates a service with all options.
     *
     * @param listener optional write listener, may be {@code null}
     */
    public DocumentService(
            DocumentStore store,
            CacheInvalidator cacheInvalidator,
            TreeValidator validator,
            CanonicalTreeSchema canonicalSchema,
            CanonicalCheckMode checkMode,
            BuilderMode builderMode,
            DocumentListener listener,
            ObjectMapper mapper) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.cacheInvalidator = Objects.requireNonNull(cacheInvalidator, "cacheInvalidator must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.canonicalSchema = Objects.requireNonNull(canonicalSchema, "canonicalSchema must not be null");
        this.checkMode = Objects.requireNonNull(checkMode, "checkMode must not be null");
        this.builderMode = Objects.requireNonNull(builderMode, "builderMode must not be null");
        this.listener = listener; // nullable
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.formats = TreeFormatChain.defaults(mapper);
        this.envelope = new WrappedTreeFormat(mapper);
    }

    public BuilderMode builderMode() {
        return builderMode;
    }

    /**
     * Loads, decodes and canonicalizes a document. The payload carries {@code document_id},
     * {@code builder}, {@code tree} (or {@code elements} when {@code flatten}),
     * {@code element_count} and {@code element_types}.
     */
    public DocumentResult read(long documentId, boolean flatten) {
        return withDocumentId(documentId, () -> {
            Optional<JsonNode> tree = loadTree(documentId);
            if (tree.isEmpty()) {
                LOG.debug("document.read document_id={} outcome=not_found", documentId);
                return DocumentResult.notFound(documentId);
            }
            ObjectNode payload = basePayload(documentId);
            if (flatten) {
                ArrayNode elements = payload.putArray("elements");
                for (FlatElement element : TreeFlattener.flatten(tree.get())) {
                    elements.add(element.toJson());
                }
            } else {
                payload.set("tree", tree.get());
            }
            payload.put("element_count", TreeFlattener.countElements(tree.get()));
            ArrayNode types = payload.putArray("element_types");
            TreeFlattener.elementTypes(tree.get()).forEach(types::add);
            LOG.debug("document.read document_id={} flatten={}", documentId, flatten);
            return DocumentResult.success(documentId, payload);
        });
    }

    /** Validates {@code tree} without touching storage. */
    public ValidationResult validate(JsonNode tree) {
        return validator.validate(tree);
    }

    /**
     * Validates and persists a whole tree. Author-supplied {@code _nextNodeId} and
     * {@code exportedLookupTable} are dropped and recomputed. On success the cache is invalidated
     * (a second time when {@code regenerateCss}) and the stored tree is read back.
     */
    public DocumentResult update(long documentId, JsonNode tree, boolean regenerateCss) {
        return withDocumentId(documentId, () -> {
            ValidationResult validation = validator.validate(tree);
            if (!validation.valid()) {
                LOG.info(
                        "document.rejected document_id={} reason=invalid_tree errors={}",
                        documentId,
                        validation.errorCount());
                notifyRejected(
                        documentId,
                        "update",
                        DocumentResult.CODE_INVALID_TREE,
                        validation.errors().stream().map(ValidationIssue::code).toList());
                return DocumentResult.invalid(documentId, validation);
            }

            ObjectNode authored = tree.deepCopy();
            authored.remove(TreeKeys.NEXT_NODE_ID);
            authored.remove(TreeKeys.LOOKUP_TABLE);
            JsonNode canonical = canonicalizer.ensureTreeIntegrity(authored);

            Optional<DocumentResult> refused = persist(documentId, "update", canonical);
            if (refused.isPresent()) {
                return refused.get();
            }
            boolean invalidated = cacheInvalidator.invalidate(documentId);
            if (regenerateCss) {
                invalidated = cacheInvalidator.invalidate(documentId) && invalidated;
            }
            logInvalidation(documentId, invalidated);

            JsonNode stored = loadTree(documentId).orElse(canonical);
            int elementCount = TreeFlattener.countElements(stored);
            ObjectNode payload = basePayload(documentId);
            payload.set("tree", stored);
            payload.put("element_count", elementCount);
            payload.put("css_regenerated", invalidated);
            if (!validation.warnings().isEmpty()) {
                ArrayNode warnings = payload.putArray("warnings");
                validation.warnings().forEach(w -> warnings.add(w.toJson()));
            }
            LOG.info(
                    "document.saved document_id={} element_count={} warnings={}",
                    documentId,
                    elementCount,
                    validation.warningCount());
            notifySaved(documentId, "update", elementCount, validation.warningCount(), invalidated);
            return DocumentResult.success(documentId, payload);
        });
    }

    /** Persists a fresh, canonical tree with no elements, replacing whatever the document held. */
    public DocumentResult createEmpty(long documentId) {
        return withDocumentId(documentId, () -> {
            JsonNode tree = canonicalizer.ensureTreeIntegrity(canonicalizer.createEmptyTree());
            Optional<DocumentResult> refused = persist(documentId, "create", tree);
            if (refused.isPresent()) {
                return refused.get();
            }
            boolean invalidated = cacheInvalidator.invalidate(documentId);
            logInvalidation(documentId, invalidated);
            LOG.info("document.created document_id={}", documentId);
            notifySaved(documentId, "create", 0, 0, invalidated);
            ObjectNode payload = basePayload(documentId);
            payload.set("tree", tree);
            return DocumentResult.success(documentId, payload);
        });
    }

    /** Reports the classes of one element. */
    public DocumentResult classes(long documentId, NodeId elementId) {
        return withDocumentId(documentId, () -> {
            Optional<JsonNode> tree = loadTree(documentId);
            if (tree.isEmpty()) {
                return DocumentResult.notFound(documentId);
            }
            Optional<ObjectNode> element = TreeWalker.findById(TreeFlattener.elementSequence(tree.get()), elementId);
            if (element.isEmpty()) {
                return DocumentResult.elementNotFound(documentId, elementId);
            }
            return DocumentResult.success(documentId, classPayload(documentId, elementId, element.get()));
        });
    }

    /** Replaces the classes at the canonical path of one element. */
    public DocumentResult setClasses(long documentId, NodeId elementId, Collection<String> classes) {
        return mutateClasses(documentId, elementId, "set_classes", e -> ElementClasses.setClasses(e, classes));
    }

    /** Appends classes to one element's custom classes. */
    public DocumentResult addClasses(long documentId, NodeId elementId, Collection<String> classes) {
        return mutateClasses(documentId, elementId, "add_classes", e -> ElementClasses.addClasses(e, classes));
    }

    /** Removes one custom class from one element. */
    public DocumentResult deleteClass(long documentId, NodeId elementId, String className) {
        return mutateClasses(documentId, elementId, "delete_class", e -> ElementClasses.deleteClass(e, className));
    }

    /** Invalidates the generated CSS of a document that has content. */
    public DocumentResult regenerateCss(long documentId) {
        return withDocumentId(documentId, () -> {
            if (loadTree(documentId).isEmpty()) {
                return DocumentResult.notFound(documentId);
            }
            if (!cacheInvalidator.invalidate(documentId)) {
                LOG.warn("document.cache_invalidation_failed document_id={}", documentId);
                return DocumentResult.rejected(
                        documentId, CODE_CACHE_INVALIDATION_FAILED, "Cache invalidation was not accepted");
            }
            LOG.info("document.css_regenerated document_id={}", documentId);
            ObjectNode payload = basePayload(documentId);
            payload.put("css_regenerated", true);
            return DocumentResult.success(documentId, payload);
        });
    }

    private DocumentResult mutateClasses(
            long documentId, NodeId elementId, String operation, Consumer<ObjectNode> mutation) {
        Objects.requireNonNull(elementId, "elementId must not be null");
        return withDocumentId(documentId, () -> {
            Optional<JsonNode> tree = loadTree(documentId);
            if (tree.isEmpty()) {
                return DocumentResult.notFound(documentId);
            }
            JsonNode working = tree.get();
            Optional<ObjectNode> element = TreeWalker.findById(TreeFlattener.elementSequence(working), elementId);
            if (element.isEmpty()) {
                LOG.debug("document.{} document_id={} element_id={} outcome=element_not_found",
                        operation, documentId, elementId);
                return DocumentResult.elementNotFound(documentId, elementId);
            }
            try {
                mutation.accept(element.get());
            } catch (ClassOperationException e) {
                LOG.info(
                        "document.rejected document_id={} operation={} reason={} class={}",
                        documentId,
                        operation,
                        e.code(),
                        e.className());
                notifyRejected(documentId, operation, e.code(), List.of(e.code()));
                return DocumentResult.rejected(documentId, e.code(), e.getMessage());
            }

            JsonNode canonical = canonicalizer.ensureTreeIntegrity(working);
            Optional<DocumentResult> refused = persist(documentId, operation, canonical);
            if (refused.isPresent()) {
                return refused.get();
            }
            boolean invalidated = cacheInvalidator.invalidate(documentId);
            logInvalidation(documentId, invalidated);
            LOG.info("document.saved document_id={} operation={} element_id={}", documentId, operation, elementId);
            notifySaved(documentId, operation, TreeFlattener.countElements(canonical), 0, invalidated);
            return DocumentResult.success(documentId, classPayload(documentId, elementId, element.get()));
        });
    }

    /** Loads the primary key, then the legacy key, and canonicalizes whatever decodes first. */
    private Optional<JsonNode> loadTree(long documentId) {
        Optional<JsonNode> decoded = store.load(documentId).flatMap(formats::decode);
        if (decoded.isEmpty()) {
            decoded = store.loadLegacy(documentId).flatMap(formats::decode);
            decoded.ifPresent(t -> LOG.debug("document.read document_id={} source=legacy", documentId));
        }
        return decoded.map(canonicalizer::ensureTreeIntegrity);
    }

    /** Schema-checks, encodes and saves; returns a refusal result, or empty when the write landed. */
    private Optional<DocumentResult> persist(long documentId, String operation, JsonNode canonical) {
        List<String> violations = canonicalSchema.check(canonical);
        if (!violations.isEmpty()) {
            if (checkMode == CanonicalCheckMode.STRICT) {
                LOG.warn(
                        "document.rejected document_id={} reason={} violations={}",
                        documentId,
                        CODE_SCHEMA_VIOLATION,
                        violations);
                notifyRejected(documentId, operation, CODE_SCHEMA_VIOLATION, List.of(CODE_SCHEMA_VIOLATION));
                return Optional.of(DocumentResult.rejected(
                        documentId,
                        CODE_SCHEMA_VIOLATION,
                        "Canonical tree does not match the renderer schema: " + String.join("; ", violations)));
            }
            LOG.warn("document.schema_violation document_id={} violations={}", documentId, violations);
        }

        if (!store.save(documentId, encode(documentId, canonical))) {
            LOG.warn("document.save_failed document_id={} operation={}", documentId, operation);
            notifyRejected(documentId, operation, DocumentResult.CODE_SAVE_FAILED, List.of());
            return Optional.of(DocumentResult.saveFailed(documentId));
        }
        return Optional.empty();
    }

    private String encode(long documentId, JsonNode tree) {
        try {
            return envelope.wrap(mapper.writeValueAsString(tree));
        } catch (JsonProcessingException e) {
            throw new TreeEncodeException("Failed to encode tree: " + e.getOriginalMessage(), e, documentId);
        }
    }

    private ObjectNode basePayload(long documentId) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("document_id", documentId);
        payload.put("builder", builderMode.builderName());
        return payload;
    }

    private ObjectNode classPayload(long documentId, NodeId elementId, JsonNode element) {
        ObjectNode payload = basePayload(documentId);
        payload.set("element_id", elementId.toJson());
        payload.setAll(ElementClasses.read(element).toJson());
        return payload;
    }

    private void logInvalidation(long documentId, boolean invalidated) {
        if (!invalidated) {
            LOG.warn("document.cache_invalidation_failed document_id={}", documentId);
        }
    }

    private DocumentResult withDocumentId(long documentId, Supplier<DocumentResult> call) {
        MDC.put(MDC_DOCUMENT_ID, Long.toString(documentId));
        try {
            return call.get();
        } finally {
            MDC.remove(MDC_DOCUMENT_ID);
        }
    }

    // --- Listener notification (exceptions are caught and logged) ---

    private void notifySaved(long documentId, String operation, int elementCount, int warnings, boolean invalidated) {
        if (listener == null) return;
        try {
            listener.onDocumentSaved(new DocumentListener.DocumentSavedEvent(
                    documentId, operation, elementCount, warnings, invalidated));
        } catch (Exception e) {
            LOG.warn("DocumentListener.onDocumentSaved failed", e);
        }
    }

    private void notifyRejected(long documentId, String operation, String reason, List<String> codes) {
        if (listener == null) return;
        try {
            listener.onDocumentRejected(
                    new DocumentListener.DocumentRejectedEvent(documentId, operation, reason, codes));
        } catch (Exception e) {
            LOG.warn("DocumentListener.onDocumentRejected failed", e);
        }
    }
}
