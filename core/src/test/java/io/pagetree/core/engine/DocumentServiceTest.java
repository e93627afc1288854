package io.pagetree.core.engine;

import static io.pagetree.core.testkit.TestTrees.json;
import static io.pagetree.core.testkit.TestTrees.object;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pagetree.core.format.WrappedTreeFormat;
import io.pagetree.core.model.BuilderMode;
import io.pagetree.core.model.DocumentResult;
import io.pagetree.core.model.NodeId;
import io.pagetree.core.spi.CacheInvalidator;
import io.pagetree.core.spi.DocumentListener;
import io.pagetree.core.testkit.InMemoryDocumentStore;
import io.pagetree.core.testkit.TestTrees;
import io.pagetree.core.validate.CanonicalCheckMode;
import io.pagetree.core.validate.CanonicalTreeSchema;
import io.pagetree.core.validate.ElementTypeCatalog;
import io.pagetree.core.validate.TreeValidator;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@DisplayName("DocumentService")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DocumentServiceTest {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final long DOC = 42;

    @Mock
    private CacheInvalidator cache;

    private InMemoryDocumentStore store;
    private CapturingListener listener;
    private DocumentService service;

    @BeforeEach
    void setUp() {
        when(cache.invalidate(anyLong())).thenReturn(true);
        store = new InMemoryDocumentStore();
        listener = new CapturingListener();
        service = service(CanonicalCheckMode.LENIENT);
    }

    private DocumentService service(CanonicalCheckMode mode) {
        return new DocumentService(
                store,
                cache,
                new TreeValidator(ElementTypeCatalog.defaults()),
                CanonicalTreeSchema.defaults(),
                mode,
                BuilderMode.BREAKDANCE,
                listener,
                JSON);
    }

    private JsonNode storedTree() throws Exception {
        JsonNode envelope = JSON.readTree(store.raw(DOC));
        return JSON.readTree(envelope.get(WrappedTreeFormat.ENVELOPE_KEY).asText());
    }

    @Nested
    @DisplayName("read")
    class Read {

        @Test
        void absentDocumentIsNotFound() {
            DocumentResult result = service.read(DOC, false);

            assertThat(result.type()).isEqualTo(DocumentResult.Type.NOT_FOUND);
        }

        @Test
        void storedTreeIsCanonicalizedOnRead() {
            store.put(DOC, new WrappedTreeFormat(JSON).wrap(TestTrees.SECTION_TREE));

            DocumentResult result = service.read(DOC, false);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.payload().get("document_id").asLong()).isEqualTo(DOC);
            assertThat(result.payload().get("builder").asText()).isEqualTo("Breakdance");
            assertThat(result.payload().at("/tree/_nextNodeId").asLong()).isEqualTo(13);
            assertThat(result.payload().get("element_count").asInt()).isEqualTo(3);
            assertThat(result.payload().get("element_types")).hasSize(3);
        }

        @Test
        void flattenReturnsElements() {
            store.put(DOC, TestTrees.SECTION_TREE);

            DocumentResult result = service.read(DOC, true);

            assertThat(result.payload().has("tree")).isFalse();
            assertThat(result.payload().get("elements")).hasSize(3);
            assertThat(result.payload().at("/elements/0/has_children").asBoolean()).isTrue();
        }

        @Test
        void legacyKeyIsTheFallback() {
            store.put(DOC, "not json at all");
            store.putLegacy(DOC, "[{\"id\":1,\"children\":[]}]");

            DocumentResult result = service.read(DOC, false);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.payload().get("tree").isArray()).isTrue();
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        void validTreeIsCanonicalizedSavedAndInvalidated() throws Exception {
            DocumentResult result = service.update(DOC, json(TestTrees.SINGLE_HEADING), false);

            assertThat(result.isSuccess()).isTrue();
            JsonNode stored = storedTree();
            assertThat(stored.get("_nextNodeId").asLong()).isEqualTo(101);
            assertThat(stored.get("exportedLookupTable").isObject()).isTrue();
            assertThat(result.payload().get("element_count").asInt()).isEqualTo(1);
            assertThat(result.payload().has("warnings")).isFalse();
            verify(cache, times(1)).invalidate(DOC);
            assertThat(listener.saved).singleElement().satisfies(e -> {
                assertThat(e.operation()).isEqualTo("update");
                assertThat(e.elementCount()).isEqualTo(1);
            });
        }

        @Test
        void invalidTreeIsNotSaved() {
            DocumentResult result = service.update(DOC, json("{\"root\":{}}"), false);

            assertThat(result.type()).isEqualTo(DocumentResult.Type.INVALID);
            assertThat(result.validation().findError("missing_status")).isPresent();
            assertThat(result.toJson().get("error_count").asInt()).isEqualTo(result.validation().errorCount());
            assertThat(store.saveCount()).isZero();
            verify(cache, never()).invalidate(anyLong());
            assertThat(listener.rejected).singleElement().satisfies(e -> assertThat(e.codes())
                    .contains("missing_status"));
        }

        @Test
        @DisplayName("A plain parentId is stored and read back as _parentId")
        void parentLinkStoredUnderCanonicalKey() throws Exception {
            service.update(DOC, json(TestTrees.SINGLE_HEADING), false);

            JsonNode child = storedTree().at("/root/children/0");
            assertThat(child.get("_parentId").asInt()).isEqualTo(1);
            assertThat(child.has("parentId")).isFalse();
            JsonNode payload = service.read(DOC, false).payload();
            assertThat(payload.at("/tree/root/children/0").has("_parentId")).isTrue();
        }

        @Test
        void authoredComputedFieldsAreRecomputedAndWarned() throws Exception {
            ObjectNode tree = object(TestTrees.SINGLE_HEADING);
            tree.put("_nextNodeId", 3);
            tree.putArray("exportedLookupTable");

            DocumentResult result = service.update(DOC, tree, false);

            assertThat(storedTree().get("_nextNodeId").asLong()).isEqualTo(101);
            assertThat(storedTree().get("exportedLookupTable").isObject()).isTrue();
            assertThat(result.payload().get("warnings")).hasSize(2);
        }

        @Test
        void regenerateCssInvalidatesAgain() {
            service.update(DOC, json(TestTrees.SINGLE_HEADING), true);

            verify(cache, times(2)).invalidate(DOC);
        }

        @Test
        void refusedWriteIsSaveFailed() {
            store.put(DOC, TestTrees.SECTION_TREE);
            store.refuseWrites(true);

            DocumentResult result = service.update(DOC, json(TestTrees.SINGLE_HEADING), false);

            assertThat(result.type()).isEqualTo(DocumentResult.Type.SAVE_FAILED);
            assertThat(store.raw(DOC)).isEqualTo(TestTrees.SECTION_TREE);
            verify(cache, never()).invalidate(anyLong());
        }

        @Test
        void strictModeRefusesSchemaViolations() {
            // valid input, but non-null root properties survive canonicalization
            JsonNode tree = json("{\"root\":{\"id\":1,\"data\":{\"type\":\"root\",\"properties\":{\"a\":1}},"
                    + "\"children\":[]},\"status\":\"exported\"}");

            DocumentResult strict = service(CanonicalCheckMode.STRICT).update(DOC, tree, false);
            assertThat(strict.type()).isEqualTo(DocumentResult.Type.REJECTED);
            assertThat(strict.code()).isEqualTo(DocumentService.CODE_SCHEMA_VIOLATION);
            assertThat(store.saveCount()).isZero();

            DocumentResult lenient = service.update(DOC, tree, false);
            assertThat(lenient.isSuccess()).isTrue();
        }
    }

    @Test
    void createEmptyPersistsCanonicalEmptyTree() throws Exception {
        DocumentResult result = service.createEmpty(DOC);

        assertThat(result.isSuccess()).isTrue();
        JsonNode stored = storedTree();
        assertThat(stored.at("/root/id").asText()).isEqualTo("el-root");
        assertThat(stored.get("_nextNodeId").asLong()).isEqualTo(1);
        assertThat(stored.get("status").asText()).isEqualTo("exported");
    }

    @Nested
    @DisplayName("classes")
    class Classes {

        @BeforeEach
        void seed() {
            store.put(DOC, TestTrees.SECTION_TREE);
        }

        @Test
        void setThenReadBack() throws Exception {
            DocumentResult set = service.setClasses(DOC, NodeId.of(11), List.of("foo", "bar"));

            assertThat(set.isSuccess()).isTrue();
            assertThat(storedTree().at("/root/children/0/children/0/data/properties/attributes/className").asText())
                    .isEqualTo("foo bar");

            DocumentResult read = service.classes(DOC, NodeId.parse("11"));
            assertThat(read.payload().get("classes").toString()).contains("foo", "bar", "bde-heading");
            assertThat(read.payload().get("element_id").asInt()).isEqualTo(11);
        }

        @Test
        void addAndDelete() {
            service.setClasses(DOC, NodeId.of(12), List.of("a"));
            service.addClasses(DOC, NodeId.of(12), List.of("b"));

            DocumentResult deleted = service.deleteClass(DOC, NodeId.of(12), "a");

            assertThat(deleted.isSuccess()).isTrue();
            assertThat(deleted.payload().get("custom_classes").toString()).isEqualTo("[\"b\"]");
            verify(cache, times(3)).invalidate(DOC);
        }

        @Test
        void deletingBuiltInIsRejected() {
            DocumentResult result = service.deleteClass(DOC, NodeId.of(11), "bde-heading");

            assertThat(result.type()).isEqualTo(DocumentResult.Type.REJECTED);
            assertThat(result.code()).isEqualTo("builtin_class");
            assertThat(store.saveCount()).isZero();
        }

        @Test
        void deletingMissingClassIsRejected() {
            assertThat(service.deleteClass(DOC, NodeId.of(11), "ghost").code()).isEqualTo("class_not_found");
        }

        @Test
        void unknownElementAndDocumentAreDistinct() {
            assertThat(service.classes(DOC, NodeId.of(999)).type()).isEqualTo(DocumentResult.Type.ELEMENT_NOT_FOUND);
            assertThat(service.classes(7, NodeId.of(11)).type()).isEqualTo(DocumentResult.Type.NOT_FOUND);
            assertThat(service.setClasses(DOC, NodeId.of(999), List.of("x")).type())
                    .isEqualTo(DocumentResult.Type.ELEMENT_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("regenerateCss")
    class RegenerateCss {

        @Test
        void documentWithContentIsInvalidated() {
            store.put(DOC, TestTrees.SECTION_TREE);

            assertThat(service.regenerateCss(DOC).isSuccess()).isTrue();
            verify(cache).invalidate(DOC);
        }

        @Test
        void missingDocumentIsNotFound() {
            assertThat(service.regenerateCss(DOC).type()).isEqualTo(DocumentResult.Type.NOT_FOUND);
            verify(cache, never()).invalidate(anyLong());
        }

        @Test
        void refusedInvalidationIsReported() {
            store.put(DOC, TestTrees.SECTION_TREE);
            when(cache.invalidate(DOC)).thenReturn(false);

            assertThat(service.regenerateCss(DOC).code()).isEqualTo(DocumentService.CODE_CACHE_INVALIDATION_FAILED);
        }
    }

    @Test
    @DisplayName("A throwing listener does not affect the operation")
    void listenerFailureIsContained() {
        DocumentService withBadListener = new DocumentService(
                store,
                cache,
                new TreeValidator(ElementTypeCatalog.defaults()),
                CanonicalTreeSchema.defaults(),
                CanonicalCheckMode.LENIENT,
                BuilderMode.OXYGEN,
                new DocumentListener() {
                    @Override
                    public void onDocumentSaved(DocumentSavedEvent event) {
                        throw new IllegalStateException("boom");
                    }

                    @Override
                    public void onDocumentRejected(DocumentRejectedEvent event) {
                        throw new IllegalStateException("boom");
                    }
                },
                JSON);

        assertThat(withBadListener.update(DOC, json(TestTrees.SINGLE_HEADING), false).isSuccess())
                .isTrue();
        assertThat(withBadListener.update(DOC, json("{}"), false).type()).isEqualTo(DocumentResult.Type.INVALID);
    }

    @Test
    @DisplayName("Sequential writers: the last write wins")
    void lastWriterWins() throws Exception {
        service.update(DOC, json(TestTrees.SECTION_TREE), false);
        service.update(DOC, json(TestTrees.SINGLE_HEADING), false);

        assertThat(storedTree().at("/root/children/0/id").asInt()).isEqualTo(100);
    }

    private static final class CapturingListener implements DocumentListener {
        final List<DocumentSavedEvent> saved = new ArrayList<>();
        final List<DocumentRejectedEvent> rejected = new ArrayList<>();

        @Override
        public void onDocumentSaved(DocumentSavedEvent event) {
            saved.add(event);
        }

        @Override
        public void onDocumentRejected(DocumentRejectedEvent event) {
            rejected.add(event);
        }
    }
}
