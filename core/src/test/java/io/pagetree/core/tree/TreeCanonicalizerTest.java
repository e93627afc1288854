package io.pagetree.core.tree;

import static io.pagetree.core.testkit.TestTrees.json;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pagetree.core.testkit.TestTrees;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

@DisplayName("TreeCanonicalizer")
class TreeCanonicalizerTest {

    private final TreeCanonicalizer canonicalizer = new TreeCanonicalizer();

    static Stream<String> trees() {
        return Stream.of(
                TestTrees.SINGLE_HEADING,
                TestTrees.SECTION_TREE,
                "{\"root\":{\"id\":\"el-root\"}}",
                "{\"root\":{\"id\":1,\"data\":{\"type\":\"OxygenElements\\\\Root\",\"properties\":[]},\"children\":[]},"
                        + "\"exportedLookupTable\":[\"a\"]}",
                "[{\"id\":3,\"children\":[]}]",
                "{\"not\":\"a tree\"}");
    }

    @ParameterizedTest
    @MethodSource("trees")
    @DisplayName("Canonicalizing twice equals canonicalizing once")
    void idempotent(String text) {
        JsonNode once = canonicalizer.ensureTreeIntegrity(json(text));
        JsonNode twice = canonicalizer.ensureTreeIntegrity(once);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    @DisplayName("Single-heading tree gains _nextNodeId 101 and an empty lookup table")
    void endToEndScenario() {
        JsonNode input = json(TestTrees.SINGLE_HEADING);

        JsonNode canonical = canonicalizer.ensureTreeIntegrity(input);

        assertThat(canonical.get("_nextNodeId").asLong()).isEqualTo(101);
        assertThat(canonical.get("exportedLookupTable").isObject()).isTrue();
        assertThat(canonical.get("exportedLookupTable").isEmpty()).isTrue();
        assertThat(canonical.get("status").asText()).isEqualTo("exported");
        assertThat(canonical.at("/root/children/0/data/properties/content/content/text").asText())
                .isEqualTo("Hi");
        assertThat(input.has("_nextNodeId")).as("input untouched").isFalse();
    }

    @Nested
    @DisplayName("Root normalization")
    class RootNormalization {

        @Test
        void namespacedRootTypeBecomesLiteralRoot() {
            JsonNode canonical = canonicalizer.ensureTreeIntegrity(
                    json("{\"root\":{\"id\":1,\"data\":{\"type\":\"EssentialElements\\\\Root\"},\"children\":[]}}"));

            assertThat(canonical.at("/root/data/type").asText()).isEqualTo("root");
            assertThat(canonical.at("/root/data/properties").isNull()).isTrue();
        }

        @Test
        void emptyPropertiesBecomeNullButContentIsKept() {
            JsonNode empty = canonicalizer.ensureTreeIntegrity(
                    json("{\"root\":{\"id\":1,\"data\":{\"type\":\"root\",\"properties\":{}},\"children\":[]}}"));
            JsonNode filled = canonicalizer.ensureTreeIntegrity(json(
                    "{\"root\":{\"id\":1,\"data\":{\"type\":\"root\",\"properties\":{\"a\":1}},\"children\":[]}}"));

            assertThat(empty.at("/root/data/properties").isNull()).isTrue();
            assertThat(filled.at("/root/data/properties/a").asInt()).isEqualTo(1);
        }

        @Test
        void missingDataAndChildrenAreAdded() {
            JsonNode canonical = canonicalizer.ensureTreeIntegrity(json("{\"root\":{\"id\":1}}"));

            assertThat(canonical.at("/root/data/type").asText()).isEqualTo("root");
            assertThat(canonical.at("/root/children").isArray()).isTrue();
        }

        @Test
        void arrayLookupTableBecomesObject() {
            JsonNode canonical = canonicalizer.ensureTreeIntegrity(
                    json("{\"root\":{\"id\":1,\"children\":[]},\"exportedLookupTable\":[]}"));

            assertThat(canonical.get("exportedLookupTable").isObject()).isTrue();
        }
    }

    @Nested
    @DisplayName("Parent links")
    class ParentLinks {

        @Test
        @DisplayName("A plain parentId is renamed to _parentId")
        void aliasIsRenamed() {
            JsonNode canonical = canonicalizer.ensureTreeIntegrity(json(TestTrees.SINGLE_HEADING));

            JsonNode heading = canonical.at("/root/children/0");
            assertThat(heading.get("_parentId").asInt()).isEqualTo(1);
            assertThat(heading.has("parentId")).isFalse();
        }

        @Test
        @DisplayName("A missing link is filled from the containing element")
        void missingLinkFilledFromContainer() {
            JsonNode canonical = canonicalizer.ensureTreeIntegrity(json("""
                    {"root": {"id": "el-root", "children": [
                      {"id": "el-0000000a", "children": [{"id": 7, "children": []}]}
                    ]}}
                    """));

            assertThat(canonical.at("/root/children/0/_parentId").asText()).isEqualTo("el-root");
            JsonNode grandchild = canonical.at("/root/children/0/children/0");
            assertThat(grandchild.get("_parentId").isTextual()).isTrue();
            assertThat(grandchild.get("_parentId").asText()).isEqualTo("el-0000000a");
        }

        @Test
        @DisplayName("An authored _parentId wins over the alias, even when wrong")
        void authoredLinkKept() {
            JsonNode canonical = canonicalizer.ensureTreeIntegrity(json(
                    "{\"root\":{\"id\":1,\"children\":[{\"id\":2,\"children\":[],\"_parentId\":9,\"parentId\":1}]}}"));

            assertThat(canonical.at("/root/children/0/_parentId").asInt()).isEqualTo(9);
            assertThat(canonical.at("/root/children/0").has("parentId")).isFalse();
        }
    }

    @Nested
    @DisplayName("Authored _nextNodeId")
    class AuthoredCounter {

        @Test
        @DisplayName("A counter at or below an existing id is recomputed")
        void tooSmallCounterRecomputed() {
            ObjectNode tree = TestTrees.object(TestTrees.SECTION_TREE);
            tree.put("_nextNodeId", 12);

            assertThat(canonicalizer.ensureTreeIntegrity(tree).get("_nextNodeId").asLong()).isEqualTo(13);
        }

        @Test
        @DisplayName("A non-integer counter is recomputed")
        void nonIntegerCounterRecomputed() {
            ObjectNode tree = TestTrees.object(TestTrees.SECTION_TREE);
            tree.put("_nextNodeId", "abc");
            JsonNode fromText = canonicalizer.ensureTreeIntegrity(tree);
            tree.put("_nextNodeId", 20.5);
            JsonNode fromDecimal = canonicalizer.ensureTreeIntegrity(tree);

            assertThat(fromText.get("_nextNodeId").isIntegralNumber()).isTrue();
            assertThat(fromText.get("_nextNodeId").asLong()).isEqualTo(13);
            assertThat(fromDecimal.get("_nextNodeId").asLong()).isEqualTo(13);
        }
    }

    @Test
    @DisplayName("Authored _nextNodeId and status are kept")
    void existingComputedFieldsKept() {
        JsonNode canonical = canonicalizer.ensureTreeIntegrity(
                json("{\"root\":{\"id\":1,\"children\":[]},\"_nextNodeId\":500,\"status\":\"draft\"}"));

        assertThat(canonical.get("_nextNodeId").asLong()).isEqualTo(500);
        assertThat(canonical.get("status").asText()).isEqualTo("draft");
    }

    @Test
    @DisplayName("A value without a root object is returned unchanged")
    void notATreeReturnedAsGiven() {
        JsonNode classic = json("[{\"id\":3,\"children\":[]}]");

        assertThat(canonicalizer.ensureTreeIntegrity(classic)).isEqualTo(classic);
    }

    @Nested
    @DisplayName("calculateNextNodeId")
    class NextNodeId {

        @Test
        void emptyTreeYieldsOne() {
            ObjectNode empty = canonicalizer.createEmptyTree();

            assertThat(canonicalizer.calculateNextNodeId(empty)).isEqualTo(1);
            assertThat(canonicalizer.calculateNextNodeId(json("{}"))).isEqualTo(1);
        }

        @Test
        void mixedIdsUseTrailingDigits() {
            JsonNode tree = json("""
                    {"root": {"id": 1, "children": [
                      {"id": "el-0000002a", "children": []},
                      {"id": 7, "children": [{"id": "el-abc19", "children": []}]},
                      {"id": "el-root", "children": []}
                    ]}}
                    """);

            assertThat(canonicalizer.calculateNextNodeId(tree)).isEqualTo(20);
        }

        @Test
        void exceedsEveryId() {
            JsonNode canonical = canonicalizer.ensureTreeIntegrity(json(TestTrees.SECTION_TREE));

            assertThat(canonical.get("_nextNodeId").asLong()).isEqualTo(13);
        }

        @Test
        void classicArrayIdsCount() {
            assertThat(canonicalizer.calculateNextNodeId(json("[{\"id\":41},{\"id\":\"el-8\"}]")))
                    .isEqualTo(42);
        }
    }

    @Test
    @DisplayName("createEmptyTree composes with ensureTreeIntegrity")
    void emptyTreeComposes() {
        ObjectNode empty = canonicalizer.createEmptyTree();

        assertThat(empty.has("status")).isFalse();
        assertThat(empty.at("/root/id").asText()).isEqualTo("el-root");
        assertThat(empty.get("_nextNodeId").asLong()).isEqualTo(1);

        JsonNode canonical = canonicalizer.ensureTreeIntegrity(empty);
        assertThat(canonical.get("status").asText()).isEqualTo("exported");
        assertThat(canonical.get("exportedLookupTable").isObject()).isTrue();
        assertThat(canonical.get("_nextNodeId").asLong()).isEqualTo(1);
    }
}
