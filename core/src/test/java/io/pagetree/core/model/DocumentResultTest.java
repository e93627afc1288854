package io.pagetree.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentResultTest {

    @Test
    void successMergesPayload() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("document_id", 5);
        ObjectNode json = DocumentResult.success(5, payload).toJson();

        assertThat(json.get("success").asBoolean()).isTrue();
        assertThat(json.get("document_id").asLong()).isEqualTo(5);
        assertThat(json.has("code")).isFalse();
    }

    @Test
    void invalidCarriesValidationShape() {
        ValidationResult validation =
                new ValidationResult(List.of(ValidationIssue.of("missing_root", "root", "m", "object", null)), null);
        DocumentResult result = DocumentResult.invalid(9, validation);
        ObjectNode json = result.toJson();

        assertThat(result.type()).isEqualTo(DocumentResult.Type.INVALID);
        assertThat(json.get("success").asBoolean()).isFalse();
        assertThat(json.get("code").asText()).isEqualTo("invalid_tree");
        assertThat(json.get("valid").asBoolean()).isFalse();
        assertThat(json.get("errors").get(0).get("code").asText()).isEqualTo("missing_root");
        assertThat(json.get("error_count").asInt()).isEqualTo(1);
    }

    @Test
    void notFoundOutcomesAreDistinct() {
        DocumentResult noDocument = DocumentResult.notFound(3);
        DocumentResult noElement = DocumentResult.elementNotFound(3, NodeId.of(44));

        assertThat(noDocument.type()).isNotEqualTo(noElement.type());
        assertThat(noDocument.code()).isEqualTo("document_not_found");
        assertThat(noElement.code()).isEqualTo("element_not_found");
        assertThat(noElement.message()).contains("44");
    }
}
