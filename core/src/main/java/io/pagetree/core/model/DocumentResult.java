package io.pagetree.core.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * Outcome of a document operation. Exactly one of:
 *
 * <ul>
 * <li>{@link Type#SUCCESS}: {@code payload} holds the operation's response body.
 * <li>{@link Type#INVALID}: the submitted tree has validation errors; {@code validation} holds them
 * all.
 * <li>{@link Type#NOT_FOUND}: the document has no decodable tree.
 * <li>{@link Type#ELEMENT_NOT_FOUND}: the document exists but has no element with the requested id.
 * <li>{@link Type#REJECTED}: a rule refused the change; {@code code} names the rule.
 * <li>{@link Type#SAVE_FAILED}: the store did not accept the write; the previous version is kept.
 * </ul>
 */
public final class DocumentResult {

    /** The type of document outcome. */
    public enum Type {
        SUCCESS,
        INVALID,
        NOT_FOUND,
        ELEMENT_NOT_FOUND,
        REJECTED,
        SAVE_FAILED
    }

    public static final String CODE_INVALID_TREE = "invalid_tree";
    public static final String CODE_NOT_FOUND = "document_not_found";
    public static final String CODE_ELEMENT_NOT_FOUND = "element_not_found";
    public static final String CODE_SAVE_FAILED = "save_failed";

    private final Type type;
    private final long documentId;
    private final ObjectNode payload;
    private final ValidationResult validation;
    private final String code;
    private final String message;

    private DocumentResult(
            Type type, long documentId, ObjectNode payload, ValidationResult validation, String code, String message) {
        this.type = type;
        this.documentId = documentId;
        this.payload = payload;
        this.validation = validation;
        this.code = code;
        this.message = message;
    }

    public static DocumentResult success(long documentId, ObjectNode payload) {
        Objects.requireNonNull(payload, "payload must not be null for SUCCESS");
        return new DocumentResult(Type.SUCCESS, documentId, payload, null, null, null);
    }

    public static DocumentResult invalid(long documentId, ValidationResult validation) {
        Objects.requireNonNull(validation, "validation must not be null for INVALID");
        return new DocumentResult(
                Type.INVALID,
                documentId,
                null,
                validation,
                CODE_INVALID_TREE,
                "Tree validation failed with " + validation.errorCount() + " error(s)");
    }

    public static DocumentResult notFound(long documentId) {
        return new DocumentResult(
                Type.NOT_FOUND, documentId, null, null, CODE_NOT_FOUND, "Document " + documentId + " has no tree");
    }

    public static DocumentResult elementNotFound(long documentId, NodeId elementId) {
        return new DocumentResult(
                Type.ELEMENT_NOT_FOUND,
                documentId,
                null,
                null,
                CODE_ELEMENT_NOT_FOUND,
                "Element " + elementId + " not found in document " + documentId);
    }

    public static DocumentResult rejected(long documentId, String code, String message) {
        Objects.requireNonNull(code, "code must not be null for REJECTED");
        return new DocumentResult(Type.REJECTED, documentId, null, null, code, message);
    }

    public static DocumentResult saveFailed(long documentId) {
        return new DocumentResult(
                Type.SAVE_FAILED,
                documentId,
                null,
                null,
                CODE_SAVE_FAILED,
                "Failed to save document " + documentId);
    }

    public Type type() {
        return type;
    }

    public long documentId() {
        return documentId;
    }

    /** Response body. Only valid when {@code type() == SUCCESS}. */
    public ObjectNode payload() {
        return payload;
    }

    /** Validation findings. Only valid when {@code type() == INVALID}. */
    public ValidationResult validation() {
        return validation;
    }

    /** Machine-readable failure code, {@code null} on success. */
    public String code() {
        return code;
    }

    public String message() {
        return message;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    /**
     * Renders the caller-facing body. Success bodies are {@code {success:true, ...payload}};
     * failures carry {@code success:false}, {@code code}, {@code message} and {@code document_id},
     * and INVALID results add the validation shape ({@code valid, errors, warnings, error_count,
     * warning_count}).
     */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("success", isSuccess());
        if (isSuccess()) {
            node.setAll(payload.deepCopy());
            return node;
        }
        node.put("code", code);
        node.put("message", message);
        node.put("document_id", documentId);
        if (validation != null) {
            node.setAll(validation.toJson());
        }
        return node;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "DocumentResult[SUCCESS, document=" + documentId + "]";
            case INVALID -> "DocumentResult[INVALID, document=" + documentId + ", errors="
                    + validation.errorCount() + "]";
            default -> "DocumentResult[" + type + ", document=" + documentId + ", code=" + code + "]";
        };
    }
}
