package io.pagetree.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;

/**
 * One finding of the tree validator. Errors block persistence, warnings are advisory; both share
 * this shape so callers can batch-report everything in one round trip.
 *
 * <p>
 * Immutable, thread-safe.
 *
 * @param code        machine-readable issue code (e.g. {@code missing_element_id})
 * @param path        dotted path into the tree (e.g. {@code root.children[0].data.type})
 * @param message     human-readable description
 * @param expected    expected type or value, may be null
 * @param example     a valid example value, may be null (JSON null examples are {@code NullNode})
 * @param actual      offending value for mismatch findings, may be null
 * @param action      corrective action, may be null
 * @param suggestions ranked replacement candidates, empty when there are none
 */
public record ValidationIssue(
        String code,
        String path,
        String message,
        JsonNode expected,
        JsonNode example,
        JsonNode actual,
        String action,
        List<String> suggestions) {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public ValidationIssue {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(message, "message must not be null");
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    /** Creates a structural finding with an expected type description and an example value. */
    public static ValidationIssue of(String code, String path, String message, String expected, JsonNode example) {
        return new ValidationIssue(
                code, path, message, expected != null ? NODES.textNode(expected) : null, example, null, null, null);
    }

    /** Creates an advisory finding that carries a corrective action instead of an example. */
    public static ValidationIssue advisory(String code, String path, String message, String action) {
        return new ValidationIssue(code, path, message, null, null, null, action, null);
    }

    /** Returns a copy carrying the given corrective action. */
    public ValidationIssue withAction(String newAction) {
        return new ValidationIssue(code, path, message, expected, example, actual, newAction, suggestions);
    }

    /** Returns a copy carrying the offending value. */
    public ValidationIssue withActual(JsonNode newActual) {
        return new ValidationIssue(code, path, message, expected, example, newActual, action, suggestions);
    }

    /** Returns a copy carrying the given ranked suggestions. */
    public ValidationIssue withSuggestions(List<String> newSuggestions) {
        return new ValidationIssue(code, path, message, expected, example, actual, action, newSuggestions);
    }

    /**
     * Renders the caller-facing shape. {@code code}, {@code path} and {@code message} are always
     * present; {@code expected} and {@code example} are present whenever they were set (an explicit
     * null example renders as JSON {@code null}); optional fields are omitted when unset.
     */
    public ObjectNode toJson() {
        ObjectNode node = NODES.objectNode();
        node.put("code", code);
        node.put("path", path);
        node.put("message", message);
        if (expected != null) node.set("expected", expected);
        if (example != null) node.set("example", example);
        if (actual != null) node.set("actual", actual);
        if (action != null) node.put("action", action);
        if (!suggestions.isEmpty()) {
            var array = node.putArray("suggestions");
            suggestions.forEach(array::add);
        }
        return node;
    }
}
