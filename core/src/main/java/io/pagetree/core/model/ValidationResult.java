package io.pagetree.core.model;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of validating a tree: ordered errors (blocking) and warnings (non-blocking).
 *
 * <p>
 * Immutable, thread-safe.
 */
public record ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings) {

    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /** {@code true} when no errors were found; warnings do not affect validity. */
    public boolean valid() {
        return errors.isEmpty();
    }

    public int errorCount() {
        return errors.size();
    }

    public int warningCount() {
        return warnings.size();
    }

    /** Returns the first error with the given code, if any. */
    public Optional<ValidationIssue> findError(String code) {
        return errors.stream().filter(e -> e.code().equals(code)).findFirst();
    }

    /** Returns the first warning with the given code, if any. */
    public Optional<ValidationIssue> findWarning(String code) {
        return warnings.stream().filter(w -> w.code().equals(code)).findFirst();
    }

    /** Renders {@code {valid, errors, warnings, error_count, warning_count}}. */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("valid", valid());
        node.set("errors", issuesToJson(errors));
        node.set("warnings", issuesToJson(warnings));
        node.put("error_count", errorCount());
        node.put("warning_count", warningCount());
        return node;
    }

    static ArrayNode issuesToJson(List<ValidationIssue> issues) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        issues.forEach(issue -> array.add(issue.toJson()));
        return array;
    }
}
