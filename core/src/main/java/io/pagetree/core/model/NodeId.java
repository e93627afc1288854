package io.pagetree.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifier of a tree node. Elements contributed by the page builder carry integer ids, elements
 * created by update tools carry string ids ({@code "el-3f2a9b1c"}), and fresh empty trees use the
 * sentinel {@code "el-root"}. Both forms are preserved as authored.
 *
 * <p>
 * Two ids denote the same node when their string forms are equal, so {@code 12} and {@code "12"}
 * are equal.
 *
 * <p>
 * Immutable, thread-safe.
 */
public final class NodeId {

    private static final Pattern TRAILING_DIGITS = Pattern.compile("(\\d+)$");

    private final String value;
    private final boolean numeric;

    private NodeId(String value, boolean numeric) {
        this.value = value;
        this.numeric = numeric;
    }

    /** Creates an integer id. */
    public static NodeId of(long id) {
        return new NodeId(Long.toString(id), true);
    }

    /** Creates a string id. */
    public static NodeId of(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return new NodeId(id, false);
    }

    /**
     * Reads an id from a JSON value. Integral numbers become integer ids, non-empty strings become
     * string ids; anything else (missing, null, objects, fractional numbers) yields empty.
     *
     * @param node the {@code id} value of a node, may be null
     * @return the parsed id, or empty if the value is not an id
     */
    public static Optional<NodeId> from(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Optional.empty();
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return Optional.of(of(node.longValue()));
        }
        if (node.isTextual() && !node.textValue().isEmpty()) {
            return Optional.of(of(node.textValue()));
        }
        return Optional.empty();
    }

    /**
     * Parses a command-line or path-segment id: all-digit strings become integer ids, everything
     * else a string id.
     */
    public static NodeId parse(String raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        String trimmed = raw.trim();
        if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit) && trimmed.length() < 19) {
            return of(Long.parseLong(trimmed));
        }
        return of(trimmed);
    }

    /** {@code true} if this id was authored as a JSON integer. */
    public boolean isNumeric() {
        return numeric;
    }

    /** The string form used for identity comparison. */
    public String asString() {
        return value;
    }

    /**
     * Numeric value used by the next-node-id counter: the integer itself, the value of a numeric
     * string, or the trailing digit group of any other string ({@code "el-42"} → 42).
     */
    public OptionalLong numericValue() {
        if (numeric) {
            return OptionalLong.of(Long.parseLong(value));
        }
        Matcher matcher = TRAILING_DIGITS.matcher(value);
        if (!matcher.find()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(matcher.group(1)));
        } catch (NumberFormatException e) {
            // digit run wider than a long
            return OptionalLong.empty();
        }
    }

    /** Renders the id with its original JSON type. */
    public JsonNode toJson() {
        return numeric
                ? JsonNodeFactory.instance.numberNode(Long.parseLong(value))
                : JsonNodeFactory.instance.textNode(value);
    }

    /** {@code true} if the given JSON value is an id with the same string form. */
    public boolean matches(JsonNode idNode) {
        return from(idNode).map(this::equals).orElse(false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeId)) return false;
        return value.equals(((NodeId) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
