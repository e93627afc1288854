package io.pagetree.core.format;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * One storage shape a document tree may arrive in. Implementations are pure: they either
 * recognize the value and return the tree it holds, or return empty so the next format can try.
 */
public interface TreeFormat {

    /** Short identifier used in logs (e.g. {@code "wrapped"}). */
    String id();

    /**
     * @param raw a decoded stored value, never null
     * @return the tree held by {@code raw}, or empty if this format does not apply
     */
    Optional<JsonNode> tryParse(JsonNode raw);
}
