package io.pagetree.core.format;

import com.fasterxml.jackson.databind.JsonNode;
import io.pagetree.core.tree.TreeKeys;
import java.util.Optional;

/**
 * The pre-6 storage shape: an array of element objects, or a single element object with
 * {@code id} or {@code children} at the top level. Returned as stored; such trees have no root and
 * pass through canonicalization unchanged.
 */
public final class ClassicTreeFormat implements TreeFormat {

    @Override
    public String id() {
        return "classic";
    }

    @Override
    public Optional<JsonNode> tryParse(JsonNode raw) {
        if (raw.isArray() && !raw.isEmpty() && raw.get(0).isObject()) {
            return Optional.of(raw);
        }
        if (raw.isObject() && !raw.has(TreeKeys.ROOT) && (raw.has(TreeKeys.ID) || raw.has(TreeKeys.CHILDREN))) {
            return Optional.of(raw);
        }
        return Optional.empty();
    }
}
