package io.pagetree.core.format;

import com.fasterxml.jackson.databind.JsonNode;
import io.pagetree.core.tree.TreeKeys;
import java.util.Optional;

/** A bare tree object with a {@code root} object. */
public final class ModernTreeFormat implements TreeFormat {

    @Override
    public String id() {
        return "modern";
    }

    @Override
    public Optional<JsonNode> tryParse(JsonNode raw) {
        return raw.isObject() && raw.path(TreeKeys.ROOT).isObject() ? Optional.of(raw) : Optional.empty();
    }
}
