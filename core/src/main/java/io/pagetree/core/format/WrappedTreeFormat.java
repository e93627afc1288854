package io.pagetree.core.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The envelope the builder's own save routine writes: {@code {"tree_json_string": "<json>"}}, where
 * the inner string holds the tree.
 */
public final class WrappedTreeFormat implements TreeFormat {

    public static final String ENVELOPE_KEY = "tree_json_string";

    private static final Logger LOG = LoggerFactory.getLogger(WrappedTreeFormat.class);

    private final ObjectMapper mapper;

    public WrappedTreeFormat(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String id() {
        return "wrapped";
    }

    @Override
    public Optional<JsonNode> tryParse(JsonNode raw) {
        JsonNode inner = raw.get(ENVELOPE_KEY);
        if (inner == null || !inner.isTextual()) {
            return Optional.empty();
        }
        try {
            JsonNode tree = mapper.readTree(inner.textValue());
            if (tree == null || !tree.isContainerNode()) {
                return Optional.empty();
            }
            return Optional.of(tree);
        } catch (JsonProcessingException e) {
            LOG.warn("Envelope '{}' does not contain valid JSON: {}", ENVELOPE_KEY, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /** Wraps an encoded tree into the envelope. */
    public String wrap(String encodedTree) {
        var envelope = mapper.createObjectNode();
        envelope.put(ENVELOPE_KEY, encodedTree);
        return envelope.toString();
    }
}
