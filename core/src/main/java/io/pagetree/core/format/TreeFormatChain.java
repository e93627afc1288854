package io.pagetree.core.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered list of {@link TreeFormat} strategies, tried until one recognizes the stored value.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class TreeFormatChain {

    private static final Logger LOG = LoggerFactory.getLogger(TreeFormatChain.class);

    private final ObjectMapper mapper;
    private final List<TreeFormat> formats;

    public TreeFormatChain(ObjectMapper mapper, List<TreeFormat> formats) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.formats = List.copyOf(formats);
    }

    /** The default chain: wrapped envelope, then modern tree, then classic element list. */
    public static TreeFormatChain defaults(ObjectMapper mapper) {
        return new TreeFormatChain(
                mapper, List.of(new WrappedTreeFormat(mapper), new ModernTreeFormat(), new ClassicTreeFormat()));
    }

    public List<TreeFormat> formats() {
        return formats;
    }

    /**
     * Decodes a stored string. A JSON string whose content is itself JSON is unwrapped one level,
     * as some writers double-encode. Unparseable input yields empty.
     */
    public Optional<JsonNode> decode(String stored) {
        if (stored == null || stored.isBlank()) {
            return Optional.empty();
        }
        JsonNode raw;
        try {
            raw = mapper.readTree(stored);
            if (raw != null && raw.isTextual()) {
                raw = mapper.readTree(raw.textValue());
            }
        } catch (JsonProcessingException e) {
            LOG.warn("Stored document is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        return decode(raw);
    }

    /** Tries each format in order on an already parsed value. */
    public Optional<JsonNode> decode(JsonNode raw) {
        if (raw == null || raw.isMissingNode() || raw.isNull()) {
            return Optional.empty();
        }
        for (TreeFormat format : formats) {
            Optional<JsonNode> tree = format.tryParse(raw);
            if (tree.isPresent()) {
                LOG.debug("Stored document decoded as '{}' format", format.id());
                return tree;
            }
        }
        LOG.debug("No tree format recognized the stored value (node type {})", raw.getNodeType());
        return Optional.empty();
    }
}
