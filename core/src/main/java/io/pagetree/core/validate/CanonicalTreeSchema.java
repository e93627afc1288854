package io.pagetree.core.validate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.pagetree.core.error.ResourceLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;

/**
 * Checks a canonicalized tree against the strict shape the downstream renderer accepts: integer
 * {@code _nextNodeId} of at least 1, object {@code exportedLookupTable}, literal {@code status},
 * literal root type, and a recursive element shape. Input trees go through {@link TreeValidator};
 * this check guards the canonicalizer's own output before it is persisted.
 *
 * <p>
 * The compiled schema is immutable and thread-safe.
 */
public final class CanonicalTreeSchema {

    public static final String DEFAULT_RESOURCE = "canonical-tree.schema.json";

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final JsonSchema schema;

    public CanonicalTreeSchema(JsonNode schemaNode) {
        this.schema = SCHEMA_FACTORY.getSchema(schemaNode);
    }

    /** Loads the bundled schema from the classpath. */
    public static CanonicalTreeSchema defaults() {
        return fromResource(DEFAULT_RESOURCE);
    }

    /**
     * Loads a schema from a classpath resource.
     *
     * @throws ResourceLoadException if the resource is missing or is not JSON
     */
    public static CanonicalTreeSchema fromResource(String resource) {
        ObjectMapper mapper = new ObjectMapper();
        try (InputStream in = CanonicalTreeSchema.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ResourceLoadException("Schema resource not found on classpath: " + resource, resource);
            }
            return new CanonicalTreeSchema(mapper.readTree(in));
        } catch (IOException e) {
            throw new ResourceLoadException("Failed to read schema resource: " + resource, e, resource);
        }
    }

    /** Violation messages for {@code tree}, sorted; empty when the tree conforms. */
    public List<String> check(JsonNode tree) {
        Set<ValidationMessage> messages = schema.validate(tree);
        return messages.stream().map(ValidationMessage::getMessage).sorted().toList();
    }

    public boolean conforms(JsonNode tree) {
        return check(tree).isEmpty();
    }
}
