package io.pagetree.core.validate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pagetree.core.error.ResourceLoadException;
import io.pagetree.core.spi.TypeVocabulary;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link TypeVocabulary} backed by a JSON catalog of the form
 * {@code {"namespaces": [...], "types": [...], "aliases": {...}}}. The default catalog ships as the
 * classpath resource {@code element-types.json}.
 *
 * <p>
 * Immutable, thread-safe.
 */
public final class ElementTypeCatalog implements TypeVocabulary {

    public static final String DEFAULT_RESOURCE = "element-types.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> namespaces;
    private final List<String> types;
    private final Set<String> typeSet;
    private final Map<String, String> byLowerShortName;

    public ElementTypeCatalog(List<String> namespaces, List<String> types, Map<String, String> aliases) {
        this.namespaces = List.copyOf(namespaces);
        this.types = List.copyOf(types);
        this.typeSet = Collections.unmodifiableSet(new HashSet<>(types));

        Map<String, String> index = new LinkedHashMap<>();
        aliases.forEach((alias, type) -> index.put(alias.toLowerCase(Locale.ROOT), type));
        for (String type : this.types) {
            // first namespace wins for short names defined under both
            index.putIfAbsent(shortName(type).toLowerCase(Locale.ROOT), type);
        }
        this.byLowerShortName = Collections.unmodifiableMap(index);
    }

    /**
     * Loads the bundled catalog.
     *
     * @throws ResourceLoadException if the resource is missing or malformed
     */
    public static ElementTypeCatalog defaults() {
        return fromResource(DEFAULT_RESOURCE);
    }

    /**
     * Loads a catalog from a classpath resource.
     *
     * @throws ResourceLoadException if the resource is missing or malformed
     */
    public static ElementTypeCatalog fromResource(String resource) {
        try (InputStream in = ElementTypeCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ResourceLoadException("Element type catalog not found on classpath: " + resource, resource);
            }
            return fromJson(MAPPER.readTree(in), resource);
        } catch (IOException e) {
            throw new ResourceLoadException("Failed to read element type catalog: " + resource, e, resource);
        }
    }

    static ElementTypeCatalog fromJson(JsonNode root, String source) {
        JsonNode namespaces = root.path("namespaces");
        JsonNode types = root.path("types");
        if (!namespaces.isArray() || namespaces.isEmpty() || !types.isArray() || types.isEmpty()) {
            throw new ResourceLoadException(
                    "Element type catalog must define non-empty 'namespaces' and 'types' arrays", source);
        }
        List<String> namespaceList = textValues(namespaces, "namespaces", source);
        List<String> typeList = textValues(types, "types", source);
        for (String type : typeList) {
            if (namespaceList.stream().noneMatch(type::startsWith)) {
                throw new ResourceLoadException(
                        "Type '" + type + "' does not start with any declared namespace", source);
            }
        }
        Map<String, String> aliases = new LinkedHashMap<>();
        root.path("aliases").fields().forEachRemaining(entry -> {
            String target = entry.getValue().asText();
            if (!typeList.contains(target)) {
                throw new ResourceLoadException(
                        "Alias '" + entry.getKey() + "' points to unknown type '" + target + "'", source);
            }
            aliases.put(entry.getKey(), target);
        });
        return new ElementTypeCatalog(namespaceList, typeList, aliases);
    }

    private static List<String> textValues(JsonNode array, String field, String source) {
        List<String> values = new ArrayList<>();
        for (JsonNode value : array) {
            if (!value.isTextual() || value.textValue().isEmpty()) {
                throw new ResourceLoadException("'" + field + "' must contain only non-empty strings", source);
            }
            values.add(value.textValue());
        }
        return values;
    }

    @Override
    public List<String> namespaces() {
        return namespaces;
    }

    @Override
    public List<String> types() {
        return types;
    }

    @Override
    public boolean isKnown(String type) {
        return typeSet.contains(type);
    }

    @Override
    public Optional<String> resolveShortName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byLowerShortName.get(name.trim().toLowerCase(Locale.ROOT)));
    }
}
