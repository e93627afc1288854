package io.pagetree.core.classes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pagetree.core.error.ClassOperationException;
import io.pagetree.core.model.ClassReport;
import io.pagetree.core.tree.JsonPaths;
import io.pagetree.core.tree.TreeKeys;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads and mutates the CSS classes of a single element.
 *
 * <p>
 * Classes may live under several property paths (relative to the element's {@code data}); all of
 * them are read, either as a whitespace-delimited string or as an array of strings. Writes go to
 * {@link #CANONICAL_PATH} only, as a space-joined string, so a class stored under a legacy path
 * stays there after {@link #setClasses}. {@link #deleteClass} is the exception: it also strips the
 * deleted name from legacy values.
 *
 * <p>
 * Mutators change the given element in place. Thread-safe, stateless utility class.
 */
public final class ElementClasses {

    /** Write path, relative to {@code data}. */
    public static final List<String> CANONICAL_PATH = List.of("properties", "attributes", "className");

    /** Read paths in order, relative to {@code data}; the first one is {@link #CANONICAL_PATH}. */
    public static final List<List<String>> CANDIDATE_PATHS = List.of(
            CANONICAL_PATH,
            List.of("properties", "settings", "advanced", "classes"),
            List.of("properties", "classes"),
            List.of("properties", "meta", "classes"),
            List.of("properties", "settings", "classes"));

    private static final Pattern CLASS_NAME = Pattern.compile("-?[_a-zA-Z]+[_a-zA-Z0-9-]*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ElementClasses() {}

    /** Reports every class of {@code element}, merged across candidate paths. */
    public static ClassReport read(JsonNode element) {
        String type = JsonPaths.get(element, TreeKeys.DATA, TreeKeys.TYPE).textValue();
        JsonNode data = element.path(TreeKeys.DATA);

        Map<String, List<String>> byPath = new LinkedHashMap<>();
        Set<String> found = new LinkedHashSet<>();
        for (List<String> path : CANDIDATE_PATHS) {
            List<String> values = parseValue(JsonPaths.get(data, path));
            if (!values.isEmpty()) {
                byPath.put(JsonPaths.format(path), values);
                found.addAll(values);
            }
        }

        List<String> typeClasses = BuiltInClasses.forType(type);
        Set<String> builtIn = new LinkedHashSet<>(typeClasses);
        List<String> custom = new ArrayList<>();
        for (String name : found) {
            if (BuiltInClasses.isBuiltIn(name)) {
                builtIn.add(name);
            } else {
                custom.add(name);
            }
        }
        // type-implied classes first, then everything found in first-seen order
        Set<String> all = new LinkedHashSet<>(typeClasses);
        all.addAll(found);
        return new ClassReport(new ArrayList<>(all), custom, new ArrayList<>(builtIn), byPath);
    }

    /** Replaces the classes at the canonical path with {@code classes}. */
    public static void setClasses(ObjectNode element, Collection<String> classes) {
        List<String> names = validated(classes);
        writeCanonical(element, names);
    }

    /** Appends {@code classes} to the element's current custom classes. */
    public static void addClasses(ObjectNode element, Collection<String> classes) {
        List<String> names = validated(classes);
        Set<String> merged = new LinkedHashSet<>(read(element).custom());
        merged.addAll(names);
        writeCanonical(element, preservedBuiltIns(element, merged));
    }

    /**
     * Removes one custom class.
     *
     * @throws ClassOperationException {@code invalid_class_name} for a malformed name,
     *                                 {@code builtin_class} for a builder-owned name,
     *                                 {@code class_not_found} when the element does not carry it
     */
    public static void deleteClass(ObjectNode element, String className) {
        requireValidName(className);
        if (BuiltInClasses.isBuiltIn(className)) {
            throw new ClassOperationException(
                    "Class '" + className + "' is a built-in class and cannot be deleted",
                    ClassOperationException.BUILTIN_CLASS,
                    className);
        }
        List<String> custom = read(element).custom();
        if (!custom.contains(className)) {
            throw new ClassOperationException(
                    "Class '" + className + "' is not set on this element",
                    ClassOperationException.CLASS_NOT_FOUND,
                    className);
        }

        Set<String> remaining = new LinkedHashSet<>(custom);
        remaining.remove(className);
        writeCanonical(element, preservedBuiltIns(element, remaining));

        ObjectNode data = (ObjectNode) element.get(TreeKeys.DATA);
        for (List<String> path : CANDIDATE_PATHS.subList(1, CANDIDATE_PATHS.size())) {
            JsonNode value = JsonPaths.get(data, path);
            if (parseValue(value).contains(className)) {
                JsonPaths.set(data, path, without(value, className));
            }
        }
    }

    /** {@code true} if {@code name} is a syntactically valid CSS class name. */
    public static boolean isValidName(String name) {
        return name != null && CLASS_NAME.matcher(name).matches();
    }

    /** Parses a class value: whitespace-delimited string or array of strings; anything else is empty. */
    static List<String> parseValue(JsonNode value) {
        Set<String> names = new LinkedHashSet<>();
        if (value.isTextual()) {
            for (String part : WHITESPACE.split(value.textValue().trim())) {
                if (!part.isEmpty()) {
                    names.add(part);
                }
            }
        } else if (value.isArray()) {
            for (JsonNode item : value) {
                if (item.isTextual() && !item.textValue().isBlank()) {
                    names.add(item.textValue().trim());
                }
            }
        }
        return new ArrayList<>(names);
    }

    private static List<String> validated(Collection<String> classes) {
        Set<String> names = new LinkedHashSet<>();
        for (String name : classes) {
            requireValidName(name);
            names.add(name);
        }
        return new ArrayList<>(names);
    }

    private static void requireValidName(String name) {
        if (!isValidName(name)) {
            throw new ClassOperationException(
                    "Invalid CSS class name '" + name + "'", ClassOperationException.INVALID_CLASS_NAME, name);
        }
    }

    /** Built-in prefixed classes already stored at the canonical path, followed by {@code custom}. */
    private static List<String> preservedBuiltIns(JsonNode element, Collection<String> custom) {
        Set<String> names = new LinkedHashSet<>();
        for (String name : parseValue(JsonPaths.get(element.path(TreeKeys.DATA), CANONICAL_PATH))) {
            if (BuiltInClasses.isBuiltIn(name)) {
                names.add(name);
            }
        }
        names.addAll(custom);
        return new ArrayList<>(names);
    }

    private static void writeCanonical(ObjectNode element, List<String> names) {
        JsonNode data = element.get(TreeKeys.DATA);
        ObjectNode target;
        if (data instanceof ObjectNode existing) {
            target = existing;
        } else {
            target = element.putObject(TreeKeys.DATA);
        }
        JsonPaths.set(target, CANONICAL_PATH, JsonNodeFactory.instance.textNode(String.join(" ", names)));
    }

    private static JsonNode without(JsonNode value, String className) {
        List<String> kept = new ArrayList<>(parseValue(value));
        kept.remove(className);
        if (value.isArray()) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            kept.forEach(array::add);
            return array;
        }
        return JsonNodeFactory.instance.textNode(String.join(" ", kept));
    }
}
