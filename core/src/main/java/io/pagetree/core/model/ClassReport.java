package io.pagetree.core.model;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CSS classes of one element.
 *
 * @param classes all classes, built-in first, without duplicates
 * @param custom  user-authored classes in first-seen order
 * @param builtIn classes implied by the element type or carrying a built-in prefix
 * @param byPath  classes found at each candidate property path that holds any, keyed by dotted path
 */
public record ClassReport(
        List<String> classes, List<String> custom, List<String> builtIn, Map<String, List<String>> byPath) {

    public ClassReport {
        classes = List.copyOf(classes);
        custom = List.copyOf(custom);
        builtIn = List.copyOf(builtIn);
        Map<String, List<String>> copy = new LinkedHashMap<>();
        byPath.forEach((path, values) -> copy.put(path, List.copyOf(values)));
        byPath = Collections.unmodifiableMap(copy);
    }

    public ObjectNode toJson() {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        ObjectNode node = nodes.objectNode();
        node.set("classes", toArray(classes));
        node.set("custom_classes", toArray(custom));
        node.set("builtin_classes", toArray(builtIn));
        ObjectNode sources = node.putObject("sources");
        byPath.forEach((path, values) -> sources.set(path, toArray(values)));
        return node;
    }

    private static ArrayNode toArray(List<String> values) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        values.forEach(array::add);
        return array;
    }
}
