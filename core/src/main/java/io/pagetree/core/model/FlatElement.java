package io.pagetree.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One entry of a flattened tree, in pre-order.
 *
 * @param id          the element id as authored, or JSON null when absent
 * @param type        the {@code data.type} tag, {@code "unknown"} when absent
 * @param path        dot-joined child indexes from the start sequence (e.g. {@code "0.2.1"})
 * @param depth       0 for entries of the start sequence
 * @param properties  {@code data.properties}, an empty object when absent
 * @param hasChildren {@code true} if the element has a non-empty children array
 */
public record FlatElement(JsonNode id, String type, String path, int depth, JsonNode properties, boolean hasChildren) {

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.set("id", id);
        node.put("type", type);
        node.put("path", path);
        node.put("depth", depth);
        node.set("properties", properties);
        node.put("has_children", hasChildren);
        return node;
    }
}
