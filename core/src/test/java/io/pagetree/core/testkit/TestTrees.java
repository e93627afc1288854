package io.pagetree.core.testkit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;

/** JSON fixtures shared by the core tests. */
public final class TestTrees {

    public static final ObjectMapper JSON = new ObjectMapper();

    /** Valid tree with one heading (id 100) under root 1. */
    public static final String SINGLE_HEADING = """
            {
              "root": {
                "id": 1,
                "data": {"type": "root", "properties": null},
                "children": [
                  {
                    "id": 100,
                    "data": {
                      "type": "EssentialElements\\\\Heading",
                      "properties": {"content": {"content": {"text": "Hi"}}}
                    },
                    "children": [],
                    "parentId": 1
                  }
                ]
              },
              "status": "exported"
            }
            """;

    /** Valid tree: section 10 holding heading 11 and text 12. */
    public static final String SECTION_TREE = """
            {
              "root": {
                "id": 1,
                "data": {"type": "root", "properties": null},
                "children": [
                  {
                    "id": 10,
                    "data": {"type": "EssentialElements\\\\Section", "properties": null},
                    "children": [
                      {
                        "id": 11,
                        "data": {"type": "EssentialElements\\\\Heading", "properties": {}},
                        "children": [],
                        "_parentId": 10
                      },
                      {
                        "id": 12,
                        "data": {"type": "EssentialElements\\\\Text", "properties": null},
                        "children": [],
                        "_parentId": 10
                      }
                    ],
                    "_parentId": 1
                  }
                ]
              },
              "status": "exported"
            }
            """;

    private TestTrees() {}

    public static JsonNode json(String text) {
        try {
            return JSON.readTree(text);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ObjectNode object(String text) {
        return (ObjectNode) json(text);
    }
}
