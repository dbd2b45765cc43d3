package com.example.jestadapter.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Custom deserializer for {@code failureMessages}.
 * Accepts an array of strings, a single string or null, always producing a list.
 */
public class FailureMessagesDeserializer extends JsonDeserializer<List<String>> {

    @Override
    public List<String> deserialize(JsonParser parser, DeserializationContext context)
            throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        return toList(node);
    }

    @Override
    public List<String> getNullValue(DeserializationContext context) {
        return List.of();
    }

    private static List<String> toList(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return List.of();
        }
        if (node.isArray()) {
            List<String> messages = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                if (!element.isNull()) {
                    messages.add(element.isTextual() ? element.asText() : element.toString());
                }
            }
            return messages;
        }
        String text = node.isTextual() ? node.asText() : node.toString();
        return text.isEmpty() ? List.of() : List.of(text);
    }
}
