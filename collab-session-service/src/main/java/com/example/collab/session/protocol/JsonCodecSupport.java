package com.example.collab.session.protocol;

import com.example.collab.session.command.ClientCommand;
import com.example.collab.shared.exception.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON plumbing shared by the codecs whose frames carry JSON documents.
 */
public abstract class JsonCodecSupport implements ProtocolCodec {

    protected final ObjectMapper objectMapper;

    protected JsonCodecSupport(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected JsonNode parse(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || node.isMissingNode()) {
                throw new ProtocolException("Empty JSON document");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    protected String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize outbound frame", e);
        }
    }

    protected ObjectNode object() {
        return objectMapper.createObjectNode();
    }

    /**
     * Reads a required text field, accepting numbers too since clients often send numeric ids.
     */
    protected String requireText(JsonNode node, String field, ClientCommand partial) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || value.isContainerNode() || value.asText().isBlank()) {
            throw new ProtocolException(ErrorCode.INVALID_ARGUMENT, "'" + field + "' is required", partial);
        }
        return value.asText();
    }

    protected static String optionalText(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * Copies numeric x, y and rotation from {@code source} into a fresh position object.
     */
    protected ObjectNode position(JsonNode source, ClientCommand partial) {
        JsonNode x = source == null ? null : source.get("x");
        JsonNode y = source == null ? null : source.get("y");
        if (x == null || !x.isNumber() || y == null || !y.isNumber()) {
            throw new ProtocolException(ErrorCode.INVALID_ARGUMENT, "x and y must be numbers", partial);
        }
        ObjectNode position = object();
        position.put("x", x.asDouble());
        position.put("y", y.asDouble());
        JsonNode rotation = source.get("rotation");
        if (rotation != null && rotation.isNumber()) {
            position.put("rotation", rotation.asDouble());
        }
        return position;
    }

    /**
     * Signal payloads are opaque: an explicit {@code payload}/{@code data} member wins, otherwise
     * everything except the addressing fields is forwarded.
     */
    protected JsonNode signalPayload(JsonNode data) {
        if (data == null || !data.isObject()) {
            return data;
        }
        if (data.has("payload")) {
            return data.get("payload");
        }
        if (data.has("data")) {
            return data.get("data");
        }
        ObjectNode copy = ((ObjectNode) data).deepCopy();
        copy.remove("target");
        copy.remove("to");
        copy.remove("kind");
        return copy;
    }
}
