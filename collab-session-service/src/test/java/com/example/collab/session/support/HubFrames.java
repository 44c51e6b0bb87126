package com.example.collab.session.support;

import com.example.collab.session.protocol.OutboundFrame;
import com.example.collab.session.protocol.hub.HubProtocolCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads back what a hub-protocol connection was sent.
 */
public final class HubFrames {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HubFrames() {
    }

    public static List<JsonNode> records(List<OutboundFrame> frames) {
        List<JsonNode> records = new ArrayList<>();
        for (OutboundFrame frame : frames) {
            for (String record : frame.getText().split(String.valueOf(HubProtocolCodec.RECORD_SEPARATOR))) {
                if (!record.isBlank()) {
                    records.add(parse(record));
                }
            }
        }
        return records;
    }

    /**
     * First argument of every invocation with the given target.
     */
    public static List<JsonNode> invocations(RecordingOutboundChannel channel, String target) {
        return records(channel.frames()).stream()
                .filter(record -> record.path("type").asInt() == 1 && target.equals(record.path("target").asText()))
                .map(record -> record.path("arguments").path(0))
                .collect(Collectors.toList());
    }

    public static List<String> targets(RecordingOutboundChannel channel) {
        return records(channel.frames()).stream()
                .filter(record -> record.path("type").asInt() == 1)
                .map(record -> record.path("target").asText())
                .collect(Collectors.toList());
    }

    public static JsonNode parse(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Not JSON: " + json, e);
        }
    }
}
