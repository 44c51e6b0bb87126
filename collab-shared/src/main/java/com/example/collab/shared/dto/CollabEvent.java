package com.example.collab.shared.dto;

import com.example.collab.shared.util.Constants;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * A transient, versioned event addressed either to a room or to a single connection.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CollabEvent {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    private String eventId = UUID.randomUUID().toString();
    private Constants.EventType type;
    /** Client-chosen event name, only set for {@link Constants.EventType#CUSTOM}. */
    private String name;
    private String roomId;
    private String targetConnectionId;
    private String originConnectionId;
    private String originUserId;
    private String originInstance;
    private long timestamp;
    @Builder.Default
    private int version = CURRENT_VERSION;
    private JsonNode payload;

    public String resolveName() {
        if (type == Constants.EventType.CUSTOM && name != null) {
            return name;
        }
        return type.getEventName();
    }
}
