package com.example.collab.session.signaling;

import com.example.collab.shared.util.Constants.EventType;

import java.util.Arrays;
import java.util.Optional;

public enum SignalKind {
    CALL_REQUEST("call-request", EventType.CALL_REQUEST),
    CALL_RESPONSE("call-response", EventType.CALL_RESPONSE),
    OFFER("offer", EventType.SDP_OFFER),
    ANSWER("answer", EventType.SDP_ANSWER),
    ICE_CANDIDATE("ice-candidate", EventType.ICE_CANDIDATE),
    CALL_ENDED("end-call", EventType.CALL_ENDED);

    private final String wireName;
    private final EventType eventType;

    SignalKind(String wireName, EventType eventType) {
        this.wireName = wireName;
        this.eventType = eventType;
    }

    public String getWireName() {
        return wireName;
    }

    public EventType getEventType() {
        return eventType;
    }

    public static Optional<SignalKind> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(kind -> kind.wireName.equals(name))
                .findFirst();
    }
}
