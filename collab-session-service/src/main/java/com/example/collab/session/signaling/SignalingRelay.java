package com.example.collab.session.signaling;

import com.example.collab.session.model.CollabConnection;
import com.example.collab.session.service.SessionCoordinator;
import com.example.collab.shared.backplane.Backplane;
import com.example.collab.shared.backplane.BackplaneChannels;
import com.example.collab.shared.dto.BackplaneEnvelope;
import com.example.collab.shared.dto.CollabEvent;
import com.example.collab.shared.service.directory.ConnectionDirectory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Relays WebRTC negotiation messages between two connections. The payload is opaque; only the
 * envelope around it ({@code from}, {@code fromUserId}, {@code timestamp}) is added here.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SignalingRelay {

    private final SessionCoordinator sessionCoordinator;
    private final ConnectionDirectory connectionDirectory;
    private final Backplane backplane;
    private final BackplaneChannels channels;
    private final ObjectMapper objectMapper;

    public RelayResult relayToPeer(String fromConnectionId, String toConnectionId, SignalKind kind, JsonNode payload) {
        CollabConnection source = sessionCoordinator.getConnection(fromConnectionId);
        if (source == null || !source.isActive()) {
            return RelayResult.SOURCE_INACTIVE;
        }
        if (!StringUtils.hasText(toConnectionId) || toConnectionId.equals(fromConnectionId)) {
            return RelayResult.TARGET_UNAVAILABLE;
        }

        long now = System.currentTimeMillis();
        ObjectNode relayed = objectMapper.createObjectNode();
        relayed.put("from", fromConnectionId);
        relayed.put("fromUserId", source.getUserId());
        relayed.set("payload", payload == null ? objectMapper.nullNode() : payload);
        relayed.put("timestamp", now);

        CollabEvent event = CollabEvent.builder()
                .type(kind.getEventType())
                .targetConnectionId(toConnectionId)
                .originConnectionId(fromConnectionId)
                .originUserId(source.getUserId())
                .originInstance(sessionCoordinator.instanceId())
                .timestamp(now)
                .payload(relayed)
                .build();

        CollabConnection target = sessionCoordinator.getConnection(toConnectionId);
        if (target != null) {
            if (target.isActive() && sessionCoordinator.sendTo(toConnectionId, event)) {
                log.debug("Relayed {} from {} to local connection {}", kind, fromConnectionId, toConnectionId);
                return RelayResult.DELIVERED_LOCAL;
            }
            return RelayResult.TARGET_UNAVAILABLE;
        }

        if (!connectionDirectory.isActive(toConnectionId)) {
            log.debug("Dropping {} from {}: target {} is not active anywhere", kind, fromConnectionId, toConnectionId);
            return RelayResult.TARGET_UNAVAILABLE;
        }
        backplane.publish(channels.connectionChannel(toConnectionId), BackplaneEnvelope.builder()
                .originInstance(sessionCoordinator.instanceId())
                .event(event)
                .build());
        log.debug("Forwarded {} from {} to remote connection {}", kind, fromConnectionId, toConnectionId);
        return RelayResult.FORWARDED;
    }

    /**
     * Delivers a signal another instance forwarded on a connection channel, if the target lives here.
     */
    public boolean onRemoteSignal(BackplaneEnvelope envelope) {
        if (envelope == null || envelope.getEvent() == null) {
            return false;
        }
        if (sessionCoordinator.instanceId().equals(envelope.getOriginInstance())) {
            return false;
        }
        String target = envelope.getEvent().getTargetConnectionId();
        if (target == null || sessionCoordinator.getConnection(target) == null) {
            return false;
        }
        return sessionCoordinator.sendTo(target, envelope.getEvent());
    }
}
