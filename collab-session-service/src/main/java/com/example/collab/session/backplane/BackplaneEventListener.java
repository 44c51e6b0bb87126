package com.example.collab.session.backplane;

import com.example.collab.session.service.SessionCoordinator;
import com.example.collab.session.signaling.SignalingRelay;
import com.example.collab.shared.backplane.Backplane;
import com.example.collab.shared.backplane.BackplaneChannels;
import com.example.collab.shared.backplane.BackplaneSubscription;
import com.example.collab.shared.dto.BackplaneEnvelope;
import com.example.collab.shared.util.Constants;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Subscribes this instance to the cluster's room, connection and control channels and hands
 * every envelope to the local-only delivery path.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BackplaneEventListener {

    private final Backplane backplane;
    private final BackplaneChannels channels;
    private final SessionCoordinator sessionCoordinator;
    private final SignalingRelay signalingRelay;

    private final List<BackplaneSubscription> subscriptions = new ArrayList<>();

    @PostConstruct
    public synchronized void subscribe() {
        if (!subscriptions.isEmpty()) {
            return;
        }
        subscriptions.add(backplane.subscribe(channels.roomPattern(), this::onMessage));
        subscriptions.add(backplane.subscribe(channels.connectionPattern(), this::onMessage));
        subscriptions.add(backplane.subscribe(channels.controlChannel(), this::onMessage));
        log.info("[BACKPLANE_SUBSCRIBED] Listening on {}, {} and {}", channels.roomPattern(), channels.connectionPattern(), channels.controlChannel());
    }

    void onMessage(String channel, BackplaneEnvelope envelope) {
        if (envelope == null || envelope.getEvent() == null || envelope.getEvent().getType() == null) {
            log.warn("Ignoring empty backplane envelope on '{}'", channel);
            return;
        }
        if (sessionCoordinator.instanceId().equals(envelope.getOriginInstance())) {
            return;
        }
        log.debug("Backplane event {} on '{}' from instance {}", envelope.getEvent().getType(), channel, envelope.getOriginInstance());
        if (envelope.getEvent().getType().getScope() == Constants.EventScope.PEER) {
            signalingRelay.onRemoteSignal(envelope);
        } else {
            sessionCoordinator.onBackplaneEvent(envelope);
        }
    }

    @PreDestroy
    public synchronized void unsubscribeAll() {
        if (subscriptions.isEmpty()) {
            return;
        }
        subscriptions.forEach(BackplaneSubscription::unsubscribe);
        subscriptions.clear();
        log.info("[BACKPLANE_UNSUBSCRIBED] Stopped listening for cluster events");
    }

    public synchronized boolean isSubscribed() {
        return !subscriptions.isEmpty();
    }
}
