package com.example.collab.shared.backplane;

import com.example.collab.shared.dto.BackplaneEnvelope;

/**
 * Pub/sub between instances. Delivery is at-least-once to every live subscriber and ordered
 * only per publisher and channel.
 */
public interface Backplane {

    /**
     * Fire-and-forget. Failures are retried with bounded backoff and then only logged.
     */
    void publish(String channel, BackplaneEnvelope envelope);

    /**
     * @param channelPattern a channel name, or a prefix ending in {@code *}
     */
    BackplaneSubscription subscribe(String channelPattern, BackplaneMessageHandler handler);
}
