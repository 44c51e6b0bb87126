package com.example.collab.shared.backplane;

import com.example.collab.shared.dto.BackplaneEnvelope;
import com.example.collab.shared.util.Constants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous in-process bus. Envelopes go through JSON like they would over Redis, so every
 * subscriber gets its own copy.
 */
@Service
@Profile(Constants.LOCAL_PROFILE)
@Slf4j
@RequiredArgsConstructor
public class InMemoryBackplane implements Backplane {

    private final ObjectMapper objectMapper;
    private final List<PatternSubscription> subscriptions = new CopyOnWriteArrayList<>();

    @Override
    public void publish(String channel, BackplaneEnvelope envelope) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize backplane envelope for channel '{}'", channel, e);
            return;
        }
        for (PatternSubscription subscription : subscriptions) {
            if (!subscription.matches(channel)) {
                continue;
            }
            try {
                subscription.handler().onMessage(channel, objectMapper.readValue(payload, BackplaneEnvelope.class));
            } catch (JsonProcessingException e) {
                log.error("Failed to deserialize backplane message on '{}'", channel, e);
            } catch (Exception e) {
                log.error("Failed to handle backplane message on '{}'. Root cause: {}", channel, e.getMessage(), e);
            }
        }
    }

    @Override
    public BackplaneSubscription subscribe(String channelPattern, BackplaneMessageHandler handler) {
        PatternSubscription subscription = new PatternSubscription(channelPattern, handler);
        subscriptions.add(subscription);
        return () -> subscriptions.remove(subscription);
    }

    public int getSubscriptionCount() {
        return subscriptions.size();
    }

    private record PatternSubscription(String pattern, BackplaneMessageHandler handler) {
        boolean matches(String channel) {
            if (pattern.endsWith("*")) {
                return channel.startsWith(pattern.substring(0, pattern.length() - 1));
            }
            return pattern.equals(channel);
        }
    }
}
