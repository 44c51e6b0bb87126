package com.example.collab.shared.backplane;

import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.dto.BackplaneEnvelope;
import com.example.collab.shared.service.StoreHealthTracker;
import com.example.collab.shared.util.Constants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Redis pub/sub backplane. Publishes run on single-threaded lanes picked by channel hash, which keeps
 * one instance's events on one channel in publish order without serializing unrelated rooms.
 */
@Service
@Profile("!" + Constants.LOCAL_PROFILE)
@Slf4j
public class RedisBackplane implements Backplane {

    public static final String PUBLISH_RETRY_NAME = "backplanePublish";

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final ObjectMapper objectMapper;
    private final StoreHealthTracker storeHealthTracker;
    private final Retry publishRetry;
    private final ExecutorService[] publishLanes;
    private final long drainTimeoutMillis;

    public RedisBackplane(StringRedisTemplate redisTemplate,
                          RedisMessageListenerContainer listenerContainer,
                          ObjectMapper objectMapper,
                          StoreHealthTracker storeHealthTracker,
                          RetryRegistry retryRegistry,
                          AppProperties appProperties) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.objectMapper = objectMapper;
        this.storeHealthTracker = storeHealthTracker;
        this.publishRetry = retryRegistry.retry(PUBLISH_RETRY_NAME);
        this.drainTimeoutMillis = appProperties.getFanout().getDrainTimeout();

        int lanes = appProperties.getFanout().getPublishLanes();
        this.publishLanes = new ExecutorService[lanes];
        for (int i = 0; i < lanes; i++) {
            publishLanes[i] = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("backplane-publish-" + i + "-"));
        }
    }

    @Override
    public void publish(String channel, BackplaneEnvelope envelope) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize backplane envelope for channel '{}'", channel, e);
            return;
        }
        try {
            laneFor(channel).execute(() -> publishWithRetry(channel, payload));
        } catch (RejectedExecutionException e) {
            log.warn("Backplane is shutting down. Dropping publish to channel '{}'", channel);
        }
    }

    private void publishWithRetry(String channel, String payload) {
        try {
            Retry.decorateRunnable(publishRetry, () -> redisTemplate.convertAndSend(channel, payload)).run();
            storeHealthTracker.recordSuccess();
        } catch (RuntimeException e) {
            storeHealthTracker.recordFailure("backplane-publish", e);
            log.warn("[BACKPLANE_PUBLISH_FAILED] channel='{}' after {} attempts: {}",
                    channel, publishRetry.getRetryConfig().getMaxAttempts(), e.getMessage());
        }
    }

    @Override
    public BackplaneSubscription subscribe(String channelPattern, BackplaneMessageHandler handler) {
        MessageListener listener = (message, pattern) -> dispatch(message, handler);
        PatternTopic topic = new PatternTopic(channelPattern);
        listenerContainer.addMessageListener(listener, topic);
        log.info("[BACKPLANE_SUBSCRIBE] pattern='{}'", channelPattern);
        return () -> {
            listenerContainer.removeMessageListener(listener, topic);
            log.info("[BACKPLANE_UNSUBSCRIBE] pattern='{}'", channelPattern);
        };
    }

    private void dispatch(Message message, BackplaneMessageHandler handler) {
        String channel = new String(message.getChannel(), StandardCharsets.UTF_8);
        try {
            BackplaneEnvelope envelope = objectMapper.readValue(message.getBody(), BackplaneEnvelope.class);
            handler.onMessage(channel, envelope);
        } catch (IOException e) {
            log.error("Failed to deserialize backplane message on '{}'. Raw message: {}",
                    channel, new String(message.getBody(), StandardCharsets.UTF_8), e);
        } catch (Exception e) {
            log.error("Failed to handle backplane message on '{}'. Root cause: {}", channel, e.getMessage(), e);
        }
    }

    private ExecutorService laneFor(String channel) {
        return publishLanes[Math.floorMod(channel.hashCode(), publishLanes.length)];
    }

    /**
     * Lets queued publishes finish before the connection factory goes away.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Draining {} backplane publish lanes...", publishLanes.length);
        for (ExecutorService lane : publishLanes) {
            lane.shutdown();
        }
        try {
            for (ExecutorService lane : publishLanes) {
                if (!lane.awaitTermination(drainTimeoutMillis, TimeUnit.MILLISECONDS)) {
                    log.warn("Backplane lane did not drain within {}ms. Forcing shutdown.", drainTimeoutMillis);
                    lane.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            for (ExecutorService lane : publishLanes) {
                lane.shutdownNow();
            }
            Thread.currentThread().interrupt();
        }
        log.info("Backplane publish lanes drained.");
    }
}
