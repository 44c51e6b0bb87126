package com.example.collab.session.config;

import com.example.collab.session.command.CommandDispatcher;
import com.example.collab.session.protocol.binary.BinaryFrameCodec;
import com.example.collab.session.protocol.hub.HubProtocolCodec;
import com.example.collab.session.protocol.legacy.LegacyTextCodec;
import com.example.collab.session.service.SessionCoordinator;
import com.example.collab.session.service.UserIdentityResolver;
import com.example.collab.session.websocket.CollabWebSocketHandler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;
import reactor.core.scheduler.Scheduler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One WebSocket endpoint per wire protocol, all backed by the same coordinator.
 */
@Configuration
public class WebSocketConfig {

    public static final String HUB_PATH = "/hub";
    public static final String BINARY_PATH = "/ws/binary";
    public static final String LEGACY_PATH = "/socket.io/";

    @Bean
    public HandlerMapping collabWebSocketMapping(HubProtocolCodec hubCodec,
                                                 BinaryFrameCodec binaryCodec,
                                                 LegacyTextCodec legacyCodec,
                                                 SessionCoordinator sessionCoordinator,
                                                 CommandDispatcher commandDispatcher,
                                                 UserIdentityResolver identityResolver,
                                                 @Qualifier("inboundScheduler") Scheduler inboundScheduler) {
        WebSocketHandler legacy = new CollabWebSocketHandler(legacyCodec, sessionCoordinator, commandDispatcher, identityResolver, inboundScheduler);

        Map<String, WebSocketHandler> handlers = new LinkedHashMap<>();
        handlers.put(HUB_PATH, new CollabWebSocketHandler(hubCodec, sessionCoordinator, commandDispatcher, identityResolver, inboundScheduler));
        handlers.put(BINARY_PATH, new CollabWebSocketHandler(binaryCodec, sessionCoordinator, commandDispatcher, identityResolver, inboundScheduler));
        handlers.put(LEGACY_PATH, legacy);
        handlers.put("/socket.io", legacy);
        return new SimpleUrlHandlerMapping(handlers, -1);
    }
}
