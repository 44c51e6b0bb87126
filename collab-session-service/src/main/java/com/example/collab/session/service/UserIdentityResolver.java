package com.example.collab.session.service;

import org.springframework.web.reactive.socket.HandshakeInfo;

import java.util.Optional;

public interface UserIdentityResolver {

    /**
     * @return the authenticated user behind a WebSocket handshake, if any
     */
    Optional<String> resolve(HandshakeInfo handshakeInfo);
}
