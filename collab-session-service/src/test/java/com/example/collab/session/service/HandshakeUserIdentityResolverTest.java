package com.example.collab.session.service;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.socket.HandshakeInfo;
import reactor.core.publisher.Mono;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class HandshakeUserIdentityResolverTest {

    private final HandshakeUserIdentityResolver resolver = new HandshakeUserIdentityResolver();

    @Test
    void headerWinsOverQueryParameter() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(HandshakeUserIdentityResolver.USER_ID_HEADER, " alice ");

        assertThat(resolver.resolve(handshake("ws://localhost/hub?userId=bob", headers))).contains("alice");
    }

    @Test
    void fallsBackToQueryParameter() {
        assertThat(resolver.resolve(handshake("ws://localhost/socket.io/?EIO=4&transport=websocket&userId=bob", new HttpHeaders())))
                .contains("bob");
    }

    @Test
    void anonymousWhenNeitherIsPresent() {
        assertThat(resolver.resolve(handshake("ws://localhost/ws/binary", new HttpHeaders()))).isEmpty();
    }

    private HandshakeInfo handshake(String uri, HttpHeaders headers) {
        return new HandshakeInfo(URI.create(uri), headers, Mono.empty(), null);
    }
}
