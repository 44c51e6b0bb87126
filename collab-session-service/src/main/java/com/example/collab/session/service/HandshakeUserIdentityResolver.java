package com.example.collab.session.service;

import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Optional;

/**
 * Reads the user id an upstream gateway attached to the handshake, first from the
 * {@code X-User-Id} header and then from the {@code userId} query parameter.
 */
@Service
public class HandshakeUserIdentityResolver implements UserIdentityResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ID_PARAM = "userId";

    @Override
    public Optional<String> resolve(HandshakeInfo handshakeInfo) {
        String header = handshakeInfo.getHeaders().getFirst(USER_ID_HEADER);
        if (StringUtils.hasText(header)) {
            return Optional.of(header.trim());
        }
        String param = UriComponentsBuilder.fromUri(handshakeInfo.getUri()).build()
                .getQueryParams().getFirst(USER_ID_PARAM);
        return StringUtils.hasText(param) ? Optional.of(param.trim()) : Optional.empty();
    }
}
