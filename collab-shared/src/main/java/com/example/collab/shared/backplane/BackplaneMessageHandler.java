package com.example.collab.shared.backplane;

import com.example.collab.shared.dto.BackplaneEnvelope;

@FunctionalInterface
public interface BackplaneMessageHandler {
    void onMessage(String channel, BackplaneEnvelope envelope);
}
