package com.example.collab.shared.backplane;

import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Channel names, namespaced per cluster so deployments sharing a Redis never see each other's traffic.
 */
@Service
@RequiredArgsConstructor
public class BackplaneChannels {

    private static final String ROOM_SEGMENT = "room:";
    private static final String CONNECTION_SEGMENT = "conn:";
    private static final String CONTROL_SEGMENT = "control";

    private final AppProperties appProperties;

    public String roomChannel(String roomId) {
        return prefix() + ROOM_SEGMENT + roomId;
    }

    public String connectionChannel(String connectionId) {
        return prefix() + CONNECTION_SEGMENT + connectionId;
    }

    public String controlChannel() {
        return prefix() + CONTROL_SEGMENT;
    }

    public String roomPattern() {
        return prefix() + ROOM_SEGMENT + "*";
    }

    public String connectionPattern() {
        return prefix() + CONNECTION_SEGMENT + "*";
    }

    private String prefix() {
        return Constants.CHANNEL_ROOT + ":" + appProperties.getClusterName() + ":";
    }
}
