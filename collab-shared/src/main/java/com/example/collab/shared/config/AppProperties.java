package com.example.collab.shared.config;

import com.example.collab.shared.dto.IceServer;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Data
@Validated
public class AppProperties {

    @NotBlank
    private String clusterName;

    @NotBlank
    private String instanceId;

    private final Lock lock = new Lock();
    private final Throttle throttle = new Throttle();
    private final Room room = new Room();
    private final KeepAlive keepAlive = new KeepAlive();
    private final Fanout fanout = new Fanout();
    private final Directory directory = new Directory();
    private final Chat chat = new Chat();
    private final Binary binary = new Binary();
    private final Legacy legacy = new Legacy();
    private final WebRtc webrtc = new WebRtc();

    @Data
    public static class Lock {
        @Positive
        private long ttl = 30000L;
    }

    @Data
    public static class Throttle {
        @Positive
        private long tick = 100L;
    }

    @Data
    public static class Room {
        @Positive
        private long gracePeriod = 30000L;
        @Positive
        private int maxMembers = 50;
        private Set<String> closedRooms = new HashSet<>();
    }

    @Data
    public static class KeepAlive {
        @Positive
        private long heartbeatInterval = 25000L;
        @Positive
        private long idleTimeout = 60000L;
    }

    @Data
    public static class Fanout {
        @Positive
        private int publishLanes = 4;
        @Positive
        private long drainTimeout = 5000L;
    }

    @Data
    public static class Directory {
        @Positive
        private long connectionTtl = 120000L;
        @Positive
        private long staleInstanceThreshold = 90000L;
        @Positive
        private long instanceHeartbeatInterval = 30000L;
    }

    @Data
    public static class Chat {
        @Positive
        private int maxLength = 1000;
    }

    @Data
    public static class Binary {
        @Positive
        private int maxFrameBytes = 1024 * 1024;
        @Positive
        private int responseBodyBytes = 1024;
    }

    @Data
    public static class Legacy {
        @Positive
        private long pingInterval = 25000L;
        @Positive
        private long pingTimeout = 20000L;
        @Positive
        private int maxPayload = 1000000;
    }

    @Data
    public static class WebRtc {
        private List<IceServer> iceServers = new ArrayList<>(List.of(
                new IceServer(List.of("stun:stun.l.google.com:19302"), null, null),
                new IceServer(List.of("stun:stun1.l.google.com:19302"), null, null),
                new IceServer(List.of("turn:localhost:3478"), "puzzle", "puzzle123")
        ));
    }
}
