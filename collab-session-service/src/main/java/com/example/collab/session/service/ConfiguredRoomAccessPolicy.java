package com.example.collab.session.service;

import com.example.collab.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Treats every room as open except those listed under {@code collab.room.closed-rooms}.
 */
@Service
@RequiredArgsConstructor
public class ConfiguredRoomAccessPolicy implements RoomAccessPolicy {

    private final AppProperties appProperties;

    @Override
    public boolean isOpen(String roomId, String userId) {
        return !appProperties.getRoom().getClosedRooms().contains(roomId);
    }
}
