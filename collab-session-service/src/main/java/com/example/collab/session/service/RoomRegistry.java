package com.example.collab.session.service;

import com.example.collab.session.model.Room;
import com.example.collab.shared.dto.MemberInfo;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rooms with at least one local member, or that recently had one. Membership changes go through
 * {@link ConcurrentHashMap#compute} so a join can never land in a room that is being evicted.
 */
@Component
public class RoomRegistry {

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();

    /**
     * Adds the member unless the room already holds {@code maxMembers} known members. The count
     * and the insert happen under the room's mapping, so concurrent joins cannot overfill it.
     */
    public JoinOutcome join(String roomId, MemberInfo member, long now, int maxMembers) {
        boolean[] created = {false};
        boolean[] admitted = {false};
        Room room = rooms.compute(roomId, (id, existing) -> {
            Room target = existing;
            if (target == null) {
                target = new Room(id, now);
                created[0] = true;
            }
            if (target.hasLocalMember(member.getConnectionId()) || target.getKnownMemberCount() < maxMembers) {
                target.addLocalMember(member, now);
                admitted[0] = true;
            }
            return admitted[0] || existing != null ? target : null;
        });
        return new JoinOutcome(room, created[0] && admitted[0], admitted[0]);
    }

    public boolean leave(String roomId, String connectionId, long now) {
        boolean[] removed = {false};
        rooms.computeIfPresent(roomId, (id, room) -> {
            removed[0] = room.removeLocalMember(connectionId, now);
            return room;
        });
        return removed[0];
    }

    public Optional<Room> find(String roomId) {
        return roomId == null ? Optional.empty() : Optional.ofNullable(rooms.get(roomId));
    }

    public Collection<Room> all() {
        return new ArrayList<>(rooms.values());
    }

    public int size() {
        return rooms.size();
    }

    /**
     * @return ids of the rooms removed because they stayed empty for the whole grace period
     */
    public List<String> evictEmpty(long now, long gracePeriodMillis) {
        List<String> evicted = new ArrayList<>();
        for (String roomId : new ArrayList<>(rooms.keySet())) {
            rooms.computeIfPresent(roomId, (id, room) -> {
                if (room.isEvictable(now, gracePeriodMillis)) {
                    evicted.add(id);
                    return null;
                }
                return room;
            });
        }
        return evicted;
    }

    public int forgetInstance(String instanceId) {
        int removed = 0;
        for (Room room : rooms.values()) {
            removed += room.removeRemoteMembersOf(instanceId);
        }
        return removed;
    }

    public record JoinOutcome(Room room, boolean created, boolean admitted) {
    }
}
