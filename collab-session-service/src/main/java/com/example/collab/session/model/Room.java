package com.example.collab.session.model;

import com.example.collab.shared.dto.MemberInfo;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * This instance's view of a room: its own members plus the members other instances have
 * announced over the backplane. No instance sees the authoritative global list.
 */
public class Room {

    @Getter
    private final String roomId;
    @Getter
    private final long createdAt;
    private final Map<String, MemberInfo> localMembers = new ConcurrentHashMap<>();
    private final Map<String, MemberInfo> remoteMembers = new ConcurrentHashMap<>();
    private volatile long lastActivityAt;
    private volatile long emptySince;

    public Room(String roomId, long createdAt) {
        this.roomId = roomId;
        this.createdAt = createdAt;
        this.lastActivityAt = createdAt;
        this.emptySince = createdAt;
    }

    public void addLocalMember(MemberInfo member, long now) {
        localMembers.put(member.getConnectionId(), member);
        emptySince = 0;
        lastActivityAt = now;
    }

    public boolean removeLocalMember(String connectionId, long now) {
        boolean removed = localMembers.remove(connectionId) != null;
        lastActivityAt = now;
        if (localMembers.isEmpty()) {
            emptySince = now;
        }
        return removed;
    }

    public void putRemoteMember(MemberInfo member) {
        remoteMembers.put(member.getConnectionId(), member);
    }

    public void removeRemoteMember(String connectionId) {
        remoteMembers.remove(connectionId);
    }

    public int removeRemoteMembersOf(String instanceId) {
        int before = remoteMembers.size();
        remoteMembers.values().removeIf(member -> instanceId.equals(member.getInstanceId()));
        return before - remoteMembers.size();
    }

    public boolean hasLocalMember(String connectionId) {
        return localMembers.containsKey(connectionId);
    }

    public Set<String> getLocalConnectionIds() {
        return new HashSet<>(localMembers.keySet());
    }

    public Collection<MemberInfo> getLocalMembers() {
        return new ArrayList<>(localMembers.values());
    }

    public List<MemberInfo> getKnownMembers() {
        List<MemberInfo> members = new ArrayList<>(localMembers.values());
        remoteMembers.forEach((connectionId, member) -> {
            if (!localMembers.containsKey(connectionId)) {
                members.add(member);
            }
        });
        return members;
    }

    public int getKnownMemberCount() {
        return getKnownMembers().size();
    }

    public boolean isEmpty() {
        return localMembers.isEmpty();
    }

    public void touch(long now) {
        lastActivityAt = now;
    }

    public long getLastActivityAt() {
        return lastActivityAt;
    }

    public boolean isEvictable(long now, long gracePeriodMillis) {
        return localMembers.isEmpty() && emptySince > 0 && now - emptySince >= gracePeriodMillis;
    }
}
