package com.example.collab.session.service;

/**
 * Answers whether a room may currently be joined. Backed by whatever owns room administration.
 */
public interface RoomAccessPolicy {

    boolean isOpen(String roomId, String userId);
}
