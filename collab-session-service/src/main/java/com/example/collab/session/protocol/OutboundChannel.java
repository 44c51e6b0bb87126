package com.example.collab.session.protocol;

/**
 * The transport side of one connection. Implementations must tolerate calls from any thread.
 */
public interface OutboundChannel {

    /**
     * Queues a frame for sending. Never blocks on the client.
     * @return false if the frame could not be queued
     */
    boolean send(OutboundFrame frame);

    void close(String reason);
}
