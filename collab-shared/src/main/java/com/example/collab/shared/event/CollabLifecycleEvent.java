package com.example.collab.shared.event;

import com.example.collab.shared.util.Constants;
import org.springframework.context.ApplicationEvent;

/**
 * Published for connection and lock lifecycle transitions. Observers get no delivery guarantees;
 * they are notified in-process and synchronously, after the transition has happened.
 */
public class CollabLifecycleEvent extends ApplicationEvent {

    private final Constants.LifecycleEventType type;
    private final String connectionId;
    private final String userId;
    private final String subject;

    public CollabLifecycleEvent(Object source, Constants.LifecycleEventType type, String connectionId, String userId, String subject) {
        super(source);
        this.type = type;
        this.connectionId = connectionId;
        this.userId = userId;
        this.subject = subject;
    }

    public Constants.LifecycleEventType getType() {
        return type;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public String getUserId() {
        return userId;
    }

    /**
     * The object id for lock events, the close reason for connection-closed, otherwise null.
     */
    public String getSubject() {
        return subject;
    }
}
