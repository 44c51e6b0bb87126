package com.example.collab.shared.lock;

public enum LockResult {
    ACQUIRED,
    BUSY,
    UNAVAILABLE;

    public boolean isAcquired() {
        return this == ACQUIRED;
    }
}
