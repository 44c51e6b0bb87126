package com.example.collab.session.signaling;

public enum RelayResult {
    DELIVERED_LOCAL,
    FORWARDED,
    SOURCE_INACTIVE,
    TARGET_UNAVAILABLE;

    public boolean isDelivered() {
        return this == DELIVERED_LOCAL || this == FORWARDED;
    }
}
