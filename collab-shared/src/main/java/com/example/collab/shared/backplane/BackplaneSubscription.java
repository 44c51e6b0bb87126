package com.example.collab.shared.backplane;

@FunctionalInterface
public interface BackplaneSubscription {
    void unsubscribe();
}
