package com.example.collab.session;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Real-time collaboration service. Clients connect over one of three WebSocket protocols,
 * join rooms and exchange piece edits, chat, cursors and call signaling; instances share
 * locks and fan events out through Redis.
 */
@SpringBootApplication(scanBasePackages = "com.example.collab")
@EnableScheduling
public class CollabSessionApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollabSessionApplication.class, args);
    }
}
