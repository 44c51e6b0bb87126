package com.example.collab.shared.dto.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionInfo implements Serializable {
    private String connectionId;
    private String userId;
    private String instanceId;
    private String protocol;
    private long connectedAt;
    private long lastActivityAt;
}
