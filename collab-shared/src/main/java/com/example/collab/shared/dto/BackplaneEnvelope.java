package com.example.collab.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackplaneEnvelope {
    private String originInstance;
    private CollabEvent event;
    @Builder.Default
    private Set<String> excludeConnectionIds = new HashSet<>();
}
