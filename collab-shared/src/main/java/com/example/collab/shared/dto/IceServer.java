package com.example.collab.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A STUN/TURN server handed to clients on join so they can negotiate peer connections.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@NoArgsConstructor
@AllArgsConstructor
public class IceServer {
    private List<String> urls;
    private String username;
    private String credential;
}
