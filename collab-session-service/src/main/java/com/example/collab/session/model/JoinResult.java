package com.example.collab.session.model;

import com.example.collab.shared.dto.IceServer;
import com.example.collab.shared.dto.MemberInfo;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JoinResult {
    private boolean success;
    private String roomId;
    private String connectionId;
    private String userId;
    /** Known members other than the caller. */
    private List<MemberInfo> members;
    private List<IceServer> iceServers;
}
