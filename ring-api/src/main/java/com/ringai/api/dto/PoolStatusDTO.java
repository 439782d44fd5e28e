package com.ringai.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 会话池容量与占用情况。
 */
@Data
public class PoolStatusDTO {

    private Integer maxSessions;
    private Integer activeSessions;
    private Integer availableSlots;
    private Long admittedTotal;
    private Long rejectedTotal;
    private List<SessionSnapshotDTO> sessions;
}
