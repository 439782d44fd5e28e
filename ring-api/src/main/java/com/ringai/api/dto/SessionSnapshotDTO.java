package com.ringai.api.dto;

import lombok.Data;

import java.time.Instant;

/**
 * 单个上游会话的运行快照。
 */
@Data
public class SessionSnapshotDTO {

    private String sessionId;
    private String state;
    private String modelId;
    private String voiceName;
    private String outputMode;
    private Instant createdAt;
    private Instant lastActivityAt;
    private Long chunksSent;
    private Long chunksReceived;
    private Long bytesSent;
    private Long bytesReceived;
    private Boolean resumable;
}
