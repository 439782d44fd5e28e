package com.ringai.api.dto;

import lombok.Data;

import java.time.Instant;

/**
 * 进行中的通话。
 */
@Data
public class CallRecordDTO {

    private String callId;
    private String gatewayId;
    private String callerNumber;
    private String sessionId;
    private String sessionState;
    private Instant startedAt;
}
