package com.ringai.domain.call.model.entity;

import com.ringai.domain.agent.service.AgentSession;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 一通已接听的电话。会话归会话池所有，这里只持有引用。
 */
@Getter
@Builder
@ToString(exclude = "session")
public class CallRecord {

    private final String callId;
    private final String gatewayId;
    private final String callerNumber;
    private final AgentSession session;
    private final Instant startedAt;

    public String getSessionId() {
        return session == null ? null : session.getSessionId();
    }
}
