package com.ringai.domain.call.service;

import com.ringai.domain.agent.model.valobj.SessionConfig;
import com.ringai.domain.agent.service.AgentSession;
import com.ringai.domain.agent.service.SessionPool;
import com.ringai.domain.call.model.entity.CallRecord;
import com.ringai.types.exception.CallAlreadyActiveException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 通话管理：把外部 call_id 映射到从会话池申请的会话，并负责申请与释放。
 * <p>
 * 同一 call_id 同时最多映射一个会话。{@link #endSession(String)} 幂等，
 * 网关挂断、连接断开、会话出错等多条结束路径都可以放心调用。
 * </p>
 *
 * @author ringai
 * @since 2026-03-02
 */
@Slf4j
public class CallManager {

    private final SessionPool sessionPool;
    private final Duration acquireTimeout;
    private final Clock clock;
    private final ConcurrentMap<String, CallRecord> calls = new ConcurrentHashMap<>();

    public CallManager(SessionPool sessionPool, Duration acquireTimeout, Clock clock) {
        this.sessionPool = sessionPool;
        this.acquireTimeout = acquireTimeout == null ? Duration.ofSeconds(5) : acquireTimeout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * 为一通电话申请会话。
     *
     * @throws CallAlreadyActiveException call_id 已存在活跃会话
     */
    public CallRecord createSession(String callId, String gatewayId, String callerNumber, SessionConfig config) {
        if (StringUtils.isBlank(callId)) {
            throw new IllegalArgumentException("Call id cannot be blank");
        }
        if (calls.containsKey(callId)) {
            throw new CallAlreadyActiveException(callId);
        }
        AgentSession session = sessionPool.acquire(config, acquireTimeout);
        CallRecord record = CallRecord.builder()
                .callId(callId)
                .gatewayId(gatewayId)
                .callerNumber(callerNumber)
                .session(session)
                .startedAt(clock.instant())
                .build();
        CallRecord existing = calls.putIfAbsent(callId, record);
        if (existing != null) {
            sessionPool.release(session.getSessionId());
            throw new CallAlreadyActiveException(callId);
        }
        log.info("Call session created. callId={}, gatewayId={}, sessionId={}, activeCalls={}",
                callId, gatewayId, session.getSessionId(), calls.size());
        return record;
    }

    public AgentSession getSession(String callId) {
        CallRecord record = getRecord(callId);
        return record == null ? null : record.getSession();
    }

    public CallRecord getRecord(String callId) {
        return callId == null ? null : calls.get(callId);
    }

    /**
     * 结束通话并把会话归还会话池，未知或已结束的 call_id 只记录日志。
     */
    public void endSession(String callId) {
        CallRecord record = callId == null ? null : calls.remove(callId);
        if (record == null) {
            log.debug("End session ignored, call not active. callId={}", callId);
            return;
        }
        try {
            sessionPool.release(record.getSessionId());
        } catch (RuntimeException ex) {
            log.warn("Failed to release session for call. callId={}, sessionId={}, error={}",
                    callId, record.getSessionId(), ex.getMessage(), ex);
        }
        long durationSeconds = record.getStartedAt() == null ? 0L
                : Duration.between(record.getStartedAt(), clock.instant()).getSeconds();
        log.info("Call session ended. callId={}, sessionId={}, durationSeconds={}, activeCalls={}",
                callId, record.getSessionId(), durationSeconds, calls.size());
    }

    /**
     * 结束所有活跃通话，进程关闭时调用。
     */
    public void teardownAll() {
        List<String> callIds = new ArrayList<>(calls.keySet());
        if (callIds.isEmpty()) {
            return;
        }
        log.info("Ending all active calls. count={}", callIds.size());
        for (String callId : callIds) {
            endSession(callId);
        }
    }

    public int activeCount() {
        return calls.size();
    }

    public List<CallRecord> activeRecords() {
        return new ArrayList<>(calls.values());
    }
}
