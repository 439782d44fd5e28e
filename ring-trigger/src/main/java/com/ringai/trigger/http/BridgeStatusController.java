package com.ringai.trigger.http;

import com.ringai.api.dto.CallRecordDTO;
import com.ringai.api.dto.PoolStatusDTO;
import com.ringai.api.dto.SessionSnapshotDTO;
import com.ringai.api.response.Response;
import com.ringai.domain.agent.model.valobj.SessionInfo;
import com.ringai.domain.agent.service.AgentSession;
import com.ringai.domain.agent.service.SessionPool;
import com.ringai.domain.call.model.entity.CallRecord;
import com.ringai.domain.call.service.CallManager;
import com.ringai.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 会话池与进行中通话的只读查询 API。
 */
@RestController
@RequestMapping("/api/bridge")
public class BridgeStatusController {

    private final SessionPool sessionPool;
    private final CallManager callManager;

    public BridgeStatusController(SessionPool sessionPool, CallManager callManager) {
        this.sessionPool = sessionPool;
        this.callManager = callManager;
    }

    @GetMapping("/pool")
    public Response<PoolStatusDTO> getPool() {
        PoolStatusDTO dto = new PoolStatusDTO();
        dto.setMaxSessions(sessionPool.getMaxSessions());
        dto.setActiveSessions(sessionPool.activeCount());
        dto.setAvailableSlots(sessionPool.availableSlots());
        dto.setAdmittedTotal(sessionPool.getAdmittedTotal());
        dto.setRejectedTotal(sessionPool.getRejectedTotal());
        dto.setSessions(sessionPool.snapshots().stream()
                .map(this::toSnapshotDTO)
                .collect(Collectors.toList()));
        return success(dto);
    }

    @GetMapping("/calls")
    public Response<List<CallRecordDTO>> listCalls() {
        List<CallRecordDTO> calls = callManager.activeRecords().stream()
                .sorted(Comparator.comparing(CallRecord::getStartedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(this::toCallRecordDTO)
                .collect(Collectors.toList());
        return success(calls);
    }

    private SessionSnapshotDTO toSnapshotDTO(SessionInfo info) {
        SessionSnapshotDTO dto = new SessionSnapshotDTO();
        dto.setSessionId(info.sessionId());
        dto.setState(info.state() == null ? null : info.state().name());
        dto.setModelId(info.modelId());
        dto.setVoiceName(info.voiceName());
        dto.setOutputMode(info.outputMode() == null ? null : info.outputMode().getCode());
        dto.setCreatedAt(info.createdAt());
        dto.setLastActivityAt(info.lastActivityAt());
        dto.setChunksSent(info.chunksSent());
        dto.setChunksReceived(info.chunksReceived());
        dto.setBytesSent(info.bytesSent());
        dto.setBytesReceived(info.bytesReceived());
        dto.setResumable(info.resumable());
        return dto;
    }

    private CallRecordDTO toCallRecordDTO(CallRecord record) {
        CallRecordDTO dto = new CallRecordDTO();
        dto.setCallId(record.getCallId());
        dto.setGatewayId(record.getGatewayId());
        dto.setCallerNumber(record.getCallerNumber());
        dto.setSessionId(record.getSessionId());
        AgentSession session = record.getSession();
        dto.setSessionState(session == null ? null : session.getState().name());
        dto.setStartedAt(record.getStartedAt());
        return dto;
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
