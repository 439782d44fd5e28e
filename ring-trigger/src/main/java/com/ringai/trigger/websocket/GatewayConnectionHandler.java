package com.ringai.trigger.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ringai.api.dto.GatewayInboundMessageDTO;
import com.ringai.api.dto.GatewayOutboundMessageDTO;
import com.ringai.api.dto.GatewayTurnCompleteMessageDTO;
import com.ringai.domain.agent.model.valobj.AgentResponse;
import com.ringai.domain.agent.model.valobj.SessionConfig;
import com.ringai.domain.agent.model.valobj.ToolCall;
import com.ringai.domain.agent.model.valobj.ToolResult;
import com.ringai.domain.agent.service.AgentSession;
import com.ringai.domain.audio.service.PcmResampler;
import com.ringai.domain.call.adapter.gateway.IToolExecutor;
import com.ringai.domain.call.adapter.repository.IExpiringStore;
import com.ringai.domain.call.model.entity.CallRecord;
import com.ringai.domain.call.service.CallManager;
import com.ringai.domain.routing.model.valobj.IncomingCall;
import com.ringai.domain.routing.model.valobj.RoutingDecision;
import com.ringai.trigger.application.command.InboundRoutingApplicationService;
import com.ringai.types.common.Constants;
import com.ringai.types.enums.GatewayInboundMessageTypeEnum;
import com.ringai.types.enums.GatewayOutboundMessageTypeEnum;
import com.ringai.types.enums.ToolExecutionStatusEnum;
import com.ringai.types.enums.TranscriptSpeakerEnum;
import com.ringai.types.exception.MalformedAudioException;
import com.ringai.types.exception.SessionTimeoutException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 网关设备 WebSocket 处理器。
 * <p>
 * 每条设备连接对应一个 {@link GatewayConnection}：文本帧是 JSON 控制消息，二进制帧是 16-bit PCM。
 * 来电先走路由决策，ANSWER 时决策暂存到过期存储，等设备上报 CALL_CONNECTED 再申请上游会话；
 * 会话建立后由中继线程持续消费上游响应并转发给设备。一条连接同一时间只有一通活跃通话，
 * 挂断、断连、上游结束三条路径最终只会释放一次会话。
 * </p>
 *
 * @author ringai
 * @since 2026-03-05
 */
@Slf4j
@Component
public class GatewayConnectionHandler extends AbstractWebSocketHandler {

    private static final int LOG_PAYLOAD_MAX_LENGTH = 200;

    private final InboundRoutingApplicationService inboundRoutingApplicationService;
    private final CallManager callManager;
    private final IExpiringStore<String, RoutingDecision> pendingDecisionStore;
    private final IToolExecutor toolExecutor;
    private final Executor bridgeRelayExecutor;
    private final ObjectMapper objectMapper;
    private final int gatewaySampleRate;
    private final int agentInputSampleRate;
    private final int agentOutputSampleRate;
    private final int sendTimeLimitMs;
    private final int sendBufferSizeBytes;

    private final Map<String, GatewayConnection> connections = new ConcurrentHashMap<>();

    private final Counter audioInCounter;
    private final Counter audioOutCounter;
    private final Counter audioDroppedCounter;
    private final Counter sessionErrorCounter;
    private final Counter invalidMessageCounter;

    public GatewayConnectionHandler(InboundRoutingApplicationService inboundRoutingApplicationService,
                                    CallManager callManager,
                                    IExpiringStore<String, RoutingDecision> pendingDecisionStore,
                                    ObjectProvider<IToolExecutor> toolExecutorProvider,
                                    @Qualifier("bridgeRelayExecutor") Executor bridgeRelayExecutor,
                                    ObjectMapper objectMapper,
                                    ObjectProvider<MeterRegistry> meterRegistryProvider,
                                    @Value("${ring.bridge.audio.gateway-sample-rate:16000}") int gatewaySampleRate,
                                    @Value("${ring.bridge.audio.agent-input-sample-rate:16000}") int agentInputSampleRate,
                                    @Value("${ring.bridge.audio.agent-output-sample-rate:24000}") int agentOutputSampleRate,
                                    @Value("${ring.bridge.gateway.send-time-limit-ms:5000}") int sendTimeLimitMs,
                                    @Value("${ring.bridge.gateway.send-buffer-size-bytes:1048576}") int sendBufferSizeBytes) {
        this.inboundRoutingApplicationService = inboundRoutingApplicationService;
        this.callManager = callManager;
        this.pendingDecisionStore = pendingDecisionStore;
        this.toolExecutor = toolExecutorProvider.getIfAvailable();
        this.bridgeRelayExecutor = bridgeRelayExecutor;
        this.objectMapper = objectMapper;
        this.gatewaySampleRate = gatewaySampleRate;
        this.agentInputSampleRate = agentInputSampleRate;
        this.agentOutputSampleRate = agentOutputSampleRate;
        this.sendTimeLimitMs = sendTimeLimitMs <= 0 ? 5000 : sendTimeLimitMs;
        this.sendBufferSizeBytes = sendBufferSizeBytes <= 0 ? 1024 * 1024 : sendBufferSizeBytes;
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
        this.audioInCounter = Counter.builder("ring.gateway.audio.in.total").register(meterRegistry);
        this.audioOutCounter = Counter.builder("ring.gateway.audio.out.total").register(meterRegistry);
        this.audioDroppedCounter = Counter.builder("ring.gateway.audio.dropped.total").register(meterRegistry);
        this.sessionErrorCounter = Counter.builder("ring.gateway.session.error.total").register(meterRegistry);
        this.invalidMessageCounter = Counter.builder("ring.gateway.message.invalid.total").register(meterRegistry);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession concurrentSession = new ConcurrentWebSocketSessionDecorator(
                session, sendTimeLimitMs, sendBufferSizeBytes);
        connections.put(session.getId(), new GatewayConnection(concurrentSession));
        log.info("Gateway connected. connectionId={}, remote={}, connections={}",
                session.getId(), session.getRemoteAddress(), connections.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        GatewayConnection connection = connections.get(session.getId());
        if (connection != null) {
            connection.onControl(message.getPayload());
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        GatewayConnection connection = connections.get(session.getId());
        if (connection != null) {
            connection.onAudio(toBytes(message.getPayload()));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Gateway transport error. connectionId={}, error={}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        GatewayConnection connection = connections.remove(session.getId());
        if (connection != null) {
            connection.close();
        }
        log.info("Gateway disconnected. connectionId={}, code={}, connections={}",
                session.getId(), status.getCode(), connections.size());
    }

    public int connectionCount() {
        return connections.size();
    }

    private static byte[] toBytes(ByteBuffer buffer) {
        ByteBuffer copy = buffer.duplicate();
        byte[] bytes = new byte[copy.remaining()];
        copy.get(bytes);
        return bytes;
    }

    private static String errorMessage(Throwable ex) {
        return StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName());
    }

    /**
     * 单条设备连接的协议状态。
     */
    final class GatewayConnection {

        private final WebSocketSession session;
        private final AtomicReference<ActiveCall> activeCall = new AtomicReference<>();
        private final Set<String> pendingCallIds = ConcurrentHashMap.newKeySet();

        GatewayConnection(WebSocketSession session) {
            this.session = session;
        }

        void onControl(String payload) {
            GatewayInboundMessageDTO message;
            try {
                message = objectMapper.readValue(payload, GatewayInboundMessageDTO.class);
            } catch (JsonProcessingException ex) {
                invalidMessageCounter.increment();
                log.warn("Invalid JSON from gateway, skip. connectionId={}, payload={}",
                        session.getId(), StringUtils.abbreviate(payload, LOG_PAYLOAD_MAX_LENGTH));
                return;
            }
            GatewayInboundMessageTypeEnum type = parseType(message.getType());
            if (type == null) {
                invalidMessageCounter.increment();
                log.warn("Unknown gateway message type, skip. connectionId={}, type={}",
                        session.getId(), message.getType());
                return;
            }
            if (StringUtils.isBlank(message.getCallId())) {
                invalidMessageCounter.increment();
                log.warn("Gateway message without call_id, skip. connectionId={}, type={}",
                        session.getId(), type.getCode());
                return;
            }
            putMdc(message.getCallId(), message.getGatewayId());
            try {
                switch (type) {
                    case INCOMING_CALL -> onIncomingCall(message);
                    case CALL_CONNECTED -> onCallConnected(message);
                    case CALL_ENDED -> onCallEnded(message);
                }
            } catch (RuntimeException ex) {
                log.error("Failed to handle gateway message. connectionId={}, type={}, callId={}",
                        session.getId(), type.getCode(), message.getCallId(), ex);
            } finally {
                clearMdc();
            }
        }

        void onAudio(byte[] data) {
            ActiveCall call = activeCall.get();
            if (call == null || call.ended.get()) {
                audioDroppedCounter.increment();
                return;
            }
            byte[] pcm;
            try {
                pcm = PcmResampler.resample(data, gatewaySampleRate, agentInputSampleRate);
            } catch (MalformedAudioException ex) {
                audioDroppedCounter.increment();
                log.warn("Malformed audio frame dropped. callId={}, bytes={}", call.callId, data.length);
                return;
            }
            if (pcm.length == 0) {
                return;
            }
            try {
                call.session.sendAudio(pcm);
                audioInCounter.increment();
            } catch (SessionTimeoutException ex) {
                putMdc(call.callId, call.gatewayId);
                try {
                    log.error("Session expired while relaying audio, ending call. callId={}, error={}",
                            call.callId, ex.getMessage());
                    endCall(call, ex.getMessage());
                } finally {
                    clearMdc();
                }
            } catch (RuntimeException ex) {
                log.error("Failed to send audio upstream. callId={}, error={}", call.callId, ex.getMessage());
            }
        }

        void close() {
            ActiveCall call = activeCall.get();
            if (call != null) {
                putMdc(call.callId, call.gatewayId);
                try {
                    endCall(call, null);
                } finally {
                    clearMdc();
                }
            }
            for (String callId : pendingCallIds) {
                pendingDecisionStore.delete(callId);
            }
            pendingCallIds.clear();
        }

        private void onIncomingCall(GatewayInboundMessageDTO message) {
            IncomingCall call = new IncomingCall(
                    message.getCallId(),
                    message.getFromNumber(),
                    message.getToNumber(),
                    message.getCarrier(),
                    message.getSimSlot() == null ? 0 : message.getSimSlot(),
                    message.getGatewayId());
            log.info("Incoming call. callId={}, from={}, to={}, gatewayId={}, carrier={}, simSlot={}",
                    call.callId(), call.fromNumber(), call.toNumber(), call.gatewayId(), call.carrier(), call.simSlot());
            inboundRoutingApplicationService.route(call)
                    .thenAccept(decision -> {
                        putMdc(call.callId(), call.gatewayId());
                        try {
                            applyDecision(call, decision);
                        } finally {
                            clearMdc();
                        }
                    })
                    .exceptionally(ex -> {
                        log.error("Failed to apply routing decision. callId={}", call.callId(), ex);
                        return null;
                    });
        }

        private void applyDecision(IncomingCall call, RoutingDecision decision) {
            log.info("Routing decision. callId={}, action={}, rule={}",
                    call.callId(), decision.getAction().getCode(),
                    StringUtils.defaultIfBlank(decision.getRuleName(), "default"));
            inboundRoutingApplicationService.recordInteraction(call, decision);
            switch (decision.getAction()) {
                case ANSWER -> answer(call.callId(), decision);
                case REJECT -> send(GatewayOutboundMessageDTO.rejectCall(call.callId(),
                        StringUtils.defaultIfBlank(decision.getRejectReason(), Constants.REJECT_REASON_DEFAULT)));
                case FORWARD -> {
                    if (StringUtils.isBlank(decision.getForwardTo())) {
                        log.error("FORWARD decision without forward_to, falling back to ANSWER. callId={}",
                                call.callId());
                        answer(call.callId(), decision);
                    } else {
                        send(GatewayOutboundMessageDTO.forwardCall(call.callId(), decision.getForwardTo()));
                    }
                }
            }
        }

        private void answer(String callId, RoutingDecision decision) {
            pendingDecisionStore.put(callId, decision);
            pendingCallIds.add(callId);
            send(GatewayOutboundMessageDTO.answerCall(callId));
        }

        private void onCallConnected(GatewayInboundMessageDTO message) {
            String callId = message.getCallId();
            log.info("Call connected. callId={}, caller={}, gatewayId={}",
                    callId, message.getCallerNumber(), message.getGatewayId());
            ActiveCall previous = activeCall.get();
            if (previous != null) {
                log.warn("New call while previous still active, ending previous. callId={}, previousCallId={}",
                        callId, previous.callId);
                endCall(previous, null);
            }
            if (StringUtils.isNotBlank(message.getKnowledgeBaseId())) {
                log.debug("Knowledge base context not supported, ignored. callId={}, orgId={}, knowledgeBaseId={}",
                        callId, message.getOrgId(), message.getKnowledgeBaseId());
            }

            RoutingDecision decision = pendingDecisionStore.delete(callId);
            pendingCallIds.remove(callId);
            CallRecord record;
            try {
                record = callManager.createSession(callId, message.getGatewayId(), message.getCallerNumber(),
                        toSessionConfig(decision));
            } catch (RuntimeException ex) {
                sessionErrorCounter.increment();
                log.error("Failed to create session for call. callId={}, error={}", callId, ex.getMessage());
                send(GatewayOutboundMessageDTO.sessionError(callId, errorMessage(ex)));
                return;
            }

            ActiveCall call = new ActiveCall(callId, message.getGatewayId(), record.getSession());
            activeCall.set(call);
            send(GatewayOutboundMessageDTO.sessionReady(callId, record.getSessionId()));
            try {
                bridgeRelayExecutor.execute(() -> relay(call));
            } catch (RejectedExecutionException ex) {
                sessionErrorCounter.increment();
                log.error("Relay executor rejected call, ending call. callId={}", callId);
                endCall(call, "Relay capacity exhausted");
            }
        }

        private void onCallEnded(GatewayInboundMessageDTO message) {
            String callId = message.getCallId();
            log.info("Call ended by gateway. callId={}, reason={}", callId, message.getReason());
            pendingDecisionStore.delete(callId);
            pendingCallIds.remove(callId);
            ActiveCall call = activeCall.get();
            if (call != null && call.callId.equals(callId)) {
                endCall(call, null);
            } else {
                // 迟到或重复的 CALL_ENDED
                callManager.endSession(callId);
            }
        }

        /**
         * 消费上游响应直到流结束；流以异常结束时先下发 SESSION_ERROR 再结束通话。
         */
        private void relay(ActiveCall call) {
            putMdc(call.callId, call.gatewayId);
            StringBuilder inputTranscript = new StringBuilder();
            StringBuilder outputTranscript = new StringBuilder();
            String failure = null;
            try {
                Iterator<AgentResponse> responses = call.session.receive();
                while (responses.hasNext()) {
                    AgentResponse response = responses.next();
                    if (call.ended.get()) {
                        break;
                    }
                    if (response.hasToolCalls()) {
                        handleToolCalls(call, response.getToolCalls());
                        continue;
                    }
                    if (response.hasAudio() && !forwardAudio(call, response.getAudio())) {
                        break;
                    }
                    if (StringUtils.isNotEmpty(response.getInputTranscript())) {
                        inputTranscript.append(response.getInputTranscript());
                        send(GatewayOutboundMessageDTO.transcript(call.callId, TranscriptSpeakerEnum.CALLER,
                                response.getInputTranscript()));
                    }
                    if (StringUtils.isNotEmpty(response.getOutputTranscript())) {
                        outputTranscript.append(response.getOutputTranscript());
                        send(GatewayOutboundMessageDTO.transcript(call.callId, TranscriptSpeakerEnum.AGENT,
                                response.getOutputTranscript()));
                    }
                    if (response.isTurnComplete()) {
                        sendTurnComplete(call, outputTranscript, inputTranscript, false);
                    }
                    if (response.isInterrupted()) {
                        log.info("Barge-in detected. callId={}", call.callId);
                        sendTurnComplete(call, outputTranscript, inputTranscript, true);
                    }
                }
            } catch (RuntimeException ex) {
                failure = errorMessage(ex);
                log.error("Upstream relay failed. callId={}, error={}", call.callId, failure);
            } finally {
                if (!call.ended.get()) {
                    if (failure != null) {
                        sessionErrorCounter.increment();
                    }
                    log.info("Upstream stream finished, ending call. callId={}, failed={}", call.callId, failure != null);
                    endCall(call, failure);
                }
                clearMdc();
            }
        }

        private boolean forwardAudio(ActiveCall call, byte[] audio) {
            byte[] pcm;
            try {
                pcm = PcmResampler.resample(audio, agentOutputSampleRate, gatewaySampleRate);
            } catch (MalformedAudioException ex) {
                audioDroppedCounter.increment();
                log.warn("Malformed upstream audio dropped. callId={}, bytes={}", call.callId, audio.length);
                return true;
            }
            if (!sendMessage(new BinaryMessage(pcm))) {
                log.error("Failed to send audio to gateway, stopping relay. callId={}", call.callId);
                return false;
            }
            audioOutCounter.increment();
            return true;
        }

        private void sendTurnComplete(ActiveCall call, StringBuilder outputTranscript,
                                      StringBuilder inputTranscript, boolean interrupted) {
            send(GatewayTurnCompleteMessageDTO.of(call.callId,
                    StringUtils.defaultIfEmpty(outputTranscript.toString(), null),
                    StringUtils.defaultIfEmpty(inputTranscript.toString(), null),
                    interrupted));
            outputTranscript.setLength(0);
            inputTranscript.setLength(0);
        }

        private void handleToolCalls(ActiveCall call, List<ToolCall> toolCalls) {
            List<ToolResult> results = new ArrayList<>(toolCalls.size());
            if (toolExecutor == null) {
                log.warn("Tool calls received but no executor configured. callId={}, count={}",
                        call.callId, toolCalls.size());
                for (ToolCall toolCall : toolCalls) {
                    results.add(ToolResult.error(toolCall, Constants.TOOL_EXECUTION_UNAVAILABLE));
                }
                call.session.sendToolResponse(results);
                return;
            }
            for (ToolCall toolCall : toolCalls) {
                log.info("Executing tool. callId={}, tool={}, toolCallId={}",
                        call.callId, toolCall.name(), toolCall.callId());
                send(GatewayOutboundMessageDTO.toolExecution(call.callId, toolCall.name(), toolCall.callId(),
                        ToolExecutionStatusEnum.EXECUTING));
                ToolResult result;
                try {
                    result = toolExecutor.execute(call.callId, toolCall);
                } catch (RuntimeException ex) {
                    log.error("Tool execution failed. callId={}, tool={}, error={}",
                            call.callId, toolCall.name(), ex.getMessage());
                    result = ToolResult.error(toolCall, errorMessage(ex));
                }
                results.add(result);
                send(GatewayOutboundMessageDTO.toolExecution(call.callId, toolCall.name(), toolCall.callId(),
                        ToolExecutionStatusEnum.COMPLETED));
            }
            call.session.sendToolResponse(results);
            log.info("Tool responses sent upstream. callId={}, count={}", call.callId, results.size());
        }

        /**
         * 结束通话，多条路径并发触发时只有第一次生效。
         *
         * @param error 非空时先向设备下发 SESSION_ERROR
         */
        private void endCall(ActiveCall call, String error) {
            if (!call.ended.compareAndSet(false, true)) {
                return;
            }
            activeCall.compareAndSet(call, null);
            if (error != null) {
                send(GatewayOutboundMessageDTO.sessionError(call.callId, error));
            }
            callManager.endSession(call.callId);
        }

        private SessionConfig toSessionConfig(RoutingDecision decision) {
            if (decision == null) {
                return null;
            }
            if (StringUtils.isBlank(decision.getSystemInstruction()) && StringUtils.isBlank(decision.getVoiceName())) {
                return null;
            }
            return SessionConfig.builder()
                    .systemInstruction(StringUtils.trimToNull(decision.getSystemInstruction()))
                    .voiceName(StringUtils.trimToNull(decision.getVoiceName()))
                    .build();
        }

        private void send(GatewayOutboundMessageDTO message) {
            sendJson(message, message.getType());
        }

        private void send(GatewayTurnCompleteMessageDTO message) {
            sendJson(message, message.getType());
        }

        private void sendJson(Object message, GatewayOutboundMessageTypeEnum type) {
            String json;
            try {
                json = objectMapper.writeValueAsString(message);
            } catch (JsonProcessingException ex) {
                log.error("Failed to serialize gateway message. type={}", type, ex);
                return;
            }
            sendMessage(new TextMessage(json));
        }

        private boolean sendMessage(WebSocketMessage<?> message) {
            if (!session.isOpen()) {
                return false;
            }
            try {
                session.sendMessage(message);
                return true;
            } catch (IOException | RuntimeException ex) {
                log.warn("Failed to send message to gateway. connectionId={}, error={}", session.getId(), ex.getMessage());
                return false;
            }
        }

        private GatewayInboundMessageTypeEnum parseType(String type) {
            try {
                return GatewayInboundMessageTypeEnum.fromText(type);
            } catch (IllegalArgumentException ex) {
                return null;
            }
        }
    }

    private static final class ActiveCall {

        private final String callId;
        private final String gatewayId;
        private final AgentSession session;
        private final AtomicBoolean ended = new AtomicBoolean(false);

        private ActiveCall(String callId, String gatewayId, AgentSession session) {
            this.callId = callId;
            this.gatewayId = gatewayId;
            this.session = session;
        }
    }

    private static void putMdc(String callId, String gatewayId) {
        MDC.put(Constants.MDC_CALL_ID, StringUtils.defaultString(callId));
        MDC.put(Constants.MDC_GATEWAY_ID, StringUtils.defaultString(gatewayId));
    }

    private static void clearMdc() {
        MDC.remove(Constants.MDC_CALL_ID);
        MDC.remove(Constants.MDC_GATEWAY_ID);
    }
}
