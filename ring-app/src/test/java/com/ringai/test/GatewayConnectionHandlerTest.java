package com.ringai.test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.cache.CacheBuilder;
import com.ringai.api.dto.GatewayInboundMessageDTO;
import com.ringai.domain.agent.model.valobj.AgentResponse;
import com.ringai.domain.agent.model.valobj.ToolCall;
import com.ringai.domain.agent.model.valobj.ToolResult;
import com.ringai.domain.agent.service.AgentSession;
import com.ringai.domain.agent.service.AgentSessionFactory;
import com.ringai.domain.agent.service.SessionPool;
import com.ringai.domain.call.adapter.gateway.IToolExecutor;
import com.ringai.domain.call.service.CallManager;
import com.ringai.domain.routing.model.valobj.RoutingDecision;
import com.ringai.infrastructure.store.GuavaExpiringStore;
import com.ringai.test.support.FakeRealtimeAgentClient;
import com.ringai.test.support.FakeRealtimeAgentClientFactory;
import com.ringai.trigger.application.command.InboundRoutingApplicationService;
import com.ringai.trigger.websocket.GatewayConnectionHandler;
import com.ringai.types.common.Constants;
import com.ringai.types.enums.RoutingActionEnum;
import com.ringai.types.enums.SessionStateEnum;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class GatewayConnectionHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private InboundRoutingApplicationService routingService;
    private FakeRealtimeAgentClientFactory clientFactory;
    private SessionPool pool;
    private CallManager callManager;
    private GuavaExpiringStore<String, RoutingDecision> pendingDecisionStore;
    private List<Runnable> relayTasks;
    private MeterRegistry meterRegistry;
    private DefaultListableBeanFactory beanFactory;
    private WebSocketSession rawSession;
    private GatewayConnectionHandler handler;

    @BeforeEach
    public void setUp() throws Exception {
        this.routingService = mock(InboundRoutingApplicationService.class);
        when(routingService.recordInteraction(any(), any())).thenReturn(CompletableFuture.completedFuture(null));
        this.clientFactory = new FakeRealtimeAgentClientFactory();
        this.pool = new SessionPool(1, null,
                new AgentSessionFactory(clientFactory, null, null, 60L, Clock.systemUTC()),
                Runnable::run, Duration.ofSeconds(5));
        this.callManager = new CallManager(pool, Duration.ofMillis(10), Clock.systemUTC());
        this.pendingDecisionStore = new GuavaExpiringStore<>(CacheBuilder.newBuilder().build());
        this.relayTasks = new ArrayList<>();
        this.meterRegistry = new SimpleMeterRegistry();
        this.beanFactory = new DefaultListableBeanFactory();
        beanFactory.registerSingleton("meterRegistry", meterRegistry);

        this.rawSession = mock(WebSocketSession.class);
        when(rawSession.getId()).thenReturn("conn-1");
        when(rawSession.isOpen()).thenReturn(true);
        this.handler = newHandler();
        handler.afterConnectionEstablished(rawSession);
    }

    @Test
    public void shouldAnswerAndKeepPendingDecision() throws Exception {
        routeTo(RoutingDecision.answer("call-1"));

        handler.handleMessage(rawSession, incomingCall("call-1"));

        JsonNode answer = onlyFrame("ANSWER_CALL");
        Assertions.assertEquals("call-1", answer.get("call_id").asText());
        Assertions.assertNotNull(pendingDecisionStore.get("call-1"));
        verify(routingService).recordInteraction(any(), any());
    }

    @Test
    public void shouldRejectWithDecisionReason() throws Exception {
        routeTo(RoutingDecision.builder().action(RoutingActionEnum.REJECT).callId("call-1")
                .rejectReason(Constants.REJECT_REASON_NO_MATCHING_RULE).build());

        handler.handleMessage(rawSession, incomingCall("call-1"));

        Assertions.assertEquals("no_matching_rule", onlyFrame("REJECT_CALL").get("reason").asText());
        Assertions.assertNull(pendingDecisionStore.get("call-1"));
    }

    @Test
    public void shouldForwardToTarget() throws Exception {
        routeTo(RoutingDecision.builder().action(RoutingActionEnum.FORWARD).callId("call-1")
                .forwardTo("+9779811111111").build());

        handler.handleMessage(rawSession, incomingCall("call-1"));

        Assertions.assertEquals("+9779811111111", onlyFrame("FORWARD_CALL").get("forward_to").asText());
    }

    @Test
    public void shouldAnswerWhenForwardTargetMissing() throws Exception {
        routeTo(RoutingDecision.builder().action(RoutingActionEnum.FORWARD).callId("call-1").build());

        handler.handleMessage(rawSession, incomingCall("call-1"));

        onlyFrame("ANSWER_CALL");
        Assertions.assertTrue(framesOfType("FORWARD_CALL").isEmpty());
    }

    @Test
    public void shouldBridgeAudioAndTranscriptsForConnectedCall() throws Exception {
        routeTo(RoutingDecision.builder().action(RoutingActionEnum.ANSWER).callId("call-1").orgId("org-1")
                .systemInstruction("Be brief").voiceName("Puck").build());
        handler.handleMessage(rawSession, incomingCall("call-1"));

        handler.handleMessage(rawSession, callConnected("call-1"));

        JsonNode ready = onlyFrame("SESSION_READY");
        AgentSession session = callManager.getSession("call-1");
        Assertions.assertEquals(session.getSessionId(), ready.get("session_id").asText());
        Assertions.assertEquals("Be brief", session.getConfig().getSystemInstruction());
        Assertions.assertEquals("Puck", session.getConfig().getVoiceName());
        Assertions.assertNull(pendingDecisionStore.get("call-1"));

        handler.handleMessage(rawSession, new BinaryMessage(new byte[]{1, 0, 2, 0}));
        FakeRealtimeAgentClient client = clientFactory.client(0);
        Assertions.assertEquals(1, client.getSentAudio().size());

        client.emit(AgentResponse.builder().audio(pcm(0, 200, 400, 600, 800, 1000)).build());
        client.emit(AgentResponse.builder().inputTranscript("Hi").build());
        client.emit(AgentResponse.builder().outputTranscript("Hello ").build());
        client.emit(AgentResponse.builder().outputTranscript("there").turnComplete(true).build());
        client.closeFromServer();
        runRelay();

        List<BinaryMessage> audio = binaryFrames();
        Assertions.assertEquals(1, audio.size());
        Assertions.assertEquals(8, audio.get(0).getPayloadLength());
        List<JsonNode> transcripts = framesOfType("CALL_TRANSCRIPT");
        Assertions.assertEquals(3, transcripts.size());
        Assertions.assertEquals("caller", transcripts.get(0).get("speaker").asText());
        Assertions.assertEquals("agent", transcripts.get(1).get("speaker").asText());
        JsonNode turn = onlyFrame("TURN_COMPLETE");
        Assertions.assertEquals("Hello there", turn.get("output_transcript").asText());
        Assertions.assertEquals("Hi", turn.get("input_transcript").asText());
        Assertions.assertFalse(turn.get("was_interrupted").asBoolean());
        Assertions.assertTrue(framesOfType("SESSION_ERROR").isEmpty());
        Assertions.assertNull(callManager.getSession("call-1"));
        Assertions.assertEquals(0, pool.activeCount());
    }

    @Test
    public void shouldUsePoolDefaultsWhenConnectedWithoutIncomingCall() throws Exception {
        handler.handleMessage(rawSession, callConnected("call-1"));

        onlyFrame("SESSION_READY");
        Assertions.assertEquals(pool.getDefaults().getVoiceName(),
                callManager.getSession("call-1").getConfig().getVoiceName());
    }

    @Test
    public void shouldAcceptConnectedFrameWithOrganisationContext() throws Exception {
        handler.handleMessage(rawSession, new TextMessage("{\"type\":\"CALL_CONNECTED\",\"call_id\":\"call-1\","
                + "\"caller_number\":\"+9779800000001\",\"gateway_id\":\"gw-1\","
                + "\"org_id\":\"org-1\",\"knowledge_base_id\":\"kb-1\"}"));

        GatewayInboundMessageDTO parsed = objectMapper.readValue(
                "{\"type\":\"CALL_CONNECTED\",\"call_id\":\"call-1\",\"org_id\":\"org-1\"}",
                GatewayInboundMessageDTO.class);

        Assertions.assertEquals("org-1", parsed.getOrgId());
        Assertions.assertEquals("call-1", onlyFrame("SESSION_READY").get("call_id").asText());
        Assertions.assertEquals(1, pool.activeCount());
    }

    @Test
    public void shouldReportBargeInAsInterruptedTurn() throws Exception {
        handler.handleMessage(rawSession, callConnected("call-1"));
        FakeRealtimeAgentClient client = clientFactory.client(0);

        client.emit(AgentResponse.builder().outputTranscript("Let me").build());
        client.emit(AgentResponse.builder().interrupted(true).build());
        client.closeFromServer();
        runRelay();

        JsonNode turn = onlyFrame("TURN_COMPLETE");
        Assertions.assertTrue(turn.get("was_interrupted").asBoolean());
        Assertions.assertEquals("Let me", turn.get("output_transcript").asText());
        Assertions.assertTrue(turn.has("input_transcript"));
        Assertions.assertTrue(turn.get("input_transcript").isNull());
        Assertions.assertFalse(onlyFrame("SESSION_READY").has("output_transcript"));
    }

    @Test
    public void shouldEndCallOnGatewayHangup() throws Exception {
        handler.handleMessage(rawSession, callConnected("call-1"));
        AgentSession session = callManager.getSession("call-1");

        handler.handleMessage(rawSession, callEnded("call-1"));
        runRelay();

        Assertions.assertEquals(SessionStateEnum.CLOSED, session.getState());
        Assertions.assertEquals(0, pool.activeCount());
        Assertions.assertTrue(framesOfType("SESSION_ERROR").isEmpty());
    }

    @Test
    public void shouldIgnoreLateHangup() throws Exception {
        handler.handleMessage(rawSession, callEnded("call-unknown"));

        Assertions.assertEquals(0, pool.activeCount());
        verify(rawSession, never()).sendMessage(any());
    }

    @Test
    public void shouldSendSessionErrorWhenUpstreamFails() throws Exception {
        handler.handleMessage(rawSession, callConnected("call-1"));

        clientFactory.client(0).fail(new IllegalStateException("connection reset"));
        runRelay();

        JsonNode error = onlyFrame("SESSION_ERROR");
        Assertions.assertEquals("call-1", error.get("call_id").asText());
        Assertions.assertTrue(error.get("error").asText().contains("connection reset"));
        Assertions.assertEquals(0, pool.activeCount());
        Assertions.assertEquals(1.0D, meterRegistry.get("ring.gateway.session.error.total").counter().count());
    }

    @Test
    public void shouldSendSessionErrorWhenPoolExhausted() throws Exception {
        callManager.createSession("other-call", "gw-2", null, null);

        handler.handleMessage(rawSession, callConnected("call-1"));

        onlyFrame("SESSION_ERROR");
        Assertions.assertTrue(framesOfType("SESSION_READY").isEmpty());
        Assertions.assertTrue(relayTasks.isEmpty());
    }

    @Test
    public void shouldEndPreviousCallWhenNewCallConnects() throws Exception {
        pool = new SessionPool(2, null,
                new AgentSessionFactory(clientFactory, null, null, 60L, Clock.systemUTC()),
                Runnable::run, Duration.ofSeconds(5));
        callManager = new CallManager(pool, Duration.ofMillis(10), Clock.systemUTC());
        handler = newHandler();
        handler.afterConnectionEstablished(rawSession);

        handler.handleMessage(rawSession, callConnected("call-1"));
        handler.handleMessage(rawSession, callConnected("call-2"));

        Assertions.assertNull(callManager.getSession("call-1"));
        Assertions.assertNotNull(callManager.getSession("call-2"));
        Assertions.assertEquals(1, pool.activeCount());
    }

    @Test
    public void shouldAnswerToolCallsWithErrorWhenNoExecutor() throws Exception {
        handler.handleMessage(rawSession, callConnected("call-1"));
        FakeRealtimeAgentClient client = clientFactory.client(0);

        client.emit(AgentResponse.builder()
                .toolCalls(List.of(new ToolCall("fc-1", "check_balance", Map.of("org_id", "org-1"))))
                .build());
        client.closeFromServer();
        runRelay();

        ToolResult result = client.getSentToolResponses().get(0).get(0);
        Assertions.assertEquals("fc-1", result.callId());
        Assertions.assertEquals(Constants.TOOL_EXECUTION_UNAVAILABLE, result.response().get("error"));
        Assertions.assertTrue(framesOfType("TOOL_EXECUTION").isEmpty());
    }

    @Test
    public void shouldExecuteToolCallsAndReportProgress() throws Exception {
        IToolExecutor toolExecutor = mock(IToolExecutor.class);
        ToolCall toolCall = new ToolCall("fc-1", "check_balance", Map.of("org_id", "org-1"));
        when(toolExecutor.execute(eq("call-1"), eq(toolCall)))
                .thenReturn(new ToolResult("fc-1", "check_balance", Map.of("balance", 42)));
        beanFactory.registerSingleton("toolExecutor", toolExecutor);
        handler = newHandler();
        handler.afterConnectionEstablished(rawSession);

        handler.handleMessage(rawSession, callConnected("call-1"));
        FakeRealtimeAgentClient client = clientFactory.client(0);
        client.emit(AgentResponse.builder().toolCalls(List.of(toolCall)).build());
        client.closeFromServer();
        runRelay();

        List<JsonNode> progress = framesOfType("TOOL_EXECUTION");
        Assertions.assertEquals(2, progress.size());
        Assertions.assertEquals("executing", progress.get(0).get("status").asText());
        Assertions.assertEquals("completed", progress.get(1).get("status").asText());
        Assertions.assertEquals("check_balance", progress.get(1).get("tool_name").asText());
        Assertions.assertEquals(42, client.getSentToolResponses().get(0).get(0).response().get("balance"));
    }

    @Test
    public void shouldSkipInvalidControlMessages() throws Exception {
        handler.handleMessage(rawSession, new TextMessage("not json"));
        handler.handleMessage(rawSession, new TextMessage("{\"type\":\"DIAL_OUT\",\"call_id\":\"call-1\"}"));
        handler.handleMessage(rawSession, new TextMessage("{\"type\":\"INCOMING_CALL\"}"));

        verify(rawSession, never()).sendMessage(any());
        verify(routingService, never()).route(any());
        Assertions.assertEquals(3.0D, meterRegistry.get("ring.gateway.message.invalid.total").counter().count());
    }

    @Test
    public void shouldDropAudioWithoutActiveCallOrWithOddLength() throws Exception {
        handler.handleMessage(rawSession, new BinaryMessage(new byte[]{1, 0}));
        handler.handleMessage(rawSession, callConnected("call-1"));
        handler.handleMessage(rawSession, new BinaryMessage(new byte[]{1, 0, 2}));

        Assertions.assertTrue(clientFactory.client(0).getSentAudio().isEmpty());
        Assertions.assertEquals(2.0D, meterRegistry.get("ring.gateway.audio.dropped.total").counter().count());
    }

    @Test
    public void shouldCleanUpWhenGatewayDisconnects() throws Exception {
        routeTo(RoutingDecision.answer("call-2"));
        handler.handleMessage(rawSession, callConnected("call-1"));
        handler.handleMessage(rawSession, incomingCall("call-2"));

        handler.afterConnectionClosed(rawSession, CloseStatus.GOING_AWAY);

        Assertions.assertEquals(0, pool.activeCount());
        Assertions.assertNull(pendingDecisionStore.get("call-2"));
        Assertions.assertEquals(0, handler.connectionCount());
    }

    private GatewayConnectionHandler newHandler() {
        ObjectProvider<IToolExecutor> toolExecutorProvider = beanFactory.getBeanProvider(IToolExecutor.class);
        ObjectProvider<MeterRegistry> meterRegistryProvider = beanFactory.getBeanProvider(MeterRegistry.class);
        return new GatewayConnectionHandler(routingService, callManager, pendingDecisionStore, toolExecutorProvider,
                relayTasks::add, objectMapper, meterRegistryProvider, 16000, 16000, 24000, 5000, 1024 * 1024);
    }

    private void routeTo(RoutingDecision decision) {
        when(routingService.route(any())).thenReturn(CompletableFuture.completedFuture(decision));
    }

    private void runRelay() {
        List<Runnable> tasks = new ArrayList<>(relayTasks);
        relayTasks.clear();
        tasks.forEach(Runnable::run);
    }

    private TextMessage incomingCall(String callId) {
        return new TextMessage("{\"type\":\"INCOMING_CALL\",\"call_id\":\"" + callId + "\","
                + "\"from_number\":\"+9779800000001\",\"to_number\":\"+9779700000000\","
                + "\"carrier\":\"Ncell\",\"sim_slot\":1,\"gateway_id\":\"gw-1\"}");
    }

    private TextMessage callConnected(String callId) {
        return new TextMessage("{\"type\":\"CALL_CONNECTED\",\"call_id\":\"" + callId + "\","
                + "\"caller_number\":\"+9779800000001\",\"gateway_id\":\"gw-1\"}");
    }

    private TextMessage callEnded(String callId) {
        return new TextMessage("{\"type\":\"CALL_ENDED\",\"call_id\":\"" + callId + "\",\"reason\":\"hangup\"}");
    }

    private List<WebSocketMessage<?>> sentMessages() throws Exception {
        @SuppressWarnings({"unchecked", "rawtypes"})
        ArgumentCaptor<WebSocketMessage<?>> captor = (ArgumentCaptor) ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(rawSession, atLeast(0)).sendMessage(captor.capture());
        return captor.getAllValues();
    }

    private List<JsonNode> framesOfType(String type) throws Exception {
        List<JsonNode> frames = new ArrayList<>();
        for (WebSocketMessage<?> message : sentMessages()) {
            if (message instanceof TextMessage textMessage) {
                JsonNode node = objectMapper.readTree(textMessage.getPayload());
                if (type.equals(node.get("type").asText())) {
                    frames.add(node);
                }
            }
        }
        return frames;
    }

    private JsonNode onlyFrame(String type) throws Exception {
        List<JsonNode> frames = framesOfType(type);
        Assertions.assertEquals(1, frames.size(), "expected exactly one " + type + " frame");
        return frames.get(0);
    }

    private List<BinaryMessage> binaryFrames() throws Exception {
        List<BinaryMessage> frames = new ArrayList<>();
        for (WebSocketMessage<?> message : sentMessages()) {
            if (message instanceof BinaryMessage binaryMessage) {
                frames.add(binaryMessage);
            }
        }
        return frames;
    }

    private static byte[] pcm(int... samples) {
        ByteBuffer buffer = ByteBuffer.allocate(samples.length * 2).order(java.nio.ByteOrder.LITTLE_ENDIAN);
        for (int sample : samples) {
            buffer.putShort((short) sample);
        }
        return buffer.array();
    }
}
