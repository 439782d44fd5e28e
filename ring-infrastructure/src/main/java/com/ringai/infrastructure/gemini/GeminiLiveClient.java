package com.ringai.infrastructure.gemini;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ringai.domain.agent.adapter.gateway.IAgentResponseListener;
import com.ringai.domain.agent.adapter.gateway.IRealtimeAgentClient;
import com.ringai.domain.agent.model.valobj.AgentResponse;
import com.ringai.domain.agent.model.valobj.AgentToolCatalog;
import com.ringai.domain.agent.model.valobj.AgentToolDefinition;
import com.ringai.domain.agent.model.valobj.SessionConfig;
import com.ringai.domain.agent.model.valobj.ToolCall;
import com.ringai.domain.agent.model.valobj.ToolResult;
import com.ringai.types.exception.UpstreamClientException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Gemini Live（BidiGenerateContent）WebSocket 客户端。
 * <p>
 * 建连后先发送 setup 消息并等待 setupComplete；之后音频以 base64 PCM 走 realtimeInput，
 * 文本以 clientContent 轮次发送，工具结果走 toolResponse。服务端消息在容器线程上按序解析并回调监听器，
 * 期间记录 sessionResumptionUpdate 下发的续期句柄。
 * </p>
 *
 * @author ringai
 * @since 2026-03-04
 */
@Slf4j
public class GeminiLiveClient implements IRealtimeAgentClient {

    private static final TypeReference<Map<String, Object>> ARGS_REF = new TypeReference<Map<String, Object>>() {};
    private static final String MODEL_PREFIX = "models/";
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 4 * 1024 * 1024;

    private final WebSocketClient webSocketClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final String apiKey;
    private final SessionConfig config;
    private final Duration connectTimeout;
    private final String audioMimeType;

    private final CompletableFuture<Void> setupComplete = new CompletableFuture<>();
    private volatile WebSocketSession session;
    private volatile IAgentResponseListener listener;
    private volatile String resumptionHandle;
    private volatile boolean connected;
    private volatile boolean closedLocally;

    public GeminiLiveClient(WebSocketClient webSocketClient,
                            ObjectMapper objectMapper,
                            URI endpoint,
                            String apiKey,
                            SessionConfig config,
                            Duration connectTimeout,
                            int inputSampleRate) {
        this.webSocketClient = webSocketClient;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.config = config;
        this.connectTimeout = connectTimeout;
        this.audioMimeType = "audio/pcm;rate=" + inputSampleRate;
    }

    @Override
    public void connect(String resumptionHandle, IAgentResponseListener listener) {
        if (connected) {
            log.warn("Gemini client already connected, skip. model={}", config.getModelId());
            return;
        }
        if (StringUtils.isBlank(apiKey)) {
            throw new UpstreamClientException("Gemini api key is not configured");
        }
        this.listener = listener;
        this.resumptionHandle = resumptionHandle;
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.add("x-goog-api-key", apiKey);
        try {
            WebSocketSession rawSession = webSocketClient.execute(new UpstreamHandler(), headers, endpoint)
                    .get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            this.session = new ConcurrentWebSocketSessionDecorator(rawSession, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
            send(buildSetup(resumptionHandle));
            setupComplete.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            connected = true;
            log.info("Gemini session connected. model={}, voice={}, mode={}, resumed={}",
                    config.getModelId(), config.getVoiceName(), config.resolveOutputMode().getCode(),
                    resumptionHandle != null);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            closeQuietly();
            throw new UpstreamClientException("Interrupted while connecting to Gemini", ex);
        } catch (ExecutionException ex) {
            closeQuietly();
            throw new UpstreamClientException("Failed to connect to Gemini: " + rootMessage(ex), ex.getCause());
        } catch (TimeoutException ex) {
            closeQuietly();
            throw new UpstreamClientException("Timed out connecting to Gemini after " + connectTimeout.toMillis() + "ms", ex);
        }
    }

    @Override
    public void sendAudio(byte[] pcm) {
        ObjectNode audio = objectMapper.createObjectNode();
        audio.put("data", Base64.getEncoder().encodeToString(pcm));
        audio.put("mimeType", audioMimeType);
        ObjectNode root = objectMapper.createObjectNode();
        root.putObject("realtimeInput").set("audio", audio);
        sendConnected(root, "audio");
    }

    @Override
    public void sendAudioEnd() {
        ObjectNode root = objectMapper.createObjectNode();
        root.putObject("realtimeInput").put("audioStreamEnd", true);
        sendConnected(root, "audio_stream_end");
    }

    @Override
    public void sendText(String text) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode clientContent = root.putObject("clientContent");
        clientContent.putArray("turns").add(content("user", text));
        clientContent.put("turnComplete", true);
        sendConnected(root, "text");
    }

    @Override
    public void sendToolResponse(List<ToolResult> results) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode responses = root.putObject("toolResponse").putArray("functionResponses");
        for (ToolResult result : results) {
            ObjectNode item = responses.addObject();
            item.put("id", result.callId());
            item.put("name", result.name());
            item.set("response", objectMapper.valueToTree(result.response()));
        }
        sendConnected(root, "tool_response");
        log.info("Gemini tool responses sent. count={}", results.size());
    }

    @Override
    public String getResumptionHandle() {
        return resumptionHandle;
    }

    @Override
    public boolean isConnected() {
        WebSocketSession current = session;
        return connected && current != null && current.isOpen();
    }

    @Override
    public void close() {
        closedLocally = true;
        connected = false;
        WebSocketSession current = session;
        session = null;
        if (current == null) {
            return;
        }
        try {
            current.close(CloseStatus.NORMAL);
            log.info("Gemini session closed. model={}", config.getModelId());
        } catch (IOException ex) {
            log.warn("Failed to close Gemini session cleanly. model={}, error={}", config.getModelId(), ex.getMessage());
        }
    }

    ObjectNode buildSetup(String handle) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode setup = root.putObject("setup");
        String modelId = config.getModelId();
        setup.put("model", modelId.startsWith(MODEL_PREFIX) ? modelId : MODEL_PREFIX + modelId);

        ObjectNode generationConfig = setup.putObject("generationConfig");
        if (config.isHybrid()) {
            generationConfig.putArray("responseModalities").add("TEXT");
        } else {
            generationConfig.putArray("responseModalities").add("AUDIO");
            generationConfig.putObject("speechConfig")
                    .putObject("voiceConfig")
                    .putObject("prebuiltVoiceConfig")
                    .put("voiceName", config.getVoiceName());
        }
        if (config.getTemperature() != null) {
            generationConfig.put("temperature", config.getTemperature());
        }

        if (StringUtils.isNotBlank(config.getSystemInstruction())) {
            setup.set("systemInstruction", content("user", config.getSystemInstruction()));
        }
        if (Boolean.TRUE.equals(config.getInputTranscription())) {
            setup.putObject("inputAudioTranscription");
        }
        if (Boolean.TRUE.equals(config.getOutputTranscription())) {
            setup.putObject("outputAudioTranscription");
        }

        List<AgentToolDefinition> tools = AgentToolCatalog.resolve(config.getToolNames());
        if (!tools.isEmpty()) {
            ArrayNode declarations = setup.putArray("tools").addObject().putArray("functionDeclarations");
            for (AgentToolDefinition tool : tools) {
                ObjectNode declaration = declarations.addObject();
                declaration.put("name", tool.name());
                declaration.put("description", tool.description());
                declaration.set("parameters", objectMapper.valueToTree(tool.parameters()));
            }
        }

        // 不带句柄也要声明，服务端才会下发续期句柄
        ObjectNode resumption = setup.putObject("sessionResumption");
        if (handle != null) {
            resumption.put("handle", handle);
        }
        return root;
    }

    /**
     * 解析一条服务端消息，返回需要回调给会话的响应，没有可回调内容时返回 null。
     */
    AgentResponse parseServerMessage(JsonNode message) {
        JsonNode resumptionUpdate = message.path("sessionResumptionUpdate");
        String newHandle = resumptionUpdate.path("newHandle").asText(null);
        if (StringUtils.isNotBlank(newHandle)) {
            resumptionHandle = newHandle;
        }

        if (message.has("goAway")) {
            log.warn("Gemini sent goAway, connection ending soon. timeLeft={}",
                    message.path("goAway").path("timeLeft").asText("unknown"));
        }

        if (message.has("setupComplete")) {
            setupComplete.complete(null);
            return null;
        }

        JsonNode functionCalls = message.path("toolCall").path("functionCalls");
        if (functionCalls.isArray() && functionCalls.size() > 0) {
            List<ToolCall> toolCalls = new ArrayList<>(functionCalls.size());
            for (JsonNode call : functionCalls) {
                Map<String, Object> args = call.hasNonNull("args")
                        ? objectMapper.convertValue(call.get("args"), ARGS_REF)
                        : Collections.emptyMap();
                toolCalls.add(new ToolCall(call.path("id").asText(null), call.path("name").asText(null), args));
            }
            log.info("Gemini tool calls received. count={}", toolCalls.size());
            return AgentResponse.builder().toolCalls(toolCalls).build();
        }

        JsonNode serverContent = message.get("serverContent");
        if (serverContent == null || serverContent.isNull()) {
            return null;
        }
        AgentResponse.AgentResponseBuilder builder = AgentResponse.builder();
        boolean hasContent = false;
        for (JsonNode part : serverContent.path("modelTurn").path("parts")) {
            String data = part.path("inlineData").path("data").asText(null);
            if (StringUtils.isNotEmpty(data)) {
                builder.audio(Base64.getDecoder().decode(data));
                hasContent = true;
            }
            String text = part.path("text").asText(null);
            if (StringUtils.isNotEmpty(text)) {
                builder.text(text);
                hasContent = true;
            }
        }
        String inputTranscript = serverContent.path("inputTranscription").path("text").asText(null);
        if (StringUtils.isNotEmpty(inputTranscript)) {
            builder.inputTranscript(inputTranscript);
            hasContent = true;
        }
        String outputTranscript = serverContent.path("outputTranscription").path("text").asText(null);
        if (StringUtils.isNotEmpty(outputTranscript)) {
            builder.outputTranscript(outputTranscript);
            hasContent = true;
        }
        if (serverContent.path("turnComplete").asBoolean(false)) {
            builder.turnComplete(true);
            hasContent = true;
        }
        if (serverContent.path("interrupted").asBoolean(false)) {
            builder.interrupted(true);
            hasContent = true;
        }
        return hasContent ? builder.build() : null;
    }

    private ObjectNode content(String role, String text) {
        ObjectNode content = objectMapper.createObjectNode();
        content.put("role", role);
        content.putArray("parts").addObject().put("text", text);
        return content;
    }

    private void sendConnected(ObjectNode payload, String kind) {
        if (!connected || session == null) {
            throw new UpstreamClientException("Gemini session is not connected, cannot send " + kind);
        }
        send(payload);
    }

    private void send(ObjectNode payload) {
        WebSocketSession current = session;
        if (current == null) {
            throw new UpstreamClientException("Gemini session is closed");
        }
        try {
            current.sendMessage(new TextMessage(objectMapper.writeValueAsString(payload)));
        } catch (IOException | IllegalStateException ex) {
            throw new UpstreamClientException("Failed to send message to Gemini: " + ex.getMessage(), ex);
        }
    }

    private void dispatch(String payload) {
        AgentResponse response;
        try {
            response = parseServerMessage(objectMapper.readTree(payload));
        } catch (IOException | IllegalArgumentException ex) {
            log.warn("Failed to parse Gemini message, skip. error={}", ex.getMessage());
            return;
        }
        IAgentResponseListener current = listener;
        if (response != null && current != null && connected) {
            current.onResponse(response);
        }
    }

    private void closeQuietly() {
        try {
            close();
        } catch (RuntimeException ex) {
            log.debug("Ignore close failure after connect error. error={}", ex.getMessage());
        }
    }

    private static String rootMessage(ExecutionException ex) {
        Throwable cause = ex.getCause() == null ? ex : ex.getCause();
        return cause.getMessage();
    }

    private final class UpstreamHandler extends AbstractWebSocketHandler {

        @Override
        protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
            dispatch(message.getPayload());
        }

        @Override
        protected void handleBinaryMessage(WebSocketSession wsSession, BinaryMessage message) {
            // 服务端以二进制帧下发 UTF-8 JSON
            dispatch(StandardCharsets.UTF_8.decode(message.getPayload()).toString());
        }

        @Override
        public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
            if (!setupComplete.isDone()) {
                setupComplete.completeExceptionally(exception);
                return;
            }
            connected = false;
            IAgentResponseListener current = listener;
            if (current != null && !closedLocally) {
                current.onError(new UpstreamClientException("Gemini transport error: " + exception.getMessage(), exception));
            }
        }

        @Override
        public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
            if (!setupComplete.isDone()) {
                setupComplete.completeExceptionally(
                        new UpstreamClientException("Gemini closed during setup: " + status));
                return;
            }
            connected = false;
            log.info("Gemini connection closed. code={}, reason={}, local={}", status.getCode(), status.getReason(), closedLocally);
            IAgentResponseListener current = listener;
            if (current != null && !closedLocally) {
                current.onClosed();
            }
        }
    }
}
