package com.ringai.infrastructure.gemini;

import com.ringai.domain.agent.adapter.gateway.IRealtimeAgentClient;
import com.ringai.domain.agent.adapter.gateway.IRealtimeAgentClientFactory;
import com.ringai.domain.agent.model.valobj.SessionConfig;
import com.ringai.infrastructure.util.JsonCodec;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.net.URI;
import java.time.Duration;

/**
 * Gemini Live 客户端工厂，所有连接共享一个 JSR-356 容器。
 */
@Slf4j
@Component
public class GeminiLiveClientFactory implements IRealtimeAgentClientFactory {

    private static final int MAX_MESSAGE_BUFFER_BYTES = 8 * 1024 * 1024;

    private final StandardWebSocketClient webSocketClient;
    private final JsonCodec jsonCodec;
    private final URI endpoint;
    private final String apiKey;
    private final Duration connectTimeout;
    private final int inputSampleRate;

    public GeminiLiveClientFactory(JsonCodec jsonCodec,
                                   @Value("${ring.bridge.gemini.endpoint:wss://generativelanguage.googleapis.com/ws/google.ai.generativelanguage.v1alpha.GenerativeService.BidiGenerateContent}") String endpoint,
                                   @Value("${ring.bridge.gemini.api-key:}") String apiKey,
                                   @Value("${ring.bridge.gemini.connect-timeout-ms:10000}") long connectTimeoutMs,
                                   @Value("${ring.bridge.audio.agent-input-sample-rate:16000}") int inputSampleRate) {
        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(MAX_MESSAGE_BUFFER_BYTES);
        container.setDefaultMaxBinaryMessageBufferSize(MAX_MESSAGE_BUFFER_BYTES);
        this.webSocketClient = new StandardWebSocketClient(container);
        this.jsonCodec = jsonCodec;
        this.endpoint = URI.create(endpoint);
        this.apiKey = apiKey;
        this.connectTimeout = Duration.ofMillis(connectTimeoutMs);
        this.inputSampleRate = inputSampleRate;
        if (StringUtils.isBlank(apiKey)) {
            log.warn("ring.bridge.gemini.api-key is empty, upstream sessions will fail to connect");
        }
    }

    @Override
    public IRealtimeAgentClient create(SessionConfig config) {
        return new GeminiLiveClient(webSocketClient, jsonCodec.getObjectMapper(), endpoint, apiKey,
                config, connectTimeout, inputSampleRate);
    }
}
