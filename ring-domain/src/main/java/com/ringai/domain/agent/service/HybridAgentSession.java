package com.ringai.domain.agent.service;

import com.ringai.domain.agent.adapter.gateway.IRealtimeAgentClientFactory;
import com.ringai.domain.agent.adapter.gateway.ISpeechSynthesizer;
import com.ringai.domain.agent.model.valobj.AgentResponse;
import com.ringai.domain.agent.model.valobj.SessionConfig;
import com.ringai.types.exception.SessionLifecycleException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.Iterator;

/**
 * 混合输出会话：上游只输出文本，本地 TTS 合成音频后再交给调用方。
 * <p>
 * 只有文本没有音频的响应会被补上合成音频；合成失败时仍原样交出纯文本响应，由调用方决定如何降级。
 * </p>
 */
@Slf4j
public class HybridAgentSession extends AgentSession {

    private final ISpeechSynthesizer speechSynthesizer;

    public HybridAgentSession(String sessionId,
                              SessionConfig config,
                              IRealtimeAgentClientFactory clientFactory,
                              TaskScheduler scheduler,
                              long extendBufferSeconds,
                              Clock clock,
                              ISpeechSynthesizer speechSynthesizer) {
        super(sessionId, config, clientFactory, scheduler, extendBufferSeconds, clock);
        if (speechSynthesizer == null) {
            throw new SessionLifecycleException("Hybrid output mode requires a speech synthesizer");
        }
        this.speechSynthesizer = speechSynthesizer;
    }

    @Override
    public Iterator<AgentResponse> receive() {
        Iterator<AgentResponse> upstream = super.receive();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return upstream.hasNext();
            }

            @Override
            public AgentResponse next() {
                return attachSpeech(upstream.next());
            }
        };
    }

    private AgentResponse attachSpeech(AgentResponse response) {
        if (!response.hasText() || response.hasAudio()) {
            return response;
        }
        try {
            byte[] audio = speechSynthesizer.synthesize(response.getText(), getConfig().ttsConfig());
            if (audio == null || audio.length == 0) {
                log.warn("Speech synthesis returned no audio. sessionId={}, provider={}",
                        getSessionId(), getConfig().getHybridTtsProvider());
                return response;
            }
            return response.withAudio(audio);
        } catch (RuntimeException ex) {
            log.warn("Speech synthesis failed, emitting text only. sessionId={}, provider={}, error={}",
                    getSessionId(), getConfig().getHybridTtsProvider(), ex.getMessage());
            return response;
        }
    }
}
