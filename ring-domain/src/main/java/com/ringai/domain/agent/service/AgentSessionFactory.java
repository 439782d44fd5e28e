package com.ringai.domain.agent.service;

import com.ringai.domain.agent.adapter.gateway.IRealtimeAgentClientFactory;
import com.ringai.domain.agent.adapter.gateway.ISpeechSynthesizer;
import com.ringai.domain.agent.model.valobj.SessionConfig;
import com.ringai.types.exception.SessionLifecycleException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.UUID;

/**
 * 按输出模式创建会话实例（原生音频或混合模式），会话 id 在此分配。
 */
public class AgentSessionFactory {

    private final IRealtimeAgentClientFactory clientFactory;
    private final ISpeechSynthesizer speechSynthesizer;
    private final TaskScheduler extensionScheduler;
    private final long extendBufferSeconds;
    private final Clock clock;

    /**
     * @param speechSynthesizer 可为 null，此时不支持混合模式
     * @param extensionScheduler 可为 null，此时会话不自动续期
     */
    public AgentSessionFactory(IRealtimeAgentClientFactory clientFactory,
                               ISpeechSynthesizer speechSynthesizer,
                               TaskScheduler extensionScheduler,
                               long extendBufferSeconds,
                               Clock clock) {
        this.clientFactory = clientFactory;
        this.speechSynthesizer = speechSynthesizer;
        this.extensionScheduler = extensionScheduler;
        this.extendBufferSeconds = extendBufferSeconds;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public AgentSession create(SessionConfig config) {
        String sessionId = UUID.randomUUID().toString();
        return switch (config.resolveOutputMode()) {
            case HYBRID -> {
                if (speechSynthesizer == null) {
                    throw new SessionLifecycleException("Hybrid output mode requires a speech synthesizer");
                }
                yield new HybridAgentSession(sessionId, config, clientFactory, extensionScheduler,
                        extendBufferSeconds, clock, speechSynthesizer);
            }
            case NATIVE_AUDIO -> new AgentSession(sessionId, config, clientFactory, extensionScheduler,
                    extendBufferSeconds, clock);
        };
    }
}
