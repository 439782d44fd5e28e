package com.ringai.config;

import com.ringai.domain.agent.adapter.gateway.IRealtimeAgentClientFactory;
import com.ringai.domain.agent.adapter.gateway.ISpeechSynthesizer;
import com.ringai.domain.agent.model.valobj.SessionConfig;
import com.ringai.domain.agent.service.AgentSessionFactory;
import com.ringai.domain.agent.service.SessionPool;
import com.ringai.domain.call.service.CallManager;
import com.ringai.types.enums.OutputModeEnum;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * 会话池与通话管理装配。
 * <p>
 * 关停顺序依赖 Bean 依赖关系：CallManager 先结束所有通话，SessionPool 再关闭剩余会话，
 * 续期调度器最后停止。
 * </p>
 *
 * @author ringai
 * @since 2026-03-05
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(BridgeProperties.class)
public class BridgeCoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AgentSessionFactory agentSessionFactory(IRealtimeAgentClientFactory realtimeAgentClientFactory,
                                                   ObjectProvider<ISpeechSynthesizer> speechSynthesizerProvider,
                                                   @Qualifier("sessionExtensionScheduler") TaskScheduler sessionExtensionScheduler,
                                                   BridgeProperties properties,
                                                   Clock clock) {
        ISpeechSynthesizer speechSynthesizer = speechSynthesizerProvider.getIfAvailable();
        if (speechSynthesizer == null) {
            log.info("No speech synthesizer configured, hybrid output mode disabled");
        }
        return new AgentSessionFactory(realtimeAgentClientFactory, speechSynthesizer, sessionExtensionScheduler,
                properties.getAgent().getExtendBufferSeconds(), clock);
    }

    @Bean(destroyMethod = "teardownAll")
    public SessionPool sessionPool(BridgeProperties properties,
                                   AgentSessionFactory agentSessionFactory,
                                   @Qualifier("commonThreadPoolExecutor") Executor commonThreadPoolExecutor,
                                   ObjectProvider<MeterRegistry> meterRegistryProvider) {
        BridgeProperties.Pool pool = properties.getPool();
        SessionPool sessionPool = new SessionPool(
                pool.getMaxSessions(),
                toDefaults(properties.getAgent()),
                agentSessionFactory,
                commonThreadPoolExecutor,
                Duration.ofSeconds(pool.getTeardownTimeoutSeconds()));
        registerPoolMetrics(sessionPool, meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new));
        log.info("Session pool initialized. maxSessions={}, defaults={}", sessionPool.getMaxSessions(), sessionPool.getDefaults());
        return sessionPool;
    }

    @Bean(destroyMethod = "teardownAll")
    public CallManager callManager(SessionPool sessionPool, BridgeProperties properties, Clock clock,
                                   ObjectProvider<MeterRegistry> meterRegistryProvider) {
        CallManager callManager = new CallManager(sessionPool,
                Duration.ofMillis(properties.getPool().getAcquireTimeoutMs()), clock);
        Gauge.builder("ring.calls.active", callManager, CallManager::activeCount)
                .register(meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new));
        return callManager;
    }

    SessionConfig toDefaults(BridgeProperties.Agent agent) {
        return SessionConfig.builder()
                .modelId(StringUtils.trimToNull(agent.getModelId()))
                .voiceName(StringUtils.trimToNull(agent.getVoiceName()))
                .systemInstruction(StringUtils.trimToNull(agent.getSystemInstruction()))
                .timeoutMinutes(agent.getTimeoutMinutes())
                .temperature(agent.getTemperature())
                .inputTranscription(agent.getInputTranscription())
                .outputTranscription(agent.getOutputTranscription())
                .outputMode(OutputModeEnum.fromText(agent.getOutputMode()))
                .hybridTtsProvider(StringUtils.trimToNull(agent.getHybridTtsProvider()))
                .hybridTtsVoice(StringUtils.trimToNull(agent.getHybridTtsVoice()))
                .toolNames(agent.getToolNames())
                .build();
    }

    private void registerPoolMetrics(SessionPool sessionPool, MeterRegistry meterRegistry) {
        Gauge.builder("ring.pool.sessions.active", sessionPool, SessionPool::activeCount)
                .register(meterRegistry);
        Gauge.builder("ring.pool.sessions.capacity", sessionPool, SessionPool::getMaxSessions)
                .register(meterRegistry);
        FunctionCounter.builder("ring.pool.admitted.total", sessionPool, SessionPool::getAdmittedTotal)
                .register(meterRegistry);
        FunctionCounter.builder("ring.pool.rejected.total", sessionPool, SessionPool::getRejectedTotal)
                .register(meterRegistry);
    }
}
