package com.ringai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 通话桥接配置，前缀 ring.bridge。
 *
 * @author ringai
 * @since 2026-03-05
 */
@Data
@ConfigurationProperties(prefix = "ring.bridge")
public class BridgeProperties {

    private Pool pool = new Pool();

    private Agent agent = new Agent();

    private Audio audio = new Audio();

    private Routing routing = new Routing();

    private Gateway gateway = new Gateway();

    /**
     * 会话池容量与等待时间。
     */
    @Data
    public static class Pool {

        /** 同时存在的上游会话上限 */
        private Integer maxSessions = 1000;

        /** 申请槽位的最长等待时间（毫秒） */
        private Long acquireTimeoutMs = 5000L;

        /** 关停时批量关闭会话的等待上限（秒） */
        private Integer teardownTimeoutSeconds = 30;
    }

    /**
     * 池级默认会话配置，单次通话的覆盖项优先。
     */
    @Data
    public static class Agent {

        private String modelId;

        private String voiceName;

        private String systemInstruction;

        private Integer timeoutMinutes;

        /** 在上游硬超时前多少秒开始续期 */
        private Long extendBufferSeconds = 60L;

        private Double temperature;

        private Boolean inputTranscription;

        private Boolean outputTranscription;

        /** native_audio 或 hybrid */
        private String outputMode;

        private String hybridTtsProvider;

        private String hybridTtsVoice;

        private List<String> toolNames = new ArrayList<>();
    }

    /**
     * 各方向 PCM 采样率。
     */
    @Data
    public static class Audio {

        private Integer gatewaySampleRate = 16000;

        private Integer agentInputSampleRate = 16000;

        private Integer agentOutputSampleRate = 24000;
    }

    @Data
    public static class Routing {

        /** 规则时间窗的评估时区 */
        private String zoneId = "UTC";

        /** 已应答未接通的决策保留时间 */
        private Long pendingDecisionTtlSeconds = 120L;

        private Long pendingDecisionMaxSize = 10000L;
    }

    @Data
    public static class Gateway {

        private String path = "/api/v1/gateway/ws";

        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

        private Integer maxBinaryMessageBytes = 256 * 1024;

        private Integer maxTextMessageBytes = 64 * 1024;
    }
}
