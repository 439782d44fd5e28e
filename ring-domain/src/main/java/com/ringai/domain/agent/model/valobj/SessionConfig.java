package com.ringai.domain.agent.model.valobj;

import com.ringai.types.enums.OutputModeEnum;
import com.ringai.types.exception.SessionLifecycleException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个上游会话的构造参数。
 * <p>
 * 每通电话创建一份，构造后不可变；需要覆盖字段时通过 {@code toBuilder()} 复制。
 * 字段允许为 null，表示"未设置"，由会话池在准入时用池级默认值补齐
 * （见 {@link #mergeDefaults(SessionConfig)}）。
 * </p>
 *
 * @author ringai
 * @since 2026-03-02
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SessionConfig {

    public static final String DEFAULT_MODEL_ID = "gemini-2.5-flash-native-audio-preview-12-2025";
    public static final String DEFAULT_VOICE_NAME = "Kore";
    public static final int DEFAULT_TIMEOUT_MINUTES = 10;
    public static final double DEFAULT_TEMPERATURE = 0.7D;
    public static final String DEFAULT_HYBRID_TTS_PROVIDER = "edge_tts";
    public static final String DEFAULT_HYBRID_TTS_VOICE = "ne-NP-HemkalaNeural";

    private final String modelId;
    private final String voiceName;
    private final String systemInstruction;
    private final Integer timeoutMinutes;
    private final Boolean inputTranscription;
    private final Boolean outputTranscription;
    private final Double temperature;
    private final OutputModeEnum outputMode;
    private final String hybridTtsProvider;
    private final String hybridTtsVoice;
    private final List<String> toolNames;

    @Builder(toBuilder = true)
    private SessionConfig(String modelId,
                          String voiceName,
                          String systemInstruction,
                          Integer timeoutMinutes,
                          Boolean inputTranscription,
                          Boolean outputTranscription,
                          Double temperature,
                          OutputModeEnum outputMode,
                          String hybridTtsProvider,
                          String hybridTtsVoice,
                          List<String> toolNames) {
        this.modelId = modelId;
        this.voiceName = voiceName;
        this.systemInstruction = systemInstruction;
        this.timeoutMinutes = timeoutMinutes;
        this.inputTranscription = inputTranscription;
        this.outputTranscription = outputTranscription;
        this.temperature = temperature;
        this.outputMode = outputMode;
        this.hybridTtsProvider = hybridTtsProvider;
        this.hybridTtsVoice = hybridTtsVoice;
        // 复制一份，调用方之后修改原列表不影响本配置
        this.toolNames = toolNames == null ? null : Collections.unmodifiableList(new ArrayList<>(toolNames));
    }

    /**
     * 内置默认值，池级默认配置未提供时兜底。
     */
    public static SessionConfig builtInDefaults() {
        return SessionConfig.builder()
                .modelId(DEFAULT_MODEL_ID)
                .voiceName(DEFAULT_VOICE_NAME)
                .timeoutMinutes(DEFAULT_TIMEOUT_MINUTES)
                .inputTranscription(true)
                .outputTranscription(true)
                .temperature(DEFAULT_TEMPERATURE)
                .outputMode(OutputModeEnum.NATIVE_AUDIO)
                .hybridTtsProvider(DEFAULT_HYBRID_TTS_PROVIDER)
                .hybridTtsVoice(DEFAULT_HYBRID_TTS_VOICE)
                .toolNames(Collections.emptyList())
                .build();
    }

    /**
     * 用 defaults 补齐本配置中未设置的字段，返回新实例。
     */
    public SessionConfig mergeDefaults(SessionConfig defaults) {
        if (defaults == null) {
            return this;
        }
        return SessionConfig.builder()
                .modelId(StringUtils.defaultIfBlank(modelId, defaults.modelId))
                .voiceName(StringUtils.defaultIfBlank(voiceName, defaults.voiceName))
                .systemInstruction(StringUtils.defaultIfBlank(systemInstruction, defaults.systemInstruction))
                .timeoutMinutes(timeoutMinutes != null ? timeoutMinutes : defaults.timeoutMinutes)
                .inputTranscription(inputTranscription != null ? inputTranscription : defaults.inputTranscription)
                .outputTranscription(outputTranscription != null ? outputTranscription : defaults.outputTranscription)
                .temperature(temperature != null ? temperature : defaults.temperature)
                .outputMode(outputMode != null ? outputMode : defaults.outputMode)
                .hybridTtsProvider(StringUtils.defaultIfBlank(hybridTtsProvider, defaults.hybridTtsProvider))
                .hybridTtsVoice(StringUtils.defaultIfBlank(hybridTtsVoice, defaults.hybridTtsVoice))
                .toolNames(toolNames != null ? toolNames : defaults.toolNames)
                .build();
    }

    /**
     * 会话启动前校验：音色必须在预置音色目录内，工具必须已声明。
     */
    public void validate() {
        if (StringUtils.isBlank(modelId)) {
            throw new SessionLifecycleException("Model id is required");
        }
        if (timeoutMinutes == null || timeoutMinutes <= 0) {
            throw new SessionLifecycleException("Timeout minutes must be positive: " + timeoutMinutes);
        }
        if (temperature != null && (temperature < 0D || temperature > 2D)) {
            throw new SessionLifecycleException("Temperature must be within [0, 2]: " + temperature);
        }
        if (StringUtils.isNotBlank(voiceName) && !VoiceCatalog.isSupported(voiceName)) {
            throw new SessionLifecycleException("Unknown voice '" + voiceName + "'");
        }
        if (toolNames != null) {
            for (String toolName : toolNames) {
                if (!AgentToolCatalog.contains(toolName)) {
                    throw new SessionLifecycleException("Unknown tool '" + toolName + "'. Available tools: "
                            + String.join(", ", AgentToolCatalog.names()));
                }
            }
        }
    }

    public OutputModeEnum resolveOutputMode() {
        return outputMode == null ? OutputModeEnum.NATIVE_AUDIO : outputMode;
    }

    public boolean isHybrid() {
        return resolveOutputMode() == OutputModeEnum.HYBRID;
    }

    public TtsConfig ttsConfig() {
        return new TtsConfig(hybridTtsProvider, hybridTtsVoice);
    }
}
