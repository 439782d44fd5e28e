package com.ringai.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 上游会话输出模式。
 */
public enum OutputModeEnum {

    /** 上游直接输出音频 */
    NATIVE_AUDIO("native_audio"),

    /** 上游输出文本，本地 TTS 合成音频 */
    HYBRID("hybrid");

    private final String code;

    OutputModeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static OutputModeEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (OutputModeEnum value : OutputModeEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown output mode: " + text);
    }
}
