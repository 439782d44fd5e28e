package com.ringai.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 转写片段的说话方。
 */
public enum TranscriptSpeakerEnum {

    /** 主叫 */
    CALLER("caller"),

    /** 语音智能体 */
    AGENT("agent");

    private final String code;

    TranscriptSpeakerEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static TranscriptSpeakerEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (TranscriptSpeakerEnum value : TranscriptSpeakerEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown speaker: " + text);
    }
}
