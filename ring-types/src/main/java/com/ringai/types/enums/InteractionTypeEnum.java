package com.ringai.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 交互记录类型。
 */
public enum InteractionTypeEnum {

    /** 呼入电话 */
    INBOUND_CALL("inbound_call");

    private final String code;

    InteractionTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static InteractionTypeEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (InteractionTypeEnum value : InteractionTypeEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown interaction type: " + text);
    }
}
