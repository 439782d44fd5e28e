package com.ringai.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 交互记录状态。
 */
public enum InteractionStatusEnum {

    /** 通话进行中 */
    IN_PROGRESS("in_progress"),

    /** 已结束（拒接、转接） */
    COMPLETED("completed");

    private final String code;

    InteractionStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static InteractionStatusEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (InteractionStatusEnum value : InteractionStatusEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown interaction status: " + text);
    }
}
