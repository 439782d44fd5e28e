package com.ringai.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 来电路由动作。
 */
public enum RoutingActionEnum {

    /** 接听并接入语音智能体 */
    ANSWER("answer"),

    /** 拒接 */
    REJECT("reject"),

    /** 转接到人工号码 */
    FORWARD("forward");

    private final String code;

    RoutingActionEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static RoutingActionEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (RoutingActionEnum value : RoutingActionEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown routing action: " + text);
    }
}
