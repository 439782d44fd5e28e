package com.ringai.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 网关设备上行控制帧类型。
 */
public enum GatewayInboundMessageTypeEnum {

    /** 来电振铃通知 */
    INCOMING_CALL("INCOMING_CALL"),

    /** 设备已接通 */
    CALL_CONNECTED("CALL_CONNECTED"),

    /** 通话结束 */
    CALL_ENDED("CALL_ENDED");

    private final String code;

    GatewayInboundMessageTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static GatewayInboundMessageTypeEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (GatewayInboundMessageTypeEnum value : GatewayInboundMessageTypeEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown gateway message type: " + text);
    }
}
