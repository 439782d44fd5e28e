package com.ringai.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 下发给网关设备的控制帧类型。
 */
public enum GatewayOutboundMessageTypeEnum {

    /** 指示接听 */
    ANSWER_CALL("ANSWER_CALL"),

    /** 指示拒接 */
    REJECT_CALL("REJECT_CALL"),

    /** 指示转接 */
    FORWARD_CALL("FORWARD_CALL"),

    /** 语音桥接就绪 */
    SESSION_READY("SESSION_READY"),

    /** 会话建立或运行失败 */
    SESSION_ERROR("SESSION_ERROR"),

    /** 一轮对话结束 */
    TURN_COMPLETE("TURN_COMPLETE"),

    /** 实时转写片段 */
    CALL_TRANSCRIPT("CALL_TRANSCRIPT"),

    /** 工具执行状态 */
    TOOL_EXECUTION("TOOL_EXECUTION");

    private final String code;

    GatewayOutboundMessageTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static GatewayOutboundMessageTypeEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (GatewayOutboundMessageTypeEnum value : GatewayOutboundMessageTypeEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown gateway message type: " + text);
    }
}
