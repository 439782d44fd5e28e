package com.ringai.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工具执行状态。
 */
public enum ToolExecutionStatusEnum {

    /** 执行中 */
    EXECUTING("executing"),

    /** 已完成 */
    COMPLETED("completed");

    private final String code;

    ToolExecutionStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ToolExecutionStatusEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (ToolExecutionStatusEnum value : ToolExecutionStatusEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown tool execution status: " + text);
    }
}
