package com.ringai.domain.agent.model.valobj;

import java.util.Map;

/**
 * 工具执行结果，回传给上游。
 */
public record ToolResult(String callId, String name, Map<String, Object> response) {

    public ToolResult {
        response = response == null ? Map.of() : Map.copyOf(response);
    }

    public static ToolResult error(ToolCall call, String message) {
        return new ToolResult(call.callId(), call.name(), Map.of("error", message));
    }
}
