package com.ringai.domain.agent.model.valobj;

import java.util.Map;

/**
 * 上游在对话中发起的一次函数调用。
 *
 * @param callId 上游分配的调用标识，回传结果时原样带回
 * @param name   工具名
 * @param args   调用参数
 */
public record ToolCall(String callId, String name, Map<String, Object> args) {

    public ToolCall {
        args = args == null ? Map.of() : Map.copyOf(args);
    }
}
