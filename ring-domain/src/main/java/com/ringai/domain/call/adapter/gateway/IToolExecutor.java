package com.ringai.domain.call.adapter.gateway;

import com.ringai.domain.agent.model.valobj.ToolCall;
import com.ringai.domain.agent.model.valobj.ToolResult;

/**
 * 工具调用执行方。
 * <p>
 * 实现方负责把上游的函数调用分发到对应的后端服务，失败时返回带 error 字段的结果而不是抛异常，
 * 上游据此继续对话。
 * </p>
 */
public interface IToolExecutor {

    /**
     * 执行一次工具调用。
     *
     * @param callId 当前通话标识，用于日志和上下文
     * @param toolCall 上游发起的调用
     * @return 回传给上游的结果
     */
    ToolResult execute(String callId, ToolCall toolCall);
}
