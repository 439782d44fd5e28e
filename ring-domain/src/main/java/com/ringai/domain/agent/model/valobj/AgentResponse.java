package com.ringai.domain.agent.model.valobj;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * 上游返回的一个响应事件。
 * <p>
 * 一个事件可能同时携带音频、文本、转写片段、轮次结束或打断信号、工具调用，各字段独立判断。
 * </p>
 */
@Getter
@ToString(exclude = "audio")
@Builder(toBuilder = true)
public final class AgentResponse {

    private final byte[] audio;
    private final String text;
    private final String inputTranscript;
    private final String outputTranscript;
    private final boolean turnComplete;
    private final boolean interrupted;
    private final List<ToolCall> toolCalls;

    public boolean hasAudio() {
        return audio != null && audio.length > 0;
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public List<ToolCall> getToolCalls() {
        return toolCalls == null ? Collections.emptyList() : Collections.unmodifiableList(toolCalls);
    }

    public int audioLength() {
        return audio == null ? 0 : audio.length;
    }

    public AgentResponse withAudio(byte[] synthesized) {
        return toBuilder().audio(synthesized).build();
    }
}
