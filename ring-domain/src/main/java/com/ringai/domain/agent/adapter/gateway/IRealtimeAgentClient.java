package com.ringai.domain.agent.adapter.gateway;

import com.ringai.domain.agent.model.valobj.ToolResult;

import java.util.List;

/**
 * 上游实时语音会话的单条传输连接。
 * <p>
 * 一个实例对应一次建连，关闭后不可复用；会话续期时由会话对象关闭旧连接并通过
 * {@link IRealtimeAgentClientFactory} 创建新连接。响应通过建连时传入的监听器异步回调。
 * 具体厂商协议由基础设施层实现。
 * </p>
 *
 * @author ringai
 * @since 2026-03-02
 */
public interface IRealtimeAgentClient {

    /**
     * 建立连接。
     *
     * @param resumptionHandle 续期句柄，首次建连为 null；非空时新连接延续原会话上下文
     * @param listener 响应监听器
     */
    void connect(String resumptionHandle, IAgentResponseListener listener);

    /**
     * 发送一段 PCM 音频。
     */
    void sendAudio(byte[] pcm);

    /**
     * 通知上游音频流暂停或结束。
     */
    void sendAudioEnd();

    /**
     * 以用户轮次发送一段文本。
     */
    void sendText(String text);

    /**
     * 回传工具执行结果。
     */
    void sendToolResponse(List<ToolResult> results);

    /**
     * 服务端最近一次下发的续期句柄，尚未下发时返回 null。
     */
    String getResumptionHandle();

    boolean isConnected();

    /**
     * 关闭连接，重复调用无副作用。
     */
    void close();
}
