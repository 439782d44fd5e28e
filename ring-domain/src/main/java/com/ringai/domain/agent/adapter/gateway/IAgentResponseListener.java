package com.ringai.domain.agent.adapter.gateway;

import com.ringai.domain.agent.model.valobj.AgentResponse;

/**
 * 上游连接的回调。实现方需保证同一连接的回调按接收顺序串行触发。
 */
public interface IAgentResponseListener {

    void onResponse(AgentResponse response);

    /**
     * 传输层错误，之后不会再有 onResponse。
     */
    void onError(Throwable error);

    /**
     * 连接被对端或本端关闭。
     */
    void onClosed();
}
