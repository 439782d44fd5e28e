package com.ringai.domain.agent.adapter.gateway;

import com.ringai.domain.agent.model.valobj.SessionConfig;

/**
 * 按会话配置创建上游连接。
 */
public interface IRealtimeAgentClientFactory {

    IRealtimeAgentClient create(SessionConfig config);
}
