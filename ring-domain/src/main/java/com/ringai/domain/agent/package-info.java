/**
 * Agent 领域 - 上游实时语音会话
 *
 * <p>职责：上游流式会话的生命周期、自动续期、混合输出和全局准入控制</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>会话：包装一条上游连接的状态机，CONNECTING → ACTIVE → {EXTENDING → ACTIVE | ERROR} → CLOSING → CLOSED</li>
 *   <li>续期：上游连接有硬性时长上限，到期前用续期句柄重连，对话上下文不丢</li>
 *   <li>准入：会话池以固定容量限制全局并发会话数</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>{@link com.ringai.domain.agent.service.AgentSession} - 会话状态机</li>
 *   <li>{@link com.ringai.domain.agent.service.HybridAgentSession} - 文本输出 + 本地 TTS</li>
 *   <li>{@link com.ringai.domain.agent.service.SessionPool} - 准入控制与会话登记</li>
 * </ul>
 *
 * @author ringai
 * @since 2026-03-02
 */
package com.ringai.domain.agent;
