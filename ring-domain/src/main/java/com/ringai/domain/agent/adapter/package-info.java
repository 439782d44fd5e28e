/**
 * 适配器层
 * <p>
 * 领域层与外部系统的接口定义，由基础设施层实现。
 * <ul>
 *   <li>{@link com.ringai.domain.agent.adapter.gateway} - 上游实时语音连接、语音合成</li>
 * </ul>
 */
package com.ringai.domain.agent.adapter;
