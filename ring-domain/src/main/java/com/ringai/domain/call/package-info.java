/**
 * 通话领域：外部通话标识到上游会话的映射。
 *
 * <h3>核心对象</h3>
 * <ul>
 *   <li>{@link com.ringai.domain.call.model.entity.CallRecord} - 一通已接听电话及其持有的会话引用</li>
 *   <li>{@link com.ringai.domain.call.service.CallManager} - 申请/释放会话并维护 call_id 映射</li>
 * </ul>
 *
 * <h3>适配器</h3>
 * <ul>
 *   <li>IToolExecutor - 通话中上游发起的工具调用的执行方</li>
 *   <li>IExpiringStore - 带过期策略的键值存储，用于暂存待接通的路由决策</li>
 * </ul>
 */
package com.ringai.domain.call;
