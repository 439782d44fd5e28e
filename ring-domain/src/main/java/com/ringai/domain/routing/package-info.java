/**
 * 呼入路由领域。
 *
 * <p>职责：根据来电元数据、网关设备登记、组织通讯录、路由规则和当前时间，决定接听、拒接或转接。</p>
 *
 * <h3>核心规则</h3>
 * <ul>
 *   <li>规则按 priority 升序评估，第一条同时满足时间窗、星期、主叫匹配的规则胜出</li>
 *   <li>没有规则命中时按设备的 auto_answer 兜底</li>
 *   <li>未登记设备或任何内部异常都放行为 ANSWER，来电不会被静默丢弃</li>
 * </ul>
 *
 * <h3>适配器</h3>
 * <ul>
 *   <li>IGatewayPhoneRepository / IContactRepository / IInboundRoutingRuleRepository - 只读</li>
 *   <li>IInteractionRepository - 追加交互记录</li>
 * </ul>
 */
package com.ringai.domain.routing;
