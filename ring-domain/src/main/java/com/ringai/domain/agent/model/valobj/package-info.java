/**
 * 值对象层
 * <p>
 * 会话配置、响应事件、工具调用与结果、会话快照等不可变对象，以及音色和工具声明目录。
 * </p>
 */
package com.ringai.domain.agent.model.valobj;
