package com.ringai.domain.agent.model.valobj;

import java.util.Map;

/**
 * 上游可调用的函数声明：名称、用途说明和 JSON Schema 形式的参数定义。
 */
public record AgentToolDefinition(String name, String description, Map<String, Object> parameters) {
}
