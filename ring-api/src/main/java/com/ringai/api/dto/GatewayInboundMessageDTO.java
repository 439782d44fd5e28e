package com.ringai.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * 网关设备上行的 JSON 控制帧。
 * <p>
 * INCOMING_CALL、CALL_CONNECTED、CALL_ENDED 共用一个结构，按 type 读取对应字段；
 * type 保留原始字符串，由处理器解析，未知类型只记录日志。
 * </p>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GatewayInboundMessageDTO {

    private String type;

    @JsonProperty("call_id")
    private String callId;

    @JsonProperty("from_number")
    private String fromNumber;

    @JsonProperty("to_number")
    private String toNumber;

    private String carrier = "";

    @JsonProperty("sim_slot")
    private Integer simSlot = 0;

    @JsonProperty("gateway_id")
    private String gatewayId;

    @JsonProperty("caller_number")
    private String callerNumber;

    @JsonProperty("org_id")
    private String orgId;

    @JsonProperty("knowledge_base_id")
    private String knowledgeBaseId;

    private String reason = "hangup";
}
