package com.ringai.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 呼入路由规则 PO（inbound_routing_rules）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundRoutingRulePO {

    private String id;
    private String orgId;
    private String name;
    private String callerPattern;
    /**
     * all / prefix / exact / contact_only
     */
    private String matchType;
    /**
     * answer / reject / forward
     */
    private String action;
    private String forwardTo;
    private String systemInstruction;
    private String voiceName;
    private LocalTime timeStart;
    private LocalTime timeEnd;
    /**
     * JSONB 数组原文，例如 [0,1,2,3,4]
     */
    private String daysOfWeek;
    private Boolean isActive;
    private Integer priority;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
