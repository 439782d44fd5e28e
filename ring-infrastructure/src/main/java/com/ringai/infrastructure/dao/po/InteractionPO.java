package com.ringai.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 交互记录 PO（interactions）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractionPO {

    private String id;
    private String orgId;
    private String contactId;
    private String type;
    private String status;
    private LocalDateTime startedAt;
    /**
     * JSONB 原文
     */
    private String metadata;
}
