package com.ringai.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 网关设备 PO（gateway_phones）
 *
 * @author ringai
 * @since 2026-03-03
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayPhonePO {

    /**
     * 主键 UUID
     */
    private String id;

    /**
     * 设备上报的网关标识
     */
    private String gatewayId;

    /**
     * 所属组织 UUID
     */
    private String orgId;

    private String phoneNumber;

    private String label;

    private Boolean autoAnswer;

    private Boolean isActive;

    private String systemInstruction;

    private String voiceName;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
