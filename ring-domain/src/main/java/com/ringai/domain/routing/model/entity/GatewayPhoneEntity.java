package com.ringai.domain.routing.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 已登记的网关设备（一台安卓手机 + SIM 卡），归属某个组织。
 */
@Data
public class GatewayPhoneEntity {

    private String id;
    private String gatewayId;
    private String orgId;
    private String phoneNumber;
    private String label;
    /** 没有规则命中时是否自动接听 */
    private Boolean autoAnswer;
    private Boolean isActive;
    /** 设备级默认系统指令 */
    private String systemInstruction;
    /** 设备级默认音色 */
    private String voiceName;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isUsable() {
        return Boolean.TRUE.equals(isActive);
    }

    public boolean shouldAutoAnswer() {
        return !Boolean.FALSE.equals(autoAnswer);
    }
}
