package com.ringai.domain.routing.adapter.repository;

import com.ringai.domain.routing.model.entity.GatewayPhoneEntity;

/**
 * 网关设备仓储接口（只读）。
 */
public interface IGatewayPhoneRepository {

    /**
     * 按设备标识查询启用中的设备，不存在或已停用返回 null。
     */
    GatewayPhoneEntity findActiveByGatewayId(String gatewayId);
}
