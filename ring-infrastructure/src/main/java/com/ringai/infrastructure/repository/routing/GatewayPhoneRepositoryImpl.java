package com.ringai.infrastructure.repository.routing;

import com.ringai.domain.routing.adapter.repository.IGatewayPhoneRepository;
import com.ringai.domain.routing.model.entity.GatewayPhoneEntity;
import com.ringai.infrastructure.dao.GatewayPhoneDao;
import com.ringai.infrastructure.dao.po.GatewayPhonePO;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

/**
 * 网关设备仓储实现。
 */
@Repository
public class GatewayPhoneRepositoryImpl implements IGatewayPhoneRepository {

    private final GatewayPhoneDao gatewayPhoneDao;

    public GatewayPhoneRepositoryImpl(GatewayPhoneDao gatewayPhoneDao) {
        this.gatewayPhoneDao = gatewayPhoneDao;
    }

    @Override
    public GatewayPhoneEntity findActiveByGatewayId(String gatewayId) {
        if (StringUtils.isBlank(gatewayId)) {
            return null;
        }
        GatewayPhonePO po = gatewayPhoneDao.selectActiveByGatewayId(gatewayId);
        return po == null ? null : toEntity(po);
    }

    private GatewayPhoneEntity toEntity(GatewayPhonePO po) {
        GatewayPhoneEntity entity = new GatewayPhoneEntity();
        entity.setId(po.getId());
        entity.setGatewayId(po.getGatewayId());
        entity.setOrgId(po.getOrgId());
        entity.setPhoneNumber(po.getPhoneNumber());
        entity.setLabel(po.getLabel());
        entity.setAutoAnswer(po.getAutoAnswer());
        entity.setIsActive(po.getIsActive());
        entity.setSystemInstruction(po.getSystemInstruction());
        entity.setVoiceName(po.getVoiceName());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }
}
