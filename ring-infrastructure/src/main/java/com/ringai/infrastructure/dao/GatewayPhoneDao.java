package com.ringai.infrastructure.dao;

import com.ringai.infrastructure.dao.po.GatewayPhonePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 网关设备 DAO
 *
 * @author ringai
 * @since 2026-03-03
 */
@Mapper
public interface GatewayPhoneDao {

    /**
     * 根据设备标识查询启用中的设备
     */
    GatewayPhonePO selectActiveByGatewayId(@Param("gatewayId") String gatewayId);
}
