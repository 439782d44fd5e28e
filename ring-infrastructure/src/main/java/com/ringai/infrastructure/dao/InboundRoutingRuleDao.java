package com.ringai.infrastructure.dao;

import com.ringai.infrastructure.dao.po.InboundRoutingRulePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 呼入路由规则 DAO
 */
@Mapper
public interface InboundRoutingRuleDao {

    /**
     * 查询组织下启用中的规则，按 priority 升序
     */
    List<InboundRoutingRulePO> selectActiveByOrgId(@Param("orgId") String orgId);
}
