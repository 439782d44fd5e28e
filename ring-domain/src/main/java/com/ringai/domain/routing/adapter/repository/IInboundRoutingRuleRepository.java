package com.ringai.domain.routing.adapter.repository;

import com.ringai.domain.routing.model.entity.InboundRoutingRuleEntity;

import java.util.List;

/**
 * 呼入路由规则仓储接口（只读）。
 */
public interface IInboundRoutingRuleRepository {

    /**
     * 查询组织下启用中的规则，按 priority 升序。
     */
    List<InboundRoutingRuleEntity> listActiveByOrgId(String orgId);
}
