package com.ringai.infrastructure.repository.routing;

import com.ringai.domain.routing.adapter.repository.IInboundRoutingRuleRepository;
import com.ringai.domain.routing.model.entity.InboundRoutingRuleEntity;
import com.ringai.infrastructure.dao.InboundRoutingRuleDao;
import com.ringai.infrastructure.dao.po.InboundRoutingRulePO;
import com.ringai.infrastructure.util.JsonCodec;
import com.ringai.types.enums.RoutingActionEnum;
import com.ringai.types.enums.RoutingMatchTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 呼入路由规则仓储实现。
 * <p>
 * 无法识别的 match_type / action 转为 null，由路由评估时跳过该条规则。
 * </p>
 */
@Slf4j
@Repository
public class InboundRoutingRuleRepositoryImpl implements IInboundRoutingRuleRepository {

    private final InboundRoutingRuleDao inboundRoutingRuleDao;
    private final JsonCodec jsonCodec;

    public InboundRoutingRuleRepositoryImpl(InboundRoutingRuleDao inboundRoutingRuleDao,
                                            JsonCodec jsonCodec) {
        this.inboundRoutingRuleDao = inboundRoutingRuleDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public List<InboundRoutingRuleEntity> listActiveByOrgId(String orgId) {
        if (StringUtils.isBlank(orgId)) {
            return Collections.emptyList();
        }
        List<InboundRoutingRulePO> poList = inboundRoutingRuleDao.selectActiveByOrgId(orgId);
        if (poList == null || poList.isEmpty()) {
            return Collections.emptyList();
        }
        return poList.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private InboundRoutingRuleEntity toEntity(InboundRoutingRulePO po) {
        InboundRoutingRuleEntity entity = new InboundRoutingRuleEntity();
        entity.setId(po.getId());
        entity.setOrgId(po.getOrgId());
        entity.setName(po.getName());
        entity.setCallerPattern(po.getCallerPattern());
        entity.setMatchType(parseMatchType(po));
        entity.setAction(parseAction(po));
        entity.setForwardTo(po.getForwardTo());
        entity.setSystemInstruction(po.getSystemInstruction());
        entity.setVoiceName(po.getVoiceName());
        entity.setTimeStart(po.getTimeStart());
        entity.setTimeEnd(po.getTimeEnd());
        entity.setDaysOfWeek(jsonCodec.readIntegerList(po.getDaysOfWeek()));
        entity.setIsActive(po.getIsActive());
        entity.setPriority(po.getPriority());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private RoutingMatchTypeEnum parseMatchType(InboundRoutingRulePO po) {
        try {
            return RoutingMatchTypeEnum.fromText(po.getMatchType());
        } catch (IllegalArgumentException ex) {
            log.warn("Unknown routing rule match type. ruleId={}, matchType={}", po.getId(), po.getMatchType());
            return null;
        }
    }

    private RoutingActionEnum parseAction(InboundRoutingRulePO po) {
        try {
            return RoutingActionEnum.fromText(po.getAction());
        } catch (IllegalArgumentException ex) {
            log.warn("Unknown routing rule action. ruleId={}, action={}", po.getId(), po.getAction());
            return null;
        }
    }
}
