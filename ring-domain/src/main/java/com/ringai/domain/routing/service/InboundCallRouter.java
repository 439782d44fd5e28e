package com.ringai.domain.routing.service;

import com.ringai.domain.routing.adapter.repository.IContactRepository;
import com.ringai.domain.routing.adapter.repository.IGatewayPhoneRepository;
import com.ringai.domain.routing.adapter.repository.IInboundRoutingRuleRepository;
import com.ringai.domain.routing.model.entity.ContactEntity;
import com.ringai.domain.routing.model.entity.GatewayPhoneEntity;
import com.ringai.domain.routing.model.entity.InboundRoutingRuleEntity;
import com.ringai.domain.routing.model.entity.InteractionEntity;
import com.ringai.domain.routing.model.valobj.IncomingCall;
import com.ringai.domain.routing.model.valobj.RoutingDecision;
import com.ringai.types.common.Constants;
import com.ringai.types.enums.InteractionStatusEnum;
import com.ringai.types.enums.InteractionTypeEnum;
import com.ringai.types.enums.RoutingActionEnum;
import com.ringai.types.exception.RoutingEvaluationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 呼入路由领域服务：决定来电接听、拒接还是转接。
 * <p>
 * 评估流程：
 * <ol>
 *   <li>按 gateway_id 查启用中的设备，查不到直接放行（ANSWER，不查规则）</li>
 *   <li>在设备所属组织内按主叫号码识别联系人</li>
 *   <li>加载组织启用中的规则，按 priority 升序逐条评估时间窗、星期、主叫匹配，第一条命中者胜出</li>
 *   <li>无规则命中：auto_answer=true 时接听并带设备级默认值，否则以 no_matching_rule 拒接</li>
 * </ol>
 * 评估中的任何异常都转换为放行决策，路由错误不会让来电被丢弃。
 * </p>
 *
 * @author ringai
 * @since 2026-03-03
 */
@Slf4j
@Service
public class InboundCallRouter {

    private static final LocalTime DAY_START = LocalTime.MIDNIGHT;
    private static final LocalTime DAY_END = LocalTime.of(23, 59, 59);
    private static final String WILDCARD = "*";

    private final IGatewayPhoneRepository gatewayPhoneRepository;
    private final IContactRepository contactRepository;
    private final IInboundRoutingRuleRepository routingRuleRepository;

    public InboundCallRouter(IGatewayPhoneRepository gatewayPhoneRepository,
                             IContactRepository contactRepository,
                             IInboundRoutingRuleRepository routingRuleRepository) {
        this.gatewayPhoneRepository = gatewayPhoneRepository;
        this.contactRepository = contactRepository;
        this.routingRuleRepository = routingRuleRepository;
    }

    /**
     * 查询设备、联系人、规则后评估。阻塞调用，调用方应放在专用线程池执行。
     */
    public RoutingDecision route(IncomingCall call, LocalDateTime now) {
        String callId = call == null ? null : call.callId();
        try {
            GatewayPhoneEntity device = gatewayPhoneRepository.findActiveByGatewayId(call.gatewayId());
            if (device == null || !device.isUsable()) {
                log.warn("Unknown gateway, defaulting to ANSWER. callId={}, gatewayId={}", callId, call.gatewayId());
                return RoutingDecision.answer(callId);
            }
            ContactEntity contact = StringUtils.isBlank(call.fromNumber()) ? null
                    : contactRepository.findByOrgIdAndPhone(device.getOrgId(), call.fromNumber());
            List<InboundRoutingRuleEntity> rules = routingRuleRepository.listActiveByOrgId(device.getOrgId());
            return decide(call, device, contact, rules, now);
        } catch (RuntimeException ex) {
            RoutingEvaluationException failure = ex instanceof RoutingEvaluationException evaluationException
                    ? evaluationException
                    : new RoutingEvaluationException("Routing evaluation failed for call " + callId, ex);
            log.error("Routing error, defaulting to ANSWER. callId={}, error={}", callId, failure.getMessage(), ex);
            return RoutingDecision.answer(callId);
        }
    }

    /**
     * 纯决策函数：相同输入总是得到相同决策。
     *
     * @param device 已解析的启用设备，null 时放行
     * @param contact 已识别的联系人，可为 null
     * @param rules 组织规则，顺序无关，内部按 priority 稳定排序
     * @param now 组织所在时区的当前时间
     */
    public RoutingDecision decide(IncomingCall call,
                                  GatewayPhoneEntity device,
                                  ContactEntity contact,
                                  List<InboundRoutingRuleEntity> rules,
                                  LocalDateTime now) {
        if (call == null) {
            throw new RoutingEvaluationException("Incoming call cannot be null", null);
        }
        if (device == null || !device.isUsable()) {
            return RoutingDecision.answer(call.callId());
        }
        RoutingDecision.RoutingDecisionBuilder base = RoutingDecision.builder()
                .callId(call.callId())
                .orgId(device.getOrgId())
                .contactId(contact == null ? null : contact.getId())
                .contactName(contact == null ? null : contact.getName())
                .gatewayPhoneId(device.getId());

        for (InboundRoutingRuleEntity rule : sortByPriority(rules)) {
            if (Boolean.FALSE.equals(rule.getIsActive()) || !isEvaluable(rule, call.callId())) {
                continue;
            }
            if (matches(rule, call.fromNumber(), contact, now)) {
                log.info("Call matched routing rule. callId={}, ruleId={}, ruleName={}, action={}",
                        call.callId(), rule.getId(), rule.getName(), rule.getAction().getCode());
                return applyRule(base, rule, device);
            }
        }

        if (device.shouldAutoAnswer()) {
            log.info("No routing rule matched, auto_answer=true. callId={}", call.callId());
            return base.action(RoutingActionEnum.ANSWER)
                    .systemInstruction(device.getSystemInstruction())
                    .voiceName(device.getVoiceName())
                    .build();
        }
        log.info("No routing rule matched, auto_answer=false. callId={}", call.callId());
        return base.action(RoutingActionEnum.REJECT)
                .rejectReason(Constants.REJECT_REASON_NO_MATCHING_RULE)
                .build();
    }

    /**
     * 配置不完整的规则只跳过自身，不影响其后的规则。
     */
    private boolean isEvaluable(InboundRoutingRuleEntity rule, String callId) {
        try {
            rule.validate();
            return true;
        } catch (IllegalStateException ex) {
            log.warn("Skipping invalid routing rule. callId={}, ruleId={}, ruleName={}, error={}",
                    callId, rule.getId(), rule.getName(), ex.getMessage());
            return false;
        }
    }

    /**
     * 规则是否命中：时间窗、星期、主叫匹配三者同时满足。
     */
    public boolean matches(InboundRoutingRuleEntity rule, String callerNumber, ContactEntity contact, LocalDateTime now) {
        rule.validate();
        if (!withinTimeWindow(rule.getTimeStart(), rule.getTimeEnd(), now.toLocalTime())) {
            return false;
        }
        if (rule.getDaysOfWeek() != null) {
            int weekday = now.getDayOfWeek().getValue() - 1;
            if (!rule.getDaysOfWeek().contains(weekday)) {
                return false;
            }
        }
        String caller = StringUtils.defaultString(callerNumber);
        return switch (rule.getMatchType()) {
            case ALL -> true;
            case PREFIX -> rule.getCallerPattern() == null
                    || caller.startsWith(StringUtils.stripEnd(rule.getCallerPattern(), WILDCARD));
            case EXACT -> rule.getCallerPattern() != null && caller.equals(rule.getCallerPattern());
            case CONTACT_ONLY -> contact != null;
        };
    }

    /**
     * 时间窗判断，两端都包含。起点晚于终点时视为跨夜窗口（例如 22:00-06:00）。
     */
    public static boolean withinTimeWindow(LocalTime start, LocalTime end, LocalTime current) {
        if (start == null && end == null) {
            return true;
        }
        LocalTime from = start == null ? DAY_START : start;
        LocalTime to = end == null ? DAY_END : end;
        if (!from.isAfter(to)) {
            return !current.isBefore(from) && !current.isAfter(to);
        }
        return !current.isBefore(from) || !current.isAfter(to);
    }

    /**
     * 根据决策构建交互记录；没有组织归属（未登记设备）时返回 null。
     */
    public InteractionEntity buildInteraction(IncomingCall call, RoutingDecision decision, LocalDateTime startedAt) {
        if (decision == null || decision.getOrgId() == null) {
            return null;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("call_id", call.callId());
        metadata.put("gateway_id", call.gatewayId());
        metadata.put("from_number", call.fromNumber());
        metadata.put("to_number", call.toNumber());
        metadata.put("carrier", call.carrier());
        metadata.put("sim_slot", call.simSlot());
        metadata.put("routing_action", decision.getAction().getCode());
        metadata.put("routing_rule_id", decision.getRuleId());
        metadata.put("routing_rule_name", decision.getRuleName());
        metadata.put("forward_to", decision.getForwardTo());
        metadata.put("contact_name", decision.getContactName());

        InteractionEntity interaction = new InteractionEntity();
        interaction.setOrgId(decision.getOrgId());
        interaction.setContactId(decision.getContactId());
        interaction.setType(InteractionTypeEnum.INBOUND_CALL);
        interaction.setStatus(decision.getAction() == RoutingActionEnum.ANSWER
                ? InteractionStatusEnum.IN_PROGRESS
                : InteractionStatusEnum.COMPLETED);
        interaction.setStartedAt(startedAt);
        interaction.setMetadata(metadata);
        return interaction;
    }

    private RoutingDecision applyRule(RoutingDecision.RoutingDecisionBuilder base,
                                      InboundRoutingRuleEntity rule,
                                      GatewayPhoneEntity device) {
        base.action(rule.getAction())
                .ruleId(rule.getId())
                .ruleName(rule.getName());
        return switch (rule.getAction()) {
            case ANSWER -> base
                    .systemInstruction(StringUtils.defaultIfBlank(rule.getSystemInstruction(), device.getSystemInstruction()))
                    .voiceName(StringUtils.defaultIfBlank(rule.getVoiceName(), device.getVoiceName()))
                    .build();
            case FORWARD -> base.forwardTo(StringUtils.trimToNull(rule.getForwardTo())).build();
            case REJECT -> base.build();
        };
    }

    private List<InboundRoutingRuleEntity> sortByPriority(List<InboundRoutingRuleEntity> rules) {
        if (rules == null || rules.isEmpty()) {
            return Collections.emptyList();
        }
        List<InboundRoutingRuleEntity> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(InboundRoutingRuleEntity::resolvePriority));
        return sorted;
    }
}
