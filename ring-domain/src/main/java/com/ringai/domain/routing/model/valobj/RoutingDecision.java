package com.ringai.domain.routing.model.valobj;

import com.ringai.types.common.Constants;
import com.ringai.types.enums.RoutingActionEnum;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 一次来电的路由结果。每通来电产生且只产生一个决策。
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class RoutingDecision {

    private final RoutingActionEnum action;
    private final String callId;
    private final String orgId;
    private final String contactId;
    private final String contactName;
    private final String gatewayPhoneId;
    private final String ruleId;
    private final String ruleName;
    private final String forwardTo;
    private final String systemInstruction;
    private final String voiceName;
    @Builder.Default
    private final String rejectReason = Constants.REJECT_REASON_DEFAULT;

    /**
     * 放行决策：直接接听，不带任何覆盖项。
     */
    public static RoutingDecision answer(String callId) {
        return RoutingDecision.builder()
                .action(RoutingActionEnum.ANSWER)
                .callId(callId)
                .build();
    }
}
