package com.ringai.domain.routing.model.entity;

import com.ringai.types.enums.RoutingActionEnum;
import com.ringai.types.enums.RoutingMatchTypeEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * 呼入路由规则。priority 越小越先评估。
 */
@Data
public class InboundRoutingRuleEntity {

    private String id;
    private String orgId;
    private String name;
    /** 主叫号码模式，prefix 模式下末尾的 * 会被忽略 */
    private String callerPattern;
    private RoutingMatchTypeEnum matchType;
    private RoutingActionEnum action;
    private String forwardTo;
    private String systemInstruction;
    private String voiceName;
    /** 生效时间窗起点，null 表示 00:00 */
    private LocalTime timeStart;
    /** 生效时间窗终点，null 表示 23:59:59；早于起点时表示跨夜 */
    private LocalTime timeEnd;
    /** 生效星期，0 = 周一 ... 6 = 周日；null 表示每天 */
    private List<Integer> daysOfWeek;
    private Boolean isActive;
    private Integer priority;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public int resolvePriority() {
        return priority == null ? 0 : priority;
    }

    public void validate() {
        if (matchType == null) {
            throw new IllegalStateException("Match type cannot be null, rule=" + id);
        }
        if (action == null) {
            throw new IllegalStateException("Action cannot be null, rule=" + id);
        }
    }
}
