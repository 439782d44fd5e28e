package com.ringai.domain.routing.model.entity;

import com.ringai.types.enums.InteractionStatusEnum;
import com.ringai.types.enums.InteractionTypeEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 交互记录，每次路由决策追加一条。
 */
@Data
public class InteractionEntity {

    private String id;
    private String orgId;
    private String contactId;
    private InteractionTypeEnum type;
    private InteractionStatusEnum status;
    private LocalDateTime startedAt;
    private Map<String, Object> metadata;

    public void validate() {
        if (orgId == null) {
            throw new IllegalStateException("Org id cannot be null");
        }
        if (type == null || status == null) {
            throw new IllegalStateException("Interaction type and status cannot be null");
        }
    }
}
