package com.ringai.infrastructure.repository.routing;

import com.ringai.domain.routing.adapter.repository.IInteractionRepository;
import com.ringai.domain.routing.model.entity.InteractionEntity;
import com.ringai.infrastructure.dao.InteractionDao;
import com.ringai.infrastructure.dao.po.InteractionPO;
import com.ringai.infrastructure.util.JsonCodec;
import org.springframework.stereotype.Repository;

/**
 * 交互记录仓储实现。
 */
@Repository
public class InteractionRepositoryImpl implements IInteractionRepository {

    private final InteractionDao interactionDao;
    private final JsonCodec jsonCodec;

    public InteractionRepositoryImpl(InteractionDao interactionDao, JsonCodec jsonCodec) {
        this.interactionDao = interactionDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public InteractionEntity save(InteractionEntity entity) {
        entity.validate();
        InteractionPO po = InteractionPO.builder()
                .orgId(entity.getOrgId())
                .contactId(entity.getContactId())
                .type(entity.getType().getCode())
                .status(entity.getStatus().getCode())
                .startedAt(entity.getStartedAt())
                .metadata(jsonCodec.writeValue(entity.getMetadata()))
                .build();
        interactionDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }
}
