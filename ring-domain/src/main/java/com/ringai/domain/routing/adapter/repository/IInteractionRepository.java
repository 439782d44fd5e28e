package com.ringai.domain.routing.adapter.repository;

import com.ringai.domain.routing.model.entity.InteractionEntity;

/**
 * 交互记录仓储接口（只追加）。
 */
public interface IInteractionRepository {

    InteractionEntity save(InteractionEntity entity);
}
