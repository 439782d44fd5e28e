package com.ringai.domain.routing.adapter.repository;

import com.ringai.domain.routing.model.entity.ContactEntity;

/**
 * 联系人仓储接口（只读）。
 */
public interface IContactRepository {

    ContactEntity findByOrgIdAndPhone(String orgId, String phone);
}
