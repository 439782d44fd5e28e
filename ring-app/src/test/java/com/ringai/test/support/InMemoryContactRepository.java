package com.ringai.test.support;

import com.ringai.domain.routing.adapter.repository.IContactRepository;
import com.ringai.domain.routing.model.entity.ContactEntity;

import java.util.ArrayList;
import java.util.List;

/**
 * 内存联系人仓储。
 */
public class InMemoryContactRepository implements IContactRepository {

    private final List<ContactEntity> store = new ArrayList<>();

    public ContactEntity save(ContactEntity entity) {
        store.add(entity);
        return entity;
    }

    @Override
    public ContactEntity findByOrgIdAndPhone(String orgId, String phone) {
        for (ContactEntity contact : store) {
            if (contact.getOrgId().equals(orgId) && contact.getPhone().equals(phone)) {
                return contact;
            }
        }
        return null;
    }
}
