package com.ringai.infrastructure.repository.routing;

import com.ringai.domain.routing.adapter.repository.IContactRepository;
import com.ringai.domain.routing.model.entity.ContactEntity;
import com.ringai.infrastructure.dao.ContactDao;
import com.ringai.infrastructure.dao.po.ContactPO;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

/**
 * 联系人仓储实现。
 */
@Repository
public class ContactRepositoryImpl implements IContactRepository {

    private final ContactDao contactDao;

    public ContactRepositoryImpl(ContactDao contactDao) {
        this.contactDao = contactDao;
    }

    @Override
    public ContactEntity findByOrgIdAndPhone(String orgId, String phone) {
        if (StringUtils.isAnyBlank(orgId, phone)) {
            return null;
        }
        ContactPO po = contactDao.selectByOrgIdAndPhone(orgId, phone);
        if (po == null) {
            return null;
        }
        ContactEntity entity = new ContactEntity();
        entity.setId(po.getId());
        entity.setOrgId(po.getOrgId());
        entity.setPhone(po.getPhone());
        entity.setName(po.getName());
        return entity;
    }
}
