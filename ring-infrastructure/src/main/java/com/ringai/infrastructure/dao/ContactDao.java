package com.ringai.infrastructure.dao;

import com.ringai.infrastructure.dao.po.ContactPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 联系人 DAO
 */
@Mapper
public interface ContactDao {

    ContactPO selectByOrgIdAndPhone(@Param("orgId") String orgId, @Param("phone") String phone);
}
