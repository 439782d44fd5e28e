package com.ringai.infrastructure.dao;

import com.ringai.infrastructure.dao.po.InteractionPO;
import org.apache.ibatis.annotations.Mapper;

/**
 * 交互记录 DAO
 */
@Mapper
public interface InteractionDao {

    int insert(InteractionPO po);
}
