package com.ringai.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 联系人 PO（contacts，只映射路由需要的列）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactPO {

    private String id;
    private String orgId;
    private String phone;
    private String name;
}
