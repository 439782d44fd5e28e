package com.ringai.domain.routing.model.entity;

import lombok.Data;

/**
 * 组织通讯录中的联系人，路由只用于识别主叫。
 */
@Data
public class ContactEntity {

    private String id;
    private String orgId;
    private String phone;
    private String name;
}
