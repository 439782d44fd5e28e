package com.ringai.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 路由规则的主叫号码匹配方式。
 */
public enum RoutingMatchTypeEnum {

    /** 任意主叫 */
    ALL("all"),

    /** 号码前缀，末尾的 * 通配符会被忽略 */
    PREFIX("prefix"),

    /** 号码完全相等 */
    EXACT("exact"),

    /** 仅匹配组织通讯录中的已知联系人 */
    CONTACT_ONLY("contact_only");

    private final String code;

    RoutingMatchTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static RoutingMatchTypeEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (RoutingMatchTypeEnum value : RoutingMatchTypeEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown match type: " + text);
    }
}
