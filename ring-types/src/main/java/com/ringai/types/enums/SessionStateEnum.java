package com.ringai.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 上游会话状态。
 * <p>
 * 合法迁移：CONNECTING → ACTIVE → {EXTENDING → ACTIVE | ERROR} → CLOSING → CLOSED，
 * 任一进行中的操作失败都可以进入 ERROR。
 * </p>
 */
public enum SessionStateEnum {

    CONNECTING("connecting"),

    ACTIVE("active"),

    /** 正在用续期句柄切换上游连接 */
    EXTENDING("extending"),

    CLOSING("closing"),

    CLOSED("closed"),

    ERROR("error");

    private final String code;

    SessionStateEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 是否允许收发数据。续期期间的发送会被缓冲，待新连接建立后按序补发。
     */
    public boolean acceptsIo() {
        return this == ACTIVE || this == EXTENDING;
    }

    public boolean isTerminal() {
        return this == CLOSING || this == CLOSED;
    }
}
