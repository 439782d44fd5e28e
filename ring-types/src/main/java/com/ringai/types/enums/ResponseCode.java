package com.ringai.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义 HTTP 响应和网关控制帧中使用的响应码和对应描述信息。
 * B 开头的为桥接核心的业务失败码。
 * </p>
 *
 * @author ringai
 * @since 2026-03-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 会话池容量耗尽 */
    ADMISSION_EXHAUSTED("B001", "会话池容量耗尽"),

    /** 会话生命周期错误 */
    SESSION_LIFECYCLE_ERROR("B002", "会话状态不允许该操作"),

    /** 会话续期失败 */
    SESSION_TIMEOUT("B003", "会话续期失败"),

    /** 路由评估失败 */
    ROUTING_EVALUATION_ERROR("B004", "路由评估失败"),

    /** 音频数据格式错误 */
    MALFORMED_AUDIO("B005", "音频数据格式错误"),

    /** 通话已存在活跃会话 */
    CALL_ALREADY_ACTIVE("B006", "通话已存在活跃会话"),

    /** 上游连接错误 */
    UPSTREAM_CLIENT_ERROR("B007", "上游连接错误");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
