package com.ringai.types.common;

/**
 * 全局常量定义类。
 *
 * @author ringai
 * @since 2026-03-02
 */
public class Constants {

    /** MDC 中的通话标识键 */
    public final static String MDC_CALL_ID = "callId";

    /** MDC 中的网关设备标识键 */
    public final static String MDC_GATEWAY_ID = "gatewayId";

    /** 无规则命中且设备关闭自动接听时的拒接原因 */
    public final static String REJECT_REASON_NO_MATCHING_RULE = "no_matching_rule";

    /** 默认拒接原因 */
    public final static String REJECT_REASON_DEFAULT = "rejected";

    /** 工具执行器缺失时回传给上游的错误信息 */
    public final static String TOOL_EXECUTION_UNAVAILABLE = "Tool execution not available";

}
