package com.ringai.domain.routing.model.valobj;

/**
 * 网关上报的来电元数据。
 *
 * @param callId     设备侧分配的通话标识
 * @param fromNumber 主叫号码
 * @param toNumber   被叫号码（设备自身号码）
 * @param carrier    运营商名称，可为空串
 * @param simSlot    SIM 卡槽位
 * @param gatewayId  网关设备标识
 */
public record IncomingCall(String callId,
                           String fromNumber,
                           String toNumber,
                           String carrier,
                           int simSlot,
                           String gatewayId) {

    public IncomingCall {
        carrier = carrier == null ? "" : carrier;
    }
}
