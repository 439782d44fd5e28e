/**
 * 音频领域：16-bit 小端单声道 PCM 的采样率转换。
 * <p>
 * 网关设备与上游语音服务的采样率不同（设备 16 kHz，上游输出 24 kHz），
 * 网关连接处理器在上下行两个方向上调用 {@link com.ringai.domain.audio.service.PcmResampler}。
 * </p>
 */
package com.ringai.domain.audio;
