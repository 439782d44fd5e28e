package com.ringai.domain.agent.model.valobj;

/**
 * 混合模式下的语音合成参数。
 *
 * @param provider TTS 提供方标识，例如 edge_tts
 * @param voice    提供方内的音色名
 */
public record TtsConfig(String provider, String voice) {
}
