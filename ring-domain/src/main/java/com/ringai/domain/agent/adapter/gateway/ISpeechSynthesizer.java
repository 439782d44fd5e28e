package com.ringai.domain.agent.adapter.gateway;

import com.ringai.domain.agent.model.valobj.TtsConfig;

/**
 * 语音合成协作方，仅混合输出模式使用。
 */
public interface ISpeechSynthesizer {

    /**
     * 合成一段文本。
     *
     * @param text 待合成文本
     * @param config 提供方与音色
     * @return 16-bit 小端单声道 PCM
     */
    byte[] synthesize(String text, TtsConfig config);
}
