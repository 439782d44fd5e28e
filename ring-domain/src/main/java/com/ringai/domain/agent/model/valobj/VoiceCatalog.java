package com.ringai.domain.agent.model.valobj;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 原生音频模型的预置音色目录（共 30 个），值为音色特征描述。
 */
public final class VoiceCatalog {

    private static final Map<String, String> VOICES;

    static {
        Map<String, String> voices = new LinkedHashMap<>();
        voices.put("Zephyr", "Bright");
        voices.put("Puck", "Upbeat");
        voices.put("Charon", "Informative");
        voices.put("Kore", "Firm");
        voices.put("Fenrir", "Excitable");
        voices.put("Leda", "Youthful");
        voices.put("Orus", "Firm");
        voices.put("Aoede", "Breezy");
        voices.put("Callirrhoe", "Easy-going");
        voices.put("Autonoe", "Bright");
        voices.put("Enceladus", "Breathy");
        voices.put("Iapetus", "Clear");
        voices.put("Umbriel", "Easy-going");
        voices.put("Algieba", "Smooth");
        voices.put("Despina", "Smooth");
        voices.put("Erinome", "Clear");
        voices.put("Algenib", "Gravelly");
        voices.put("Rasalgethi", "Informative");
        voices.put("Laomedeia", "Upbeat");
        voices.put("Achernar", "Soft");
        voices.put("Alnilam", "Firm");
        voices.put("Schedar", "Even");
        voices.put("Gacrux", "Mature");
        voices.put("Pulcherrima", "Forward");
        voices.put("Achird", "Friendly");
        voices.put("Zubenelgenubi", "Casual");
        voices.put("Vindemiatrix", "Gentle");
        voices.put("Sadachbia", "Lively");
        voices.put("Sadaltager", "Knowledgeable");
        voices.put("Sulafat", "Warm");
        VOICES = Collections.unmodifiableMap(voices);
    }

    private VoiceCatalog() {
    }

    public static boolean isSupported(String voiceName) {
        return voiceName != null && VOICES.containsKey(voiceName);
    }

    public static String characteristicOf(String voiceName) {
        return voiceName == null ? null : VOICES.get(voiceName);
    }

    public static Set<String> names() {
        return VOICES.keySet();
    }
}
