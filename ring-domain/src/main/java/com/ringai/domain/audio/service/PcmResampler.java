package com.ringai.domain.audio.service;

import com.ringai.types.exception.MalformedAudioException;

/**
 * 16-bit 有符号、小端、单声道 PCM 的线性插值重采样。
 * <p>
 * 输出采样数为 {@code floor(inputCount * targetRate / sourceRate)}；第 i 个输出采样取源位置
 * {@code i * sourceRate / targetRate} 两侧采样的线性插值，四舍六入五成双后截断到 16 位范围。
 * 上下行两个方向共用，方向只由参数决定。
 * </p>
 *
 * @author ringai
 * @since 2026-03-02
 */
public final class PcmResampler {

    public static final int SAMPLE_SIZE = 2;

    private PcmResampler() {
    }

    public static byte[] resample(byte[] data, int sourceRate, int targetRate) {
        if (sourceRate <= 0 || targetRate <= 0) {
            throw new IllegalArgumentException("Sample rates must be positive: " + sourceRate + " -> " + targetRate);
        }
        if (data == null || data.length == 0) {
            return new byte[0];
        }
        if (data.length % SAMPLE_SIZE != 0) {
            throw new MalformedAudioException("Audio data length (" + data.length
                    + ") must be a multiple of " + SAMPLE_SIZE + " bytes");
        }
        int inputCount = data.length / SAMPLE_SIZE;
        if (inputCount < 2 || sourceRate == targetRate) {
            return data;
        }

        int outputCount = (int) ((long) inputCount * targetRate / sourceRate);
        byte[] output = new byte[outputCount * SAMPLE_SIZE];
        double ratio = (double) sourceRate / (double) targetRate;
        for (int i = 0; i < outputCount; i++) {
            double sourcePos = i * ratio;
            int sourceIdx = (int) sourcePos;
            double frac = sourcePos - sourceIdx;

            double sample;
            int current = readSample(data, sourceIdx);
            if (sourceIdx + 1 < inputCount) {
                int next = readSample(data, sourceIdx + 1);
                sample = current + frac * (next - current);
            } else {
                sample = current;
            }
            writeSample(output, i, clamp(Math.rint(sample)));
        }
        return output;
    }

    /**
     * 读取第 index 个采样（小端）。
     */
    static int readSample(byte[] data, int index) {
        int offset = index * SAMPLE_SIZE;
        return (short) ((data[offset] & 0xFF) | ((data[offset + 1] & 0xFF) << 8));
    }

    private static void writeSample(byte[] data, int index, int sample) {
        int offset = index * SAMPLE_SIZE;
        data[offset] = (byte) (sample & 0xFF);
        data[offset + 1] = (byte) ((sample >> 8) & 0xFF);
    }

    private static int clamp(double sample) {
        if (sample > Short.MAX_VALUE) {
            return Short.MAX_VALUE;
        }
        if (sample < Short.MIN_VALUE) {
            return Short.MIN_VALUE;
        }
        return (int) sample;
    }
}
