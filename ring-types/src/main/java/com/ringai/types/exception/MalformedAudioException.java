package com.ringai.types.exception;

import com.ringai.types.enums.ResponseCode;

/**
 * PCM 数据长度不是 2 的整数倍。
 */
public class MalformedAudioException extends AppException {

    private static final long serialVersionUID = -503812745901824367L;

    public MalformedAudioException(String message) {
        super(ResponseCode.MALFORMED_AUDIO.getCode(), message);
    }
}
