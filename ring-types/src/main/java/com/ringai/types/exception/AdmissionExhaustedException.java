package com.ringai.types.exception;

import com.ringai.types.enums.ResponseCode;

/**
 * 会话池在等待超时内没有可用容量。
 */
public class AdmissionExhaustedException extends AppException {

    private static final long serialVersionUID = -2874162019356377121L;

    public AdmissionExhaustedException(String message) {
        super(ResponseCode.ADMISSION_EXHAUSTED.getCode(), message);
    }
}
