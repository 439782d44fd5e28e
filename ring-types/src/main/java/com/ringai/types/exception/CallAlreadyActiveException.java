package com.ringai.types.exception;

import com.ringai.types.enums.ResponseCode;

/**
 * call_id 已经映射到一个活跃会话。
 */
public class CallAlreadyActiveException extends AppException {

    private static final long serialVersionUID = 8823716502319984412L;

    public CallAlreadyActiveException(String callId) {
        super(ResponseCode.CALL_ALREADY_ACTIVE.getCode(), "Call already has an active session: " + callId);
    }
}
