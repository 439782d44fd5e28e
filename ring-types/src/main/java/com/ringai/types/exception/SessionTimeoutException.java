package com.ringai.types.exception;

import com.ringai.types.enums.ResponseCode;

/**
 * 会话自动续期失败，上游连接已不可用，调用方应尽快结束通话。
 */
public class SessionTimeoutException extends SessionLifecycleException {

    private static final long serialVersionUID = -6001457398124413730L;

    public SessionTimeoutException(String message, Throwable cause) {
        super(ResponseCode.SESSION_TIMEOUT.getCode(), message, cause);
    }
}
