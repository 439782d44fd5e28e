package com.ringai.types.exception;

import com.ringai.types.enums.ResponseCode;

/**
 * 会话生命周期异常：当前状态不允许该操作，或建连/断开失败。
 */
public class SessionLifecycleException extends AppException {

    private static final long serialVersionUID = 1630986720483924455L;

    public SessionLifecycleException(String message) {
        super(ResponseCode.SESSION_LIFECYCLE_ERROR.getCode(), message);
    }

    public SessionLifecycleException(String message, Throwable cause) {
        super(ResponseCode.SESSION_LIFECYCLE_ERROR.getCode(), message, cause);
    }

    protected SessionLifecycleException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
