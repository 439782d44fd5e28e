package com.ringai.types.exception;

import com.ringai.types.enums.ResponseCode;

/**
 * 上游实时语音连接的传输层失败（建连、发送、协议解析）。
 */
public class UpstreamClientException extends AppException {

    private static final long serialVersionUID = -1192837465019283746L;

    public UpstreamClientException(String message) {
        super(ResponseCode.UPSTREAM_CLIENT_ERROR.getCode(), message);
    }

    public UpstreamClientException(String message, Throwable cause) {
        super(ResponseCode.UPSTREAM_CLIENT_ERROR.getCode(), message, cause);
    }
}
