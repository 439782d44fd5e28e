package com.ringai.types.exception;

import com.ringai.types.enums.ResponseCode;

/**
 * 路由规则评估内部失败。只在路由器内部出现，最终总会被转换为放行（ANSWER）决策。
 */
public class RoutingEvaluationException extends AppException {

    private static final long serialVersionUID = 4471350866113870542L;

    public RoutingEvaluationException(String message, Throwable cause) {
        super(ResponseCode.ROUTING_EVALUATION_ERROR.getCode(), message, cause);
    }
}
