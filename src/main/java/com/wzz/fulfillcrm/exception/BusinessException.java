package com.wzz.fulfillcrm.exception;

import lombok.Getter;

/**
 * 业务异常，{@code code} 即返回给前端的 HTTP 状态码
 */
@Getter
public class BusinessException extends RuntimeException {
    private final int code;
    private final Object data;

    public BusinessException(int code, String msg) {
        this(code, msg, null);
    }

    public BusinessException(String msg) {
        this(400, msg, null);
    }

    public BusinessException(int code, String msg, Object data) {
        super(msg);
        this.code = code;
        this.data = data;
    }

    public static BusinessException notFound(String msg) {
        return new BusinessException(404, msg);
    }

    public static BusinessException badRequest(String msg) {
        return new BusinessException(400, msg);
    }

    public static BusinessException forbidden(String msg) {
        return new BusinessException(403, msg);
    }
}
