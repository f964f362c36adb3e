package com.slb.crowdfund_backend.common.exception;

/**
 * 业务异常基类 / Base class for synchronous business rejections.
 * <p>
 * code 与 HTTP 状态码对齐；machineCode 为稳定的机器可读错误码，供前端或调用方分支判断。
 */
public class BizException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private static final String DEFAULT_MACHINE_CODE = "BIZ_ERROR";

    private final int code;

    private final String machineCode;

    public BizException(int code, String message) {
        this(code, DEFAULT_MACHINE_CODE, message);
    }

    public BizException(int code, String machineCode, String message) {
        super(message);
        this.code = code;
        this.machineCode = machineCode;
    }

    public BizException(int code, String machineCode, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.machineCode = machineCode;
    }

    public int getCode() {
        return code;
    }

    public String getMachineCode() {
        return machineCode;
    }
}
