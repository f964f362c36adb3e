package com.slb.crowdfund_backend.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.slb.crowdfund_backend.common.trace.TraceIdHolder;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 统一响应封装结构 / Unified API response envelope.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "统一响应结构，所有接口（成功或异常）均返回该结构 / Unified response envelope used by all APIs.")
public class ApiResponse<T> {

    @Schema(description = "业务状态码，0 表示成功，非 0 与 HTTP 状态码一致。/ 0 on success, otherwise mirrors the HTTP status.", example = "0")
    private int code;

    @Schema(description = "提示信息；成功时为 'ok'，失败时为具体错误原因。/ 'ok' on success, error reason otherwise.", example = "ok")
    private String message;

    @Schema(description = "展示用文案（中文），用于前端直接展示。/ Display message for UI.", nullable = true)
    private String displayMessage;

    @Schema(description = "业务数据载体。/ Business payload.", nullable = true)
    private T data;

    @Schema(description = "请求链路追踪 ID。/ Trace identifier for request correlation.", example = "b3f7e6c9a1d24c31")
    private String traceId;

    @Schema(description = "错误扩展信息（可选）。/ Optional structured error details.", nullable = true)
    private ErrorBody error;

    private ApiResponse(int code, String message, T data, String traceId) {
        this.code = code;
        this.message = message;
        this.data = data;
        this.traceId = traceId;
    }

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(0, "ok", data, TraceIdHolder.require());
    }

    public static ApiResponse<Void> error(int code, String message) {
        return new ApiResponse<>(code, message, null, TraceIdHolder.require());
    }

    /**
     * 带稳定机器码的错误响应：message 保留原始原因，error.code 供调用方分支判断。
     */
    public static ApiResponse<Void> error(int code, String machineCode, String message, String displayMessage) {
        ApiResponse<Void> resp = error(code, message);
        resp.setDisplayMessage(displayMessage);
        resp.setError(new ErrorBody(machineCode, displayMessage, null));
        return resp;
    }

    public static ApiResponse<Void> validationError(int code, String machineCode, String message,
                                                    Map<String, String> errors) {
        ApiResponse<Void> resp = error(code, message);
        resp.setError(new ErrorBody(machineCode, message, errors));
        return resp;
    }

    @Data
    @NoArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Schema(description = "错误扩展结构 / Structured error details.")
    public static class ErrorBody {
        @Schema(description = "稳定机器错误码 / Stable machine-readable error code.", example = "CAMPAIGN_BOUNDS")
        private String code;

        @Schema(description = "展示文案 / Display message for UI.", example = "超出单账户出资上限")
        private String displayMessage;

        @Schema(description = "字段级错误明细（可选）/ Field-level errors (optional).", nullable = true)
        private Map<String, String> errors;

        public ErrorBody(String code, String displayMessage, Map<String, String> errors) {
            this.code = code;
            this.displayMessage = displayMessage;
            this.errors = errors;
        }
    }
}
