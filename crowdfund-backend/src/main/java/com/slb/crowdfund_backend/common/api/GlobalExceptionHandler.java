package com.slb.crowdfund_backend.common.api;

import com.slb.crowdfund_backend.common.exception.BizException;
import com.slb.crowdfund_backend.modules.campaign.exception.CampaignException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(CampaignException.class)
    public ResponseEntity<ApiResponse<Void>> campaign(CampaignException e) {
        HttpStatus status = e.getType().getStatus();
        log.info("Campaign operation rejected: type={}, message={}", e.getType(), e.getMessage());
        return ResponseEntity.status(status)
                .body(ApiResponse.error(status.value(), e.getMachineCode(), e.getMessage(), e.getType().getDisplayMessage()));
    }

    @ExceptionHandler(BizException.class)
    public ResponseEntity<ApiResponse<Void>> biz(BizException e) {
        HttpStatus status = HttpStatus.resolve(e.getCode());
        if (status == null) {
            status = HttpStatus.BAD_REQUEST;
        }
        return ResponseEntity.status(status)
                .body(ApiResponse.error(e.getCode(), e.getMachineCode(), e.getMessage(), null));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> invalidArgument(MethodArgumentNotValidException e) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        return ResponseEntity.badRequest()
                .body(ApiResponse.validationError(HttpStatus.BAD_REQUEST.value(), "VALIDATION_FAILED", "请求参数不合法", errors));
    }
}
