package com.slb.crowdfund_backend.modules.campaign.exception;

import org.springframework.http.HttpStatus;

/**
 * Catalogue of campaign rejection kinds.
 */
public enum CampaignErrorType {
    CONFIG(HttpStatus.BAD_REQUEST, "CAMPAIGN_CONFIG", "活动参数不合法"),
    WINDOW(HttpStatus.CONFLICT, "CAMPAIGN_WINDOW", "当前不在允许的时间窗口内"),
    STATE(HttpStatus.CONFLICT, "CAMPAIGN_STATE", "当前活动状态不允许该操作"),
    BOUNDS(HttpStatus.UNPROCESSABLE_ENTITY, "CAMPAIGN_BOUNDS", "出资金额超出允许范围"),
    TRANSPORT(HttpStatus.BAD_GATEWAY, "CAMPAIGN_TRANSPORT", "资金划转失败，请稍后重试"),
    BALANCE(HttpStatus.UNPROCESSABLE_ENTITY, "CAMPAIGN_BALANCE", "可用余额不足"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "CAMPAIGN_NOT_FOUND", "活动不存在");

    private final HttpStatus status;
    private final String code;
    private final String displayMessage;

    CampaignErrorType(HttpStatus status, String code, String displayMessage) {
        this.status = status;
        this.code = code;
        this.displayMessage = displayMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayMessage() {
        return displayMessage;
    }
}
