package com.slb.crowdfund_backend.modules.campaign.exception;

import com.slb.crowdfund_backend.common.exception.BizException;

/**
 * Synchronous rejection of a campaign operation. The campaign is left exactly as it was
 * before the rejected call.
 */
public class CampaignException extends BizException {

    private static final long serialVersionUID = 1L;

    private final CampaignErrorType type;

    public CampaignException(CampaignErrorType type, String message) {
        super(type.getStatus().value(), type.getCode(), message);
        this.type = type;
    }

    public CampaignException(CampaignErrorType type, String message, Throwable cause) {
        super(type.getStatus().value(), type.getCode(), message, cause);
        this.type = type;
    }

    public CampaignErrorType getType() {
        return type;
    }

    public static CampaignException config(String message) {
        return new CampaignException(CampaignErrorType.CONFIG, message);
    }

    public static CampaignException window(String message) {
        return new CampaignException(CampaignErrorType.WINDOW, message);
    }

    public static CampaignException state(String message) {
        return new CampaignException(CampaignErrorType.STATE, message);
    }

    public static CampaignException bounds(String message) {
        return new CampaignException(CampaignErrorType.BOUNDS, message);
    }

    public static CampaignException balance(String message) {
        return new CampaignException(CampaignErrorType.BALANCE, message);
    }

    public static CampaignException transport(String message, Throwable cause) {
        return new CampaignException(CampaignErrorType.TRANSPORT, message, cause);
    }

    public static CampaignException notFound(Long campaignId) {
        return new CampaignException(CampaignErrorType.NOT_FOUND, "campaign " + campaignId + " not found");
    }
}
