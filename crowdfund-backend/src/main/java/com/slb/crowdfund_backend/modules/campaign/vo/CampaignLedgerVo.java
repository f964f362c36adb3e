package com.slb.crowdfund_backend.modules.campaign.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Schema(description = "活动流水视图对象 / Campaign audit row")
public class CampaignLedgerVo {

    private Long campaignId;

    @Schema(description = "活动内事件序号。/ Per-campaign event sequence.", example = "1")
    private Long seq;

    @Schema(description = "事件类型。/ Event type.", example = "CONTRIBUTION_ACCEPTED",
            allowableValues = {"FEE_SCHEDULE_APPLIED", "CONTRIBUTION_ACCEPTED", "SETTLED", "FAILED",
                    "YIELD_DEPOSITED", "WITHDRAWN", "SHARE_TRANSFER"})
    private String eventType;

    private String account;

    private String counterparty;

    private String amount;

    private String traceId;

    private LocalDateTime eventTime;
}
