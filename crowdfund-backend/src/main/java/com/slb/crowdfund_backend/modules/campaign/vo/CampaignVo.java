package com.slb.crowdfund_backend.modules.campaign.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.Instant;

/**
 * 所有数量字段均为最小单位整数的十进制字符串，避免前端精度丢失。
 */
@Data
@Schema(description = "众筹活动视图对象 / Campaign view object")
public class CampaignVo {

    @Schema(description = "活动 ID。/ Campaign ID.", example = "1")
    private Long campaignId;

    @Schema(description = "状态：FUNDING / FUNDED / FAILED。/ Lifecycle state.", example = "FUNDING")
    private String state;

    @Schema(description = "是否已结算或已判定失败。/ Whether the campaign has been resolved.", example = "false")
    private boolean processed;

    @Schema(description = "计价单位标识。/ Denomination key.", example = "NATIVE")
    private String denomination;

    private String recipient;

    @Schema(description = "手续费收取方（可为空）。/ Fee collector.", nullable = true)
    private String feeCollector;

    private int upfrontFeeBips;

    private int payoutFeeBips;

    private String goalMin;

    private String goalMax;

    private String contributionMin;

    private String contributionMax;

    private Instant startsAt;

    private Instant endsAt;

    @Schema(description = "当前累计出资（即份额总量）。/ Deposit total, equal to share supply.", example = "3000000000000000000")
    private String depositTotal;

    @Schema(description = "累计收到的收益。/ Cumulative yield received.", example = "0")
    private String yieldTotal;

    @Schema(description = "收益提取累计收取的手续费。/ Payout fees accrued to the collector.", example = "0")
    private String collectorFeesAccrued;

    @Schema(description = "托管余额。/ Value currently held in custody.", example = "3000000000000000000")
    private String heldBalance;

    private boolean contributionAllowed;

    private boolean goalMinMet;

    private boolean goalMaxMet;

    @Schema(description = "当前是否可以结算。/ Whether settle() is callable now.")
    private boolean canSettle;

    @Schema(description = "当前是否可以判定失败。/ Whether releaseFailed() is callable now.")
    private boolean canReleaseFailed;
}
