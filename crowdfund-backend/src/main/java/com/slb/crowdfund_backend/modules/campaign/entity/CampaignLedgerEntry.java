package com.slb.crowdfund_backend.modules.campaign.entity;

import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 活动流水记录（审计用）。
 * 对应 campaign_ledger 表，每个已提交的活动事件写入一行。
 */
@Data
public class CampaignLedgerEntry implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private Long campaignId;
    /** 活动内事件序号，与 campaignId 组成唯一键 */
    private Long seq;
    /** 事件类型（CONTRIBUTION_ACCEPTED、SETTLED、WITHDRAWN 等） */
    private String eventType;
    /** 主账户（可为空） */
    private String account;
    /** 对手方账户，仅份额转移时有值 */
    private String counterparty;
    /** 数量（最小单位整数，十进制字符串），可为空 */
    private String amount;
    /** 链路追踪 ID */
    private String traceId;
    /** 业务发生时间 */
    private LocalDateTime eventTime;
    private LocalDateTime createdTime;
}
