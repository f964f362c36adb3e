package com.slb.crowdfund_backend.modules.campaign.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "资金操作结果（出资 / 注入收益 / 提取）/ Value-moving operation result")
public class OperationResultVo {

    private Long campaignId;

    private String account;

    @Schema(description = "实际划转数量：出资与注入为实际到账的净额，提取为账户实收（扣除手续费后）。/ Net amount actually moved.", example = "1000000000000000000")
    private String amount;

    @Schema(description = "操作后的活动状态。/ Campaign state after the operation.", example = "FUNDING")
    private String state;
}
