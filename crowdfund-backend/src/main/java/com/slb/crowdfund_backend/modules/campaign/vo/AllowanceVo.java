package com.slb.crowdfund_backend.modules.campaign.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "份额授权额度 / Share allowance")
public class AllowanceVo {

    private Long campaignId;

    private String owner;

    private String spender;

    private String amount;
}
