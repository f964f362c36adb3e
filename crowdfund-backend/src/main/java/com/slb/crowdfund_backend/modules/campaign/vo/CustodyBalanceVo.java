package com.slb.crowdfund_backend.modules.campaign.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "托管账本余额 / Custody book balance")
public class CustodyBalanceVo {

    private String denomination;

    private String holder;

    private String balance;
}
