package com.slb.crowdfund_backend.modules.campaign.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "账户持仓视图对象 / Account position view object")
public class AccountVo {

    private Long campaignId;

    private String account;

    @Schema(description = "份额余额（1:1 对应净出资）。/ Share balance.", example = "1000000000000000000")
    private String shareBalance;

    @Schema(description = "已计入提取的收益（含手续费，转移份额时按比例调整）。/ Yield already accounted as withdrawn.", example = "0")
    private String withdrawn;

    @Schema(description = "当前可提取收益（仅 FUNDED 状态下非 0）。/ Pending yield, non-zero only when FUNDED.", example = "0")
    private String yieldBalance;

    @Schema(description = "是否仍持有出资凭证（份额大于 0）。/ Whether the account still holds a contribution claim.")
    private boolean hasClaim;
}
