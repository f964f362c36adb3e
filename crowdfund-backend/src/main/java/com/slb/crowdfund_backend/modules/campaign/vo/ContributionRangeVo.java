package com.slb.crowdfund_backend.modules.campaign.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "账户下一笔出资的合法区间 / Legal range for the account's next contribution")
public class ContributionRangeVo {

    private Long campaignId;

    private String account;

    @Schema(description = "下限（含）；区间关闭时为 0。/ Inclusive minimum, 0 when closed.", example = "1000000000000000")
    private String min;

    @Schema(description = "上限（含）；区间关闭时为 0。/ Inclusive maximum, 0 when closed.", example = "2000000000000000000")
    private String max;

    @Schema(description = "当前是否可以出资。/ Whether any contribution is currently accepted.")
    private boolean open;
}
