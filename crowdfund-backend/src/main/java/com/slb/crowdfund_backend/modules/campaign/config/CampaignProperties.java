package com.slb.crowdfund_backend.modules.campaign.config;

import com.slb.crowdfund_backend.modules.campaign.domain.CampaignPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app.campaign")
@Data
public class CampaignProperties {

    /**
     * 手续费上限（基点），不得超过 1250（12.5%）。
     */
    private int maxFeeBips = CampaignPolicy.HARD_MAX_FEE_BIPS;

    /**
     * 出资窗口最长时长。
     */
    private Duration maxWindow = CampaignPolicy.DEFAULT_MAX_WINDOW;

    /**
     * 结束后超过该时长仍未结算的活动，任何人都可以将其置为失败（资金兜底释放）。
     */
    private Duration staleGracePeriod = CampaignPolicy.DEFAULT_STALE_GRACE_PERIOD;

    private Resolution resolution = new Resolution();

    public CampaignPolicy toPolicy() {
        return new CampaignPolicy(maxFeeBips, maxWindow, staleGracePeriod);
    }

    @Data
    public static class Resolution {
        /**
         * 是否由定时任务自动把到期未达标的活动置为失败。
         */
        private boolean enabled = false;
        private long intervalMs = 60_000L;
    }
}
