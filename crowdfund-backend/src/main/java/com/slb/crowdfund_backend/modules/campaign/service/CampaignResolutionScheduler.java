package com.slb.crowdfund_backend.modules.campaign.service;

import com.slb.crowdfund_backend.common.trace.TraceIdHolder;
import com.slb.crowdfund_backend.modules.campaign.config.CampaignProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时把到期未达标（或超过兜底期限）的活动置为失败，使出资人可以自行退款。
 */
@Component
@Slf4j
public class CampaignResolutionScheduler {

    private final CampaignService campaignService;
    private final CampaignProperties campaignProperties;

    public CampaignResolutionScheduler(CampaignService campaignService, CampaignProperties campaignProperties) {
        this.campaignService = campaignService;
        this.campaignProperties = campaignProperties;
    }

    @Scheduled(fixedDelayString = "${app.campaign.resolution.interval-ms:60000}")
    public void releaseDueCampaigns() {
        if (!campaignProperties.getResolution().isEnabled()) {
            return;
        }
        TraceIdHolder.set(TraceIdHolder.generate());
        try {
            int released = campaignService.releaseDueCampaigns();
            if (released > 0) {
                log.info("Scheduled resolution released {} campaign(s)", released);
            }
        } finally {
            TraceIdHolder.clear();
        }
    }
}
