package com.slb.crowdfund_backend.modules.campaign.service;

import com.slb.crowdfund_backend.common.trace.TraceIdHolder;
import com.slb.crowdfund_backend.modules.campaign.config.CampaignProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CampaignResolutionSchedulerTest {

    @Test
    void disabledSchedulerShouldNotTouchCampaigns() {
        CampaignService campaignService = mock(CampaignService.class);
        CampaignResolutionScheduler scheduler = new CampaignResolutionScheduler(campaignService, new CampaignProperties());

        scheduler.releaseDueCampaigns();

        verify(campaignService, never()).releaseDueCampaigns();
    }

    @Test
    void enabledSchedulerShouldReleaseAndClearTraceId() {
        CampaignService campaignService = mock(CampaignService.class);
        when(campaignService.releaseDueCampaigns()).thenReturn(2);
        CampaignProperties properties = new CampaignProperties();
        properties.getResolution().setEnabled(true);
        CampaignResolutionScheduler scheduler = new CampaignResolutionScheduler(campaignService, properties);

        scheduler.releaseDueCampaigns();

        verify(campaignService).releaseDueCampaigns();
        assertThat(TraceIdHolder.getOptional()).isEmpty();
    }
}
