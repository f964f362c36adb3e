package com.slb.crowdfund_backend.modules.campaign.event;

public record FeeScheduleApplied(long campaignId, String collector, int upfrontBips, int payoutBips)
        implements CampaignEvent {

    @Override
    public String type() {
        return "FEE_SCHEDULE_APPLIED";
    }

    @Override
    public String account() {
        return collector;
    }
}
