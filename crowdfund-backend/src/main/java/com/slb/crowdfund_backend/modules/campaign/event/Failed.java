package com.slb.crowdfund_backend.modules.campaign.event;

public record Failed(long campaignId) implements CampaignEvent {

    @Override
    public String type() {
        return "FAILED";
    }
}
