package com.slb.crowdfund_backend.modules.campaign.event;

/**
 * Receives events after the operation that produced them has committed.
 */
@FunctionalInterface
public interface CampaignEventListener {

    void onEvent(CampaignEvent event);

    CampaignEventListener NO_OP = event -> {
    };
}
