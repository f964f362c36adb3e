package com.slb.crowdfund_backend.modules.campaign.event;

import java.math.BigInteger;

/**
 * {@code amount} is the net amount credited as shares.
 */
public record ContributionAccepted(long campaignId, String account, BigInteger amount) implements CampaignEvent {

    @Override
    public String type() {
        return "CONTRIBUTION_ACCEPTED";
    }
}
