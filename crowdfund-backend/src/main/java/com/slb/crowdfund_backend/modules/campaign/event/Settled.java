package com.slb.crowdfund_backend.modules.campaign.event;

import java.math.BigInteger;

/**
 * One leg of the settlement payout: the recipient's net pool or the collector's upfront fee.
 */
public record Settled(long campaignId, String target, BigInteger amount) implements CampaignEvent {

    @Override
    public String type() {
        return "SETTLED";
    }

    @Override
    public String account() {
        return target;
    }
}
