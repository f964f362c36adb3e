package com.slb.crowdfund_backend.modules.campaign.event;

import java.math.BigInteger;

public record YieldDeposited(long campaignId, String depositor, BigInteger amount) implements CampaignEvent {

    @Override
    public String type() {
        return "YIELD_DEPOSITED";
    }

    @Override
    public String account() {
        return depositor;
    }
}
