package com.slb.crowdfund_backend.modules.campaign.event;

import java.math.BigInteger;

public record ShareTransfer(long campaignId, String from, String to, BigInteger amount) implements CampaignEvent {

    @Override
    public String type() {
        return "SHARE_TRANSFER";
    }

    @Override
    public String account() {
        return from;
    }

    @Override
    public String counterparty() {
        return to;
    }
}
