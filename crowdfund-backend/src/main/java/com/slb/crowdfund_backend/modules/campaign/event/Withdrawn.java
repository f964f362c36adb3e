package com.slb.crowdfund_backend.modules.campaign.event;

import java.math.BigInteger;

/**
 * Value paid out of the pool to {@code account}: a refund, a yield payment or a payout fee.
 */
public record Withdrawn(long campaignId, String account, BigInteger amount) implements CampaignEvent {

    @Override
    public String type() {
        return "WITHDRAWN";
    }
}
