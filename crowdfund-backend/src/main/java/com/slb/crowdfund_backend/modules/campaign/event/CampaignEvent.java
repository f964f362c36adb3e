package com.slb.crowdfund_backend.modules.campaign.event;

import java.math.BigInteger;

/**
 * Observable outcome of a committed campaign operation.
 */
public interface CampaignEvent {

    long campaignId();

    /**
     * Stable event name written to the audit trail.
     */
    String type();

    /**
     * Primary account the event concerns, if any.
     */
    default String account() {
        return null;
    }

    default String counterparty() {
        return null;
    }

    default BigInteger amount() {
        return null;
    }
}
