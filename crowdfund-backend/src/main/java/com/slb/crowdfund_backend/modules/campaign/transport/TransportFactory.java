package com.slb.crowdfund_backend.modules.campaign.transport;

import com.slb.crowdfund_backend.modules.campaign.domain.Denomination;

/**
 * Binds a campaign to the transport for its denomination, once, at initialization.
 */
public interface TransportFactory {

    ValueTransport create(long campaignId, Denomination denomination);
}
