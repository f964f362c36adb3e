package com.slb.crowdfund_backend.modules.campaign.transport;

import com.slb.crowdfund_backend.modules.campaign.config.TransportProperties;
import com.slb.crowdfund_backend.modules.campaign.domain.Denomination;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class InMemoryTransportFactory implements TransportFactory {

    private final InMemoryCustodyBook custodyBook;
    private final TransportProperties properties;

    public InMemoryTransportFactory(InMemoryCustodyBook custodyBook, TransportProperties properties) {
        this.custodyBook = custodyBook;
        this.properties = properties;
    }

    @Override
    public ValueTransport create(long campaignId, Denomination denomination) {
        // only external tokens can be fee-on-transfer
        int feeBips = denomination instanceof Denomination.ExternalFungible
                ? properties.getTokenTransferFeeBips()
                : 0;
        String holder = custodyHolderFor(campaignId);
        log.info("Transport bound: campaignId={}, denomination={}, custodyHolder={}, transferFeeBips={}",
                campaignId, denomination.key(), holder, feeBips);
        return new CustodyBookTransport(custodyBook, denomination, holder, feeBips);
    }

    public static String custodyHolderFor(long campaignId) {
        return "campaign:" + campaignId;
    }
}
