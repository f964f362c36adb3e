package com.slb.crowdfund_backend.modules.campaign.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Write-once campaign parameters. Validated by {@link CampaignConfigValidator} when the
 * campaign is initialized.
 */
public record CampaignConfig(String recipient,
                             String feeCollector,
                             int upfrontFeeBips,
                             int payoutFeeBips,
                             BigInteger goalMin,
                             BigInteger goalMax,
                             BigInteger contributionMin,
                             BigInteger contributionMax,
                             Instant startsAt,
                             Instant endsAt,
                             Denomination denomination) {

    public FeeSchedule feeSchedule() {
        return new FeeSchedule(feeCollector, upfrontFeeBips, payoutFeeBips);
    }
}
