package com.slb.crowdfund_backend.modules.campaign.support;

import com.slb.crowdfund_backend.modules.campaign.domain.CampaignConfig;
import com.slb.crowdfund_backend.modules.campaign.domain.Denomination;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

public final class CampaignFixtures {

    public static final Instant START = Instant.parse("2026-11-01T00:00:00Z");
    public static final Instant END = START.plus(Duration.ofDays(30));

    public static final String RECIPIENT = "alice";
    public static final String COLLECTOR = "treasury";

    private CampaignFixtures() {
    }

    public static BigInteger e18(long units) {
        return BigInteger.valueOf(units).multiply(BigInteger.TEN.pow(18));
    }

    public static BigInteger e17(long units) {
        return BigInteger.valueOf(units).multiply(BigInteger.TEN.pow(17));
    }

    public static BigInteger e16(long units) {
        return BigInteger.valueOf(units).multiply(BigInteger.TEN.pow(16));
    }

    /**
     * goal [2e18, 5e18], per-account [2e17, 1e18], 30-day window, native, no fees.
     */
    public static CampaignConfig standard() {
        return new CampaignConfig(RECIPIENT, null, 0, 0,
                e18(2), e18(5), e17(2), e18(1),
                START, END, Denomination.nativeUnit());
    }

    public static CampaignConfig withFees(CampaignConfig base, String collector, int upfrontBips, int payoutBips) {
        return new CampaignConfig(base.recipient(), collector, upfrontBips, payoutBips,
                base.goalMin(), base.goalMax(), base.contributionMin(), base.contributionMax(),
                base.startsAt(), base.endsAt(), base.denomination());
    }

    public static CampaignConfig withBounds(CampaignConfig base, BigInteger goalMin, BigInteger goalMax,
                                            BigInteger contributionMin, BigInteger contributionMax) {
        return new CampaignConfig(base.recipient(), base.feeCollector(), base.upfrontFeeBips(), base.payoutFeeBips(),
                goalMin, goalMax, contributionMin, contributionMax,
                base.startsAt(), base.endsAt(), base.denomination());
    }

    public static CampaignConfig withWindow(CampaignConfig base, Instant startsAt, Instant endsAt) {
        return new CampaignConfig(base.recipient(), base.feeCollector(), base.upfrontFeeBips(), base.payoutFeeBips(),
                base.goalMin(), base.goalMax(), base.contributionMin(), base.contributionMax(),
                startsAt, endsAt, base.denomination());
    }

    public static CampaignConfig withDenomination(CampaignConfig base, Denomination denomination) {
        return new CampaignConfig(base.recipient(), base.feeCollector(), base.upfrontFeeBips(), base.payoutFeeBips(),
                base.goalMin(), base.goalMax(), base.contributionMin(), base.contributionMax(),
                base.startsAt(), base.endsAt(), denomination);
    }
}
