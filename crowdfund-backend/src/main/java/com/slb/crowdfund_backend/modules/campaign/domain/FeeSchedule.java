package com.slb.crowdfund_backend.modules.campaign.domain;

import java.math.BigInteger;

/**
 * Upfront and payout fees in basis points, paid to {@code collector}.
 */
public record FeeSchedule(String collector, int upfrontBips, int payoutBips) {

    public static final BigInteger BIPS_DENOMINATOR = BigInteger.valueOf(10_000);

    public static FeeSchedule none() {
        return new FeeSchedule(null, 0, 0);
    }

    public boolean hasCollector() {
        return collector != null;
    }

    public BigInteger upfrontFee(BigInteger pool) {
        return hasCollector() ? bipsOf(pool, upfrontBips) : BigInteger.ZERO;
    }

    /**
     * Fee on a single withdrawal's due amount; without a collector the whole due goes to the holder.
     */
    public BigInteger payoutFee(BigInteger due) {
        return hasCollector() ? bipsOf(due, payoutBips) : BigInteger.ZERO;
    }

    static BigInteger bipsOf(BigInteger amount, int bips) {
        if (bips == 0 || amount.signum() == 0) {
            return BigInteger.ZERO;
        }
        return amount.multiply(BigInteger.valueOf(bips)).divide(BIPS_DENOMINATOR);
    }
}
