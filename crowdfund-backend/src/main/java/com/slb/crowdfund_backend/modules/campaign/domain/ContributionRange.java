package com.slb.crowdfund_backend.modules.campaign.domain;

import java.math.BigInteger;

/**
 * Legal size of an account's next single contribution, inclusive on both ends.
 * {@link #CLOSED} means no contribution is currently possible.
 */
public record ContributionRange(BigInteger min, BigInteger max) {

    public static final ContributionRange CLOSED = new ContributionRange(BigInteger.ZERO, BigInteger.ZERO);

    public boolean isOpen() {
        return max.signum() > 0;
    }

    public boolean admits(BigInteger amount) {
        return isOpen() && amount.compareTo(min) >= 0 && amount.compareTo(max) <= 0;
    }
}
