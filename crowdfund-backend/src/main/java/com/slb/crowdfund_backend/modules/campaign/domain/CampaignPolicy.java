package com.slb.crowdfund_backend.modules.campaign.domain;

import java.time.Duration;

/**
 * Deployment-wide limits applied to every campaign.
 *
 * @param maxFeeBips        ceiling for either fee; never above {@link #HARD_MAX_FEE_BIPS}
 * @param maxWindow         longest allowed contribution window
 * @param staleGracePeriod  time after {@code endsAt} from which an unsettled campaign may be failed
 */
public record CampaignPolicy(int maxFeeBips, Duration maxWindow, Duration staleGracePeriod) {

    public static final int HARD_MAX_FEE_BIPS = 1250;
    public static final Duration DEFAULT_MAX_WINDOW = Duration.ofDays(90);
    public static final Duration DEFAULT_STALE_GRACE_PERIOD = Duration.ofDays(90);

    public CampaignPolicy {
        if (maxFeeBips < 0 || maxFeeBips > HARD_MAX_FEE_BIPS) {
            throw new IllegalArgumentException("maxFeeBips must be within [0, " + HARD_MAX_FEE_BIPS + "]");
        }
        if (maxWindow == null || maxWindow.isNegative() || maxWindow.isZero()) {
            throw new IllegalArgumentException("maxWindow must be positive");
        }
        if (staleGracePeriod == null || staleGracePeriod.isNegative()) {
            throw new IllegalArgumentException("staleGracePeriod must not be negative");
        }
    }

    public static CampaignPolicy defaults() {
        return new CampaignPolicy(HARD_MAX_FEE_BIPS, DEFAULT_MAX_WINDOW, DEFAULT_STALE_GRACE_PERIOD);
    }
}
