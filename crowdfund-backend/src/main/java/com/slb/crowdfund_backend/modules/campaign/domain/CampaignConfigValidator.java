package com.slb.crowdfund_backend.modules.campaign.domain;

import com.slb.crowdfund_backend.modules.campaign.exception.CampaignException;
import org.springframework.util.StringUtils;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Rejects parameter sets a campaign could not operate under.
 */
public final class CampaignConfigValidator {

    private CampaignConfigValidator() {
    }

    public static void validate(CampaignConfig config, CampaignPolicy policy) {
        if (config == null) {
            throw CampaignException.config("config is required");
        }
        if (!StringUtils.hasText(config.recipient())) {
            throw CampaignException.config("recipient is required");
        }
        if (config.denomination() == null) {
            throw CampaignException.config("denomination is required");
        }
        validateFees(config, policy);
        validateGoals(config);
        validateWindow(config, policy);
    }

    private static void validateFees(CampaignConfig config, CampaignPolicy policy) {
        checkBips("upfrontFeeBips", config.upfrontFeeBips(), policy.maxFeeBips());
        checkBips("payoutFeeBips", config.payoutFeeBips(), policy.maxFeeBips());
        boolean anyFee = config.upfrontFeeBips() > 0 || config.payoutFeeBips() > 0;
        if (config.feeCollector() == null) {
            if (anyFee) {
                throw CampaignException.config("fees require a fee collector");
            }
        } else {
            if (!StringUtils.hasText(config.feeCollector())) {
                throw CampaignException.config("fee collector must not be blank");
            }
            if (!anyFee) {
                throw CampaignException.config("fee collector requires a non-zero fee");
            }
        }
    }

    private static void checkBips(String name, int bips, int max) {
        if (bips < 0 || bips > max) {
            throw CampaignException.config(name + " must be within [0, " + max + "]");
        }
    }

    private static void validateGoals(CampaignConfig config) {
        BigInteger goalMin = config.goalMin();
        BigInteger goalMax = config.goalMax();
        BigInteger contributionMin = config.contributionMin();
        BigInteger contributionMax = config.contributionMax();
        if (goalMin == null || goalMax == null || contributionMin == null || contributionMax == null) {
            throw CampaignException.config("goal and contribution bounds are required");
        }
        if (goalMin.signum() <= 0 || goalMax.signum() <= 0) {
            throw CampaignException.config("goals must be positive");
        }
        if (goalMin.compareTo(goalMax) > 0) {
            throw CampaignException.config("goalMin must not exceed goalMax");
        }
        if (contributionMin.signum() <= 0) {
            throw CampaignException.config("contributionMin must be positive");
        }
        if (contributionMin.compareTo(contributionMax) > 0) {
            throw CampaignException.config("contributionMin must not exceed contributionMax");
        }
        // otherwise the last contributor may not fit the per-account minimum under goalMax
        boolean singleUnit = contributionMin.equals(BigInteger.ONE);
        if (!singleUnit && contributionMin.compareTo(goalMax.subtract(goalMin)) >= 0) {
            throw CampaignException.config("contributionMin must be below goalMax - goalMin");
        }
    }

    private static void validateWindow(CampaignConfig config, CampaignPolicy policy) {
        if (config.startsAt() == null || config.endsAt() == null) {
            throw CampaignException.config("startsAt and endsAt are required");
        }
        if (!config.startsAt().isBefore(config.endsAt())) {
            throw CampaignException.config("startsAt must be before endsAt");
        }
        Duration window = Duration.between(config.startsAt(), config.endsAt());
        if (window.compareTo(policy.maxWindow()) > 0) {
            throw CampaignException.config("campaign window must not exceed " + policy.maxWindow().toDays() + " days");
        }
    }
}
