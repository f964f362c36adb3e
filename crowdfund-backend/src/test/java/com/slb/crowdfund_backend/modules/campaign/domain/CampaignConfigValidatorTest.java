package com.slb.crowdfund_backend.modules.campaign.domain;

import com.slb.crowdfund_backend.modules.campaign.exception.CampaignErrorType;
import com.slb.crowdfund_backend.modules.campaign.exception.CampaignException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;

import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.COLLECTOR;
import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.START;
import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.e17;
import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.e18;
import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.standard;
import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.withBounds;
import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.withFees;
import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.withWindow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CampaignConfigValidatorTest {

    private final CampaignPolicy policy = CampaignPolicy.defaults();

    private String rejection(CampaignConfig config) {
        CampaignException ex = assertThrows(CampaignException.class, () -> CampaignConfigValidator.validate(config, policy));
        assertThat(ex.getType()).isEqualTo(CampaignErrorType.CONFIG);
        return ex.getMessage();
    }

    @Test
    void standardConfigShouldPass() {
        assertThatCode(() -> CampaignConfigValidator.validate(standard(), policy)).doesNotThrowAnyException();
        assertThatCode(() -> CampaignConfigValidator.validate(withFees(standard(), COLLECTOR, 1250, 0), policy))
                .doesNotThrowAnyException();
    }

    @Test
    void feesShouldBeBoundedAndNeedACollector() {
        assertThat(rejection(withFees(standard(), COLLECTOR, 1251, 0))).contains("upfrontFeeBips");
        assertThat(rejection(withFees(standard(), null, 0, 100))).isEqualTo("fees require a fee collector");
        assertThat(rejection(withFees(standard(), COLLECTOR, 0, 0))).isEqualTo("fee collector requires a non-zero fee");
        assertThat(rejection(withFees(standard(), " ", 10, 0))).isEqualTo("fee collector must not be blank");
    }

    @Test
    void policyShouldLowerTheFeeCeiling() {
        CampaignPolicy strict = new CampaignPolicy(100, CampaignPolicy.DEFAULT_MAX_WINDOW, CampaignPolicy.DEFAULT_STALE_GRACE_PERIOD);

        CampaignException ex = assertThrows(CampaignException.class,
                () -> CampaignConfigValidator.validate(withFees(standard(), COLLECTOR, 101, 0), strict));

        assertThat(ex.getMessage()).contains("[0, 100]");
    }

    @Test
    void goalsAndBoundsShouldBeOrdered() {
        assertThat(rejection(withBounds(standard(), e18(6), e18(5), e17(2), e18(1))))
                .isEqualTo("goalMin must not exceed goalMax");
        assertThat(rejection(withBounds(standard(), e18(2), e18(5), e18(2), e18(1))))
                .isEqualTo("contributionMin must not exceed contributionMax");
        assertThat(rejection(withBounds(standard(), e18(2), e18(5), BigInteger.ZERO, e18(1))))
                .isEqualTo("contributionMin must be positive");
    }

    @Test
    void contributionMinShouldLeaveRoomBetweenGoals() {
        assertThat(rejection(withBounds(standard(), e18(4), e18(5), e18(1), e18(2))))
                .isEqualTo("contributionMin must be below goalMax - goalMin");
        // 单位最小出资豁免该约束，即使两个目标相等
        assertThatCode(() -> CampaignConfigValidator.validate(
                withBounds(standard(), e18(5), e18(5), BigInteger.ONE, e18(1)), policy)).doesNotThrowAnyException();
    }

    @Test
    void windowShouldBeOrderedAndBounded() {
        assertThat(rejection(withWindow(standard(), START, START))).isEqualTo("startsAt must be before endsAt");
        assertThat(rejection(withWindow(standard(), START, START.plus(Duration.ofDays(91)))))
                .startsWith("campaign window must not exceed");
        assertThatCode(() -> CampaignConfigValidator.validate(
                withWindow(standard(), START, START.plus(Duration.ofDays(90))), policy)).doesNotThrowAnyException();
    }
}
