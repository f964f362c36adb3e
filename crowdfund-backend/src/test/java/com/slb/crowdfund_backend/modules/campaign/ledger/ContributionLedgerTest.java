package com.slb.crowdfund_backend.modules.campaign.ledger;

import com.slb.crowdfund_backend.modules.campaign.domain.CampaignConfig;
import com.slb.crowdfund_backend.modules.campaign.domain.ContributionRange;
import com.slb.crowdfund_backend.modules.campaign.exception.CampaignErrorType;
import com.slb.crowdfund_backend.modules.campaign.exception.CampaignException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.e17;
import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.e18;
import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.standard;
import static com.slb.crowdfund_backend.modules.campaign.support.CampaignFixtures.withBounds;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ContributionLedgerTest {

    private final CampaignConfig config = standard();

    @Test
    void freshAccountRangeShouldSpanPersonalBounds() {
        ContributionLedger ledger = new ContributionLedger();

        ContributionRange range = ledger.rangeFor("bob", config);

        assertThat(range).isEqualTo(new ContributionRange(e17(2), e18(1)));
        assertThat(range.admits(e17(2))).isTrue();
        assertThat(range.admits(e18(1))).isTrue();
        assertThat(range.admits(e17(1))).isFalse();
        assertThat(ContributionRange.CLOSED.admits(BigInteger.ONE)).isFalse();
    }

    @Test
    void rangeShouldShrinkWithExistingBalance() {
        ContributionLedger ledger = new ContributionLedger();
        ledger.credit("bob", e17(1));

        assertThat(ledger.rangeFor("bob", config)).isEqualTo(new ContributionRange(e17(1), e17(9)));
    }

    @Test
    void rangeShouldBeCappedByGoalHeadroom() {
        ContributionLedger ledger = new ContributionLedger();
        ledger.credit("a", e18(1));
        ledger.credit("b", e18(1));
        ledger.credit("c", e18(1));
        ledger.credit("d", e17(15));

        // headroom 5e17 is still >= contributionMin, so the minimum applies
        assertThat(ledger.isMinimumWaived(config)).isFalse();
        assertThat(ledger.rangeFor("bob", config)).isEqualTo(new ContributionRange(e17(2), e17(5)));
    }

    @Test
    void minimumShouldBeWaivedBelowContributionMinHeadroom() {
        ContributionLedger ledger = new ContributionLedger();
        ledger.credit("a", e17(49));

        assertThat(ledger.goalHeadroom(config)).isEqualTo(e17(1));
        assertThat(ledger.isMinimumWaived(config)).isTrue();
        assertThat(ledger.rangeFor("bob", config)).isEqualTo(new ContributionRange(BigInteger.ONE, e17(1)));
    }

    @Test
    void rangeShouldCloseWhenNothingFitsUnderPersonalMaximum() {
        CampaignConfig tight = withBounds(config, e18(2), e18(5), e17(2), e17(2));
        ContributionLedger ledger = new ContributionLedger();
        ledger.credit("bob", e17(2));

        assertThat(ledger.rangeFor("bob", tight)).isEqualTo(ContributionRange.CLOSED);
        assertThat(ContributionRange.CLOSED.isOpen()).isFalse();
    }

    @Test
    void headroomShouldNeverBeNegative() {
        ContributionLedger ledger = new ContributionLedger();
        ledger.credit("a", e18(6));

        assertThat(ledger.goalHeadroom(config)).isZero();
    }

    @Test
    void burnAllShouldRemoveBalanceFromTotal() {
        ContributionLedger ledger = new ContributionLedger();
        ledger.credit("bob", e17(3));
        ledger.credit("carol", e17(4));

        assertThat(ledger.burnAll("bob")).isEqualTo(e17(3));
        assertThat(ledger.depositTotal()).isEqualTo(e17(4));

        CampaignException ex = assertThrows(CampaignException.class, () -> ledger.burnAll("bob"));
        assertThat(ex.getType()).isEqualTo(CampaignErrorType.BALANCE);
    }

    @Test
    void copyShouldBeIndependent() {
        ContributionLedger ledger = new ContributionLedger();
        ledger.credit("bob", e17(3));
        ContributionLedger copy = ledger.copy();

        ledger.credit("bob", e17(1));

        assertThat(copy.balanceOf("bob")).isEqualTo(e17(3));
        assertThat(copy.depositTotal()).isEqualTo(e17(3));
    }
}
