package com.slb.crowdfund_backend.modules.campaign.ledger;

import com.slb.crowdfund_backend.modules.campaign.domain.CampaignConfig;
import com.slb.crowdfund_backend.modules.campaign.domain.ContributionRange;
import com.slb.crowdfund_backend.modules.campaign.exception.CampaignException;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Share balances per account plus their sum. Shares are minted 1:1 with net contributed
 * units and are also the total supply used as the yield denominator.
 */
public class ContributionLedger {

    private final Map<String, BigInteger> shares;
    private BigInteger depositTotal;

    public ContributionLedger() {
        this(new LinkedHashMap<>(), BigInteger.ZERO);
    }

    private ContributionLedger(Map<String, BigInteger> shares, BigInteger depositTotal) {
        this.shares = shares;
        this.depositTotal = depositTotal;
    }

    public BigInteger balanceOf(String account) {
        return shares.getOrDefault(account, BigInteger.ZERO);
    }

    public BigInteger depositTotal() {
        return depositTotal;
    }

    public Set<String> accounts() {
        return Collections.unmodifiableSet(shares.keySet());
    }

    public void credit(String account, BigInteger amount) {
        shares.merge(account, amount, BigInteger::add);
        depositTotal = depositTotal.add(amount);
    }

    /**
     * Zeroes the account's shares and removes them from the total.
     *
     * @return the burned amount
     */
    public BigInteger burnAll(String account) {
        BigInteger balance = balanceOf(account);
        if (balance.signum() == 0) {
            throw CampaignException.balance("no balance");
        }
        shares.put(account, BigInteger.ZERO);
        depositTotal = depositTotal.subtract(balance);
        return balance;
    }

    public void move(String from, String to, BigInteger amount) {
        BigInteger fromBalance = balanceOf(from);
        if (fromBalance.compareTo(amount) < 0) {
            throw CampaignException.balance("insufficient share balance");
        }
        shares.put(from, fromBalance.subtract(amount));
        shares.merge(to, amount, BigInteger::add);
    }

    /**
     * Remaining room under {@code goalMax}; never negative.
     */
    public BigInteger goalHeadroom(CampaignConfig config) {
        BigInteger headroom = config.goalMax().subtract(depositTotal);
        return headroom.signum() > 0 ? headroom : BigInteger.ZERO;
    }

    /**
     * The personal minimum is waived once less than {@code contributionMin} is left under
     * the goal cap, so the raise can be topped off by any positive amount.
     */
    public boolean isMinimumWaived(CampaignConfig config) {
        return goalHeadroom(config).compareTo(config.contributionMin()) < 0;
    }

    /**
     * Next legal single contribution for an account, assuming contributions are open.
     */
    public ContributionRange rangeFor(String account, CampaignConfig config) {
        BigInteger balance = balanceOf(account);
        BigInteger headroom = goalHeadroom(config);
        BigInteger personalRoom = config.contributionMax().subtract(balance);
        if (personalRoom.signum() < 0) {
            personalRoom = BigInteger.ZERO;
        }
        BigInteger max = personalRoom.min(headroom);

        BigInteger min;
        if (isMinimumWaived(config)) {
            min = BigInteger.ONE;
        } else {
            min = config.contributionMin().subtract(balance);
            if (min.signum() <= 0) {
                min = BigInteger.ONE;
            }
        }
        // dead zone: the minimum is above what still fits
        if (max.compareTo(min) < 0) {
            return ContributionRange.CLOSED;
        }
        return new ContributionRange(min, max);
    }

    public ContributionLedger copy() {
        return new ContributionLedger(new LinkedHashMap<>(shares), depositTotal);
    }
}
