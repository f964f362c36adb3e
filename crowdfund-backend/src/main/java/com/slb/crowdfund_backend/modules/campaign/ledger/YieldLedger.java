package com.slb.crowdfund_backend.modules.campaign.ledger;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lazily distributed yield. An account's entitlement is its current share of every unit of
 * yield ever received; its withdrawal credit records how much of that entitlement has been
 * paid and moves with the shares whenever they change hands.
 *
 * <p>Credit is held in units of {@code 1 / depositTotal} so a transfer can move an exact
 * proportional slice without truncating to whole yield units. Supply only changes while no
 * credit exists (contributions before settlement, refunds after failure), so the scale stays
 * fixed for as long as any credit is recorded.
 */
public class YieldLedger {

    private final ContributionLedger shares;
    private final Map<String, BigInteger> credit;
    private BigInteger yieldTotal;
    private BigInteger paidTotal;
    private BigInteger collectorFeesAccrued;

    public YieldLedger(ContributionLedger shares) {
        this(shares, new LinkedHashMap<>(), BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO);
    }

    private YieldLedger(ContributionLedger shares,
                        Map<String, BigInteger> credit,
                        BigInteger yieldTotal,
                        BigInteger paidTotal,
                        BigInteger collectorFeesAccrued) {
        this.shares = shares;
        this.credit = credit;
        this.yieldTotal = yieldTotal;
        this.paidTotal = paidTotal;
        this.collectorFeesAccrued = collectorFeesAccrued;
    }

    public BigInteger yieldTotal() {
        return yieldTotal;
    }

    /**
     * Withdrawal credit in whole yield units, rounded down.
     */
    public BigInteger withdrawnOf(String account) {
        BigInteger supply = shares.depositTotal();
        if (supply.signum() == 0) {
            return BigInteger.ZERO;
        }
        return creditOf(account).divide(supply);
    }

    /**
     * Yield actually paid out, fees included.
     */
    public BigInteger totalWithdrawn() {
        return paidTotal;
    }

    /**
     * Yield received but not yet paid out.
     */
    public BigInteger undistributed() {
        return yieldTotal.subtract(paidTotal);
    }

    /**
     * Payout fees taken from yield withdrawals and owed to the fee collector. Tracked apart
     * from shares since the collector holds none.
     */
    public BigInteger collectorFeesAccrued() {
        return collectorFeesAccrued;
    }

    public void recordYield(BigInteger amount) {
        yieldTotal = yieldTotal.add(amount);
    }

    /**
     * {@code floor((shares * yieldTotal - credit) / depositTotal)}. For an account that never
     * traded shares this is {@code floor(shares * yieldTotal / depositTotal) - withdrawn}.
     * Never negative: a transfer leaves each side's numerator non-negative and a withdrawal
     * brings it down to its remainder.
     */
    public BigInteger yieldBalanceOf(String account) {
        BigInteger supply = shares.depositTotal();
        if (supply.signum() == 0 || yieldTotal.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger unclaimed = shares.balanceOf(account).multiply(yieldTotal).subtract(creditOf(account));
        return unclaimed.signum() > 0 ? unclaimed.divide(supply) : BigInteger.ZERO;
    }

    /**
     * Marks {@code due} as paid to the account, of which {@code fee} goes to the collector.
     */
    public void recordWithdrawal(String account, BigInteger due, BigInteger fee) {
        credit.merge(account, due.multiply(shares.depositTotal()), BigInteger::add);
        paidTotal = paidTotal.add(due);
        collectorFeesAccrued = collectorFeesAccrued.add(fee);
    }

    /**
     * Moves the sender's withdrawal credit along with the shares, in the same proportion.
     * The pair's combined unclaimed numerator is unchanged, so neither side can end up owed
     * yield the other gave up. Must run before the share balances move.
     */
    public void rebalanceOnTransfer(String from, String to, BigInteger amount) {
        BigInteger fromBalance = shares.balanceOf(from);
        BigInteger fromCredit = creditOf(from);
        if (amount.signum() == 0 || fromBalance.signum() == 0 || fromCredit.signum() == 0 || from.equals(to)) {
            return;
        }
        BigInteger moved = fromCredit.multiply(amount).divide(fromBalance);
        credit.put(from, fromCredit.subtract(moved));
        credit.merge(to, moved, BigInteger::add);
    }

    /**
     * Copy bound to {@code sharesCopy}, which must be a copy of this ledger's share ledger.
     */
    public YieldLedger copy(ContributionLedger sharesCopy) {
        return new YieldLedger(sharesCopy, new LinkedHashMap<>(credit), yieldTotal, paidTotal, collectorFeesAccrued);
    }

    private BigInteger creditOf(String account) {
        return credit.getOrDefault(account, BigInteger.ZERO);
    }
}
