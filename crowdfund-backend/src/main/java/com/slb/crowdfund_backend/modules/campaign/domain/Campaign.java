package com.slb.crowdfund_backend.modules.campaign.domain;

import com.slb.crowdfund_backend.modules.campaign.event.CampaignEvent;
import com.slb.crowdfund_backend.modules.campaign.event.CampaignEventListener;
import com.slb.crowdfund_backend.modules.campaign.event.ContributionAccepted;
import com.slb.crowdfund_backend.modules.campaign.event.Failed;
import com.slb.crowdfund_backend.modules.campaign.event.FeeScheduleApplied;
import com.slb.crowdfund_backend.modules.campaign.event.Settled;
import com.slb.crowdfund_backend.modules.campaign.event.ShareTransfer;
import com.slb.crowdfund_backend.modules.campaign.event.Withdrawn;
import com.slb.crowdfund_backend.modules.campaign.event.YieldDeposited;
import com.slb.crowdfund_backend.modules.campaign.exception.CampaignException;
import com.slb.crowdfund_backend.modules.campaign.ledger.ContributionLedger;
import com.slb.crowdfund_backend.modules.campaign.ledger.YieldLedger;
import com.slb.crowdfund_backend.modules.campaign.transport.TransferLeg;
import com.slb.crowdfund_backend.modules.campaign.transport.TransportException;
import com.slb.crowdfund_backend.modules.campaign.transport.TransportFactory;
import com.slb.crowdfund_backend.modules.campaign.transport.ValueTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * A single fundraising campaign: contribution ledger, FUNDING/FUNDED/FAILED state machine,
 * settlement, and pro-rata yield distribution over transferable shares.
 * <p>
 * Every public method runs under the instance monitor, so operations on one campaign never
 * interleave. Each mutating operation either commits completely or leaves the campaign as
 * it found it: ledger effects are applied before value leaves custody, and a failed
 * transfer restores the snapshot taken when the operation began. Events are buffered and
 * handed to the listener only once the outermost operation has committed.
 */
@Slf4j
public class Campaign {

    private final long id;
    private final Clock clock;
    private final CampaignPolicy policy;
    private final TransportFactory transportFactory;
    private final CampaignEventListener listener;

    private CampaignConfig config;
    private FeeSchedule feeSchedule = FeeSchedule.none();
    private ValueTransport transport;

    private CampaignState state = CampaignState.FUNDING;
    private boolean processed;
    private ContributionLedger contributions = new ContributionLedger();
    private YieldLedger yields = new YieldLedger(contributions);
    private Map<String, Map<String, BigInteger>> allowances = new HashMap<>();

    private final List<CampaignEvent> pendingEvents = new ArrayList<>();
    private int depth;

    public Campaign(long id, Clock clock, CampaignPolicy policy,
                    TransportFactory transportFactory, CampaignEventListener listener) {
        this.id = id;
        this.clock = clock;
        this.policy = policy;
        this.transportFactory = transportFactory;
        this.listener = listener != null ? listener : CampaignEventListener.NO_OP;
    }

    // ---------------------------------------------------------------------------------
    // Initialization
    // ---------------------------------------------------------------------------------

    /**
     * Binds the write-once parameters and the transport for their denomination.
     */
    public synchronized void initialize(CampaignConfig config) {
        if (this.config != null) {
            throw CampaignException.state("campaign already initialized");
        }
        CampaignConfigValidator.validate(config, policy);
        ValueTransport bound = transportFactory.create(id, config.denomination());
        this.config = config;
        this.feeSchedule = config.feeSchedule();
        this.transport = bound;
        if (feeSchedule.hasCollector()) {
            pendingEvents.add(new FeeScheduleApplied(id, feeSchedule.collector(),
                    feeSchedule.upfrontBips(), feeSchedule.payoutBips()));
            flushEvents();
        }
        log.info("Campaign initialized: campaignId={}, recipient={}, goal=[{}, {}], window=[{}, {}), denomination={}",
                id, config.recipient(), config.goalMin(), config.goalMax(),
                config.startsAt(), config.endsAt(), config.denomination().key());
    }

    // ---------------------------------------------------------------------------------
    // Contribution
    // ---------------------------------------------------------------------------------

    /**
     * Pulls {@code amount} from the account and credits what actually arrived as shares.
     *
     * @return the net amount credited
     */
    public synchronized BigInteger contribute(String account, BigInteger amount) {
        requireInitialized();
        requireAccount(account);
        return atomically(() -> {
            if (state != CampaignState.FUNDING) {
                throw CampaignException.state("contribution window closed");
            }
            Instant now = clock.instant();
            if (now.isBefore(config.startsAt()) || !now.isBefore(config.endsAt())) {
                throw CampaignException.window("contribution window closed");
            }
            requirePositive(amount);
            BigInteger headroom = contributions.goalHeadroom(config);
            if (headroom.signum() == 0 || amount.compareTo(headroom) > 0) {
                throw CampaignException.bounds("goal-max exceeded");
            }
            boolean minimumWaived = contributions.isMinimumWaived(config);
            BigInteger prior = contributions.balanceOf(account);
            // cannot reach the minimum even if fully delivered; reject before pulling
            if (!minimumWaived && prior.add(amount).compareTo(config.contributionMin()) < 0) {
                throw CampaignException.bounds("amount below per-account minimum");
            }
            if (prior.add(amount).compareTo(config.contributionMax()) > 0) {
                throw CampaignException.bounds("amount above per-account maximum");
            }

            BigInteger received = pullFrom(account, amount);
            String violation = admissionViolation(prior.add(received), received, headroom, minimumWaived);
            if (violation != null) {
                // return exactly what arrived
                pushTo(List.of(new TransferLeg(account, received)));
                throw CampaignException.bounds(violation);
            }
            contributions.credit(account, received);
            emit(new ContributionAccepted(id, account, received));
            log.info("Contribution accepted: campaignId={}, account={}, requested={}, received={}, depositTotal={}",
                    id, account, amount, received, contributions.depositTotal());
            return received;
        });
    }

    private String admissionViolation(BigInteger newBalance, BigInteger received,
                                      BigInteger headroom, boolean minimumWaived) {
        if (received.compareTo(headroom) > 0) {
            return "goal-max exceeded";
        }
        if (!minimumWaived && newBalance.compareTo(config.contributionMin()) < 0) {
            return "amount below per-account minimum";
        }
        if (newBalance.compareTo(config.contributionMax()) > 0) {
            return "amount above per-account maximum";
        }
        return null;
    }

    /**
     * Legal window for the account's next single contribution; {@link ContributionRange#CLOSED}
     * whenever contributions are not allowed at all.
     */
    public synchronized ContributionRange contributionRangeFor(String account) {
        if (!isContributionAllowed()) {
            return ContributionRange.CLOSED;
        }
        return contributions.rangeFor(account, config);
    }

    // ---------------------------------------------------------------------------------
    // State machine
    // ---------------------------------------------------------------------------------

    public synchronized boolean isContributionAllowed() {
        if (config == null || state != CampaignState.FUNDING) {
            return false;
        }
        Instant now = clock.instant();
        return !now.isBefore(config.startsAt())
                && now.isBefore(config.endsAt())
                && contributions.depositTotal().compareTo(config.goalMax()) < 0;
    }

    public synchronized boolean isGoalMinMet() {
        return config != null && contributions.depositTotal().compareTo(config.goalMin()) >= 0;
    }

    public synchronized boolean isGoalMaxMet() {
        return config != null && contributions.depositTotal().compareTo(config.goalMax()) >= 0;
    }

    /**
     * Goal cap reached (any time), or window over with the minimum goal reached.
     */
    public synchronized boolean canSettle() {
        if (config == null || state != CampaignState.FUNDING) {
            return false;
        }
        return isGoalMaxMet() || (isEnded() && isGoalMinMet());
    }

    /**
     * Window over without reaching the minimum goal, or the stale-funds grace period after
     * the window has elapsed regardless of goal status. Both boundaries are inclusive.
     */
    public synchronized boolean canReleaseFailed() {
        if (config == null || state != CampaignState.FUNDING) {
            return false;
        }
        Instant staleAt = config.endsAt().plus(policy.staleGracePeriod());
        return (isEnded() && !isGoalMinMet()) || !clock.instant().isBefore(staleAt);
    }

    private boolean isEnded() {
        return !clock.instant().isBefore(config.endsAt());
    }

    // ---------------------------------------------------------------------------------
    // Settlement
    // ---------------------------------------------------------------------------------

    /**
     * Pays the pool to the recipient, less the upfront fee which goes to the collector.
     * Shares are kept: {@code depositTotal} stays the yield denominator from here on.
     */
    public synchronized void settle() {
        requireInitialized();
        atomically(() -> {
            if (state != CampaignState.FUNDING) {
                throw CampaignException.state("campaign already processed");
            }
            if (!canSettle()) {
                throw CampaignException.window("settlement not available yet");
            }
            BigInteger pool = contributions.depositTotal();
            BigInteger upfrontFee = feeSchedule.upfrontFee(pool);
            BigInteger toRecipient = pool.subtract(upfrontFee);

            state = CampaignState.FUNDED;
            processed = true;
            List<TransferLeg> legs = new ArrayList<>();
            legs.add(new TransferLeg(config.recipient(), toRecipient));
            emit(new Settled(id, config.recipient(), toRecipient));
            if (upfrontFee.signum() > 0) {
                legs.add(new TransferLeg(feeSchedule.collector(), upfrontFee));
                emit(new Settled(id, feeSchedule.collector(), upfrontFee));
            }
            pushTo(legs);
            log.info("Campaign settled: campaignId={}, pool={}, recipient={}, upfrontFee={}",
                    id, pool, toRecipient, upfrontFee);
            return null;
        });
    }

    /**
     * Resolves the campaign as FAILED; funds stay in custody for per-account refunds.
     */
    public synchronized void releaseFailed() {
        requireInitialized();
        atomically(() -> {
            if (state != CampaignState.FUNDING) {
                throw CampaignException.state("campaign already processed");
            }
            if (!canReleaseFailed()) {
                throw CampaignException.window("failure release not available yet");
            }
            state = CampaignState.FAILED;
            processed = true;
            emit(new Failed(id));
            log.info("Campaign failed: campaignId={}, depositTotal={}, goalMinMet={}",
                    id, contributions.depositTotal(), isGoalMinMet());
            return null;
        });
    }

    // ---------------------------------------------------------------------------------
    // Yield and withdrawal
    // ---------------------------------------------------------------------------------

    /**
     * Accepts post-settlement value for pro-rata distribution. Anyone may deposit.
     *
     * @return the net amount added to the yield total
     */
    public synchronized BigInteger depositYield(String from, BigInteger amount) {
        requireInitialized();
        requireAccount(from);
        return atomically(() -> {
            if (state != CampaignState.FUNDED) {
                throw CampaignException.state("yield is accepted only after settlement");
            }
            requirePositive(amount);
            BigInteger received = pullFrom(from, amount);
            yields.recordYield(received);
            emit(new YieldDeposited(id, from, received));
            log.info("Yield deposited: campaignId={}, from={}, received={}, yieldTotal={}",
                    id, from, received, yields.yieldTotal());
            return received;
        });
    }

    /**
     * Refunds the account's stake after failure, or pays its pending yield after success.
     *
     * @return the amount paid to the account itself (net of any payout fee)
     */
    public synchronized BigInteger withdraw(String account) {
        requireInitialized();
        requireAccount(account);
        return atomically(() -> switch (state) {
            case FAILED -> withdrawStake(account);
            case FUNDED -> withdrawYield(account);
            case FUNDING -> throw CampaignException.state("campaign not resolved yet");
        });
    }

    private BigInteger withdrawStake(String account) {
        BigInteger refund = contributions.burnAll(account);
        emit(new Withdrawn(id, account, refund));
        pushTo(List.of(new TransferLeg(account, refund)));
        log.info("Stake refunded: campaignId={}, account={}, refund={}, depositTotal={}",
                id, account, refund, contributions.depositTotal());
        return refund;
    }

    private BigInteger withdrawYield(String account) {
        BigInteger due = yields.yieldBalanceOf(account).min(yields.undistributed());
        if (due.signum() <= 0) {
            throw CampaignException.balance("no balance");
        }
        BigInteger payoutFee = feeSchedule.payoutFee(due);
        BigInteger net = due.subtract(payoutFee);
        yields.recordWithdrawal(account, due, payoutFee);

        List<TransferLeg> legs = new ArrayList<>();
        legs.add(new TransferLeg(account, net));
        emit(new Withdrawn(id, account, net));
        if (payoutFee.signum() > 0) {
            legs.add(new TransferLeg(feeSchedule.collector(), payoutFee));
            emit(new Withdrawn(id, feeSchedule.collector(), payoutFee));
        }
        pushTo(legs);
        log.info("Yield withdrawn: campaignId={}, account={}, due={}, payoutFee={}", id, account, due, payoutFee);
        return net;
    }

    public synchronized BigInteger yieldBalanceOf(String account) {
        if (state != CampaignState.FUNDED) {
            return BigInteger.ZERO;
        }
        return yields.yieldBalanceOf(account);
    }

    // ---------------------------------------------------------------------------------
    // Share token surface
    // ---------------------------------------------------------------------------------

    /**
     * Moves shares together with a proportional slice of the sender's withdrawal credit.
     */
    public synchronized void transfer(String from, String to, BigInteger amount) {
        requireInitialized();
        requireAccount(from);
        atomically(() -> {
            moveShares(from, to, amount);
            return null;
        });
    }

    public synchronized void approve(String owner, String spender, BigInteger amount) {
        requireInitialized();
        requireAccount(owner);
        requireAccount(spender);
        if (amount == null || amount.signum() < 0) {
            throw CampaignException.bounds("allowance must not be negative");
        }
        allowances.computeIfAbsent(owner, k -> new HashMap<>()).put(spender, amount);
        log.debug("Allowance set: campaignId={}, owner={}, spender={}, amount={}", id, owner, spender, amount);
    }

    public synchronized BigInteger allowance(String owner, String spender) {
        Map<String, BigInteger> granted = allowances.get(owner);
        return granted == null ? BigInteger.ZERO : granted.getOrDefault(spender, BigInteger.ZERO);
    }

    public synchronized void transferFrom(String spender, String from, String to, BigInteger amount) {
        requireInitialized();
        requireAccount(spender);
        requireAccount(from);
        atomically(() -> {
            if (!spender.equals(from)) {
                BigInteger granted = allowance(from, spender);
                if (amount == null || granted.compareTo(amount) < 0) {
                    throw CampaignException.balance("insufficient allowance");
                }
                allowances.computeIfAbsent(from, k -> new HashMap<>()).put(spender, granted.subtract(amount));
            }
            moveShares(from, to, amount);
            return null;
        });
    }

    private void moveShares(String from, String to, BigInteger amount) {
        if (!StringUtils.hasText(to)) {
            throw CampaignException.balance("invalid recipient");
        }
        if (amount == null || amount.signum() < 0) {
            throw CampaignException.bounds("amount must not be negative");
        }
        if (contributions.balanceOf(from).compareTo(amount) < 0) {
            throw CampaignException.balance("insufficient share balance");
        }
        yields.rebalanceOnTransfer(from, to, amount);
        contributions.move(from, to, amount);
        emit(new ShareTransfer(id, from, to, amount));
        log.debug("Shares transferred: campaignId={}, from={}, to={}, amount={}", id, from, to, amount);
    }

    // ---------------------------------------------------------------------------------
    // Views
    // ---------------------------------------------------------------------------------

    public long getId() {
        return id;
    }

    public synchronized CampaignConfig getConfig() {
        return config;
    }

    public synchronized CampaignState getState() {
        return state;
    }

    public synchronized boolean isProcessed() {
        return processed;
    }

    public synchronized BigInteger balanceOf(String account) {
        return contributions.balanceOf(account);
    }

    public synchronized BigInteger totalSupply() {
        return contributions.depositTotal();
    }

    public synchronized BigInteger depositTotal() {
        return contributions.depositTotal();
    }

    public synchronized BigInteger yieldTotal() {
        return yields.yieldTotal();
    }

    public synchronized BigInteger withdrawnOf(String account) {
        return yields.withdrawnOf(account);
    }

    public synchronized BigInteger totalWithdrawn() {
        return yields.totalWithdrawn();
    }

    public synchronized BigInteger collectorFeesAccrued() {
        return yields.collectorFeesAccrued();
    }

    /**
     * Value currently in custody as reported by the transport.
     */
    public synchronized BigInteger heldBalance() {
        return transport == null ? BigInteger.ZERO : transport.heldBalance();
    }

    /**
     * Whether the account still holds a contribution-backed claim (non-zero shares). Read by
     * the proof-of-contribution registry.
     */
    public synchronized boolean hasClaim(String account) {
        return contributions.balanceOf(account).signum() > 0;
    }

    public synchronized AccountPosition positionOf(String account) {
        return new AccountPosition(account, contributions.balanceOf(account),
                yields.withdrawnOf(account), yieldBalanceOf(account));
    }

    public synchronized List<AccountPosition> positions() {
        List<AccountPosition> result = new ArrayList<>();
        for (String account : contributions.accounts()) {
            result.add(positionOf(account));
        }
        return result;
    }

    // ---------------------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------------------

    private BigInteger pullFrom(String from, BigInteger amount) {
        BigInteger before = transport.heldBalance();
        BigInteger reported = transport.transferIn(from, amount);
        BigInteger received = transport.heldBalance().subtract(before);
        if (received.signum() <= 0) {
            throw new TransportException("nothing received from " + from);
        }
        if (reported != null && reported.compareTo(received) != 0) {
            log.warn("Transport reported a different amount than custody received: campaignId={}, reported={}, received={}",
                    id, reported, received);
        }
        return received;
    }

    private void pushTo(List<TransferLeg> legs) {
        List<TransferLeg> payable = legs.stream().filter(leg -> leg.amount().signum() > 0).toList();
        if (payable.isEmpty()) {
            return;
        }
        boolean delivered = payable.size() == 1
                ? transport.transferOut(payable.get(0).to(), payable.get(0).amount())
                : transport.transferOutBatch(payable);
        if (!delivered) {
            throw new TransportException("transfer refused by receiver");
        }
    }

    private <T> T atomically(Supplier<T> operation) {
        Snapshot snapshot = new Snapshot();
        depth++;
        T result;
        try {
            result = operation.get();
        } catch (TransportException ex) {
            restore(snapshot);
            log.warn("Campaign operation rolled back after transport failure: campaignId={}, reason={}",
                    id, ex.getMessage());
            throw CampaignException.transport("transport failed: " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            restore(snapshot);
            throw ex;
        } finally {
            depth--;
        }
        if (depth == 0) {
            flushEvents();
        }
        return result;
    }

    private void emit(CampaignEvent event) {
        pendingEvents.add(event);
    }

    private void flushEvents() {
        if (pendingEvents.isEmpty()) {
            return;
        }
        List<CampaignEvent> committed = new ArrayList<>(pendingEvents);
        pendingEvents.clear();
        for (CampaignEvent event : committed) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException ex) {
                // the operation is already committed
                log.warn("Campaign event listener failed: campaignId={}, event={}", id, event.type(), ex);
            }
        }
    }

    private void restore(Snapshot snapshot) {
        state = snapshot.state;
        processed = snapshot.processed;
        contributions = snapshot.contributions;
        yields = snapshot.yields;
        allowances = snapshot.allowances;
        while (pendingEvents.size() > snapshot.pendingEventCount) {
            pendingEvents.remove(pendingEvents.size() - 1);
        }
    }

    private void requireInitialized() {
        if (config == null) {
            throw CampaignException.state("campaign not initialized");
        }
    }

    private static void requireAccount(String account) {
        if (!StringUtils.hasText(account)) {
            throw CampaignException.balance("account is required");
        }
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw CampaignException.bounds("amount must be positive");
        }
    }

    private final class Snapshot {
        private final CampaignState state;
        private final boolean processed;
        private final ContributionLedger contributions;
        private final YieldLedger yields;
        private final Map<String, Map<String, BigInteger>> allowances;
        private final int pendingEventCount;

        private Snapshot() {
            this.state = Campaign.this.state;
            this.processed = Campaign.this.processed;
            this.contributions = Campaign.this.contributions.copy();
            this.yields = Campaign.this.yields.copy(this.contributions);
            this.allowances = new HashMap<>();
            Campaign.this.allowances.forEach((owner, granted) -> this.allowances.put(owner, new HashMap<>(granted)));
            this.pendingEventCount = Campaign.this.pendingEvents.size();
        }
    }
}
