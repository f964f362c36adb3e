package com.slb.crowdfund_backend.modules.campaign.transport;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-local balance book standing in for the chain or token contract that really holds
 * value. Keyed by denomination key, then holder.
 */
@Component
@Slf4j
public class InMemoryCustodyBook {

    private static final BigInteger BIPS_DENOMINATOR = BigInteger.valueOf(10_000);

    private final Map<String, Map<String, BigInteger>> books = new HashMap<>();

    public synchronized BigInteger balanceOf(String denominationKey, String holder) {
        return book(denominationKey).getOrDefault(holder, BigInteger.ZERO);
    }

    /**
     * Creates value out of thin air; used by the dev faucet and tests.
     */
    public synchronized void mint(String denominationKey, String holder, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("mint amount must be positive");
        }
        book(denominationKey).merge(holder, amount, BigInteger::add);
        log.debug("Custody mint: denomination={}, holder={}, amount={}", denominationKey, holder, amount);
    }

    /**
     * Debits {@code amount} from {@code from}; {@code to} is credited the amount minus the
     * transfer fee, which is burned.
     *
     * @return the amount credited to {@code to}
     */
    public synchronized BigInteger move(String denominationKey, String from, String to,
                                        BigInteger amount, int transferFeeBips) {
        Map<String, BigInteger> book = book(denominationKey);
        BigInteger available = book.getOrDefault(from, BigInteger.ZERO);
        if (available.compareTo(amount) < 0) {
            throw new TransportException("insufficient balance: holder=" + from
                    + ", available=" + available + ", requested=" + amount);
        }
        BigInteger delivered = amount.subtract(feeOf(amount, transferFeeBips));
        book.put(from, available.subtract(amount));
        book.merge(to, delivered, BigInteger::add);
        return delivered;
    }

    /**
     * All-or-nothing variant of {@link #move} from a single source.
     */
    public synchronized void moveAll(String denominationKey, String from, List<TransferLeg> legs, int transferFeeBips) {
        BigInteger required = legs.stream().map(TransferLeg::amount).reduce(BigInteger.ZERO, BigInteger::add);
        BigInteger available = balanceOf(denominationKey, from);
        if (available.compareTo(required) < 0) {
            throw new TransportException("insufficient balance: holder=" + from
                    + ", available=" + available + ", requested=" + required);
        }
        for (TransferLeg leg : legs) {
            move(denominationKey, from, leg.to(), leg.amount(), transferFeeBips);
        }
    }

    private Map<String, BigInteger> book(String denominationKey) {
        return books.computeIfAbsent(denominationKey, k -> new HashMap<>());
    }

    private static BigInteger feeOf(BigInteger amount, int bips) {
        if (bips <= 0) {
            return BigInteger.ZERO;
        }
        return amount.multiply(BigInteger.valueOf(bips)).divide(BIPS_DENOMINATOR);
    }
}
