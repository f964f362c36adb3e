package com.slb.crowdfund_backend.modules.campaign.transport;

import com.slb.crowdfund_backend.modules.campaign.domain.Denomination;

import java.math.BigInteger;
import java.util.List;

/**
 * {@link ValueTransport} over the {@link InMemoryCustodyBook}; the campaign's funds sit under
 * a dedicated custody holder.
 */
public class CustodyBookTransport implements ValueTransport {

    private final InMemoryCustodyBook book;
    private final Denomination denomination;
    private final String custodyHolder;
    private final int transferFeeBips;

    public CustodyBookTransport(InMemoryCustodyBook book, Denomination denomination,
                                String custodyHolder, int transferFeeBips) {
        this.book = book;
        this.denomination = denomination;
        this.custodyHolder = custodyHolder;
        this.transferFeeBips = transferFeeBips;
    }

    @Override
    public Denomination denomination() {
        return denomination;
    }

    public String custodyHolder() {
        return custodyHolder;
    }

    @Override
    public BigInteger heldBalance() {
        return book.balanceOf(denomination.key(), custodyHolder);
    }

    @Override
    public BigInteger transferIn(String from, BigInteger amount) {
        return book.move(denomination.key(), from, custodyHolder, amount, transferFeeBips);
    }

    @Override
    public boolean transferOut(String to, BigInteger amount) {
        book.move(denomination.key(), custodyHolder, to, amount, transferFeeBips);
        return true;
    }

    @Override
    public boolean transferOutBatch(List<TransferLeg> legs) {
        book.moveAll(denomination.key(), custodyHolder, legs, transferFeeBips);
        return true;
    }
}
