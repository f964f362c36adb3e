package com.slb.crowdfund_backend.modules.campaign.transport;

import com.slb.crowdfund_backend.modules.campaign.domain.Denomination;

import java.math.BigInteger;
import java.util.List;

/**
 * Moves value of one denomination in and out of a campaign's custody.
 * <p>
 * Implementations may call back into untrusted code; callers must finish their own state
 * changes before invoking {@link #transferOut} or {@link #transferOutBatch}.
 */
public interface ValueTransport {

    Denomination denomination();

    /**
     * Units currently held in the campaign's custody.
     */
    BigInteger heldBalance();

    /**
     * Pulls {@code amount} from {@code from}. A fee-bearing token may deliver less than asked.
     *
     * @return the amount the custody actually received
     * @throws TransportException when the source balance or allowance is insufficient
     */
    BigInteger transferIn(String from, BigInteger amount) throws TransportException;

    /**
     * @return {@code false} when the receiver refused the transfer
     */
    boolean transferOut(String to, BigInteger amount) throws TransportException;

    /**
     * Pays every leg or none of them.
     *
     * @return {@code false} when any receiver refused; nothing has moved in that case
     */
    boolean transferOutBatch(List<TransferLeg> legs) throws TransportException;
}
