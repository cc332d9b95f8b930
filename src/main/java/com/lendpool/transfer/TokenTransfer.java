package com.lendpool.transfer;

import java.math.BigDecimal;

/**
 * Token movement capability consumed by the pool. Implementations must be all-or-nothing per call.
 */
public interface TokenTransfer {

    /**
     * Move {@code amount} of {@code asset} from one account to another. Inside an open {@link LedgerTransaction}
     * of the calling thread the movement is staged there.
     *
     * @throws com.lendpool.common.LendingException INSUFFICIENT_BALANCE when {@code from} cannot cover the amount
     */
    void transfer(String asset, String from, String to, BigDecimal amount);

    /**
     * Open a ledger transaction on the calling thread. Every transfer the thread makes until it is closed,
     * including transfers made by callbacks, is staged in it.
     *
     * @throws IllegalStateException when the thread already has one open
     */
    LedgerTransaction begin();
}
