package com.lendpool.transfer;

/**
 * Transfers staged by one thread. Until {@link #commit()} they are visible only to that thread; closing without
 * a commit discards them.
 */
public interface LedgerTransaction extends AutoCloseable {

    /**
     * Apply every staged transfer at once.
     *
     * @throws com.lendpool.common.LendingException INSUFFICIENT_BALANCE when a committed balance no longer covers
     *                                              the staged debits; nothing is applied
     */
    void commit();

    @Override
    void close();
}
