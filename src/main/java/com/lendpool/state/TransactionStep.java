package com.lendpool.state;

import com.lendpool.common.LendingError;
import com.lendpool.common.LendingException;
import com.lendpool.transfer.TokenTransfer;

import java.math.BigDecimal;

/**
 * External side effect executed at commit time, in registration order, inside the commit's ledger transaction.
 */
interface TransactionStep {

    void run(TokenTransfer tokenTransfer);

    /**
     * Token movement. When {@code failureError} is set, an INSUFFICIENT_BALANCE from the collaborator is reported
     * under that code instead.
     */
    record Transfer(String asset, String from, String to, BigDecimal amount, LendingError failureError)
            implements TransactionStep {

        @Override
        public void run(TokenTransfer tokenTransfer) {
            try {
                tokenTransfer.transfer(asset, from, to, amount);
            } catch (LendingException e) {
                if (failureError != null && e.getError() == LendingError.INSUFFICIENT_BALANCE) {
                    throw new LendingException(failureError, e.getMessage(), e);
                }
                throw e;
            }
        }
    }

    /**
     * Caller-supplied hook (flash-loan receivers). Transfers it makes on the committing thread are staged with the
     * rest of the commit.
     */
    record Callback(Runnable action) implements TransactionStep {

        @Override
        public void run(TokenTransfer tokenTransfer) {
            action.run();
        }
    }
}
