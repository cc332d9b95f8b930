package com.lendpool.pool;

import java.math.BigDecimal;

/**
 * Borrower side of a flash loan. Invoked after {@code amount} has been transferred to the receiver; by the time it
 * returns the receiver must hold {@code amount + fee} of {@code asset}, which the pool then pulls back.
 * Token transfers the callback makes on the calling thread belong to the loan and are discarded with it when the
 * loan aborts. The callback must not call back into the pool; such calls fail with CONCURRENT_MODIFICATION.
 */
@FunctionalInterface
public interface FlashLoanReceiver {

    void onFlashLoan(String asset, BigDecimal amount, BigDecimal fee);
}
