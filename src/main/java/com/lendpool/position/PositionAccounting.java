package com.lendpool.position;

import com.lendpool.common.FixedPoint;
import com.lendpool.common.LendingError;
import com.lendpool.common.LendingException;
import com.lendpool.domain.UserPosition;

import java.math.BigDecimal;

/**
 * Principal/index bookkeeping for user positions. Every change rebases the position to the current index, so
 * principal always means "balance as of indexSnapshot". Division truncates toward zero.
 */
public final class PositionAccounting {

    private PositionAccounting() {
    }

    /**
     * principal * reserveIndex / indexSnapshot at WAD precision.
     */
    public static BigDecimal currentBalance(UserPosition position, BigDecimal reserveIndex) {
        if (position == null || position.isEmpty()) {
            return FixedPoint.WAD_ZERO;
        }
        return FixedPoint.divWad(position.getPrincipal().multiply(reserveIndex), position.getIndexSnapshot());
    }

    /**
     * Deposit/borrow: add delta to the current balance and rebase. Returns the new balance.
     */
    public static BigDecimal increase(UserPosition position, BigDecimal reserveIndex, BigDecimal delta) {
        requireNonNegative(delta);
        BigDecimal updated = currentBalance(position, reserveIndex).add(FixedPoint.wad(delta));
        rebase(position, reserveIndex, updated);
        return updated;
    }

    /**
     * Withdraw/repay: subtract delta from the current balance and rebase. Returns the new balance.
     *
     * @throws LendingException INSUFFICIENT_BALANCE when delta exceeds the current balance
     */
    public static BigDecimal decrease(UserPosition position, BigDecimal reserveIndex, BigDecimal delta) {
        requireNonNegative(delta);
        BigDecimal balance = currentBalance(position, reserveIndex);
        if (delta.compareTo(balance) > 0) {
            throw new LendingException(LendingError.INSUFFICIENT_BALANCE,
                    "Requested " + delta.stripTrailingZeros().toPlainString() + " " + position.getAsset()
                            + " exceeds " + position.getKind() + " balance " + balance.stripTrailingZeros().toPlainString());
        }
        BigDecimal updated = FixedPoint.wad(balance.subtract(delta));
        rebase(position, reserveIndex, updated);
        return updated;
    }

    private static void rebase(UserPosition position, BigDecimal reserveIndex, BigDecimal newPrincipal) {
        position.setPrincipal(newPrincipal);
        position.setIndexSnapshot(reserveIndex);
    }

    private static void requireNonNegative(BigDecimal delta) {
        if (delta == null || delta.signum() < 0) {
            throw new LendingException(LendingError.INVALID_AMOUNT, "Amount must be non-negative, got: " + delta);
        }
    }
}
