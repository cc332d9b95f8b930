package com.lendpool.liquidation;

import com.lendpool.common.FixedPoint;
import com.lendpool.common.LendingError;
import com.lendpool.common.LendingException;
import com.lendpool.domain.PositionKey;
import com.lendpool.domain.Reserve;
import com.lendpool.domain.UserPosition;
import com.lendpool.health.HealthFactorCalculator;
import com.lendpool.health.HealthSnapshot;
import com.lendpool.health.PriceSheet;
import com.lendpool.position.PositionAccounting;
import com.lendpool.state.PoolTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Bounded partial liquidation of an undercollateralized borrower.
 * A borrower is Liquidatable while healthFactor &lt; 1.0 and Healthy otherwise; the state is recomputed from live
 * positions and fresh prices on every call. All checks run before any staged mutation, and nothing is visible
 * until the caller commits the transaction.
 * The resulting health factor is reported but not required to improve: with a deep shortfall and a large bonus a
 * liquidation can leave the borrower worse off, and it still goes through.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LiquidationEngine {

    private final HealthFactorCalculator healthFactorCalculator;

    /**
     * Stage a liquidation on {@code tx}. The liquidator's debt-asset payment is left to the caller.
     *
     * @throws LendingException NOT_LIQUIDATABLE, ZERO_LIQUIDATION, INSUFFICIENT_COLLATERAL, NO_DEBT, NO_COLLATERAL,
     *                          SELF_LIQUIDATION, or any price guard error
     */
    public LiquidationResult liquidate(PoolTransaction tx, PriceSheet prices, String liquidator, String borrower,
                                       String debtAsset, String collateralAsset, BigDecimal repayAmount) {
        if (!FixedPoint.isPositive(repayAmount)) {
            throw new LendingException(LendingError.INVALID_AMOUNT, "Repay amount must be positive, got: " + repayAmount);
        }
        if (liquidator.equals(borrower)) {
            throw new LendingException(LendingError.SELF_LIQUIDATION, "Borrower cannot liquidate own position");
        }

        Reserve debtReserve = tx.reserveForUpdate(debtAsset);
        Reserve collateralReserve = tx.reserveForUpdate(collateralAsset);

        HealthSnapshot before = healthFactorCalculator.compute(tx.positionsOf(borrower), tx::reserve, prices);
        if (before.isHealthy()) {
            throw new LendingException(LendingError.NOT_LIQUIDATABLE,
                    borrower + " is healthy (health factor " + before.healthFactor().stripTrailingZeros().toPlainString() + ")");
        }

        UserPosition debt = tx.positionForUpdate(PositionKey.borrow(borrower, debtAsset))
                .orElseThrow(() -> new LendingException(LendingError.NO_DEBT, borrower + " has no " + debtAsset + " debt"));
        BigDecimal debtBalance = PositionAccounting.currentBalance(debt, debtReserve.getBorrowIndex());
        BigDecimal maxRepay = FixedPoint.mulWad(debtBalance, debtReserve.getLiquidationConfig().closeFactor());
        BigDecimal actualRepaid = FixedPoint.wad(repayAmount.min(maxRepay));
        if (actualRepaid.signum() == 0) {
            throw new LendingException(LendingError.ZERO_LIQUIDATION, "Nothing to repay for " + borrower + " in " + debtAsset);
        }

        UserPosition collateral = tx.positionForUpdate(PositionKey.deposit(borrower, collateralAsset))
                .filter(UserPosition::countsAsCollateral)
                .orElseThrow(() -> new LendingException(LendingError.NO_COLLATERAL,
                        borrower + " has no " + collateralAsset + " collateral"));
        BigDecimal repayValue = FixedPoint.mulWad(actualRepaid, prices.price(debtAsset));
        BigDecimal bonus = BigDecimal.ONE.add(collateralReserve.getLiquidationConfig().liquidationBonus());
        BigDecimal collateralSeized = FixedPoint.divWad(repayValue.multiply(bonus), prices.price(collateralAsset));
        BigDecimal collateralBalance = PositionAccounting.currentBalance(collateral, collateralReserve.getSupplyIndex());
        if (collateralSeized.compareTo(collateralBalance) > 0) {
            throw new LendingException(LendingError.INSUFFICIENT_COLLATERAL,
                    "Seizing " + collateralSeized.stripTrailingZeros().toPlainString() + " " + collateralAsset
                            + " exceeds borrower balance " + collateralBalance.stripTrailingZeros().toPlainString());
        }

        PositionAccounting.decrease(debt, debtReserve.getBorrowIndex(), actualRepaid);
        debtReserve.setTotalBorrows(FixedPoint.subtractFloorZero(debtReserve.getTotalBorrows(), actualRepaid));
        debtReserve.setAvailableLiquidity(debtReserve.getAvailableLiquidity().add(actualRepaid));

        PositionAccounting.decrease(collateral, collateralReserve.getSupplyIndex(), collateralSeized);
        UserPosition seized = tx.openPosition(PositionKey.deposit(liquidator, collateralAsset));
        PositionAccounting.increase(seized, collateralReserve.getSupplyIndex(), collateralSeized);

        HealthSnapshot after = healthFactorCalculator.compute(tx.positionsOf(borrower), tx::reserve, prices);
        log.debug("Staged liquidation of {}: repaid {} {}, seized {} {}, health factor {} -> {}",
                borrower, actualRepaid, debtAsset, collateralSeized, collateralAsset,
                before.healthFactor(), after.healthFactor());
        return new LiquidationResult(actualRepaid, collateralSeized, before.healthFactor(), after.healthFactor());
    }
}
