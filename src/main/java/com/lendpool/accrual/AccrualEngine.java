package com.lendpool.accrual;

import com.lendpool.common.FixedPoint;
import com.lendpool.domain.Reserve;
import com.lendpool.ratemodel.InterestRates;
import com.lendpool.ratemodel.RateModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Advances a reserve's borrow and supply indices to a point in time.
 * Uses linear compounding per step (factor = 1 + rate * elapsed), not continuous compounding.
 * Calling accrue twice with the same timestamp is a no-op; timestamps earlier than the last update are ignored.
 */
@Component
@Slf4j
public class AccrualEngine {

    /**
     * Accrue interest on the reserve in place up to {@code now} (epoch seconds).
     */
    public void accrue(Reserve reserve, long now) {
        long elapsed = now - reserve.getLastUpdateTimestamp();
        if (elapsed <= 0) {
            return;
        }
        InterestRates rates = currentRates(reserve);
        BigDecimal dt = BigDecimal.valueOf(elapsed);
        BigDecimal borrowFactor = FixedPoint.ray(FixedPoint.RAY_ONE.add(rates.borrowRate().multiply(dt)));
        BigDecimal supplyFactor = FixedPoint.ray(FixedPoint.RAY_ONE.add(rates.supplyRate().multiply(dt)));

        BigDecimal previousBorrows = reserve.getTotalBorrows();
        BigDecimal newBorrows = FixedPoint.mulWad(previousBorrows, borrowFactor);
        BigDecimal borrowInterest = newBorrows.subtract(previousBorrows);
        BigDecimal treasuryShare = FixedPoint.mulWad(borrowInterest, reserve.getRateConfig().reserveFactor());

        reserve.setBorrowIndex(FixedPoint.mulRay(reserve.getBorrowIndex(), borrowFactor));
        reserve.setSupplyIndex(FixedPoint.mulRay(reserve.getSupplyIndex(), supplyFactor));
        reserve.setTotalBorrows(newBorrows);
        reserve.setTotalDeposits(FixedPoint.mulWad(reserve.getTotalDeposits(), supplyFactor));
        reserve.setAccruedToTreasury(reserve.getAccruedToTreasury().add(treasuryShare));
        reserve.setLastUpdateTimestamp(now);

        log.debug("Accrued {} over {}s: utilization={} borrowIndex={} supplyIndex={} interest={}",
                reserve.getAsset(), elapsed, rates.utilization(), reserve.getBorrowIndex(),
                reserve.getSupplyIndex(), borrowInterest);
    }

    /**
     * Rates implied by the reserve's current utilization (per second, RAY).
     */
    public InterestRates currentRates(Reserve reserve) {
        BigDecimal utilization = RateModel.utilization(reserve.getTotalBorrows(), reserve.getAvailableLiquidity());
        return reserve.getRateModel().rates(utilization, reserve.getRateConfig());
    }
}
