package com.lendpool.ratemodel;

import com.lendpool.common.FixedPoint;

import java.math.BigDecimal;

/**
 * Closed set of interest-rate curves. A reserve selects one variant at configuration time; every variant is a
 * pure function of (utilization, config) and is agnostic of the time unit the config rates are expressed in.
 */
public enum RateModel {

    /**
     * Two-slope curve with a kink at optimalUtilization.
     * optimalUtilization == 0 degenerates to base + slope1 + u * slope2, optimalUtilization == 1 to base + u * slope1.
     */
    KINKED {
        @Override
        public BigDecimal borrowRate(BigDecimal utilization, RateConfig config) {
            BigDecimal u = clampUtilization(utilization);
            BigDecimal optimal = config.optimalUtilization();
            if (optimal.signum() == 0) {
                return FixedPoint.ray(config.baseRate().add(config.slope1()).add(u.multiply(config.slope2())));
            }
            if (optimal.compareTo(BigDecimal.ONE) >= 0) {
                return FixedPoint.ray(config.baseRate().add(u.multiply(config.slope1())));
            }
            if (u.compareTo(optimal) <= 0) {
                BigDecimal share = FixedPoint.divRay(u, optimal);
                return FixedPoint.ray(config.baseRate().add(share.multiply(config.slope1())));
            }
            BigDecimal excess = FixedPoint.divRay(u.subtract(optimal), BigDecimal.ONE.subtract(optimal));
            return FixedPoint.ray(config.baseRate().add(config.slope1()).add(excess.multiply(config.slope2())));
        }
    },

    /**
     * Single straight line base + u * slope1; optimalUtilization and slope2 are ignored.
     */
    LINEAR {
        @Override
        public BigDecimal borrowRate(BigDecimal utilization, RateConfig config) {
            BigDecimal u = clampUtilization(utilization);
            return FixedPoint.ray(config.baseRate().add(u.multiply(config.slope1())));
        }
    };

    public abstract BigDecimal borrowRate(BigDecimal utilization, RateConfig config);

    public BigDecimal supplyRate(BigDecimal utilization, RateConfig config) {
        BigDecimal u = clampUtilization(utilization);
        BigDecimal keep = BigDecimal.ONE.subtract(config.reserveFactor());
        return FixedPoint.ray(borrowRate(u, config).multiply(u).multiply(keep));
    }

    public InterestRates rates(BigDecimal utilization, RateConfig config) {
        BigDecimal u = clampUtilization(utilization);
        return new InterestRates(u, borrowRate(u, config), supplyRate(u, config));
    }

    /**
     * totalBorrows / (totalBorrows + availableLiquidity), clamped to [0, 1]; 0 when the pool is empty.
     */
    public static BigDecimal utilization(BigDecimal totalBorrows, BigDecimal availableLiquidity) {
        BigDecimal borrows = totalBorrows.max(BigDecimal.ZERO);
        BigDecimal denominator = borrows.add(availableLiquidity.max(BigDecimal.ZERO));
        if (denominator.signum() == 0) {
            return FixedPoint.ray(BigDecimal.ZERO);
        }
        return clampUtilization(FixedPoint.divRay(borrows, denominator));
    }

    private static BigDecimal clampUtilization(BigDecimal utilization) {
        if (utilization == null) {
            return FixedPoint.ray(BigDecimal.ZERO);
        }
        return FixedPoint.ray(FixedPoint.clamp(utilization, BigDecimal.ZERO, BigDecimal.ONE));
    }
}
