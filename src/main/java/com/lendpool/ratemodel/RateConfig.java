package com.lendpool.ratemodel;

import com.lendpool.common.FixedPoint;
import com.lendpool.common.LendingError;
import com.lendpool.common.LendingException;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Interest-rate curve parameters. baseRate, slope1 and slope2 are per elapsed-time-unit (seconds in this
 * application); optimalUtilization and reserveFactor are fractions in [0, 1].
 */
public record RateConfig(
        BigDecimal baseRate,
        BigDecimal optimalUtilization,
        BigDecimal slope1,
        BigDecimal slope2,
        BigDecimal reserveFactor
) {

    public RateConfig {
        Objects.requireNonNull(baseRate, "baseRate");
        Objects.requireNonNull(optimalUtilization, "optimalUtilization");
        Objects.requireNonNull(slope1, "slope1");
        Objects.requireNonNull(slope2, "slope2");
        Objects.requireNonNull(reserveFactor, "reserveFactor");
    }

    /**
     * Converts yearly rates into per-second rates once, at configuration time.
     */
    public static RateConfig fromAnnual(BigDecimal baseRateApr, BigDecimal optimalUtilization,
                                        BigDecimal slope1Apr, BigDecimal slope2Apr,
                                        BigDecimal reserveFactor, long secondsPerYear) {
        if (secondsPerYear <= 0) {
            throw new LendingException(LendingError.INVALID_CONFIG, "secondsPerYear must be positive");
        }
        BigDecimal year = BigDecimal.valueOf(secondsPerYear);
        return new RateConfig(
                FixedPoint.divRay(baseRateApr, year),
                optimalUtilization,
                FixedPoint.divRay(slope1Apr, year),
                FixedPoint.divRay(slope2Apr, year),
                reserveFactor);
    }

    public void validate() {
        if (baseRate.signum() < 0 || slope1.signum() < 0 || slope2.signum() < 0) {
            throw new LendingException(LendingError.INVALID_CONFIG, "rates must be non-negative");
        }
        if (!FixedPoint.isFraction(optimalUtilization)) {
            throw new LendingException(LendingError.INVALID_CONFIG, "optimalUtilization must be within [0, 1]");
        }
        if (!FixedPoint.isFraction(reserveFactor)) {
            throw new LendingException(LendingError.INVALID_CONFIG, "reserveFactor must be within [0, 1]");
        }
    }
}
