package com.lendpool.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point arithmetic over BigDecimal.
 * WAD (18 dp): token amounts, prices, USD values, health factors.
 * RAY (27 dp): borrow/supply indices and per-second rates.
 * BigDecimal products are exact, so every multiplication is done wide and only then narrowed.
 * Narrowing always truncates toward zero.
 */
public final class FixedPoint {

    public static final int WAD_SCALE = 18;
    public static final int RAY_SCALE = 27;
    public static final RoundingMode ROUNDING = RoundingMode.DOWN;

    public static final BigDecimal WAD_ONE = BigDecimal.ONE.setScale(WAD_SCALE, ROUNDING);
    public static final BigDecimal RAY_ONE = BigDecimal.ONE.setScale(RAY_SCALE, ROUNDING);
    public static final BigDecimal WAD_ZERO = BigDecimal.ZERO.setScale(WAD_SCALE, ROUNDING);

    private static final BigDecimal BPS_DENOMINATOR = BigDecimal.valueOf(10_000);

    private FixedPoint() {
    }

    public static BigDecimal wad(BigDecimal value) {
        return value.setScale(WAD_SCALE, ROUNDING);
    }

    public static BigDecimal wad(String value) {
        return wad(new BigDecimal(value));
    }

    public static BigDecimal ray(BigDecimal value) {
        return value.setScale(RAY_SCALE, ROUNDING);
    }

    public static BigDecimal mulWad(BigDecimal a, BigDecimal b) {
        return a.multiply(b).setScale(WAD_SCALE, ROUNDING);
    }

    public static BigDecimal mulRay(BigDecimal a, BigDecimal b) {
        return a.multiply(b).setScale(RAY_SCALE, ROUNDING);
    }

    public static BigDecimal divWad(BigDecimal numerator, BigDecimal denominator) {
        return numerator.divide(denominator, WAD_SCALE, ROUNDING);
    }

    public static BigDecimal divRay(BigDecimal numerator, BigDecimal denominator) {
        return numerator.divide(denominator, RAY_SCALE, ROUNDING);
    }

    /**
     * Basis points (1 bps = 0.01%) as a WAD fraction.
     */
    public static BigDecimal bps(int basisPoints) {
        return divWad(BigDecimal.valueOf(basisPoints), BPS_DENOMINATOR);
    }

    public static BigDecimal clamp(BigDecimal value, BigDecimal min, BigDecimal max) {
        return value.max(min).min(max);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static boolean isZero(BigDecimal value) {
        return value == null || value.signum() == 0;
    }

    public static boolean isFraction(BigDecimal value) {
        return value != null && value.signum() >= 0 && value.compareTo(BigDecimal.ONE) <= 0;
    }

    /**
     * Subtracts and floors at zero; used where truncation drift could push an aggregate a unit below zero.
     */
    public static BigDecimal subtractFloorZero(BigDecimal a, BigDecimal b) {
        BigDecimal result = a.subtract(b);
        return result.signum() < 0 ? BigDecimal.ZERO.setScale(a.scale(), ROUNDING) : result;
    }
}
