package com.lendpool.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class FixedPointTest {

    @Test
    @DisplayName("division truncates toward zero at WAD precision")
    void divWad_truncates() {
        BigDecimal third = FixedPoint.divWad(BigDecimal.ONE, new BigDecimal("3"));

        assertThat(third).isEqualTo(new BigDecimal("0.333333333333333333"));
        assertThat(FixedPoint.divWad(new BigDecimal("2"), new BigDecimal("3")))
                .isEqualTo(new BigDecimal("0.666666666666666666"));
    }

    @Test
    @DisplayName("negative values truncate toward zero, not toward negative infinity")
    void divWad_negative_truncatesTowardZero() {
        assertThat(FixedPoint.divWad(BigDecimal.ONE.negate(), new BigDecimal("3")))
                .isEqualTo(new BigDecimal("-0.333333333333333333"));
    }

    @Test
    @DisplayName("products are exact before narrowing")
    void mulRay_exactThenNarrowed() {
        BigDecimal a = new BigDecimal("1.000000000000000000000000001");
        BigDecimal b = new BigDecimal("1.000000000000000000000000001");

        assertThat(FixedPoint.mulRay(a, b)).isEqualTo(new BigDecimal("1.000000000000000000000000002"));
    }

    @Test
    @DisplayName("basis points become WAD fractions")
    void bps() {
        assertThat(FixedPoint.bps(9)).isEqualByComparingTo("0.0009");
        assertThat(FixedPoint.bps(10_000)).isEqualByComparingTo("1");
    }

    @Test
    void subtractFloorZero_neverNegative() {
        BigDecimal a = FixedPoint.wad("1");

        assertThat(FixedPoint.subtractFloorZero(a, new BigDecimal("1.000000000000000001"))).isEqualByComparingTo("0");
        assertThat(FixedPoint.subtractFloorZero(a, new BigDecimal("0.4"))).isEqualByComparingTo("0.6");
    }

    @Test
    void isFraction_bounds() {
        assertThat(FixedPoint.isFraction(BigDecimal.ZERO)).isTrue();
        assertThat(FixedPoint.isFraction(BigDecimal.ONE)).isTrue();
        assertThat(FixedPoint.isFraction(new BigDecimal("1.01"))).isFalse();
        assertThat(FixedPoint.isFraction(new BigDecimal("-0.01"))).isFalse();
        assertThat(FixedPoint.isFraction(null)).isFalse();
    }
}
