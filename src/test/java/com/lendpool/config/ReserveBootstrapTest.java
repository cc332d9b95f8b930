package com.lendpool.config;

import com.lendpool.common.LendingError;
import com.lendpool.common.LendingException;
import com.lendpool.domain.Reserve;
import com.lendpool.pool.config.LendPoolProperties.ReserveProperties;
import com.lendpool.ratemodel.RateConfig;
import com.lendpool.ratemodel.RateModel;
import com.lendpool.support.PoolFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReserveBootstrapTest {

    private PoolFixture fixture;
    private ReserveBootstrap bootstrap;

    @BeforeEach
    void setUp() {
        fixture = new PoolFixture();
        bootstrap = new ReserveBootstrap(fixture.admin, fixture.reserveStore, fixture.properties);
    }

    private static ReserveProperties reserve(String asset) {
        ReserveProperties reserve = new ReserveProperties();
        reserve.setAsset(asset);
        return reserve;
    }

    @Test
    @DisplayName("configured reserves are listed with per-second rates")
    void listsConfiguredReserves() {
        ReserveProperties dai = reserve("DAI");
        dai.setRateModel(RateModel.LINEAR);
        dai.setBaseRateApr(new BigDecimal("0.02"));
        dai.setSlope1Apr(new BigDecimal("0.1"));
        ReserveProperties wbtc = reserve("WBTC");
        wbtc.setBorrowingEnabled(false);
        fixture.properties.setReserves(List.of(dai, wbtc));

        bootstrap.run(null);

        Reserve listed = fixture.reserveStore.load("DAI").orElseThrow();
        assertThat(listed.getRateModel()).isEqualTo(RateModel.LINEAR);
        assertThat(listed.getRateConfig()).isEqualTo(RateConfig.fromAnnual(new BigDecimal("0.02"),
                new BigDecimal("0.8"), new BigDecimal("0.1"), new BigDecimal("0.6"), new BigDecimal("0.1"),
                PoolFixture.SECONDS_PER_YEAR));
        assertThat(listed.isActive()).isTrue();
        assertThat(listed.isBorrowingEnabled()).isTrue();
        assertThat(fixture.reserveStore.load("WBTC").orElseThrow().isBorrowingEnabled()).isFalse();
    }

    @Test
    @DisplayName("already listed reserves are left untouched")
    void skipsListedReserves() {
        fixture.withUsdc();
        RateConfig before = fixture.reserveStore.load("USDC").orElseThrow().getRateConfig();
        ReserveProperties usdc = reserve("USDC");
        usdc.setBaseRateApr(new BigDecimal("0.5"));
        fixture.properties.setReserves(List.of(usdc));

        bootstrap.run(null);

        assertThat(fixture.reserveStore.load("USDC").orElseThrow().getRateConfig()).isEqualTo(before);
    }

    @Test
    @DisplayName("invalid reserve definition fails startup")
    void invalidReserve_failsStartup() {
        ReserveProperties broken = reserve("BAD");
        broken.setCollateralFactor(new BigDecimal("0.9"));
        broken.setLiquidationThreshold(new BigDecimal("0.8"));
        fixture.properties.setReserves(List.of(broken));

        assertThatThrownBy(() -> bootstrap.run(null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("BAD")
                .hasCauseInstanceOf(LendingException.class)
                .cause()
                .satisfies(cause -> assertThat(((LendingException) cause).getError())
                        .isEqualTo(LendingError.INVALID_CONFIG));
        assertThat(fixture.reserveStore.contains("BAD")).isFalse();
    }
}
