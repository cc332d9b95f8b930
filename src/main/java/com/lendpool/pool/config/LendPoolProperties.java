package com.lendpool.pool.config;

import com.lendpool.ratemodel.RateModel;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Pool configuration. Documented in application.yml under lendpool.
 */
@ConfigurationProperties(prefix = "lendpool")
@Getter
@Setter
public class LendPoolProperties {

    /**
     * Account allowed to list reserves and change risk parameters.
     */
    private String adminAddress = "admin";

    /**
     * Account holding the pool's liquidity in the token ledger.
     */
    private String poolAccount = "lendpool-vault";

    /**
     * Used once, at configuration time, to turn yearly rates into per-second rates.
     */
    private long secondsPerYear = 31_536_000L;

    /**
     * Flash-loan fee in basis points of the borrowed amount (9 = 0.09%).
     */
    private int flashLoanFeeBps = 9;

    /**
     * Reserves listed at startup.
     */
    private List<ReserveProperties> reserves = new ArrayList<>();

    @Getter
    @Setter
    public static class ReserveProperties {
        private String asset;
        private RateModel rateModel = RateModel.KINKED;
        /** Yearly rates as fractions (0.04 = 4% APR). */
        private BigDecimal baseRateApr = BigDecimal.ZERO;
        private BigDecimal optimalUtilization = new BigDecimal("0.8");
        private BigDecimal slope1Apr = new BigDecimal("0.04");
        private BigDecimal slope2Apr = new BigDecimal("0.6");
        private BigDecimal reserveFactor = new BigDecimal("0.1");
        private BigDecimal collateralFactor = new BigDecimal("0.75");
        private BigDecimal liquidationThreshold = new BigDecimal("0.8");
        private BigDecimal liquidationBonus = new BigDecimal("0.1");
        private BigDecimal closeFactor = new BigDecimal("0.5");
        private boolean borrowingEnabled = true;
    }
}
