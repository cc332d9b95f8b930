package com.lendpool.health;

import com.lendpool.common.FixedPoint;
import com.lendpool.common.LendingError;
import com.lendpool.common.LendingException;
import com.lendpool.domain.PositionKind;
import com.lendpool.domain.Reserve;
import com.lendpool.domain.UserPosition;
import com.lendpool.position.PositionAccounting;
import com.lendpool.pricing.PriceOracle;
import com.lendpool.pricing.PriceQuote;
import com.lendpool.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.function.Function;

/**
 * Aggregates a user's risk-adjusted collateral value and debt value across assets.
 * healthFactor = collateralValue / debtValue at WAD precision (1e18 = 1.0); {@link #MAX_HEALTH_FACTOR} when the
 * user has no debt, 0 when there is debt but no collateral.
 * Prices are rejected when older than lendpool.pricing.max-price-age-seconds or when their confidence interval
 * exceeds lendpool.pricing.max-confidence-ratio of the price; rejection aborts the calling operation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HealthFactorCalculator {

    /** (2^256 - 1) / 1e18: the no-debt sentinel. */
    public static final BigDecimal MAX_HEALTH_FACTOR =
            new BigDecimal(BigInteger.TWO.pow(256).subtract(BigInteger.ONE), FixedPoint.WAD_SCALE);

    private final PriceOracle priceOracle;
    private final PricingProperties pricingProperties;

    /**
     * Price sheet for an operation executing at {@code now}; every quote drawn from it is validated.
     */
    public PriceSheet prices(long now) {
        return new PriceSheet(asset -> validatedPrice(asset, now));
    }

    /**
     * @param positions the user's positions
     * @param reserves  reserve lookup, already accrued to the operation's timestamp
     * @param prices    validated prices for the operation
     */
    public HealthSnapshot compute(Collection<UserPosition> positions, Function<String, Reserve> reserves,
                                  PriceSheet prices) {
        BigDecimal collateralValue = FixedPoint.WAD_ZERO;
        BigDecimal debtValue = FixedPoint.WAD_ZERO;
        for (UserPosition position : positions) {
            boolean isDebt = position.getKind() == PositionKind.BORROW;
            if (!isDebt && !position.countsAsCollateral()) {
                continue;
            }
            Reserve reserve = reserves.apply(position.getAsset());
            BigDecimal balance = PositionAccounting.currentBalance(position, reserve.indexFor(position.getKind()));
            if (balance.signum() == 0) {
                continue;
            }
            BigDecimal value = FixedPoint.mulWad(balance, prices.price(position.getAsset()));
            if (isDebt) {
                debtValue = debtValue.add(value);
            } else {
                collateralValue = collateralValue.add(
                        FixedPoint.mulWad(value, reserve.getLiquidationConfig().collateralFactor()));
            }
        }
        return snapshot(collateralValue, debtValue);
    }

    static HealthSnapshot snapshot(BigDecimal collateralValue, BigDecimal debtValue) {
        BigDecimal healthFactor;
        if (debtValue.signum() == 0) {
            healthFactor = MAX_HEALTH_FACTOR;
        } else if (collateralValue.signum() == 0) {
            healthFactor = FixedPoint.WAD_ZERO;
        } else {
            healthFactor = FixedPoint.divWad(collateralValue, debtValue);
        }
        BigDecimal availableToBorrow = FixedPoint.wad(collateralValue.subtract(debtValue).max(BigDecimal.ZERO));
        return new HealthSnapshot(collateralValue, debtValue, healthFactor, availableToBorrow);
    }

    /**
     * Quote the asset and apply the staleness, confidence and positivity guards.
     */
    public BigDecimal validatedPrice(String asset, long now) {
        PriceQuote quote = priceOracle.getPrice(asset);
        if (quote == null || !FixedPoint.isPositive(quote.price())) {
            throw new LendingException(LendingError.PRICE_UNAVAILABLE, "No positive price for " + asset);
        }
        long age = now - quote.timestamp();
        if (age > pricingProperties.getMaxPriceAgeSeconds()) {
            log.warn("Rejected stale price for {}: age {}s exceeds {}s", asset, age, pricingProperties.getMaxPriceAgeSeconds());
            throw new LendingException(LendingError.STALE_PRICE,
                    "Price for " + asset + " is " + age + "s old (max " + pricingProperties.getMaxPriceAgeSeconds() + "s)");
        }
        BigDecimal confidenceRatio = FixedPoint.divWad(quote.confidenceOrZero(), quote.price());
        if (confidenceRatio.compareTo(pricingProperties.getMaxConfidenceRatio()) > 0) {
            log.warn("Rejected low-confidence price for {}: confidence ratio {}", asset, confidenceRatio);
            throw new LendingException(LendingError.PRICE_CONFIDENCE_TOO_LOW,
                    "Price for " + asset + " has confidence ratio " + confidenceRatio.stripTrailingZeros().toPlainString());
        }
        return FixedPoint.wad(quote.price());
    }
}
