package com.lendpool.domain;

import com.lendpool.common.FixedPoint;
import com.lendpool.ratemodel.RateConfig;
import com.lendpool.ratemodel.RateModel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Aggregate state of one asset's pool. Amounts are WAD, indices RAY; both indices start at 1.0 and never decrease.
 * Only mutated through AccrualEngine and pool operations on a transaction-local copy (see PoolTransaction).
 */
@NoArgsConstructor
@Getter
@Setter
public class Reserve {

    private String asset;
    private BigDecimal totalDeposits;
    private BigDecimal totalBorrows;
    /** Cash held by the pool for this asset. */
    private BigDecimal availableLiquidity;
    /** Reserve-factor share of borrow interest retained by the protocol. */
    private BigDecimal accruedToTreasury;
    private BigDecimal borrowIndex;
    private BigDecimal supplyIndex;
    /** Epoch seconds of the last accrual. */
    private long lastUpdateTimestamp;
    private RateModel rateModel;
    private RateConfig rateConfig;
    private LiquidationConfig liquidationConfig;
    private boolean borrowingEnabled;
    private boolean active;
    /** Optimistic-concurrency version; 0 means never committed. */
    private long version;

    public static Reserve create(String asset, RateModel rateModel, RateConfig rateConfig,
                                 LiquidationConfig liquidationConfig, long now) {
        Reserve reserve = new Reserve();
        reserve.setAsset(asset);
        reserve.setTotalDeposits(FixedPoint.WAD_ZERO);
        reserve.setTotalBorrows(FixedPoint.WAD_ZERO);
        reserve.setAvailableLiquidity(FixedPoint.WAD_ZERO);
        reserve.setAccruedToTreasury(FixedPoint.WAD_ZERO);
        reserve.setBorrowIndex(FixedPoint.RAY_ONE);
        reserve.setSupplyIndex(FixedPoint.RAY_ONE);
        reserve.setLastUpdateTimestamp(now);
        reserve.setRateModel(rateModel);
        reserve.setRateConfig(rateConfig);
        reserve.setLiquidationConfig(liquidationConfig);
        reserve.setBorrowingEnabled(true);
        reserve.setActive(true);
        return reserve;
    }

    public BigDecimal indexFor(PositionKind kind) {
        return kind == PositionKind.BORROW ? borrowIndex : supplyIndex;
    }

    public Reserve copy() {
        Reserve copy = new Reserve();
        copy.asset = asset;
        copy.totalDeposits = totalDeposits;
        copy.totalBorrows = totalBorrows;
        copy.availableLiquidity = availableLiquidity;
        copy.accruedToTreasury = accruedToTreasury;
        copy.borrowIndex = borrowIndex;
        copy.supplyIndex = supplyIndex;
        copy.lastUpdateTimestamp = lastUpdateTimestamp;
        copy.rateModel = rateModel;
        copy.rateConfig = rateConfig;
        copy.liquidationConfig = liquidationConfig;
        copy.borrowingEnabled = borrowingEnabled;
        copy.active = active;
        copy.version = version;
        return copy;
    }
}
