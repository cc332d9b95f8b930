package com.lendpool.pool;

import com.lendpool.accrual.AccrualEngine;
import com.lendpool.common.FixedPoint;
import com.lendpool.common.LendingError;
import com.lendpool.common.LendingException;
import com.lendpool.domain.PositionKey;
import com.lendpool.domain.PositionKind;
import com.lendpool.domain.Reserve;
import com.lendpool.domain.UserPosition;
import com.lendpool.health.HealthFactorCalculator;
import com.lendpool.health.HealthSnapshot;
import com.lendpool.health.PriceSheet;
import com.lendpool.liquidation.LiquidationEngine;
import com.lendpool.liquidation.LiquidationRecord;
import com.lendpool.liquidation.LiquidationResult;
import com.lendpool.pool.config.LendPoolProperties;
import com.lendpool.position.PositionAccounting;
import com.lendpool.ratemodel.InterestRates;
import com.lendpool.state.PoolTransaction;
import com.lendpool.state.WorldState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;

/**
 * Public operations of the lending pool.
 * Every mutating operation accrues the reserves it touches, updates positions on a {@link PoolTransaction},
 * runs its safety checks and commits. A failed check or a failed token transfer leaves no trace.
 * Amounts are token units; they are truncated to WAD precision.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LendingPool {

    /**
     * Amount sentinel accepted by {@link #withdraw} and {@link #repay}: the entire current balance.
     */
    public static final BigDecimal MAX_AMOUNT = BigDecimal.ONE.negate();

    private final WorldState worldState;
    private final AccrualEngine accrualEngine;
    private final HealthFactorCalculator healthFactorCalculator;
    private final LiquidationEngine liquidationEngine;
    private final LendPoolProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * @return the user's deposit balance after the operation
     */
    public BigDecimal deposit(String user, String asset, BigDecimal amount) {
        BigDecimal value = requirePositive(amount);
        PoolTransaction tx = worldState.begin(now());
        Reserve reserve = tx.reserveForUpdate(asset);
        requireActive(reserve);

        UserPosition position = tx.openPosition(PositionKey.deposit(user, asset));
        BigDecimal balance = PositionAccounting.increase(position, reserve.getSupplyIndex(), value);
        reserve.setTotalDeposits(reserve.getTotalDeposits().add(value));
        reserve.setAvailableLiquidity(reserve.getAvailableLiquidity().add(value));

        tx.transfer(asset, user, properties.getPoolAccount(), value);
        tx.commit();
        log.info("Deposit: {} supplied {} {}", user, plain(value), asset);
        return balance;
    }

    /**
     * @param amount token amount or {@link #MAX_AMOUNT}
     * @return the amount withdrawn
     */
    public BigDecimal withdraw(String user, String asset, BigDecimal amount) {
        boolean all = isMax(amount);
        BigDecimal requested = all ? null : requirePositive(amount);
        PoolTransaction tx = worldState.begin(now());
        Reserve reserve = tx.reserveForUpdate(asset);

        UserPosition position = tx.positionForUpdate(PositionKey.deposit(user, asset))
                .orElseThrow(() -> new LendingException(LendingError.INSUFFICIENT_BALANCE,
                        user + " has no " + asset + " deposit"));
        BigDecimal balance = PositionAccounting.currentBalance(position, reserve.getSupplyIndex());
        BigDecimal value = all ? balance : requested;
        if (value.compareTo(balance) > 0) {
            throw new LendingException(LendingError.INSUFFICIENT_BALANCE,
                    user + " holds " + plain(balance) + " " + asset + ", requested " + plain(value));
        }
        if (value.compareTo(reserve.getAvailableLiquidity()) > 0) {
            throw new LendingException(LendingError.INSUFFICIENT_LIQUIDITY,
                    "Pool holds " + plain(reserve.getAvailableLiquidity()) + " " + asset + ", requested " + plain(value));
        }
        PositionAccounting.decrease(position, reserve.getSupplyIndex(), value);
        reserve.setTotalDeposits(FixedPoint.subtractFloorZero(reserve.getTotalDeposits(), value));
        reserve.setAvailableLiquidity(reserve.getAvailableLiquidity().subtract(value));

        requireHealthy(tx, healthFactorCalculator.prices(tx.getNow()), user);

        tx.transfer(asset, properties.getPoolAccount(), user, value);
        tx.commit();
        log.info("Withdraw: {} withdrew {} {}", user, plain(value), asset);
        return value;
    }

    /**
     * @return the user's debt balance after the operation
     */
    public BigDecimal borrow(String user, String asset, BigDecimal amount) {
        BigDecimal value = requirePositive(amount);
        PoolTransaction tx = worldState.begin(now());
        Reserve reserve = tx.reserveForUpdate(asset);
        requireActive(reserve);
        if (!reserve.isBorrowingEnabled()) {
            throw new LendingException(LendingError.BORROWING_DISABLED, "Borrowing is disabled for " + asset);
        }
        if (value.compareTo(reserve.getAvailableLiquidity()) > 0) {
            throw new LendingException(LendingError.INSUFFICIENT_LIQUIDITY,
                    "Pool holds " + plain(reserve.getAvailableLiquidity()) + " " + asset + ", requested " + plain(value));
        }

        UserPosition position = tx.openPosition(PositionKey.borrow(user, asset));
        BigDecimal debt = PositionAccounting.increase(position, reserve.getBorrowIndex(), value);
        reserve.setTotalBorrows(reserve.getTotalBorrows().add(value));
        reserve.setAvailableLiquidity(reserve.getAvailableLiquidity().subtract(value));

        requireHealthy(tx, healthFactorCalculator.prices(tx.getNow()), user);

        tx.transfer(asset, properties.getPoolAccount(), user, value);
        tx.commit();
        log.info("Borrow: {} borrowed {} {}", user, plain(value), asset);
        return debt;
    }

    /**
     * Repays up to the current debt; a larger amount is capped.
     *
     * @param amount token amount or {@link #MAX_AMOUNT}
     * @return the amount actually repaid
     */
    public BigDecimal repay(String user, String asset, BigDecimal amount) {
        boolean all = isMax(amount);
        BigDecimal requested = all ? null : requirePositive(amount);
        PoolTransaction tx = worldState.begin(now());
        Reserve reserve = tx.reserveForUpdate(asset);

        UserPosition position = tx.positionForUpdate(PositionKey.borrow(user, asset))
                .orElseThrow(() -> new LendingException(LendingError.NO_DEBT, user + " has no " + asset + " debt"));
        BigDecimal debt = PositionAccounting.currentBalance(position, reserve.getBorrowIndex());
        BigDecimal value = all ? debt : requested.min(debt);
        PositionAccounting.decrease(position, reserve.getBorrowIndex(), value);
        reserve.setTotalBorrows(FixedPoint.subtractFloorZero(reserve.getTotalBorrows(), value));
        reserve.setAvailableLiquidity(reserve.getAvailableLiquidity().add(value));

        tx.transfer(asset, user, properties.getPoolAccount(), value);
        tx.commit();
        log.info("Repay: {} repaid {} {}", user, plain(value), asset);
        return value;
    }

    /**
     * Repay part of an unhealthy borrower's debt and seize discounted collateral. The liquidator pays the debt
     * asset into the pool and receives the seized collateral as a deposit position.
     */
    public LiquidationResult liquidate(String liquidator, String borrower, String debtAsset,
                                       String collateralAsset, BigDecimal repayAmount) {
        PoolTransaction tx = worldState.begin(now());
        PriceSheet prices = healthFactorCalculator.prices(tx.getNow());
        LiquidationResult result = liquidationEngine.liquidate(
                tx, prices, liquidator, borrower, debtAsset, collateralAsset, repayAmount);

        tx.transfer(debtAsset, liquidator, properties.getPoolAccount(), result.actualRepaid());
        tx.commit();
        eventPublisher.publishEvent(
                LiquidationRecord.of(liquidator, borrower, debtAsset, collateralAsset, result, tx.getNow()));
        return result;
    }

    /**
     * Include or exclude a deposit from the user's collateral. Disabling must leave the user healthy.
     */
    public void setUseAsCollateral(String user, String asset, boolean enabled) {
        PoolTransaction tx = worldState.begin(now());
        tx.reserve(asset);
        UserPosition position = tx.positionForUpdate(PositionKey.deposit(user, asset))
                .filter(p -> !p.isEmpty())
                .orElseThrow(() -> new LendingException(LendingError.NO_COLLATERAL,
                        user + " has no " + asset + " deposit"));
        if (position.isCollateralEnabled() == enabled) {
            return;
        }
        position.setCollateralEnabled(enabled);
        if (!enabled) {
            requireHealthy(tx, healthFactorCalculator.prices(tx.getNow()), user);
        }
        tx.commit();
        log.info("Collateral: {} {} {} as collateral", user, enabled ? "enabled" : "disabled", asset);
    }

    /**
     * Lend {@code amount} to {@code receiver} for the duration of {@code callback}. The receiver must return
     * amount + fee before the operation ends; the fee goes to depositors. When it does not, every token movement made
     * during the loan, including the receiver's own, is discarded.
     *
     * @return the fee charged
     * @throws LendingException FLASH_LOAN_NOT_REPAID when the receiver cannot pay back amount + fee
     */
    public BigDecimal flashLoan(String receiver, String asset, BigDecimal amount, FlashLoanReceiver callback) {
        BigDecimal value = requirePositive(amount);
        PoolTransaction tx = worldState.begin(now());
        Reserve reserve = tx.reserveForUpdate(asset);
        requireActive(reserve);
        if (value.compareTo(reserve.getAvailableLiquidity()) > 0) {
            throw new LendingException(LendingError.INSUFFICIENT_LIQUIDITY,
                    "Pool holds " + plain(reserve.getAvailableLiquidity()) + " " + asset + ", requested " + plain(value));
        }
        BigDecimal fee = FixedPoint.mulWad(value, FixedPoint.bps(properties.getFlashLoanFeeBps()));
        distributeFee(reserve, fee);

        String pool = properties.getPoolAccount();
        tx.transfer(asset, pool, receiver, value);
        tx.invoke(() -> callback.onFlashLoan(asset, value, fee));
        tx.transfer(asset, receiver, pool, value.add(fee), LendingError.FLASH_LOAN_NOT_REPAID);
        tx.commit();
        log.info("Flash loan: {} borrowed {} {} (fee {})", receiver, plain(value), asset, plain(fee));
        return fee;
    }

    public ReserveData getReserveData(String asset) {
        Reserve reserve = worldState.begin(now()).reserve(asset);
        InterestRates rates = accrualEngine.currentRates(reserve);
        BigDecimal year = BigDecimal.valueOf(properties.getSecondsPerYear());
        return new ReserveData(
                reserve.getAsset(),
                reserve.getTotalDeposits(),
                reserve.getTotalBorrows(),
                reserve.getAvailableLiquidity(),
                reserve.getAccruedToTreasury(),
                FixedPoint.wad(rates.utilization()),
                rates.borrowRate(),
                rates.supplyRate(),
                FixedPoint.mulWad(rates.borrowRate(), year),
                FixedPoint.mulWad(rates.supplyRate(), year),
                reserve.getBorrowIndex(),
                reserve.getSupplyIndex(),
                reserve.getLastUpdateTimestamp(),
                reserve.isBorrowingEnabled(),
                reserve.isActive());
    }

    public List<String> listedAssets() {
        return worldState.getReserveStore().assets();
    }

    public BigDecimal getUserHealthFactor(String user) {
        return snapshot(user).healthFactor();
    }

    public UserAccountData getUserAccountData(String user) {
        HealthSnapshot snapshot = snapshot(user);
        return new UserAccountData(user, snapshot.collateralValue(), snapshot.debtValue(),
                snapshot.healthFactor(), snapshot.availableToBorrow());
    }

    /**
     * Non-empty positions of the user with balances projected to now.
     */
    public List<PositionView> getUserPositions(String user) {
        PoolTransaction tx = worldState.begin(now());
        return tx.positionsOf(user).stream()
                .sorted(Comparator.comparing(UserPosition::getAsset).thenComparing(UserPosition::getKind))
                .map(p -> new PositionView(p.getAsset(), p.getKind(),
                        PositionAccounting.currentBalance(p, tx.reserve(p.getAsset()).indexFor(p.getKind())),
                        p.countsAsCollateral()))
                .toList();
    }

    private HealthSnapshot snapshot(String user) {
        PoolTransaction tx = worldState.begin(now());
        return healthFactorCalculator.compute(tx.positionsOf(user), tx::reserve,
                healthFactorCalculator.prices(tx.getNow()));
    }

    private void requireHealthy(PoolTransaction tx, PriceSheet prices, String user) {
        List<UserPosition> positions = tx.positionsOf(user);
        if (positions.stream().noneMatch(p -> p.getKind() == PositionKind.BORROW)) {
            return;
        }
        HealthSnapshot snapshot = healthFactorCalculator.compute(positions, tx::reserve, prices);
        if (!snapshot.isHealthy()) {
            throw new LendingException(LendingError.HEALTH_FACTOR_TOO_LOW,
                    "Operation would leave " + user + " with health factor " + plain(snapshot.healthFactor()));
        }
    }

    /**
     * Flash-loan fee: raise the supply index so existing deposits grow by the fee. With no deposits the fee goes
     * to the treasury.
     */
    private static void distributeFee(Reserve reserve, BigDecimal fee) {
        BigDecimal deposits = reserve.getTotalDeposits();
        if (deposits.signum() > 0) {
            BigDecimal factor = FixedPoint.divRay(deposits.add(fee), deposits);
            reserve.setSupplyIndex(FixedPoint.mulRay(reserve.getSupplyIndex(), factor));
            reserve.setTotalDeposits(deposits.add(fee));
        } else {
            reserve.setAccruedToTreasury(reserve.getAccruedToTreasury().add(fee));
        }
        reserve.setAvailableLiquidity(reserve.getAvailableLiquidity().add(fee));
    }

    private static void requireActive(Reserve reserve) {
        if (!reserve.isActive()) {
            throw new LendingException(LendingError.RESERVE_INACTIVE, "Reserve is inactive: " + reserve.getAsset());
        }
    }

    private static BigDecimal requirePositive(BigDecimal amount) {
        if (!FixedPoint.isPositive(amount)) {
            throw new LendingException(LendingError.INVALID_AMOUNT, "Amount must be positive, got: " + amount);
        }
        BigDecimal value = FixedPoint.wad(amount);
        if (value.signum() == 0) {
            throw new LendingException(LendingError.INVALID_AMOUNT, "Amount is below WAD precision: " + amount);
        }
        return value;
    }

    private static boolean isMax(BigDecimal amount) {
        return amount != null && amount.compareTo(MAX_AMOUNT) == 0;
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
