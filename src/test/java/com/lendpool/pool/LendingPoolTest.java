package com.lendpool.pool;

import com.lendpool.common.LendingError;
import com.lendpool.common.LendingException;
import com.lendpool.domain.PositionKind;
import com.lendpool.health.HealthFactorCalculator;
import com.lendpool.pricing.PriceQuote;
import com.lendpool.ratemodel.RateModel;
import com.lendpool.support.PoolFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static com.lendpool.support.LendingAssertions.assertFailsWith;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LendingPoolTest {

    private PoolFixture fx;
    private LendingPool pool;

    @BeforeEach
    void setUp() {
        fx = new PoolFixture().withUsdc().withEth();
        pool = fx.pool;
    }

    private BigDecimal balance(String user, String asset, PositionKind kind) {
        return pool.getUserPositions(user).stream()
                .filter(p -> p.asset().equals(asset) && p.kind() == kind)
                .map(PositionView::balance)
                .findFirst()
                .orElse(BigDecimal.ZERO);
    }

    @Nested
    class Deposit {

        @Test
        @DisplayName("moves tokens into the pool and credits a collateral-enabled deposit position")
        void deposit_creditsPosition() {
            fx.mint("alice", "USDC", "1000");

            BigDecimal balance = pool.deposit("alice", "USDC", new BigDecimal("1000"));

            assertThat(balance).isEqualByComparingTo("1000");
            assertThat(fx.walletBalance("alice", "USDC")).isEqualByComparingTo("0");
            assertThat(fx.walletBalance(PoolFixture.VAULT, "USDC")).isEqualByComparingTo("1000");
            ReserveData usdc = pool.getReserveData("USDC");
            assertThat(usdc.totalDeposits()).isEqualByComparingTo("1000");
            assertThat(usdc.availableLiquidity()).isEqualByComparingTo("1000");
            assertThat(pool.getUserPositions("alice"))
                    .singleElement()
                    .satisfies(p -> assertThat(p.collateralEnabled()).isTrue());
        }

        @Test
        @DisplayName("failed token transfer leaves no trace")
        void deposit_transferFails_atomic() {
            assertFailsWith(LendingError.INSUFFICIENT_BALANCE,
                    () -> pool.deposit("alice", "USDC", new BigDecimal("1000")));

            assertThat(pool.getReserveData("USDC").totalDeposits()).isEqualByComparingTo("0");
            assertThat(pool.getUserPositions("alice")).isEmpty();
            assertThat(fx.positionStore.keysOf("alice")).isEmpty();
        }

        @Test
        void deposit_rejectsBadInput() {
            assertFailsWith(LendingError.INVALID_AMOUNT, () -> pool.deposit("alice", "USDC", BigDecimal.ZERO));
            assertFailsWith(LendingError.INVALID_AMOUNT, () -> pool.deposit("alice", "USDC", new BigDecimal("-5")));
            assertFailsWith(LendingError.UNSUPPORTED_ASSET, () -> pool.deposit("alice", "DOGE", BigDecimal.TEN));
        }

        @Test
        void deposit_inactiveReserve_rejected() {
            fx.admin.setReserveActive(PoolFixture.ADMIN, "USDC", false);
            fx.mint("alice", "USDC", "10");

            assertFailsWith(LendingError.RESERVE_INACTIVE, () -> pool.deposit("alice", "USDC", BigDecimal.TEN));
        }
    }

    @Nested
    class BorrowAndRepay {

        @BeforeEach
        void fund() {
            fx.deposit("lender", "USDC", "20000");
            fx.deposit("bob", "ETH", "10");
        }

        @Test
        @DisplayName("borrow within collateral power pays out and records debt")
        void borrow_withinCollateral() {
            BigDecimal debt = pool.borrow("bob", "USDC", new BigDecimal("5000"));

            assertThat(debt).isEqualByComparingTo("5000");
            assertThat(fx.walletBalance("bob", "USDC")).isEqualByComparingTo("5000");
            assertThat(pool.getUserHealthFactor("bob")).isEqualByComparingTo("3");
            ReserveData usdc = pool.getReserveData("USDC");
            assertThat(usdc.totalBorrows()).isEqualByComparingTo("5000");
            assertThat(usdc.availableLiquidity()).isEqualByComparingTo("15000");
            assertThat(usdc.utilization()).isEqualByComparingTo("0.25");
        }

        @Test
        @DisplayName("borrow that would leave HF below 1 is rejected")
        void borrow_beyondCollateral_rejected() {
            assertFailsWith(LendingError.HEALTH_FACTOR_TOO_LOW,
                    () -> pool.borrow("bob", "USDC", new BigDecimal("15000.000000000000000001")));

            assertThat(pool.getUserPositions("bob")).hasSize(1);
            assertThat(fx.walletBalance("bob", "USDC")).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("borrow up to exactly HF 1.0 is allowed")
        void borrow_toExactlyOne_allowed() {
            pool.borrow("bob", "USDC", new BigDecimal("15000"));

            assertThat(pool.getUserHealthFactor("bob")).isEqualByComparingTo("1");
        }

        @Test
        void borrow_withoutCollateral_rejected() {
            assertFailsWith(LendingError.HEALTH_FACTOR_TOO_LOW,
                    () -> pool.borrow("carol", "USDC", BigDecimal.ONE));
        }

        @Test
        void borrow_moreThanLiquidity_rejected() {
            assertFailsWith(LendingError.INSUFFICIENT_LIQUIDITY,
                    () -> pool.borrow("bob", "USDC", new BigDecimal("20001")));
        }

        @Test
        void borrow_disabled_rejected() {
            fx.admin.setBorrowingEnabled(PoolFixture.ADMIN, "USDC", false);

            assertFailsWith(LendingError.BORROWING_DISABLED, () -> pool.borrow("bob", "USDC", BigDecimal.TEN));
        }

        @Test
        @DisplayName("stale price aborts the borrow")
        void borrow_stalePrice_rejected() {
            fx.oracle.setQuote("ETH", PriceQuote.of(new BigDecimal("2000"), fx.clock.epochSecond() - 7200));

            assertFailsWith(LendingError.STALE_PRICE, () -> pool.borrow("bob", "USDC", BigDecimal.TEN));
            assertThat(pool.getReserveData("USDC").totalBorrows()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("repay larger than the debt is capped; the position closes")
        void repay_cappedAtDebt() {
            pool.borrow("bob", "USDC", new BigDecimal("100"));

            BigDecimal repaid = pool.repay("bob", "USDC", new BigDecimal("250"));

            assertThat(repaid).isEqualByComparingTo("100");
            assertThat(fx.walletBalance("bob", "USDC")).isEqualByComparingTo("0");
            assertThat(balance("bob", "USDC", PositionKind.BORROW)).isEqualByComparingTo("0");
            assertThat(pool.getUserHealthFactor("bob"))
                    .isEqualByComparingTo(HealthFactorCalculator.MAX_HEALTH_FACTOR);
        }

        @Test
        void repay_withoutDebt_rejected() {
            fx.mint("bob", "USDC", "10");

            assertFailsWith(LendingError.NO_DEBT, () -> pool.repay("bob", "USDC", BigDecimal.TEN));
        }

        @Test
        @DisplayName("fixed 10% APR: 500 borrowed for 365 days is about 550 owed; MAX repays it all")
        void debt_accruesOverOneYear() {
            fx.admin.initReserve(PoolFixture.ADMIN, "DAI", RateModel.LINEAR,
                    PoolFixture.annual("0.1", "0.8", "0", "0", "0"),
                    PoolFixture.liquidation("0.8", "0.85", "0.05", "0.5"));
            fx.oracle.setPrice("DAI", BigDecimal.ONE);
            fx.deposit("dana", "DAI", "1000");
            pool.borrow("dana", "DAI", new BigDecimal("500"));

            fx.clock.advance(Duration.ofDays(365));

            BigDecimal debt = balance("dana", "DAI", PositionKind.BORROW);
            assertThat(debt).isCloseTo(new BigDecimal("550"), within(new BigDecimal("0.000001")));

            fx.mint("dana", "DAI", "60");
            BigDecimal repaid = pool.repay("dana", "DAI", LendingPool.MAX_AMOUNT);

            assertThat(repaid).isEqualByComparingTo(debt);
            assertThat(balance("dana", "DAI", PositionKind.BORROW)).isEqualByComparingTo("0");
            assertThat(pool.getReserveData("DAI").totalBorrows()).isLessThan(new BigDecimal("0.000001"));
        }

        @Test
        @DisplayName("kinked curve at 90% utilization reports a 34% borrow APR")
        void reserveData_annualizedRates() {
            fx.deposit("whale", "ETH", "100");
            pool.borrow("whale", "USDC", new BigDecimal("18000"));

            ReserveData usdc = pool.getReserveData("USDC");

            assertThat(usdc.utilization()).isEqualByComparingTo("0.9");
            assertThat(usdc.borrowApr()).isCloseTo(new BigDecimal("0.34"), within(new BigDecimal("0.000000001")));
            assertThat(usdc.supplyApr())
                    .isCloseTo(new BigDecimal("0.34").multiply(new BigDecimal("0.9")).multiply(new BigDecimal("0.9")),
                            within(new BigDecimal("0.000000001")));
        }
    }

    @Nested
    class Withdraw {

        @BeforeEach
        void fund() {
            fx.deposit("lender", "USDC", "20000");
            fx.deposit("bob", "ETH", "10");
        }

        @Test
        void withdraw_partial() {
            BigDecimal withdrawn = pool.withdraw("bob", "ETH", new BigDecimal("4"));

            assertThat(withdrawn).isEqualByComparingTo("4");
            assertThat(balance("bob", "ETH", PositionKind.DEPOSIT)).isEqualByComparingTo("6");
            assertThat(fx.walletBalance("bob", "ETH")).isEqualByComparingTo("4");
        }

        @Test
        @DisplayName("MAX withdraws the whole balance and removes the position")
        void withdraw_max() {
            BigDecimal withdrawn = pool.withdraw("bob", "ETH", LendingPool.MAX_AMOUNT);

            assertThat(withdrawn).isEqualByComparingTo("10");
            assertThat(pool.getUserPositions("bob")).isEmpty();
            assertThat(pool.getReserveData("ETH").totalDeposits()).isEqualByComparingTo("0");
        }

        @Test
        void withdraw_moreThanBalance_rejected() {
            assertFailsWith(LendingError.INSUFFICIENT_BALANCE, () -> pool.withdraw("bob", "ETH", new BigDecimal("11")));
            assertFailsWith(LendingError.INSUFFICIENT_BALANCE, () -> pool.withdraw("carol", "ETH", BigDecimal.ONE));
        }

        @Test
        @DisplayName("withdraw is limited by the cash the pool holds")
        void withdraw_moreThanLiquidity_rejected() {
            fx.deposit("whale", "ETH", "100");
            pool.borrow("whale", "USDC", new BigDecimal("19990"));

            assertFailsWith(LendingError.INSUFFICIENT_LIQUIDITY,
                    () -> pool.withdraw("lender", "USDC", new BigDecimal("11")));
        }

        @Test
        @DisplayName("withdraw that would leave a borrower under HF 1 is rejected")
        void withdraw_breaksHealth_rejected() {
            pool.borrow("bob", "USDC", new BigDecimal("10000"));

            assertFailsWith(LendingError.HEALTH_FACTOR_TOO_LOW, () -> pool.withdraw("bob", "ETH", new BigDecimal("5")));
            assertThat(balance("bob", "ETH", PositionKind.DEPOSIT)).isEqualByComparingTo("10");
        }
    }

    @Nested
    class Collateral {

        @BeforeEach
        void fund() {
            fx.deposit("lender", "USDC", "20000");
            fx.deposit("bob", "ETH", "10");
        }

        @Test
        @DisplayName("disabled deposits stop counting as collateral")
        void disable_withoutDebt() {
            pool.setUseAsCollateral("bob", "ETH", false);

            assertThat(pool.getUserAccountData("bob").collateralValue()).isEqualByComparingTo("0");
            assertFailsWith(LendingError.HEALTH_FACTOR_TOO_LOW, () -> pool.borrow("bob", "USDC", BigDecimal.ONE));

            pool.setUseAsCollateral("bob", "ETH", true);
            assertThat(pool.getUserAccountData("bob").collateralValue()).isEqualByComparingTo("15000");
        }

        @Test
        void disable_backingDebt_rejected() {
            pool.borrow("bob", "USDC", new BigDecimal("100"));

            assertFailsWith(LendingError.HEALTH_FACTOR_TOO_LOW, () -> pool.setUseAsCollateral("bob", "ETH", false));
            assertThat(pool.getUserPositions("bob"))
                    .filteredOn(p -> p.kind() == PositionKind.DEPOSIT)
                    .singleElement()
                    .satisfies(p -> assertThat(p.collateralEnabled()).isTrue());
        }

        @Test
        void toggle_withoutDeposit_rejected() {
            assertFailsWith(LendingError.NO_COLLATERAL, () -> pool.setUseAsCollateral("carol", "ETH", false));
        }

        @Test
        @DisplayName("account data sums collateral power and debt across assets")
        void accountData() {
            fx.deposit("bob", "USDC", "1000");
            pool.borrow("bob", "USDC", new BigDecimal("3000"));

            UserAccountData data = pool.getUserAccountData("bob");

            assertThat(data.collateralValue()).isEqualByComparingTo("15800");
            assertThat(data.debtValue()).isEqualByComparingTo("3000");
            assertThat(data.availableToBorrow()).isEqualByComparingTo("12800");
        }
    }

    @Nested
    class FlashLoan {

        @BeforeEach
        void fund() {
            fx.deposit("lender", "USDC", "1000");
        }

        @Test
        @DisplayName("receiver repays amount plus fee; the fee accrues to depositors")
        void flashLoan_repaid() {
            fx.mint("arb", "USDC", "1");

            BigDecimal fee = pool.flashLoan("arb", "USDC", new BigDecimal("500"),
                    (asset, amount, charged) -> assertThat(fx.walletBalance("arb", "USDC")).isEqualByComparingTo("501"));

            assertThat(fee).isEqualByComparingTo("0.45");
            assertThat(fx.walletBalance("arb", "USDC")).isEqualByComparingTo("0.55");
            assertThat(fx.walletBalance(PoolFixture.VAULT, "USDC")).isEqualByComparingTo("1000.45");
            assertThat(balance("lender", "USDC", PositionKind.DEPOSIT)).isEqualByComparingTo("1000.45");
            ReserveData usdc = pool.getReserveData("USDC");
            assertThat(usdc.totalDeposits()).isEqualByComparingTo("1000.45");
            assertThat(usdc.availableLiquidity()).isEqualByComparingTo("1000.45");
        }

        @Test
        @DisplayName("receiver that cannot pay the fee aborts the loan and the pool is made whole")
        void flashLoan_notRepaid() {
            assertFailsWith(LendingError.FLASH_LOAN_NOT_REPAID,
                    () -> pool.flashLoan("arb", "USDC", new BigDecimal("500"), (asset, amount, fee) -> { }));

            assertThat(fx.walletBalance("arb", "USDC")).isEqualByComparingTo("0");
            assertThat(fx.walletBalance(PoolFixture.VAULT, "USDC")).isEqualByComparingTo("1000");
            assertThat(pool.getReserveData("USDC").totalDeposits()).isEqualByComparingTo("1000");
        }

        @Test
        void flashLoan_callbackFailure_propagates() {
            fx.mint("arb", "USDC", "1");

            assertThatThrownBy(() -> pool.flashLoan("arb", "USDC", new BigDecimal("500"), (asset, amount, fee) -> {
                throw new IllegalStateException("swap failed");
            })).isInstanceOf(IllegalStateException.class).hasMessage("swap failed");

            assertThat(fx.walletBalance("arb", "USDC")).isEqualByComparingTo("1");
            assertThat(fx.walletBalance(PoolFixture.VAULT, "USDC")).isEqualByComparingTo("1000");
        }

        @Test
        @DisplayName("tokens the receiver moves away during an unpaid loan are returned with it")
        void flashLoan_notRepaid_receiverTransfersDiscarded() {
            assertFailsWith(LendingError.FLASH_LOAN_NOT_REPAID,
                    () -> pool.flashLoan("arb", "USDC", new BigDecimal("500"),
                            (asset, amount, fee) -> fx.ledger.transfer(asset, "arb", "accomplice", amount)));

            assertThat(fx.walletBalance(PoolFixture.VAULT, "USDC")).isEqualByComparingTo("1000");
            assertThat(fx.walletBalance("accomplice", "USDC")).isEqualByComparingTo("0");
            assertThat(fx.walletBalance("arb", "USDC")).isEqualByComparingTo("0");
            assertThat(pool.getReserveData("USDC").availableLiquidity()).isEqualByComparingTo("1000");
        }

        @Test
        @DisplayName("receiver transfers made during a repaid loan are kept")
        void flashLoan_repaid_receiverTransfersKept() {
            fx.mint("arb", "USDC", "1");

            pool.flashLoan("arb", "USDC", new BigDecimal("500"), (asset, amount, fee) -> {
                fx.ledger.transfer(asset, "arb", "dex", amount);
                fx.ledger.transfer(asset, "dex", "arb", amount);
                fx.ledger.transfer(asset, "arb", "dex", new BigDecimal("0.5"));
            });

            assertThat(fx.walletBalance("dex", "USDC")).isEqualByComparingTo("0.5");
            assertThat(fx.walletBalance("arb", "USDC")).isEqualByComparingTo("0.05");
            assertThat(fx.walletBalance(PoolFixture.VAULT, "USDC")).isEqualByComparingTo("1000.45");
        }

        @Test
        @DisplayName("callback calling back into the pool aborts the loan")
        void flashLoan_reentrantCallback_conflict() {
            fx.mint("arb", "USDC", "200");
            fx.mint("arb", "ETH", "1");

            assertFailsWith(LendingError.CONCURRENT_MODIFICATION,
                    () -> pool.flashLoan("arb", "USDC", new BigDecimal("500"),
                            (asset, amount, fee) -> pool.deposit("arb", "USDC", new BigDecimal("100"))));
            assertFailsWith(LendingError.CONCURRENT_MODIFICATION,
                    () -> pool.flashLoan("arb", "USDC", new BigDecimal("500"),
                            (asset, amount, fee) -> pool.deposit("arb", "ETH", BigDecimal.ONE)));

            assertThat(fx.walletBalance("arb", "USDC")).isEqualByComparingTo("200");
            assertThat(fx.walletBalance("arb", "ETH")).isEqualByComparingTo("1");
            assertThat(fx.walletBalance(PoolFixture.VAULT, "USDC")).isEqualByComparingTo("1000");
            assertThat(pool.getUserPositions("arb")).isEmpty();
        }

        @Test
        @DisplayName("commits on other reserves proceed during a loan; the borrowed reserve fails fast")
        void flashLoan_inFlight_isolatesOnlyBorrowedReserve() {
            fx.mint("arb", "USDC", "1");
            fx.mint("carol", "ETH", "1");
            fx.mint("dave", "USDC", "5");
            AtomicReference<BigDecimal> carolDeposit = new AtomicReference<>();
            AtomicReference<Throwable> daveFailure = new AtomicReference<>();
            AtomicReference<BigDecimal> arbSeenElsewhere = new AtomicReference<>();
            ExecutorService other = Executors.newSingleThreadExecutor();
            try {
                pool.flashLoan("arb", "USDC", new BigDecimal("500"), (asset, amount, fee) -> {
                    try {
                        carolDeposit.set(other.submit(() -> pool.deposit("carol", "ETH", BigDecimal.ONE))
                                .get(2, TimeUnit.SECONDS));
                        arbSeenElsewhere.set(other.submit(() -> fx.walletBalance("arb", "USDC"))
                                .get(2, TimeUnit.SECONDS));
                        Future<BigDecimal> dave = other.submit(() -> pool.deposit("dave", "USDC", new BigDecimal("5")));
                        try {
                            dave.get(2, TimeUnit.SECONDS);
                        } catch (ExecutionException e) {
                            daveFailure.set(e.getCause());
                        }
                    } catch (InterruptedException | ExecutionException | TimeoutException e) {
                        throw new IllegalStateException(e);
                    }
                });
            } finally {
                other.shutdownNow();
            }

            assertThat(carolDeposit.get()).isEqualByComparingTo("1");
            assertThat(arbSeenElsewhere.get()).isEqualByComparingTo("1");
            assertThat(daveFailure.get())
                    .isInstanceOf(LendingException.class)
                    .satisfies(e -> assertThat(((LendingException) e).getError())
                            .isEqualTo(LendingError.CONCURRENT_MODIFICATION));
            assertThat(fx.walletBalance("dave", "USDC")).isEqualByComparingTo("5");

            pool.deposit("dave", "USDC", new BigDecimal("5"));
            assertThat(fx.walletBalance("dave", "USDC")).isEqualByComparingTo("0");
        }

        @Test
        void flashLoan_moreThanLiquidity_rejected() {
            assertFailsWith(LendingError.INSUFFICIENT_LIQUIDITY,
                    () -> pool.flashLoan("arb", "USDC", new BigDecimal("1000.01"), (asset, amount, fee) -> { }));
        }
    }
}
