package com.lendpool.transfer;

import com.lendpool.common.FixedPoint;
import com.lendpool.common.LendingError;
import com.lendpool.common.LendingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process token balances per (account, asset). Stands in for the host chain's token module.
 * Balances read by a thread include the transfers it has staged in its open {@link LedgerTransaction}.
 */
@Component
@Slf4j
public class InMemoryTokenLedger implements TokenTransfer {

    private final Map<String, Map<String, BigDecimal>> balances = new ConcurrentHashMap<>();
    private final ThreadLocal<Staged> staged = new ThreadLocal<>();

    @Override
    public synchronized void transfer(String asset, String from, String to, BigDecimal amount) {
        if (!FixedPoint.isPositive(amount)) {
            throw new LendingException(LendingError.INVALID_AMOUNT, "Transfer amount must be positive, got: " + amount);
        }
        BigDecimal available = balanceOf(from, asset);
        if (available.compareTo(amount) < 0) {
            throw insufficient(from, asset, available, amount);
        }
        Staged open = staged.get();
        if (open != null) {
            open.add(from, asset, amount.negate());
            open.add(to, asset, amount);
            log.debug("Staged {} {} from {} to {}", amount, asset, from, to);
            return;
        }
        apply(from, asset, amount.negate());
        apply(to, asset, amount);
        log.debug("Transferred {} {} from {} to {}", amount, asset, from, to);
    }

    @Override
    public LedgerTransaction begin() {
        if (staged.get() != null) {
            throw new IllegalStateException("A ledger transaction is already open on this thread");
        }
        Staged open = new Staged();
        staged.set(open);
        return open;
    }

    /**
     * Credit an account out of thin air (faucet for local runs and tests).
     */
    public synchronized void mint(String account, String asset, BigDecimal amount) {
        if (!FixedPoint.isPositive(amount)) {
            throw new LendingException(LendingError.INVALID_AMOUNT, "Mint amount must be positive, got: " + amount);
        }
        apply(account, asset, amount);
    }

    public synchronized BigDecimal balanceOf(String account, String asset) {
        BigDecimal committed = committedBalance(account, asset);
        Staged open = staged.get();
        return open == null ? committed : committed.add(open.delta(account, asset));
    }

    private BigDecimal committedBalance(String account, String asset) {
        Map<String, BigDecimal> held = balances.get(account);
        if (held == null) {
            return BigDecimal.ZERO;
        }
        return held.getOrDefault(asset, BigDecimal.ZERO);
    }

    private void apply(String account, String asset, BigDecimal delta) {
        balances.computeIfAbsent(account, k -> new ConcurrentHashMap<>()).merge(asset, delta, BigDecimal::add);
    }

    private static LendingException insufficient(String account, String asset, BigDecimal available,
                                                 BigDecimal amount) {
        return new LendingException(LendingError.INSUFFICIENT_BALANCE,
                account + " holds " + available.stripTrailingZeros().toPlainString() + " " + asset
                        + ", cannot transfer " + amount.stripTrailingZeros().toPlainString());
    }

    /** Net balance changes per account and asset. */
    private final class Staged implements LedgerTransaction {

        private final Map<String, Map<String, BigDecimal>> deltas = new LinkedHashMap<>();
        private boolean closed;

        void add(String account, String asset, BigDecimal delta) {
            deltas.computeIfAbsent(account, k -> new HashMap<>()).merge(asset, delta, BigDecimal::add);
        }

        BigDecimal delta(String account, String asset) {
            Map<String, BigDecimal> held = deltas.get(account);
            return held == null ? BigDecimal.ZERO : held.getOrDefault(asset, BigDecimal.ZERO);
        }

        @Override
        public void commit() {
            if (closed) {
                throw new IllegalStateException("Ledger transaction already closed");
            }
            synchronized (InMemoryTokenLedger.this) {
                for (Map.Entry<String, Map<String, BigDecimal>> account : deltas.entrySet()) {
                    for (Map.Entry<String, BigDecimal> change : account.getValue().entrySet()) {
                        BigDecimal committed = committedBalance(account.getKey(), change.getKey());
                        if (committed.add(change.getValue()).signum() < 0) {
                            throw insufficient(account.getKey(), change.getKey(), committed, change.getValue().negate());
                        }
                    }
                }
                deltas.forEach((account, changes) -> changes.forEach((asset, delta) -> apply(account, asset, delta)));
            }
            release();
        }

        @Override
        public void close() {
            if (!closed) {
                log.debug("Discarded {} staged account change(s)", deltas.size());
                release();
            }
        }

        private void release() {
            closed = true;
            staged.remove();
        }
    }
}
