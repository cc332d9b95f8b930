package com.lendpool.state;

import com.lendpool.accrual.AccrualEngine;
import com.lendpool.common.LendingError;
import com.lendpool.common.LendingException;
import com.lendpool.domain.PositionKey;
import com.lendpool.domain.Reserve;
import com.lendpool.domain.UserPosition;
import com.lendpool.transfer.LedgerTransaction;
import com.lendpool.transfer.TokenTransfer;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The pool's global state: reserves by asset and positions by (user, asset, kind).
 * Operations run optimistically on a {@link PoolTransaction}. Commit locks only the reserves and user books the
 * transaction read, validates that they are unchanged, runs its external steps in one ledger transaction and then
 * publishes. Commits over disjoint resources never wait on each other; overlapping ones fail fast with
 * CONCURRENT_MODIFICATION.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorldState {

    @Getter
    private final ReserveStore reserveStore;
    @Getter
    private final PositionStore positionStore;
    private final AccrualEngine accrualEngine;
    private final TokenTransfer tokenTransfer;

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ThreadLocal<PoolTransaction> committing = new ThreadLocal<>();

    public PoolTransaction begin(long now) {
        return new PoolTransaction(this, accrualEngine, now);
    }

    void commit(PoolTransaction tx) {
        if (committing.get() != null) {
            throw new LendingException(LendingError.CONCURRENT_MODIFICATION,
                    "Pool operations cannot run inside a flash-loan callback");
        }
        List<ReentrantLock> held = lock(tx);
        committing.set(tx);
        try (LedgerTransaction ledger = tokenTransfer.begin()) {
            validate(tx);
            for (TransactionStep step : tx.steps()) {
                step.run(tokenTransfer);
            }
            ledger.commit();
            publish(tx);
        } finally {
            committing.remove();
            unlock(held);
        }
    }

    /**
     * Locks every reserve and user book the transaction read, in key order. A lock held by another commit fails the
     * transaction instead of waiting.
     */
    private List<ReentrantLock> lock(PoolTransaction tx) {
        SortedSet<String> keys = new TreeSet<>();
        tx.reserveReadVersions().keySet().forEach(asset -> keys.add("reserve " + asset));
        tx.userReadVersions().keySet().forEach(user -> keys.add("user " + user));
        tx.positionReadVersions().keySet().forEach(key -> keys.add("user " + key.user()));

        List<ReentrantLock> held = new ArrayList<>(keys.size());
        for (String key : keys) {
            ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
            if (!lock.tryLock()) {
                log.debug("Commit rejected: {} is held by another commit", key);
                unlock(held);
                throw conflict(key);
            }
            held.add(lock);
        }
        return held;
    }

    private static void unlock(List<ReentrantLock> held) {
        for (int i = held.size() - 1; i >= 0; i--) {
            held.get(i).unlock();
        }
    }

    private void validate(PoolTransaction tx) {
        for (Map.Entry<String, Long> read : tx.reserveReadVersions().entrySet()) {
            if (reserveStore.version(read.getKey()) != read.getValue()) {
                throw conflict("reserve " + read.getKey());
            }
        }
        for (Map.Entry<PositionKey, Long> read : tx.positionReadVersions().entrySet()) {
            if (positionStore.version(read.getKey()) != read.getValue()) {
                throw conflict("position " + read.getKey());
            }
        }
        for (Map.Entry<String, Long> read : tx.userReadVersions().entrySet()) {
            if (positionStore.userVersion(read.getKey()) != read.getValue()) {
                throw conflict("positions of " + read.getKey());
            }
        }
    }

    private void publish(PoolTransaction tx) {
        for (Reserve reserve : tx.dirtyReserves()) {
            long readVersion = tx.reserveReadVersions().get(reserve.getAsset());
            reserveStore.publish(reserve, readVersion + 1);
        }
        for (PositionKey key : tx.dirtyPositionKeys()) {
            UserPosition staged = tx.staged(key);
            if (staged == null || staged.isEmpty()) {
                positionStore.remove(key);
            } else {
                long readVersion = tx.positionReadVersions().getOrDefault(key, 0L);
                positionStore.publish(staged, readVersion + 1);
            }
        }
    }

    private static LendingException conflict(String resource) {
        return new LendingException(LendingError.CONCURRENT_MODIFICATION,
                "Concurrent modification of " + resource + "; retry the operation");
    }
}
