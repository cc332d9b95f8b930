package com.lendpool.state;

import com.lendpool.accrual.AccrualEngine;
import com.lendpool.common.LendingError;
import com.lendpool.common.LendingException;
import com.lendpool.domain.PositionKey;
import com.lendpool.domain.Reserve;
import com.lendpool.domain.UserPosition;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Unit of work for one pool operation. Works on private copies of exactly the reserves and positions it touches,
 * records the version of everything it read and publishes only on {@link #commit()}. Abandoning a transaction
 * (e.g. after a failed check) leaves committed state untouched.
 * Every reserve is accrued to {@link #getNow()} as it is loaded.
 * Not thread-safe; one transaction per operation.
 */
public class PoolTransaction {

    private final WorldState worldState;
    private final AccrualEngine accrualEngine;
    @Getter
    private final long now;

    private final Map<String, Reserve> reserves = new LinkedHashMap<>();
    private final Map<String, Long> reserveReadVersions = new HashMap<>();
    private final Set<String> dirtyReserves = new LinkedHashSet<>();

    private final Map<PositionKey, UserPosition> positions = new LinkedHashMap<>();
    private final Map<PositionKey, Long> positionReadVersions = new HashMap<>();
    private final Set<PositionKey> dirtyPositions = new LinkedHashSet<>();
    private final Map<String, Long> userReadVersions = new HashMap<>();

    private final List<TransactionStep> steps = new ArrayList<>();
    private boolean committed;

    PoolTransaction(WorldState worldState, AccrualEngine accrualEngine, long now) {
        this.worldState = worldState;
        this.accrualEngine = accrualEngine;
        this.now = now;
    }

    /**
     * Read access to a reserve, accrued to now.
     *
     * @throws LendingException UNSUPPORTED_ASSET when the asset is not listed
     */
    public Reserve reserve(String asset) {
        Reserve cached = reserves.get(asset);
        if (cached != null) {
            return cached;
        }
        Reserve loaded = worldState.getReserveStore().load(asset)
                .orElseThrow(() -> new LendingException(LendingError.UNSUPPORTED_ASSET, "Asset not listed: " + asset));
        reserveReadVersions.put(asset, loaded.getVersion());
        accrualEngine.accrue(loaded, now);
        reserves.put(asset, loaded);
        return loaded;
    }

    /**
     * Same as {@link #reserve(String)} but the reserve is written back on commit.
     */
    public Reserve reserveForUpdate(String asset) {
        Reserve reserve = reserve(asset);
        dirtyReserves.add(asset);
        return reserve;
    }

    /**
     * Stage a newly listed reserve.
     *
     * @throws LendingException RESERVE_EXISTS when the asset is already listed
     */
    public void listReserve(Reserve reserve) {
        String asset = reserve.getAsset();
        if (reserves.containsKey(asset) || worldState.getReserveStore().contains(asset)) {
            throw new LendingException(LendingError.RESERVE_EXISTS, "Reserve already listed: " + asset);
        }
        reserve.setVersion(0L);
        reserveReadVersions.put(asset, 0L);
        reserves.put(asset, reserve);
        dirtyReserves.add(asset);
    }

    public Optional<UserPosition> position(PositionKey key) {
        if (positions.containsKey(key)) {
            return Optional.ofNullable(positions.get(key));
        }
        UserPosition loaded = worldState.getPositionStore().load(key).orElse(null);
        positionReadVersions.put(key, loaded == null ? 0L : loaded.getVersion());
        positions.put(key, loaded);
        return Optional.ofNullable(loaded);
    }

    public Optional<UserPosition> positionForUpdate(PositionKey key) {
        Optional<UserPosition> position = position(key);
        position.ifPresent(p -> dirtyPositions.add(key));
        return position;
    }

    /**
     * Existing position for update, or a new empty one snapshotted at the reserve's current index.
     */
    public UserPosition openPosition(PositionKey key) {
        Optional<UserPosition> existing = positionForUpdate(key);
        if (existing.isPresent()) {
            return existing.get();
        }
        UserPosition created = UserPosition.open(key, reserve(key.asset()).indexFor(key.kind()));
        positions.put(key, created);
        dirtyPositions.add(key);
        return created;
    }

    /**
     * All non-empty positions of a user as seen by this transaction (including staged changes).
     */
    public List<UserPosition> positionsOf(String user) {
        if (!userReadVersions.containsKey(user)) {
            PositionStore store = worldState.getPositionStore();
            userReadVersions.put(user, store.userVersion(user));
            for (PositionKey key : store.keysOf(user)) {
                position(key);
            }
        }
        return positions.values().stream()
                .filter(Objects::nonNull)
                .filter(p -> p.getUser().equals(user))
                .filter(p -> !p.isEmpty())
                .toList();
    }

    public void transfer(String asset, String from, String to, BigDecimal amount) {
        steps.add(new TransactionStep.Transfer(asset, from, to, amount, null));
    }

    /**
     * Transfer whose INSUFFICIENT_BALANCE failure is reported as {@code failureError}.
     */
    public void transfer(String asset, String from, String to, BigDecimal amount, LendingError failureError) {
        steps.add(new TransactionStep.Transfer(asset, from, to, amount, failureError));
    }

    public void invoke(Runnable callback) {
        steps.add(new TransactionStep.Callback(callback));
    }

    /**
     * Validate read versions, run external steps and publish staged state, all or nothing.
     *
     * @throws LendingException CONCURRENT_MODIFICATION when anything read has changed since it was loaded
     */
    public void commit() {
        if (committed) {
            throw new IllegalStateException("Transaction already committed");
        }
        committed = true;
        worldState.commit(this);
    }

    Map<String, Long> reserveReadVersions() {
        return reserveReadVersions;
    }

    Map<PositionKey, Long> positionReadVersions() {
        return positionReadVersions;
    }

    Map<String, Long> userReadVersions() {
        return userReadVersions;
    }

    List<Reserve> dirtyReserves() {
        return dirtyReserves.stream().map(reserves::get).toList();
    }

    List<PositionKey> dirtyPositionKeys() {
        return new ArrayList<>(dirtyPositions);
    }

    UserPosition staged(PositionKey key) {
        return positions.get(key);
    }

    List<TransactionStep> steps() {
        return steps;
    }
}
