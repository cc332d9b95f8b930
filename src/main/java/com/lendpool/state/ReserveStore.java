package com.lendpool.state;

import com.lendpool.domain.Reserve;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Committed reserves keyed by asset. Readers always get a copy; writes go through WorldState.commit.
 */
@Component
public class ReserveStore {

    private final ConcurrentMap<String, Reserve> reserves = new ConcurrentHashMap<>();

    public Optional<Reserve> load(String asset) {
        if (asset == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(reserves.get(asset)).map(Reserve::copy);
    }

    public boolean contains(String asset) {
        return asset != null && reserves.containsKey(asset);
    }

    /** Committed version, 0 when the asset is not listed. */
    public long version(String asset) {
        Reserve reserve = reserves.get(asset);
        return reserve == null ? 0L : reserve.getVersion();
    }

    public List<String> assets() {
        return reserves.keySet().stream().sorted().toList();
    }

    void publish(Reserve reserve, long newVersion) {
        Reserve stored = reserve.copy();
        stored.setVersion(newVersion);
        reserves.put(stored.getAsset(), stored);
    }
}
