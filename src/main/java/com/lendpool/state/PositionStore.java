package com.lendpool.state;

import com.lendpool.domain.PositionKey;
import com.lendpool.domain.UserPosition;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Committed user positions keyed by (user, asset, kind), plus a per-user key set so a user's whole book can be
 * loaded without scanning other users. The key set carries its own version (bumped on open/close of a position).
 */
@Component
public class PositionStore {

    private final ConcurrentMap<PositionKey, UserPosition> positions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<PositionKey>> keysByUser = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Long> userVersions = new ConcurrentHashMap<>();

    public Optional<UserPosition> load(PositionKey key) {
        return Optional.ofNullable(positions.get(key)).map(UserPosition::copy);
    }

    public long version(PositionKey key) {
        UserPosition position = positions.get(key);
        return position == null ? 0L : position.getVersion();
    }

    public Set<PositionKey> keysOf(String user) {
        Set<PositionKey> keys = keysByUser.get(user);
        return keys == null ? Set.of() : Set.copyOf(keys);
    }

    public long userVersion(String user) {
        return userVersions.getOrDefault(user, 0L);
    }

    void publish(UserPosition position, long newVersion) {
        UserPosition stored = position.copy();
        stored.setVersion(newVersion);
        PositionKey key = stored.key();
        if (positions.put(key, stored) == null) {
            keysByUser.computeIfAbsent(key.user(), u -> Collections.newSetFromMap(new ConcurrentHashMap<>())).add(key);
            userVersions.merge(key.user(), 1L, Long::sum);
        }
    }

    void remove(PositionKey key) {
        if (positions.remove(key) != null) {
            Set<PositionKey> keys = keysByUser.get(key.user());
            if (keys != null) {
                keys.remove(key);
            }
            userVersions.merge(key.user(), 1L, Long::sum);
        }
    }
}
