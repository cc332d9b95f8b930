package com.lendpool.domain;

import java.util.Objects;

/**
 * Identity of a position: one per (user, asset, kind).
 */
public record PositionKey(String user, String asset, PositionKind kind) {

    public PositionKey {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(kind, "kind");
    }

    public static PositionKey deposit(String user, String asset) {
        return new PositionKey(user, asset, PositionKind.DEPOSIT);
    }

    public static PositionKey borrow(String user, String asset) {
        return new PositionKey(user, asset, PositionKind.BORROW);
    }
}
