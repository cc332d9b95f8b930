package com.lendpool.domain;

import com.lendpool.common.FixedPoint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Principal of one (user, asset, kind) position paired with the reserve index at the last rebase.
 * Current balance = principal * currentIndex / indexSnapshot (see PositionAccounting).
 */
@NoArgsConstructor
@Getter
@Setter
public class UserPosition {

    private String user;
    private String asset;
    private PositionKind kind;
    private BigDecimal principal;
    private BigDecimal indexSnapshot;
    /** Deposits only: whether the balance counts towards collateral power. */
    private boolean collateralEnabled;
    private long version;

    public static UserPosition open(PositionKey key, BigDecimal index) {
        UserPosition position = new UserPosition();
        position.setUser(key.user());
        position.setAsset(key.asset());
        position.setKind(key.kind());
        position.setPrincipal(FixedPoint.WAD_ZERO);
        position.setIndexSnapshot(index);
        position.setCollateralEnabled(key.kind() == PositionKind.DEPOSIT);
        return position;
    }

    public PositionKey key() {
        return new PositionKey(user, asset, kind);
    }

    public boolean isEmpty() {
        return FixedPoint.isZero(principal);
    }

    public boolean countsAsCollateral() {
        return kind == PositionKind.DEPOSIT && collateralEnabled;
    }

    public UserPosition copy() {
        UserPosition copy = new UserPosition();
        copy.user = user;
        copy.asset = asset;
        copy.kind = kind;
        copy.principal = principal;
        copy.indexSnapshot = indexSnapshot;
        copy.collateralEnabled = collateralEnabled;
        copy.version = version;
        return copy;
    }
}
