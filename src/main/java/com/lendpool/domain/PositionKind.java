package com.lendpool.domain;

/**
 * Side of a user position. DEPOSIT balances follow the supply index, BORROW balances the borrow index.
 */
public enum PositionKind {
    DEPOSIT,
    BORROW
}
