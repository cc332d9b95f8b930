package com.lendpool.common;

/**
 * Error taxonomy for pool operations. Every category aborts the whole operation with no partial effect.
 */
public enum ErrorCategory {
    /** Bad input or configuration (zero amount, unknown asset, invalid risk parameters). */
    VALIDATION,
    /** Operation not possible in the current ledger state (balance, liquidity, collateral). */
    STATE,
    /** Solvency or price-quality guard tripped. */
    SAFETY,
    /** Privileged action attempted by a non-admin caller. */
    AUTHORIZATION
}
