package com.lendpool.common;

/**
 * Stable error codes exposed to callers (also used as the HTTP error body code).
 */
public enum LendingError {

    INVALID_AMOUNT(ErrorCategory.VALIDATION),
    UNSUPPORTED_ASSET(ErrorCategory.VALIDATION),
    INVALID_CONFIG(ErrorCategory.VALIDATION),
    RESERVE_EXISTS(ErrorCategory.VALIDATION),
    RESERVE_INACTIVE(ErrorCategory.VALIDATION),
    BORROWING_DISABLED(ErrorCategory.VALIDATION),
    SELF_LIQUIDATION(ErrorCategory.VALIDATION),

    INSUFFICIENT_BALANCE(ErrorCategory.STATE),
    INSUFFICIENT_LIQUIDITY(ErrorCategory.STATE),
    INSUFFICIENT_COLLATERAL(ErrorCategory.STATE),
    NO_DEBT(ErrorCategory.STATE),
    NO_COLLATERAL(ErrorCategory.STATE),
    NOT_LIQUIDATABLE(ErrorCategory.STATE),
    ZERO_LIQUIDATION(ErrorCategory.STATE),
    FLASH_LOAN_NOT_REPAID(ErrorCategory.STATE),
    CONCURRENT_MODIFICATION(ErrorCategory.STATE),

    HEALTH_FACTOR_TOO_LOW(ErrorCategory.SAFETY),
    STALE_PRICE(ErrorCategory.SAFETY),
    PRICE_CONFIDENCE_TOO_LOW(ErrorCategory.SAFETY),
    PRICE_UNAVAILABLE(ErrorCategory.SAFETY),

    UNAUTHORIZED(ErrorCategory.AUTHORIZATION);

    private final ErrorCategory category;

    LendingError(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }

    public String code() {
        return name();
    }
}
