package com.lendpool.api.dto;

import java.math.BigDecimal;

/**
 * value: position balance after deposit or borrow; amount actually moved for withdraw and repay.
 */
public record PoolOperationResponse(String operation, String user, String asset, BigDecimal value) {
}
