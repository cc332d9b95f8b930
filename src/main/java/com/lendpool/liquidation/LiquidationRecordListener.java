package com.lendpool.liquidation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs every committed liquidation.
 */
@Component
@Slf4j
public class LiquidationRecordListener {

    @EventListener
    public void onLiquidation(LiquidationRecord record) {
        log.info("Liquidation: {} repaid {} {} for {} seized {} {} (health factor {} -> {})",
                record.liquidator(), record.actualRepaid().stripTrailingZeros().toPlainString(), record.debtAsset(),
                record.borrower(), record.collateralSeized().stripTrailingZeros().toPlainString(),
                record.collateralAsset(), record.healthFactorBefore(), record.healthFactorAfter());
    }
}
