package com.vaultlend.ledger.liquidation;

import java.math.BigInteger;

public record LiquidationResult(
    String liquidator,
    String account,
    String borrowAsset,
    BigInteger repaidAmount,
    String collateralAsset,
    BigInteger seizedAmount,
    BigInteger ratioBefore
) {
}
